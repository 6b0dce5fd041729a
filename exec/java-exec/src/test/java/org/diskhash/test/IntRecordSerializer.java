/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.diskhash.test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import org.diskhash.exec.physical.impl.spill.RecordSerializer;

/**
 * Fixed-width serializer for integer records: a four-byte count followed by
 * four bytes per value. Sizes are exact, which makes spill points easy to
 * predict in tests.
 */

public class IntRecordSerializer implements RecordSerializer<Integer> {

  public static final int HEADER_WIDTH = 4;
  public static final int VALUE_WIDTH = 4;

  @Override
  public byte[] serialize(List<Integer> records) {
    ByteBuffer buf = ByteBuffer.allocate(byteLength(records));
    buf.putInt(records.size());
    for (Integer value : records) {
      buf.putInt(value);
    }
    return buf.array();
  }

  @Override
  public List<Integer> deserialize(byte[] bytes) throws IOException {
    if (bytes.length < HEADER_WIDTH) {
      throw new IOException("Truncated group: " + bytes.length + " bytes");
    }
    ByteBuffer buf = ByteBuffer.wrap(bytes);
    int count = buf.getInt();
    if (bytes.length != HEADER_WIDTH + count * VALUE_WIDTH) {
      throw new IOException("Group of " + count + " values cannot be " + bytes.length + " bytes");
    }
    List<Integer> values = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      values.add(buf.getInt());
    }
    return values;
  }

  @Override
  public int byteLength(List<Integer> records) {
    return HEADER_WIDTH + records.size() * VALUE_WIDTH;
  }

  @Override
  public int recordLength(Integer record) {
    return VALUE_WIDTH;
  }
}
