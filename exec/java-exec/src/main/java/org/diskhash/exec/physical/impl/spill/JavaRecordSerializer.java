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
package org.diskhash.exec.physical.impl.spill;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Record serializer based on Java object serialization. Each group is
 * written as a single {@link ArrayList} in its own object stream.
 */

public class JavaRecordSerializer<T extends Serializable> implements RecordSerializer<T> {

  private final Class<T> recordClass;

  /**
   * Bytes an object stream writes before its first object.
   */
  private final int streamHeaderLength;

  public JavaRecordSerializer(Class<T> recordClass) {
    this.recordClass = Preconditions.checkNotNull(recordClass);
    try {
      streamHeaderLength = writeObject(null, false).length;
    } catch (IOException e) {
      throw new IllegalStateException("Object streams unavailable", e);
    }
  }

  @Override
  public byte[] serialize(List<T> records) throws IOException {
    return writeObject(new ArrayList<>(records), true);
  }

  @Override
  public List<T> deserialize(byte[] bytes) throws IOException {
    Object value;
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
      value = in.readObject();
    } catch (ClassNotFoundException e) {
      throw new IOException("Unknown class in spilled data", e);
    }
    if (! (value instanceof List)) {
      throw new IOException("Expected a list of records, found " +
          (value == null ? "null" : value.getClass().getName()));
    }
    List<?> values = (List<?>) value;
    List<T> records = new ArrayList<>(values.size());
    for (Object record : values) {
      try {
        records.add(recordClass.cast(record));
      } catch (ClassCastException e) {
        throw new IOException("Spilled record is not a " + recordClass.getName(), e);
      }
    }
    return records;
  }

  @Override
  public int byteLength(List<T> records) throws IOException {
    return serialize(records).length;
  }

  /**
   * Length of the record serialized on its own, less the stream header. An
   * over-estimate inside a group, where class descriptors are written once.
   */
  @Override
  public int recordLength(T record) throws IOException {
    return writeObject(record, true).length - streamHeaderLength;
  }

  private byte[] writeObject(Object value, boolean write) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      if (write) {
        out.writeObject(value);
      }
    }
    return bytes.toByteArray();
  }
}
