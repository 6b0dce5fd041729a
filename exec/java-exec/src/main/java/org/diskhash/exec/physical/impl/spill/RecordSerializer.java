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

import java.io.IOException;
import java.util.List;

/**
 * Converts groups of records to and from the bytes written to a spill file.
 * Encoding is not self-delimiting across groups: callers must remember the
 * length of each group they write in order to read it back.
 * <p>
 * Implementations must round-trip exactly:
 * <tt>deserialize(serialize(records))</tt> equals <tt>records</tt>.
 *
 * @param <T> the record type
 */

public interface RecordSerializer<T> {

  byte[] serialize(List<T> records) throws IOException;

  List<T> deserialize(byte[] bytes) throws IOException;

  /**
   * @return the exact length of <tt>serialize(records)</tt>
   */
  int byteLength(List<T> records) throws IOException;

  /**
   * Estimate the number of bytes one record adds to a serialized group.
   * Used to track buffer sizes incrementally; may over-estimate, but should
   * not under-estimate.
   */
  int recordLength(T record) throws IOException;
}
