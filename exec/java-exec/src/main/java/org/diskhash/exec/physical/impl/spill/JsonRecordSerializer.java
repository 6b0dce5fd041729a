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

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

/**
 * Record serializer that writes each group as a JSON array using Jackson.
 * Records must be Jackson-serializable beans (or carry
 * {@code @JsonCreator}/{@code @JsonProperty} annotations).
 */

public class JsonRecordSerializer<T> implements RecordSerializer<T> {

  private final ObjectMapper mapper;
  private final JavaType listType;

  public JsonRecordSerializer(Class<T> recordClass) {
    this(new ObjectMapper(), recordClass);
  }

  public JsonRecordSerializer(ObjectMapper mapper, Class<T> recordClass) {
    this.mapper = Preconditions.checkNotNull(mapper);
    listType = mapper.getTypeFactory().constructCollectionType(List.class, recordClass);
  }

  @Override
  public byte[] serialize(List<T> records) throws IOException {
    return mapper.writerFor(listType).writeValueAsBytes(records);
  }

  @Override
  public List<T> deserialize(byte[] bytes) throws IOException {
    return mapper.readValue(bytes, listType);
  }

  @Override
  public int byteLength(List<T> records) throws IOException {
    return serialize(records).length;
  }

  /**
   * The record's JSON plus one byte for the separating comma.
   */
  @Override
  public int recordLength(T record) throws IOException {
    return mapper.writeValueAsBytes(record).length + 1;
  }
}
