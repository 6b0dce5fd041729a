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
package org.diskhash.exec.physical.impl.join.spill;

import java.util.Iterator;

import org.diskhash.exec.physical.impl.spill.RecordSerializer;
import org.diskhash.exec.physical.impl.spill.SpillSet;

/**
 * A relation that is hash partitioned and spilled to disk: the output of
 * the first phase of external hashing. Every partition's input is closed, so
 * each can be replayed with {@link DiskPartition#getData()}.
 *
 * @param <T> the record type
 */

public interface DiskHashedRelation<T> {

  /**
   * @return an iterator over the partitions that make up this relation, in
   * partition index order
   */
  Iterator<DiskPartition<T>> getIterator();

  int getPartitionCount();

  DiskPartition<T> getPartition(int index);

  /**
   * @return the number of partitions that wrote at least one chunk to disk
   */
  int getSpilledPartitionCount();

  /**
   * Close all the partitions of this relation, deleting the files they
   * spilled to.
   */
  void closeAllPartitions();

  /**
   * Start building a relation whose partitions spill through the given
   * spill set and serializer.
   */
  static <T> DiskHashedRelationBuilder<T> builder(SpillSet spillSet, RecordSerializer<T> serializer) {
    return new DiskHashedRelationBuilder<>(spillSet, serializer);
  }
}
