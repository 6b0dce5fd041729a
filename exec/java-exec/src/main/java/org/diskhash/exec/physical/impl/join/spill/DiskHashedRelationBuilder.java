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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.diskhash.exec.physical.impl.spill.RecordSerializer;
import org.diskhash.exec.physical.impl.spill.SpillSet;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Runs the first phase of external hashing: uses a coarse-grained hash of
 * each record's key to distribute the records across a number of
 * {@link DiskPartition}s, then closes the input of every partition and
 * wraps them in a {@link DiskHashedRelation}.
 * <p>
 * Typical usage: <pre><code>
 * DiskHashedRelation&lt;Row&gt; relation = DiskHashedRelation.builder(spillSet, serializer)
 *     .config(new PartitionConfig(diskHashConfig))
 *     .keyGenerator(Row::getKey)
 *     .build(rows);
 * </code></pre>
 * The defaults are 64 partitions with a 64,000 byte block size.
 */

public class DiskHashedRelationBuilder<T> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DiskHashedRelationBuilder.class);

  private final SpillSet spillSet;
  private final RecordSerializer<T> serializer;
  private Function<? super T, ?> keyGenerator;
  private int partitionCount = PartitionConfig.DEFAULT_PARTITION_COUNT;
  private int blockSize = PartitionConfig.DEFAULT_BLOCK_SIZE;
  private boolean dropSpillTrigger;
  private boolean flushUnspilledOnClose;

  public DiskHashedRelationBuilder(SpillSet spillSet, RecordSerializer<T> serializer) {
    this.spillSet = Preconditions.checkNotNull(spillSet);
    this.serializer = Preconditions.checkNotNull(serializer);
  }

  /**
   * Take all partition settings from the given configuration. Settings made
   * after this call override it.
   */
  public DiskHashedRelationBuilder<T> config(PartitionConfig config) {
    partitionCount = config.partitionCount();
    blockSize = config.blockSize();
    dropSpillTrigger = config.dropSpillTrigger();
    flushUnspilledOnClose = config.flushUnspilledOnClose();
    return this;
  }

  public DiskHashedRelationBuilder<T> keyGenerator(Function<? super T, ?> keyGenerator) {
    this.keyGenerator = keyGenerator;
    return this;
  }

  public DiskHashedRelationBuilder<T> partitionCount(int partitionCount) {
    this.partitionCount = partitionCount;
    return this;
  }

  public DiskHashedRelationBuilder<T> blockSize(int blockSize) {
    this.blockSize = blockSize;
    return this;
  }

  public DiskHashedRelationBuilder<T> dropSpillTrigger(boolean flag) {
    dropSpillTrigger = flag;
    return this;
  }

  public DiskHashedRelationBuilder<T> flushUnspilledOnClose(boolean flag) {
    flushUnspilledOnClose = flag;
    return this;
  }

  /**
   * Partition the input and return the resulting relation. On failure,
   * every partition created so far is closed before the error propagates.
   *
   * @param input the records to partition
   * @return the relation, with the input of every partition closed
   */
  public DiskHashedRelation<T> build(Iterator<? extends T> input) {
    Preconditions.checkNotNull(input);
    Preconditions.checkState(keyGenerator != null, "A key generator is required");
    PartitionConfig config = new PartitionConfig(partitionCount, blockSize,
        dropSpillTrigger, flushUnspilledOnClose);

    Stopwatch watch = Stopwatch.createStarted();
    List<DiskPartition<T>> partitions = new ArrayList<>(partitionCount);
    int rowCount = 0;
    try {
      for (int i = 0; i < partitionCount; i++) {
        partitions.add(new DiskPartition<>(i, config, spillSet, serializer));
      }
      while (input.hasNext()) {
        T row = input.next();
        int index = HashPartitioner.partitionFor(keyGenerator.apply(row), partitionCount);
        partitions.get(index).insert(row);
        rowCount++;
      }
      for (DiskPartition<T> partition : partitions) {
        partition.closeInput();
      }
    } catch (RuntimeException e) {
      release(partitions, e);
      throw e;
    }
    GeneralDiskHashedRelation<T> relation = new GeneralDiskHashedRelation<>(partitions, spillSet);
    logger.debug("Partitioned {} records into {} partitions ({} spilled) in {} ms",
        rowCount, partitionCount, relation.getSpilledPartitionCount(),
        watch.elapsed(TimeUnit.MILLISECONDS));
    return relation;
  }

  private void release(List<DiskPartition<T>> partitions, RuntimeException cause) {
    for (DiskPartition<T> partition : partitions) {
      try {
        partition.closePartition();
      } catch (Exception e) {
        cause.addSuppressed(e);
      }
    }
    spillSet.close();
  }
}
