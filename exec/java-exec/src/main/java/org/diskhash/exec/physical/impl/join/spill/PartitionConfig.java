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

import org.diskhash.common.config.DiskHashConfig;
import org.diskhash.exec.ExecConstants;

import com.google.common.base.Preconditions;

/**
 * Settings for the partitions of a disk-hashed relation, read from the
 * configuration with out-of-range values clamped to their limits, or given
 * explicitly and validated.
 */

public class PartitionConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PartitionConfig.class);

  public static final int DEFAULT_PARTITION_COUNT = 64;
  public static final int DEFAULT_BLOCK_SIZE = 64_000;

  public static final int MIN_PARTITION_COUNT = 1;
  public static final int MIN_BLOCK_SIZE = 0;

  private final int partitionCount;
  private final int blockSize;
  private final boolean dropSpillTrigger;
  private final boolean flushUnspilledOnClose;

  public PartitionConfig(DiskHashConfig config) {
    partitionCount = Math.max(MIN_PARTITION_COUNT, config.getInt(ExecConstants.HASH_PARTITION_COUNT));

    // Block size is a byte count, so accept the HOCON size forms ("64K")
    // but limit it to what a single chunk can hold.

    long limit = config.getBytes(ExecConstants.HASH_PARTITION_BLOCK_SIZE);
    blockSize = (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_BLOCK_SIZE, limit));
    dropSpillTrigger = config.getBoolean(ExecConstants.HASH_PARTITION_DROP_SPILL_TRIGGER);
    flushUnspilledOnClose = config.getBoolean(ExecConstants.HASH_PARTITION_FLUSH_UNSPILLED);
    logConfig();
  }

  public PartitionConfig(int partitionCount, int blockSize,
      boolean dropSpillTrigger, boolean flushUnspilledOnClose) {
    Preconditions.checkArgument(partitionCount >= MIN_PARTITION_COUNT,
        "Partition count must be at least %s: %s", MIN_PARTITION_COUNT, partitionCount);
    Preconditions.checkArgument(blockSize >= MIN_BLOCK_SIZE,
        "Block size must be at least %s: %s", MIN_BLOCK_SIZE, blockSize);
    this.partitionCount = partitionCount;
    this.blockSize = blockSize;
    this.dropSpillTrigger = dropSpillTrigger;
    this.flushUnspilledOnClose = flushUnspilledOnClose;
  }

  public static PartitionConfig defaults() {
    return new PartitionConfig(DEFAULT_PARTITION_COUNT, DEFAULT_BLOCK_SIZE, false, false);
  }

  private void logConfig() {
    logger.debug("Config: partition count = {}, block size = {}, " +
                 "drop spill trigger = {}, flush unspilled on close = {}",
                 partitionCount, blockSize, dropSpillTrigger, flushUnspilledOnClose);
  }

  public int partitionCount() { return partitionCount; }
  public int blockSize() { return blockSize; }
  public boolean dropSpillTrigger() { return dropSpillTrigger; }
  public boolean flushUnspilledOnClose() { return flushUnspilledOnClose; }

  @Override
  public String toString() {
    return "PartitionConfig[partitionCount=" + partitionCount +
        ", blockSize=" + blockSize +
        ", dropSpillTrigger=" + dropSpillTrigger +
        ", flushUnspilledOnClose=" + flushUnspilledOnClose + "]";
  }
}
