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
import java.util.List;

import org.diskhash.common.exceptions.SpillException;
import org.diskhash.exec.physical.impl.spill.SpillSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * General implementation of {@link DiskHashedRelation} over a fixed list of
 * partitions. Owns the spill set the partitions were allocated from and
 * closes it once the partitions are closed.
 */

public final class GeneralDiskHashedRelation<T> implements DiskHashedRelation<T> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(GeneralDiskHashedRelation.class);

  private final List<DiskPartition<T>> partitions;
  private final SpillSet spillSet;

  public GeneralDiskHashedRelation(List<DiskPartition<T>> partitions, SpillSet spillSet) {
    this.partitions = ImmutableList.copyOf(partitions);
    this.spillSet = Preconditions.checkNotNull(spillSet);
  }

  @Override
  public Iterator<DiskPartition<T>> getIterator() {
    return partitions.iterator();
  }

  @Override
  public int getPartitionCount() { return partitions.size(); }

  @Override
  public DiskPartition<T> getPartition(int index) {
    Preconditions.checkElementIndex(index, partitions.size());
    return partitions.get(index);
  }

  @Override
  public int getSpilledPartitionCount() {
    int count = 0;
    for (DiskPartition<T> partition : partitions) {
      if (partition.isSpilled()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Close every partition, then the spill set. A failure to close one
   * partition does not stop the others from being closed; the first failure
   * is rethrown with the rest attached as suppressed exceptions.
   */
  @Override
  public void closeAllPartitions() {
    Exception first = null;
    int failures = 0;
    for (DiskPartition<T> partition : partitions) {
      try {
        partition.closePartition();
      } catch (Exception e) {
        failures++;
        if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    spillSet.close();
    if (first != null) {
      throw SpillException.resourceError(first)
          .message("Failed to close %d of %d partitions", failures, partitions.size())
          .addContext("Spill set", spillSet.getSpillDirName())
          .build(logger);
    }
    logger.debug("Closed {} partitions, {} spilled, {} bytes written",
        partitions.size(), getSpilledPartitionCount(), spillSet.getWriteBytes());
  }
}
