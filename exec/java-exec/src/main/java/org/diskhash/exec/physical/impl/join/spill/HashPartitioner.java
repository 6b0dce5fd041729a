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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.math.IntMath;

/**
 * Coarse-grained hash used to assign records to partitions in the first
 * phase of external hashing.
 */

public final class HashPartitioner {

  private HashPartitioner() { }

  /**
   * Hash code of a partitioning key. Null keys hash to zero; arrays hash by
   * content so that composite keys built as arrays partition consistently.
   */
  public static int hashCode(Object key) {
    if (key == null) {
      return 0;
    }
    if (key instanceof Object[]) {
      return Arrays.deepHashCode((Object[]) key);
    }
    return key.hashCode();
  }

  /**
   * Partition index of the given key.
   *
   * @return a value in <tt>[0, partitionCount)</tt>, also for keys whose
   * hash code is negative
   */
  public static int partitionFor(Object key, int partitionCount) {
    Preconditions.checkArgument(partitionCount > 0, "Partition count must be positive: %s", partitionCount);
    return IntMath.mod(hashCode(key), partitionCount);
  }
}
