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
package org.diskhash.exec;

/**
 * Names of the configuration keys used by the execution engine. Defaults
 * live in <tt>diskhash-module.conf</tt>.
 */
public final class ExecConstants {

  private ExecConstants() { }

  public static final String HASH_PARTITION_PARENT = "diskhash.exec.hash_partition";
  public static final String SPILL_PARENT = "diskhash.exec.spill";

  /**
   * Number of partitions the build phase hashes records into.
   */
  public static final String HASH_PARTITION_COUNT = HASH_PARTITION_PARENT + ".count";

  /**
   * Estimated serialized size, in bytes, above which a partition's in-memory
   * buffer is spilled on the next insert.
   */
  public static final String HASH_PARTITION_BLOCK_SIZE = HASH_PARTITION_PARENT + ".block_size";

  /**
   * Legacy behavior: discard the record whose insert triggered a spill
   * instead of buffering it after the spill.
   */
  public static final String HASH_PARTITION_DROP_SPILL_TRIGGER = HASH_PARTITION_PARENT + ".drop_spill_trigger";

  /**
   * Write the buffered tail of a partition that never spilled to disk when
   * its input is closed, rather than keeping it in memory.
   */
  public static final String HASH_PARTITION_FLUSH_UNSPILLED = HASH_PARTITION_PARENT + ".flush_unspilled_on_close";

  // Spill files

  public static final String SPILL_FILESYSTEM = SPILL_PARENT + ".fs";
  public static final String SPILL_DIRS = SPILL_PARENT + ".directories";
  public static final String SPILL_USE_HADOOP_FS = SPILL_PARENT + ".use_hadoop_fs";
}
