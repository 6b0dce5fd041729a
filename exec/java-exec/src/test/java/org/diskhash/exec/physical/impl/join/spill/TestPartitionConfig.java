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

import static org.junit.Assert.*;

import java.util.Collections;

import org.diskhash.common.config.DiskHashConfig;
import org.diskhash.exec.ExecConstants;
import org.diskhash.test.ConfigBuilder;
import org.junit.Test;

public class TestPartitionConfig {

  /**
   * Verify defaults configured in diskhash-module.conf.
   */
  @Test
  public void testConfigDefaults() {
    DiskHashConfig config = DiskHashConfig.create();
    PartitionConfig partitionConfig = new PartitionConfig(config);
    assertEquals(64, partitionConfig.partitionCount());
    assertEquals(64_000, partitionConfig.blockSize());
    assertFalse(partitionConfig.dropSpillTrigger());
    assertFalse(partitionConfig.flushUnspilledOnClose());

    assertEquals("file:///", config.getString(ExecConstants.SPILL_FILESYSTEM));
    assertFalse(config.getBoolean(ExecConstants.SPILL_USE_HADOOP_FS));

    // Spill directories default to the shared temporary directories.

    assertEquals(Collections.singletonList("/tmp/diskhash"), config.getStringList(ExecConstants.SPILL_DIRS));
  }

  /**
   * Verify that the constants map to the expected properties, and that the
   * properties can be overridden, including with HOCON size strings.
   */
  @Test
  public void testConfigOverride() {
    DiskHashConfig config = new ConfigBuilder()
        .put(ExecConstants.HASH_PARTITION_COUNT, 16)
        .put(ExecConstants.HASH_PARTITION_BLOCK_SIZE, "32K")
        .put(ExecConstants.HASH_PARTITION_DROP_SPILL_TRIGGER, true)
        .put(ExecConstants.HASH_PARTITION_FLUSH_UNSPILLED, true)
        .build();
    PartitionConfig partitionConfig = new PartitionConfig(config);
    assertEquals(16, partitionConfig.partitionCount());
    assertEquals(32 * 1024, partitionConfig.blockSize());
    assertTrue(partitionConfig.dropSpillTrigger());
    assertTrue(partitionConfig.flushUnspilledOnClose());
  }

  /**
   * Out-of-range configured values are clamped to their limits.
   */
  @Test
  public void testConfigLimits() {
    DiskHashConfig config = new ConfigBuilder()
        .put(ExecConstants.HASH_PARTITION_COUNT, PartitionConfig.MIN_PARTITION_COUNT - 1)
        .put(ExecConstants.HASH_PARTITION_BLOCK_SIZE, 10_000_000_000L)
        .build();
    PartitionConfig partitionConfig = new PartitionConfig(config);
    assertEquals(PartitionConfig.MIN_PARTITION_COUNT, partitionConfig.partitionCount());
    assertEquals(Integer.MAX_VALUE, partitionConfig.blockSize());
  }

  /**
   * Explicit values, as given to the builder, are checked instead.
   */
  @Test
  public void testExplicitValues() {
    PartitionConfig config = new PartitionConfig(8, 0, true, false);
    assertEquals(8, config.partitionCount());
    assertEquals(0, config.blockSize());
    try {
      new PartitionConfig(0, 100, false, false);
      fail();
    } catch (IllegalArgumentException e) {
      // Expected
    }
    try {
      new PartitionConfig(4, -1, false, false);
      fail();
    } catch (IllegalArgumentException e) {
      // Expected
    }
  }
}
