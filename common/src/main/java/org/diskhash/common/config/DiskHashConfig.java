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
package org.diskhash.common.config;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration used within the DiskHash code. Values come, in increasing
 * order of precedence, from:
 * <ol>
 * <li>the base defaults in {@value #DEFAULTS_FILE_NAME},</li>
 * <li>every {@value #MODULE_FILE_NAME} found on the class path (one per
 * module),</li>
 * <li>the optional user file {@value #OVERRIDE_FILE_NAME},</li>
 * <li>Java system properties,</li>
 * <li>overrides passed to {@link #create(Config)}.</li>
 * </ol>
 */
public final class DiskHashConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DiskHashConfig.class);

  public static final String DEFAULTS_FILE_NAME = "diskhash-default.conf";
  public static final String MODULE_FILE_NAME = "diskhash-module.conf";
  public static final String OVERRIDE_FILE_NAME = "diskhash-override.conf";

  public static final String ROOT_PARENT = "diskhash";

  private final Config config;

  private DiskHashConfig(Config config) {
    this.config = config;
  }

  public static String append(String parent, String key) {
    return parent + "." + key;
  }

  /**
   * Load the configuration from the class path and system properties.
   */
  public static DiskHashConfig create() {
    return create(ConfigFactory.empty());
  }

  /**
   * Load the configuration as in {@link #create()}, then apply the given
   * overrides on top. Used mostly by tests.
   */
  public static DiskHashConfig create(Config overrides) {
    Preconditions.checkNotNull(overrides);

    // parseResources() merges all same-named resources, so each module's
    // diskhash-module.conf contributes its own defaults.

    Config defaults = ConfigFactory.parseResources(DEFAULTS_FILE_NAME);
    Config modules = ConfigFactory.parseResources(MODULE_FILE_NAME);
    Config user = ConfigFactory.parseResources(OVERRIDE_FILE_NAME);

    Config config = overrides
        .withFallback(ConfigFactory.systemProperties())
        .withFallback(user)
        .withFallback(modules)
        .withFallback(defaults)
        .resolve();
    logger.debug("Loaded configuration: {} module keys, {} override keys",
        modules.entrySet().size(), overrides.entrySet().size());
    return new DiskHashConfig(config);
  }

  public static DiskHashConfig create(Map<String, ?> overrides) {
    return create(ConfigFactory.parseMap(overrides));
  }

  /**
   * Wrap an already-resolved configuration without consulting the class path.
   */
  public static DiskHashConfig forConfig(Config config) {
    return new DiskHashConfig(config.resolve());
  }

  public Config getConfig() { return config; }

  public boolean hasPath(String path) { return config.hasPath(path); }

  public String getString(String path) { return config.getString(path); }

  public int getInt(String path) { return config.getInt(path); }

  public long getLong(String path) { return config.getLong(path); }

  public boolean getBoolean(String path) { return config.getBoolean(path); }

  /**
   * Memory and file sizes, accepting the HOCON size forms ("64K", "10M")
   * as well as plain byte counts.
   */
  public long getBytes(String path) { return config.getBytes(path); }

  public List<String> getStringList(String path) { return config.getStringList(path); }

  @Override
  public String toString() {
    if (! config.hasPath(ROOT_PARENT)) {
      return "{}";
    }
    return config.getConfig(ROOT_PARENT).root().render();
  }
}
