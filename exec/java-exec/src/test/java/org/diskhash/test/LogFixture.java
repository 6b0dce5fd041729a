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
package org.diskhash.test;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

/**
 * Sets test-specific log levels without touching <tt>logback-test.xml</tt>,
 * optionally capturing the events of the DiskHash loggers for assertions.
 * The original levels come back when the fixture closes.
 * <p>
 * Typical usage: <pre><code>
 * try (LogFixture logs = LogFixture.builder()
 *          .logger(DiskPartition.class, Level.DEBUG)
 *          .capture()
 *          .build()) {
 *   // Test code here
 *   assertTrue(logs.contains("spilled"));
 * }</code></pre>
 */

public class LogFixture implements AutoCloseable {

  private static final String PROJECT_PACKAGE_NAME = "org.diskhash";

  /**
   * Memento for a logger name and level.
   */
  private static class LogSpec {
    final String loggerName;
    final Level logLevel;

    LogSpec(String loggerName, Level level) {
      this.loggerName = loggerName;
      this.logLevel = level;
    }
  }

  public static class LogFixtureBuilder {

    private boolean capture;
    private final List<LogSpec> loggers = new ArrayList<>();

    /**
     * Keep the events logged under the project package in memory so that
     * the test can inspect them.
     */
    public LogFixtureBuilder capture() {
      capture = true;
      return this;
    }

    public LogFixtureBuilder logger(Class<?> loggerClass, Level level) {
      loggers.add(new LogSpec(loggerClass.getName(), level));
      return this;
    }

    public LogFixture build() {
      return new LogFixture(this);
    }
  }

  private ListAppender<ILoggingEvent> captureAppender;
  private final List<LogSpec> loggers = new ArrayList<>();
  private final Logger projectLogger;

  public LogFixture(LogFixtureBuilder builder) {
    projectLogger = (Logger) LoggerFactory.getLogger(PROJECT_PACKAGE_NAME);
    if (builder.capture) {
      LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
      captureAppender = new ListAppender<>();
      captureAppender.setContext(lc);
      captureAppender.setName("Capture");
      captureAppender.start();
      projectLogger.addAppender(captureAppender);
    }
    for (LogSpec spec : builder.loggers) {
      Logger logger = (Logger) LoggerFactory.getLogger(spec.loggerName);
      loggers.add(new LogSpec(spec.loggerName, logger.getLevel()));
      logger.setLevel(spec.logLevel);
    }
  }

  public static LogFixtureBuilder builder() {
    return new LogFixtureBuilder();
  }

  /**
   * @return the formatted messages captured so far, oldest first
   */
  public List<String> messages() {
    List<String> messages = new ArrayList<>();
    if (captureAppender != null) {
      for (ILoggingEvent event : captureAppender.list) {
        messages.add(event.getFormattedMessage());
      }
    }
    return messages;
  }

  public boolean contains(String text) {
    for (String message : messages()) {
      if (message.contains(text)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void close() {
    for (LogSpec spec : loggers) {
      ((Logger) LoggerFactory.getLogger(spec.loggerName)).setLevel(spec.logLevel);
    }
    if (captureAppender != null) {
      projectLogger.detachAppender(captureAppender);
      captureAppender.stop();
    }
  }
}
