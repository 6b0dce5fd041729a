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
package org.diskhash.common.exceptions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.diskhash.common.exceptions.SpillException.ErrorType;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

public class TestSpillException {

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @Before
  public void setup() {
    logger = (Logger) LoggerFactory.getLogger(TestSpillException.class);
    logger.setLevel(Level.ERROR);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @After
  public void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(null);
  }

  @Test
  public void testMessageAndContext() {
    IOException cause = new IOException("disk full");
    SpillException e = SpillException.dataWriteError(cause)
        .message("Failed to spill partition %d", 3)
        .addContext("File", "/tmp/spill1_partition3")
        .addContext("Chunk 2")
        .build(logger);
    assertEquals(ErrorType.DATA_WRITE, e.getErrorType());
    assertSame(cause, e.getCause());
    assertEquals("DATA_WRITE ERROR: Failed to spill partition 3\n\n" +
        "File: /tmp/spill1_partition3\nChunk 2", e.getMessage());
    assertEquals(2, e.getContext().size());
  }

  @Test
  public void testMessageFromCause() {
    SpillException e = SpillException.resourceError(new IOException("gone"))
        .build(logger);
    assertEquals(ErrorType.RESOURCE, e.getErrorType());
    assertEquals("RESOURCE ERROR: gone", e.getMessage());

    e = SpillException.dataReadError().build(logger);
    assertEquals(ErrorType.DATA_READ, e.getErrorType());
    assertEquals("DATA_READ ERROR: Spill failure", e.getMessage());
  }

  @Test
  public void testLiteralPercent() {
    SpillException e = SpillException.dataReadError()
        .message("100% of chunk read")
        .build(logger);
    assertEquals("DATA_READ ERROR: 100% of chunk read", e.getMessage());
  }

  @Test
  public void testBuildLogs() {
    SpillException e = SpillException.resourceError()
        .message("Cannot delete")
        .build(logger);
    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.ERROR, event.getLevel());
    assertEquals(e.getMessage(), event.getFormattedMessage());
    assertTrue(e instanceof RuntimeException);
  }
}
