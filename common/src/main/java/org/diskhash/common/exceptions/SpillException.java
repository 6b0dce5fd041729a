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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * Unchecked exception raised when spilling to, or reading back from, a spill
 * file fails. Created through a builder that attaches a message and context
 * and logs the error as it is built:
 * <pre><code>
 * throw SpillException.dataWriteError(e)
 *     .message("Failed to spill partition %d", index)
 *     .addContext("File", path)
 *     .build(logger);
 * </code></pre>
 */
public class SpillException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum ErrorType {

    /**
     * A file or directory could not be created, opened, closed or deleted.
     */
    RESOURCE,

    /**
     * Records could not be encoded or written to a spill file.
     */
    DATA_WRITE,

    /**
     * Spilled bytes could not be read or decoded, including chunk framing
     * errors.
     */
    DATA_READ
  }

  private final ErrorType errorType;
  private final List<String> context;

  protected SpillException(Builder builder) {
    super(builder.formatMessage(), builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  public static Builder resourceError() {
    return new Builder(ErrorType.RESOURCE, null);
  }

  public static Builder resourceError(Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  public static Builder dataWriteError() {
    return new Builder(ErrorType.DATA_WRITE, null);
  }

  public static Builder dataWriteError(Throwable cause) {
    return new Builder(ErrorType.DATA_WRITE, cause);
  }

  public static Builder dataReadError() {
    return new Builder(ErrorType.DATA_READ, null);
  }

  public static Builder dataReadError(Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  public ErrorType getErrorType() { return errorType; }

  public List<String> getContext() { return context; }

  public static class Builder {
    private final ErrorType errorType;
    private final Throwable cause;
    private final List<String> context = new ArrayList<>();
    private String message;

    protected Builder(ErrorType errorType, Throwable cause) {
      this.errorType = Preconditions.checkNotNull(errorType);
      this.cause = cause;
    }

    public Builder message(String format, Object... args) {
      message = args.length == 0 ? format : String.format(format, args);
      return this;
    }

    public Builder addContext(String name, Object value) {
      context.add(name + ": " + value);
      return this;
    }

    public Builder addContext(String value) {
      context.add(value);
      return this;
    }

    private String formatMessage() {
      StringBuilder buf = new StringBuilder()
          .append(errorType.name())
          .append(" ERROR: ");
      if (message != null) {
        buf.append(message);
      } else if (cause != null && cause.getMessage() != null) {
        buf.append(cause.getMessage());
      } else {
        buf.append("Spill failure");
      }
      if (! context.isEmpty()) {
        buf.append("\n\n");
        Joiner.on("\n").appendTo(buf, context);
      }
      return buf.toString();
    }

    /**
     * Build the exception and log it at error level.
     *
     * @param logger the logger of the class reporting the error
     * @return the exception, ready to be thrown
     */
    public SpillException build(org.slf4j.Logger logger) {
      SpillException e = new SpillException(this);
      logger.error(e.getMessage(), cause);
      return e;
    }
  }
}
