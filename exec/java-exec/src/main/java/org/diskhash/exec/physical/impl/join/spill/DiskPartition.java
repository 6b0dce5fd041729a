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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

import org.diskhash.common.exceptions.SpillException;
import org.diskhash.exec.physical.impl.spill.RecordSerializer;
import org.diskhash.exec.physical.impl.spill.SpillSet;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.io.ByteStreams;

/**
 * One bucket of a disk-hashed relation. Records are buffered in memory; once
 * the estimated size of the buffer exceeds the block size, the next insert
 * spills the whole buffer to the partition's spill file as one chunk.
 * <p>
 * The spill file is a plain concatenation of chunks, each the output of one
 * {@link RecordSerializer#serialize(List)} call. Chunk lengths are kept in
 * memory, in spill order, to find the chunk boundaries on read.
 * <p>
 * A partition has two phases. In the write phase, {@link #insert(Object)}
 * adds records. {@link #closeInput()} ends the write phase; after that
 * {@link #getData()} replays the records, chunks first, then any tail that
 * was never spilled. {@link #closePartition()} releases the file.
 * Not thread safe.
 *
 * @param <T> the record type
 */

public class DiskPartition<T> implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DiskPartition.class);

  private final int partitionIndex;
  private final SpillSet spillSet;
  private final RecordSerializer<T> serializer;
  private final int blockSize;
  private final boolean dropSpillTrigger;
  private final boolean flushUnspilledOnClose;
  private final String path;

  private final List<T> buffer = new ArrayList<>();
  private final List<Integer> chunkSizes = new ArrayList<>();

  /**
   * Serialized size of an empty group: the starting point of
   * {@link #bufferedBytes} after each spill.
   */
  private final long emptyBytes;

  /**
   * Running estimate of the serialized size of {@link #buffer}.
   */
  private long bufferedBytes;

  private OutputStream outputStream;
  private InputStream inputStream;

  private boolean spilled;
  private boolean inputClosed;
  private boolean closed;

  /**
   * Set when a spill fails. The file may then hold bytes of a partial chunk
   * that no chunk size accounts for, so the partition accepts no more work
   * other than {@link #closePartition()}.
   */
  private boolean failed;

  private int recordCount;
  private int droppedCount;
  private long writeBytes;

  public DiskPartition(int partitionIndex, PartitionConfig config,
      SpillSet spillSet, RecordSerializer<T> serializer) {
    this.partitionIndex = partitionIndex;
    this.spillSet = Preconditions.checkNotNull(spillSet);
    this.serializer = Preconditions.checkNotNull(serializer);
    blockSize = config.blockSize();
    dropSpillTrigger = config.dropSpillTrigger();
    flushUnspilledOnClose = config.flushUnspilledOnClose();
    try {
      emptyBytes = serializer.byteLength(Collections.<T>emptyList());
    } catch (IOException e) {
      throw SpillException.dataWriteError(e)
          .message("Cannot size an empty record group")
          .addContext("Partition", partitionIndex)
          .build(logger);
    }
    bufferedBytes = emptyBytes;
    path = spillSet.getNextSpillFile("partition" + partitionIndex);
    try {
      outputStream = spillSet.openForOutput(path);
    } catch (IOException e) {
      throw SpillException.resourceError(e)
          .message("Failed to create spill file for partition %d", partitionIndex)
          .addContext("File", path)
          .build(logger);
    }
  }

  /**
   * Add a record to this partition. If the buffered records already exceed
   * the block size, they are first spilled to disk. The record itself is
   * then buffered, unless the partition is configured to drop the record
   * that triggers a spill.
   *
   * @param record the record to add
   * @throws IllegalStateException if input was already closed
   */
  public void insert(T record) {
    Preconditions.checkState(! inputClosed && ! closed,
        "Cannot insert into partition %s after its input is closed", partitionIndex);
    checkNotFailed();
    if (! buffer.isEmpty() && blockSize < bufferedBytes && blockSize < measureBuffer()) {
      spillPartitionToDisk();
      if (dropSpillTrigger) {
        droppedCount++;
        logger.trace("Partition {} dropped the record that triggered a spill", partitionIndex);
        return;
      }
    }
    int length;
    try {
      length = serializer.recordLength(record);
    } catch (IOException e) {
      throw SpillException.dataWriteError(e)
          .message("Cannot size record for partition %d", partitionIndex)
          .build(logger);
    }
    buffer.add(record);
    bufferedBytes += length;
    recordCount++;
  }

  /**
   * Replace the running estimate with the exact serialized size of the
   * buffer. The per-record estimates only bound the real cost from above,
   * so the estimate passing the block size says the buffer may be full;
   * this says whether it is.
   *
   * @return the exact size of the buffered records
   */
  private long measureBuffer() {
    try {
      bufferedBytes = serializer.byteLength(buffer);
    } catch (IOException e) {
      throw SpillException.dataWriteError(e)
          .message("Cannot size the buffered records of partition %d", partitionIndex)
          .addContext("Records", buffer.size())
          .build(logger);
    }
    return bufferedBytes;
  }

  private void checkNotFailed() {
    Preconditions.checkState(! failed,
        "Partition %s failed while spilling and can only be closed", partitionIndex);
  }

  /**
   * Write the buffered records to the end of the spill file as one chunk
   * and clear the buffer.
   */
  private void spillPartitionToDisk() {
    Stopwatch watch = Stopwatch.createStarted();
    byte[] bytes;
    try {
      bytes = serializer.serialize(buffer);
      outputStream.write(bytes);
    } catch (IOException e) {
      failed = true;
      throw SpillException.dataWriteError(e)
          .message("Failed to spill partition %d to disk", partitionIndex)
          .addContext("File", path)
          .addContext("Records", buffer.size())
          .build(logger);
    }

    // Chunk sizes are the only record of where one spill ends and the
    // next begins.

    chunkSizes.add(bytes.length);
    writeBytes += bytes.length;
    spillSet.tallyWriteBytes(bytes.length);
    spilled = true;
    logger.debug("Partition {}: spilled {} records, {} bytes (estimated {}) in {} us",
        partitionIndex, buffer.size(), bytes.length, bufferedBytes,
        watch.elapsed(TimeUnit.MICROSECONDS));
    buffer.clear();
    bufferedBytes = emptyBytes;
  }

  /**
   * End the write phase. A partition that has spilled writes its remaining
   * records as a final chunk; one that never spilled keeps them in memory
   * unless configured to flush them. The output stream is closed either way.
   *
   * @throws IllegalStateException if input was already closed
   */
  public void closeInput() {
    Preconditions.checkState(! inputClosed && ! closed,
        "Input of partition %s is already closed", partitionIndex);
    checkNotFailed();
    RuntimeException spillFailure = null;
    try {
      if (! buffer.isEmpty() && (spilled || flushUnspilledOnClose)) {
        spillPartitionToDisk();
      }
    } catch (RuntimeException e) {
      spillFailure = e;
    }
    inputClosed = true;
    try {
      closeOutputStream();
    } catch (IOException e) {
      SpillException closeFailure = SpillException.resourceError(e)
          .message("Failed to close spill file of partition %d", partitionIndex)
          .addContext("File", path)
          .build(logger);
      if (spillFailure == null) {
        throw closeFailure;
      }
      spillFailure.addSuppressed(closeFailure);
    }
    if (spillFailure != null) {
      throw spillFailure;
    }
    logger.trace("Partition {}: input closed with {} records, {} chunks, {} in memory",
        partitionIndex, recordCount, chunkSizes.size(), buffer.size());
  }

  /**
   * Replay the records of this partition: every spilled chunk in the order
   * written, then the records still held in memory. Each call starts a new
   * replay from the beginning of the file; starting one closes the file
   * handle of any earlier replay, which must no longer be used.
   *
   * @return a single-pass iterator over the partition's records
   * @throws IllegalStateException if input has not been closed
   */
  public Iterator<T> getData() {
    Preconditions.checkState(inputClosed,
        "Should not be reading partition %s before closing input", partitionIndex);
    Preconditions.checkState(! closed, "Partition %s is closed", partitionIndex);
    checkNotFailed();
    try {
      closeInputStream();
      if (! chunkSizes.isEmpty()) {
        inputStream = spillSet.openForInput(path);
      }
    } catch (IOException e) {
      throw SpillException.resourceError(e)
          .message("Failed to open spill file of partition %d", partitionIndex)
          .addContext("File", path)
          .build(logger);
    }
    return new ReplayIterator(inputStream);
  }

  /**
   * Walks the chunks of the spill file, then the in-memory tail.
   */
  private class ReplayIterator implements Iterator<T> {

    private final InputStream in;
    private final Iterator<Integer> chunkSizeIter = chunkSizes.iterator();
    private Iterator<T> current = Collections.emptyIterator();
    private ReplayState state = ReplayState.READING_CHUNK;
    private int chunkIndex;

    public ReplayIterator(InputStream in) {
      this.in = in;
    }

    @Override
    public boolean hasNext() {
      Preconditions.checkState(state == ReplayState.EXHAUSTED || ! closed,
          "Partition %s was closed during replay", partitionIndex);
      for (;;) {
        switch (state) {
        case READING_CHUNK:
          if (current.hasNext()) {
            return true;
          }
          if (chunkSizeIter.hasNext()) {
            current = readChunk(chunkSizeIter.next());
          } else {
            releaseInput(in);
            current = Collections.unmodifiableList(buffer).iterator();
            state = ReplayState.READING_TAIL;
          }
          break;
        case READING_TAIL:
          if (current.hasNext()) {
            return true;
          }
          state = ReplayState.EXHAUSTED;
          break;
        default:
          return false;
        }
      }
    }

    @Override
    public T next() {
      if (! hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }

    /**
     * Read exactly one chunk from the current file position and decode it.
     */
    private Iterator<T> readChunk(int chunkSize) {
      int chunk = chunkIndex++;
      if (chunkSize <= 0) {
        throw SpillException.dataReadError()
            .message("Invalid size %d for chunk %d of partition %d", chunkSize, chunk, partitionIndex)
            .addContext("File", path)
            .build(logger);
      }
      Stopwatch watch = Stopwatch.createStarted();
      byte[] bytes = new byte[chunkSize];
      try {
        ByteStreams.readFully(in, bytes);
      } catch (EOFException e) {
        throw SpillException.dataReadError(e)
            .message("Spill file of partition %d ended inside chunk %d of %d bytes",
                partitionIndex, chunk, chunkSize)
            .addContext("File", path)
            .build(logger);
      } catch (IOException e) {
        throw SpillException.dataReadError(e)
            .message("Failure while reading spilled data of partition %d", partitionIndex)
            .addContext("File", path)
            .build(logger);
      }
      List<T> records;
      try {
        records = serializer.deserialize(bytes);
      } catch (IOException e) {
        throw SpillException.dataReadError(e)
            .message("Cannot decode chunk %d of partition %d", chunk, partitionIndex)
            .addContext("File", path)
            .addContext("Chunk size", chunkSize)
            .build(logger);
      }
      spillSet.tallyReadBytes(chunkSize);
      logger.debug("Partition {}: read {} records from chunk {} in {} us",
          partitionIndex, records.size(), chunk, watch.elapsed(TimeUnit.MICROSECONDS));
      return records.iterator();
    }
  }

  private enum ReplayState { READING_CHUNK, READING_TAIL, EXHAUSTED }

  /**
   * Release the read handle once a replay has consumed every chunk, unless
   * a newer replay has replaced it.
   */
  private void releaseInput(InputStream in) {
    if (in == null || in != inputStream) {
      return;
    }
    try {
      closeInputStream();
    } catch (IOException e) {
      throw SpillException.resourceError(e)
          .message("Failed to close spill file of partition %d", partitionIndex)
          .addContext("File", path)
          .build(logger);
    }
  }

  /**
   * Close this partition: release both file handles and delete the spill
   * file. Each step is attempted; the first failure is reported. Safe to
   * call more than once.
   */
  public void closePartition() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    buffer.clear();
    IOException ex = null;
    try {
      closeOutputStream();
    } catch (IOException e) {
      ex = e;
    }
    try {
      closeInputStream();
    } catch (IOException e) {
      ex = ex == null ? e : ex;
    }
    try {
      spillSet.delete(path);
    } catch (IOException e) {
      ex = ex == null ? e : ex;
    }
    if (ex != null) {
      throw ex;
    }
    logger.trace("Partition {}: closed, deleted {}", partitionIndex, path);
  }

  @Override
  public void close() throws IOException {
    closePartition();
  }

  private void closeOutputStream() throws IOException {
    if (outputStream == null) {
      return;
    }
    try {
      outputStream.close();
    } finally {
      outputStream = null;
    }
  }

  private void closeInputStream() throws IOException {
    if (inputStream == null) {
      return;
    }
    try {
      inputStream.close();
    } finally {
      inputStream = null;
    }
  }

  public int getPartitionIndex() { return partitionIndex; }

  public String getPath() { return path; }

  public List<Integer> getChunkSizes() { return Collections.unmodifiableList(chunkSizes); }

  public boolean isSpilled() { return spilled; }

  public boolean isInputClosed() { return inputClosed; }

  public boolean isClosed() { return closed; }

  public int getBufferedRecordCount() { return buffer.size(); }

  /**
   * @return the running estimate of the serialized size of the records held
   * in memory
   */
  public long getBufferedBytes() { return bufferedBytes; }

  public int getSpillCount() { return chunkSizes.size(); }

  /**
   * @return bytes written to the spill file: the sum of the chunk sizes
   */
  public long getWriteBytes() { return writeBytes; }

  /**
   * @return records kept by this partition, excluding any dropped on spill
   */
  public int getRecordCount() { return recordCount; }

  public int getDroppedCount() { return droppedCount; }

  @Override
  public String toString() {
    return "DiskPartition[index=" + partitionIndex +
        ", path=" + path +
        ", records=" + recordCount +
        ", chunks=" + chunkSizes +
        ", buffered=" + buffer.size() +
        ", inputClosed=" + inputClosed + "]";
  }
}
