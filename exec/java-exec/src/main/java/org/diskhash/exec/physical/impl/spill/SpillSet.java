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
package org.diskhash.exec.physical.impl.spill;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.CommonConfigurationKeysPublic;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.diskhash.common.config.DiskHashConfig;
import org.diskhash.common.exceptions.SpillException;
import org.diskhash.exec.ExecConstants;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;

/**
 * Allocates the spill files for one partitioned relation. Files are spread
 * round-robin across the configured spill directories, each under a
 * directory private to this spill set, and all of them go away when the
 * spill set is closed.
 */

public class SpillSet implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SpillSet.class);

  /**
   * Spilling to the local disk through the Hadoop file system adds checksum
   * files and buffer copies. This interface lets a local spill bypass HDFS
   * while still allowing spill files on any Hadoop-supported file system.
   */

  interface FileManager {

    void deleteOnExit(String spillDir) throws IOException;

    OutputStream createForWrite(String fileName) throws IOException;

    InputStream openForInput(String fileName) throws IOException;

    void deleteFile(String fileName) throws IOException;

    void deleteDir(String spillDir) throws IOException;
  }

  /**
   * Spill files on any file system Hadoop supports: local disk, HDFS, or
   * another DFS chosen when nodes lack local disk space.
   */

  static class HadoopFileManager implements FileManager {

    private final FileSystem fs;

    protected HadoopFileManager(String fsName) {
      Configuration conf = new Configuration();
      conf.set(CommonConfigurationKeysPublic.FS_DEFAULT_NAME_KEY, fsName);
      try {
        fs = FileSystem.get(conf);
      } catch (IOException e) {
        throw SpillException.resourceError(e)
              .message("Failed to get the file system for spilling")
              .addContext("File system", fsName)
              .build(logger);
      }
    }

    @Override
    public void deleteOnExit(String spillDir) throws IOException {
      fs.deleteOnExit(new Path(spillDir));
    }

    @Override
    public OutputStream createForWrite(String fileName) throws IOException {
      return fs.create(new Path(fileName));
    }

    @Override
    public InputStream openForInput(String fileName) throws IOException {
      return fs.open(new Path(fileName));
    }

    @Override
    public void deleteFile(String fileName) throws IOException {
      Path path = new Path(fileName);
      if (fs.exists(path)) {
        fs.delete(path, false);
      }
    }

    @Override
    public void deleteDir(String spillDir) throws IOException {
      Path path = new Path(spillDir);
      if (fs.exists(path)) {
        if (fs.delete(path, true)) {
          fs.cancelDeleteOnExit(path);
        }
      }
    }
  }

  /**
   * Direct access to the local file system, bypassing HDFS.
   */

  static class LocalFileManager implements FileManager {

    private final File baseDir;

    public LocalFileManager(String fsName) {
      baseDir = new File(fsName.replace("file://", ""));
    }

    @Override
    public void deleteOnExit(String spillDir) throws IOException {
      File dir = new File(baseDir, spillDir);
      if (! dir.mkdirs() && ! dir.isDirectory()) {
        throw new IOException("Cannot create spill directory " + dir);
      }
      dir.deleteOnExit();
    }

    @Override
    public OutputStream createForWrite(String fileName) throws IOException {
      return new FileOutputStream(new File(baseDir, fileName));
    }

    @Override
    public InputStream openForInput(String fileName) throws IOException {
      return new FileInputStream(new File(baseDir, fileName));
    }

    @Override
    public void deleteFile(String fileName) throws IOException {
      Files.deleteIfExists(new File(baseDir, fileName).toPath());
    }

    @Override
    public void deleteDir(String spillDir) throws IOException {
      Files.deleteIfExists(new File(baseDir, spillDir).toPath());
    }
  }

  private final Iterator<String> dirs;

  /**
   * Per-spill-set directories created so far, one under each spill
   * directory used. The admin must ensure that sufficient space exists
   * in the spill directories; no check is made before writing.
   */

  private final Set<String> currSpillDirs = Sets.newTreeSet();

  /**
   * Name of the directory, unique to this spill set, created under each
   * spill directory to hold its files.
   */

  private final String spillDirName;

  private final FileManager fileManager;

  private int fileCount = 0;
  private long writeBytes;
  private long readBytes;

  public SpillSet(DiskHashConfig config, String operatorName) {
    List<String> dirList = config.getStringList(ExecConstants.SPILL_DIRS);
    Preconditions.checkArgument(! dirList.isEmpty(), "At least one spill directory is required: %s",
        ExecConstants.SPILL_DIRS);
    dirs = Iterators.cycle(dirList);

    // Use the local file system directly unless the admin chose another
    // file system or explicitly asked for the Hadoop one.

    String spillFs = config.getString(ExecConstants.SPILL_FILESYSTEM);
    boolean useHadoop = config.getBoolean(ExecConstants.SPILL_USE_HADOOP_FS);
    if (spillFs.startsWith("file:///") && ! useHadoop) {
      fileManager = new LocalFileManager(spillFs);
    } else {
      fileManager = new HadoopFileManager(spillFs);
    }
    spillDirName = String.format("%s_%s", operatorName, UUID.randomUUID());
    logger.debug("Spill set {} uses {} on {} across {}", spillDirName,
        fileManager.getClass().getSimpleName(), spillFs, dirList);
  }

  /**
   * Reserve the name of the next spill file. The file itself is created by
   * {@link #openForOutput(String)}.
   *
   * @param suffix appended to the file name to identify its owner
   * @return the full path of the new spill file
   */

  public String getNextSpillFile(String suffix) {

    // Identify the next directory from the round-robin list to
    // hold the file created for this spill.

    String spillDir = dirs.next();
    String currSpillPath = Joiner.on("/").join(spillDir, spillDirName);
    currSpillDirs.add(currSpillPath);
    String outputFile = Joiner.on("/").join(currSpillPath, "spill" + ++fileCount + "_" + suffix);
    try {
      fileManager.deleteOnExit(currSpillPath);
    } catch (IOException e) {
      throw SpillException.resourceError(e)
          .message("Unable to create spill directory %s", currSpillPath)
          .build(logger);
    }
    return outputFile;
  }

  public boolean hasSpilled() {
    return fileCount > 0;
  }

  public int getFileCount() { return fileCount; }

  public String getSpillDirName() { return spillDirName; }

  public InputStream openForInput(String fileName) throws IOException {
    return fileManager.openForInput(fileName);
  }

  public OutputStream openForOutput(String fileName) throws IOException {
    return fileManager.createForWrite(fileName);
  }

  public void delete(String fileName) throws IOException {
    fileManager.deleteFile(fileName);
  }

  public void tallyWriteBytes(long bytes) {
    writeBytes += bytes;
  }

  public void tallyReadBytes(long bytes) {
    readBytes += bytes;
  }

  public long getWriteBytes() { return writeBytes; }

  public long getReadBytes() { return readBytes; }

  @Override
  public void close() {
    for (String path : currSpillDirs) {
      try {
        fileManager.deleteDir(path);
      } catch (IOException e) {
        // Cleanup runs after the data is consumed; leftovers are only reported.
        logger.warn("Unable to delete spill directory " + path,  e);
      }
    }
    logger.trace("Summary: wrote {} bytes, read {} bytes in {} files under {}",
        writeBytes, readBytes, fileCount, spillDirName);
  }
}
