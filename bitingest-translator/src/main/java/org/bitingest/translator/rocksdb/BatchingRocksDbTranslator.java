/**
 * bitingest: Bitmap Index Ingestion.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of bitingest.
 *
 * bitingest is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.bitingest.translator.rocksdb;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.bitingest.data.ValueCodec;
import org.bitingest.translator.BulkAddingTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Longs;

/**
 * Persistent {@link Translator} that stores all frames in a single RocksDB database, using the column families
 * <code>&lt;frame&gt;-id</code> and <code>&lt;frame&gt;-val</code> for each frame. Identifiers are stored as 8 byte
 * big-endian values.
 * 
 * <p>
 * Lookups of values that have an identifier already are served directly. New identifiers are assigned by a single
 * writer thread, which collects the pending assignments of all callers for a short time and commits them in one
 * {@link WriteBatch}. A caller returns as soon as the batch containing its value is committed. Callers asking for the
 * same new value concurrently wait for the same assignment.
 *
 * @author Bastian Gloeckle
 */
public class BatchingRocksDbTranslator implements BulkAddingTranslator {
  private static final Logger logger = LoggerFactory.getLogger(BatchingRocksDbTranslator.class);

  static {
    RocksDB.loadLibrary();
  }

  private static final long POLL_TIMEOUT_MS = 100;

  private final File dir;
  private final int maxBatchSize;
  private final long maxDelayNanos;
  private final int bulkAddBatchSize;

  private final DBOptions dbOptions;
  private final ColumnFamilyOptions columnFamilyOptions;
  private final WriteOptions writeOptions;
  private RocksDB db;
  private final List<ColumnFamilyHandle> openHandles = new ArrayList<>();

  private final Map<String, FrameState> frames = new ConcurrentHashMap<>();
  private final Object frameCreationSync = new Object();

  private final BlockingQueue<WriteTask> queue = new LinkedBlockingQueue<>();
  private final WriterThread writerThread = new WriterThread();

  /** Write lock is held when closing, read lock when enqueuing tasks. */
  private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
  private volatile boolean closed = false;

  /**
   * @param dir
   *          Directory of the RocksDB database, will be created if it does not exist.
   * @param maxBatchSize
   *          Maximum number of new assignments committed at once.
   * @param maxDelayMicros
   *          Maximum time the writer waits for more assignments after receiving the first one of a batch.
   * @param bulkAddBatchSize
   *          Number of values written at once on {@link #bulkAdd(String, List)}.
   * @param frames
   *          Frames to open in addition to the ones found in the database.
   * @throws TranslatorException
   *           if the database cannot be opened.
   */
  public BatchingRocksDbTranslator(File dir, int maxBatchSize, long maxDelayMicros, int bulkAddBatchSize,
      String... frames) throws TranslatorException {
    this.dir = dir;
    this.maxBatchSize = maxBatchSize;
    this.maxDelayNanos = TimeUnit.MICROSECONDS.toNanos(maxDelayMicros);
    this.bulkAddBatchSize = bulkAddBatchSize;

    RocksDbUtil.ensureDirectory(dir);
    dbOptions = new DBOptions().setCreateIfMissing(true).setCreateMissingColumnFamilies(true);
    columnFamilyOptions = new ColumnFamilyOptions();
    writeOptions = new WriteOptions();

    try {
      openDatabase();
      for (String frame : frames)
        getFrame(frame);
    } catch (TranslatorException | RuntimeException e) {
      closeResources(e);
      throw e;
    }

    writerThread.start();
    logger.info("Opened batching translator at {} with frames {}", dir.getAbsolutePath(), this.frames.keySet());
  }

  private void openDatabase() throws TranslatorException {
    List<String> columnFamilyNames = new ArrayList<>();
    if (new File(dir, "CURRENT").exists()) {
      try (Options listOptions = new Options()) {
        for (byte[] name : RocksDB.listColumnFamilies(listOptions, dir.getAbsolutePath()))
          columnFamilyNames.add(new String(name, StandardCharsets.UTF_8));
      } catch (RocksDBException e) {
        throw new TranslatorException("Could not list column families of " + dir.getAbsolutePath(), e);
      }
    }
    String defaultName = new String(RocksDB.DEFAULT_COLUMN_FAMILY, StandardCharsets.UTF_8);
    columnFamilyNames.remove(defaultName);
    columnFamilyNames.add(0, defaultName);

    // all existing column families need to be opened.
    List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
    for (String name : columnFamilyNames)
      descriptors.add(descriptor(name));

    List<ColumnFamilyHandle> handles = new ArrayList<>();
    try {
      db = RocksDB.open(dbOptions, dir.getAbsolutePath(), descriptors, handles);
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not open RocksDB at " + dir.getAbsolutePath(), e);
    }
    openHandles.addAll(handles);

    Map<String, ColumnFamilyHandle> handlesByName = new HashMap<>();
    for (int i = 0; i < columnFamilyNames.size(); i++)
      handlesByName.put(columnFamilyNames.get(i), handles.get(i));

    for (String frame : RocksDbUtil.framesOfStoreNames(columnFamilyNames))
      frames.put(frame, new FrameState(frame, handlesByName.get(frame + RocksDbUtil.ID_SUFFIX),
          handlesByName.get(frame + RocksDbUtil.VAL_SUFFIX)));
  }

  private ColumnFamilyDescriptor descriptor(String name) {
    return new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8), columnFamilyOptions);
  }

  @Override
  public Object get(String frame, long id) throws TranslatorException, UnknownFrameException {
    FrameState state = frames.get(frame);
    if (state == null)
      throw new UnknownFrameException(frame);

    byte[] value;
    try {
      value = db.get(state.idHandle, RocksDbUtil.idToBytes(id));
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not read identifier " + id + " of frame '" + frame + "'", e);
    }
    if (value == null)
      throw new TranslatorException("Identifier " + id + " was not assigned in frame '" + frame + "'");
    return ValueCodec.decode(value);
  }

  @Override
  public long getId(String frame, Object value) throws TranslatorException {
    byte[] key = ValueCodec.encode(value);
    FrameState state = getFrame(frame);

    Long res = lookup(state, key);
    if (res != null)
      return res;

    ByteBuffer keyBuffer = ByteBuffer.wrap(key);
    CompletableFuture<Long> future = new CompletableFuture<>();
    CompletableFuture<Long> existing = state.pending.putIfAbsent(keyBuffer, future);
    if (existing == null) {
      try {
        enqueue(new Assignment(state, key, keyBuffer, future));
      } catch (TranslatorException e) {
        state.pending.remove(keyBuffer, future);
        future.completeExceptionally(e);
        throw e;
      }
      existing = future;
    }
    return await(existing);
  }

  @Override
  public void bulkAdd(String frame, List<?> values) throws TranslatorException {
    FrameState state = getFrame(frame);
    List<byte[]> keys = new ArrayList<>(values.size());
    for (Object value : values)
      keys.add(ValueCodec.encode(value));

    CompletableFuture<Void> future = new CompletableFuture<>();
    enqueue(new BulkAdd(state, keys, future));
    await(future);
  }

  private void enqueue(WriteTask task) throws TranslatorException {
    Lock lock = closeLock.readLock();
    lock.lock();
    try {
      if (closed)
        throw new TranslatorException("Translator at " + dir.getAbsolutePath() + " is closed.");
      queue.add(task);
    } finally {
      lock.unlock();
    }
  }

  private <T> T await(CompletableFuture<T> future) throws TranslatorException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslatorException("Interrupted while waiting for the translation to be stored.", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof TranslatorException)
        throw new TranslatorException(e.getCause().getMessage(), e.getCause());
      throw new TranslatorException("Could not store translation.", e.getCause());
    }
  }

  private Long lookup(FrameState state, byte[] key) throws TranslatorException {
    byte[] idBytes;
    try {
      idBytes = db.get(state.valHandle, key);
    } catch (RocksDBException e) {
      throw new TranslatorException("Could not read value of frame '" + state.frame + "'", e);
    }
    if (idBytes == null)
      return null;
    return RocksDbUtil.bytesToId(idBytes);
  }

  private FrameState getFrame(String frame) throws TranslatorException {
    if (closed)
      throw new TranslatorException("Translator at " + dir.getAbsolutePath() + " is closed.");

    FrameState res = frames.get(frame);
    if (res != null)
      return res;

    synchronized (frameCreationSync) {
      res = frames.get(frame);
      if (res != null)
        return res;
      if (db == null)
        throw new TranslatorException("Translator at " + dir.getAbsolutePath() + " is closed.");

      RocksDbUtil.validateFrameName(frame);
      ColumnFamilyHandle idHandle = null;
      try {
        idHandle = db.createColumnFamily(descriptor(frame + RocksDbUtil.ID_SUFFIX));
        ColumnFamilyHandle valHandle = db.createColumnFamily(descriptor(frame + RocksDbUtil.VAL_SUFFIX));
        openHandles.add(idHandle);
        openHandles.add(valHandle);
        res = new FrameState(frame, idHandle, valHandle);
      } catch (RocksDBException e) {
        if (idHandle != null)
          idHandle.close();
        throw new TranslatorException("Could not create column families of frame '" + frame + "'", e);
      }
      frames.put(frame, res);
      logger.debug("Created frame '{}'", frame);
      return res;
    }
  }

  @Override
  public Set<String> getFrames() {
    return Collections.unmodifiableSet(frames.keySet());
  }

  @Override
  public void close() throws IOException {
    Lock lock = closeLock.writeLock();
    lock.lock();
    try {
      if (closed)
        return;
      closed = true;
    } finally {
      lock.unlock();
    }

    writerThread.shutdown();
    try {
      writerThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for the writer of " + dir.getAbsolutePath() + " to finish.",
          e);
    }

    IOException res = new IOException("Could not close RocksDB at " + dir.getAbsolutePath());
    closeResources(res);
    logger.info("Closed batching translator at {}", dir.getAbsolutePath());
    if (res.getSuppressed().length > 0)
      throw res;
  }

  /**
   * Closes all RocksDB objects, adding any failures to the given exception.
   */
  private void closeResources(Exception failures) {
    synchronized (frameCreationSync) {
      for (ColumnFamilyHandle handle : openHandles)
        handle.close();
      openHandles.clear();
      frames.clear();
      if (db != null) {
        try {
          db.closeE();
        } catch (RocksDBException e) {
          failures.addSuppressed(e);
        }
        db = null;
      }
      writeOptions.close();
      columnFamilyOptions.close();
      dbOptions.close();
    }
  }

  /**
   * State of a single frame.
   */
  private class FrameState {
    private final String frame;
    private final ColumnFamilyHandle idHandle;
    private final ColumnFamilyHandle valHandle;

    /** Values of which an assignment is enqueued but not yet committed. */
    private final Map<ByteBuffer, CompletableFuture<Long>> pending = new ConcurrentHashMap<>();

    /** Only accessed by the writer thread after construction. */
    private long nextId;

    FrameState(String frame, ColumnFamilyHandle idHandle, ColumnFamilyHandle valHandle) {
      this.frame = frame;
      this.idHandle = idHandle;
      this.valHandle = valHandle;
      try (RocksIterator it = db.newIterator(idHandle)) {
        it.seekToLast();
        nextId = it.isValid() ? Longs.fromByteArray(it.key()) + 1 : 0L;
      }
    }
  }

  private interface WriteTask {
    void fail(Throwable t);
  }

  private static class Assignment implements WriteTask {
    private final FrameState state;
    private final byte[] key;
    private final ByteBuffer keyBuffer;
    private final CompletableFuture<Long> future;

    Assignment(FrameState state, byte[] key, ByteBuffer keyBuffer, CompletableFuture<Long> future) {
      this.state = state;
      this.key = key;
      this.keyBuffer = keyBuffer;
      this.future = future;
    }

    @Override
    public void fail(Throwable t) {
      state.pending.remove(keyBuffer, future);
      future.completeExceptionally(t);
    }
  }

  private static class BulkAdd implements WriteTask {
    private final FrameState state;
    private final List<byte[]> keys;
    private final CompletableFuture<Void> future;

    BulkAdd(FrameState state, List<byte[]> keys, CompletableFuture<Void> future) {
      this.state = state;
      this.keys = keys;
      this.future = future;
    }

    @Override
    public void fail(Throwable t) {
      future.completeExceptionally(t);
    }
  }

  /**
   * The single thread that assigns new identifiers and writes them to RocksDB.
   */
  private class WriterThread extends Thread {
    private volatile boolean shutdown = false;

    WriterThread() {
      super("translator-writer-" + dir.getName());
      setDaemon(true);
      setUncaughtExceptionHandler(
          (thread, t) -> logger.error("Uncaught exception in writer of translator at {}", dir.getAbsolutePath(), t));
    }

    void shutdown() {
      shutdown = true;
    }

    @Override
    public void run() {
      List<Assignment> batch = new ArrayList<>();
      try {
        while (!shutdown || !queue.isEmpty()) {
          WriteTask first = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
          if (first == null)
            continue;

          BulkAdd bulkAdd = null;
          if (first instanceof BulkAdd)
            bulkAdd = (BulkAdd) first;
          else {
            batch.add((Assignment) first);
            long deadline = System.nanoTime() + maxDelayNanos;
            while (batch.size() < maxBatchSize) {
              long remaining = deadline - System.nanoTime();
              if (remaining <= 0)
                break;
              WriteTask next = queue.poll(remaining, TimeUnit.NANOSECONDS);
              if (next == null)
                break;
              if (next instanceof BulkAdd) {
                bulkAdd = (BulkAdd) next;
                break;
              }
              batch.add((Assignment) next);
            }
            commit(batch);
            batch.clear();
          }

          if (bulkAdd != null)
            executeBulkAdd(bulkAdd);
        }
      } catch (InterruptedException e) {
        logger.warn("Writer of translator at {} interrupted, failing all pending assignments.", dir.getAbsolutePath());
        TranslatorException failure = new TranslatorException("Writer of translator was interrupted.", e);
        for (Assignment a : batch)
          a.fail(failure);
      }

      List<WriteTask> remaining = new ArrayList<>();
      queue.drainTo(remaining);
      for (WriteTask task : remaining)
        task.fail(new TranslatorException("Translator at " + dir.getAbsolutePath() + " is closed."));
    }

    private void commit(List<Assignment> batch) {
      Map<FrameState, Long> originalNextIds = new HashMap<>();
      Map<FrameState, Map<ByteBuffer, Long>> assignedInBatch = new HashMap<>();
      long[] ids = new long[batch.size()];

      try (WriteBatch writeBatch = new WriteBatch()) {
        for (int i = 0; i < batch.size(); i++) {
          Assignment a = batch.get(i);
          // value might have been committed by a previous batch after the caller checked.
          Long existing = lookup(a.state, a.key);
          if (existing == null)
            existing = assignedInBatch.computeIfAbsent(a.state, s -> new HashMap<>()).get(a.keyBuffer);
          if (existing != null) {
            ids[i] = existing;
            continue;
          }

          originalNextIds.putIfAbsent(a.state, a.state.nextId);
          long id = a.state.nextId++;
          byte[] idBytes = RocksDbUtil.idToBytes(id);
          writeBatch.put(a.state.idHandle, idBytes, a.key);
          writeBatch.put(a.state.valHandle, a.key, idBytes);
          assignedInBatch.get(a.state).put(a.keyBuffer, id);
          ids[i] = id;
        }
        if (writeBatch.count() > 0)
          db.write(writeOptions, writeBatch);
      } catch (RocksDBException | TranslatorException e) {
        logger.warn("Could not commit {} assignments of translator at {}", batch.size(), dir.getAbsolutePath(), e);
        for (Map.Entry<FrameState, Long> entry : originalNextIds.entrySet())
          entry.getKey().nextId = entry.getValue();
        TranslatorException failure = new TranslatorException("Could not store translations.", e);
        for (Assignment a : batch)
          a.fail(failure);
        return;
      }

      logger.trace("Committed batch of {} assignments", batch.size());
      for (int i = 0; i < batch.size(); i++) {
        Assignment a = batch.get(i);
        a.future.complete(ids[i]);
        a.state.pending.remove(a.keyBuffer, a.future);
      }
    }

    private void executeBulkAdd(BulkAdd bulkAdd) {
      FrameState state = bulkAdd.state;
      try {
        Set<ByteBuffer> seen = new HashSet<>();
        for (int i = 0; i < bulkAdd.keys.size(); i++) {
          byte[] key = bulkAdd.keys.get(i);
          if (!seen.add(ByteBuffer.wrap(key)))
            throw new TranslatorException("Value at index " + i + " is contained multiple times in the bulk.");
          if (lookup(state, key) != null)
            throw new TranslatorException(
                "Value at index " + i + " has an identifier in frame '" + state.frame + "' already.");
        }

        long base = state.nextId;
        for (int batchStart = 0; batchStart < bulkAdd.keys.size(); batchStart += bulkAddBatchSize) {
          int batchEnd = Math.min(bulkAdd.keys.size(), batchStart + bulkAddBatchSize);
          try (WriteBatch writeBatch = new WriteBatch()) {
            for (int i = batchStart; i < batchEnd; i++) {
              byte[] idBytes = RocksDbUtil.idToBytes(base + i);
              writeBatch.put(state.idHandle, idBytes, bulkAdd.keys.get(i));
              writeBatch.put(state.valHandle, bulkAdd.keys.get(i), idBytes);
            }
            db.write(writeOptions, writeBatch);
          } catch (RocksDBException e) {
            throw new TranslatorException("Could not store bulk of frame '" + state.frame + "'", e);
          }
          state.nextId = base + batchEnd;
        }
        bulkAdd.future.complete(null);
      } catch (TranslatorException e) {
        bulkAdd.fail(e);
      }
    }
  }
}
