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
package org.bitingest.threads;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import javax.annotation.PreDestroy;

import org.bitingest.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Manages {@link ExecutorService}s for bitingest.
 * 
 * <p>
 * All executors created by this class are shut down when the context is shut down.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ExecutorManager {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorManager.class);

  private Deque<ExecutorService> executors = new ConcurrentLinkedDeque<>();

  /**
   * Create a new thread pool with a fixed set of threads, see {@link Executors#newFixedThreadPool(int)}.
   * 
   * @param nameFormat
   *          a {@link String#format(String, Object...)}-compatible format String, to which a unique integer (0, 1,
   *          etc.) will be supplied as the single parameter. For example, {@code "ingest-worker-%d"} will generate
   *          thread names like {@code "ingest-worker-0"}, {@code "ingest-worker-1"}, etc.
   * @param uncaughtExceptionHandler
   *          This will be called in case any of the threads of the ExecutorService ends because an exception was
   *          thrown. Can be <code>null</code>.
   * @param numberOfThreads
   *          Number of threads in the pool.
   * @return The new {@link ExecutorService}.
   */
  public ExecutorService newFixedThreadPool(String nameFormat, UncaughtExceptionHandler uncaughtExceptionHandler,
      int numberOfThreads) {
    ExecutorService res = Executors.newFixedThreadPool(numberOfThreads,
        createThreadFactoryBuilder(nameFormat, uncaughtExceptionHandler).build());
    register(res);
    return res;
  }

  /**
   * Shuts down all executors that were created by this manager and are not shut down yet.
   */
  @PreDestroy
  public void shutdownAll() {
    for (Iterator<ExecutorService> it = executors.iterator(); it.hasNext();) {
      ExecutorService executor = it.next();
      if (!executor.isShutdown()) {
        logger.debug("Shutting down executor {}", executor);
        executor.shutdownNow();
      }
      it.remove();
    }
  }

  private void register(ExecutorService executor) {
    // forget about executors that have been shut down by their users already.
    executors.removeIf(e -> e.isShutdown());
    executors.add(executor);
  }

  private ThreadFactoryBuilder createThreadFactoryBuilder(String nameFormat,
      UncaughtExceptionHandler uncaughtExceptionHandler) {
    ThreadFactoryBuilder threadFactoryBuilder = new ThreadFactoryBuilder();
    threadFactoryBuilder.setNameFormat(nameFormat);
    if (uncaughtExceptionHandler != null)
      threadFactoryBuilder.setUncaughtExceptionHandler(uncaughtExceptionHandler);
    return threadFactoryBuilder;
  }
}
