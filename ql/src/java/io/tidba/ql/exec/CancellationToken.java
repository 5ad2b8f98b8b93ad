/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.tidba.ql.exec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * A single cancellation signal shared by every blocking step of a long
 * running operation. Whichever source fires first (deadline, operator
 * interrupt or a failure) decides the reason; later requests are ignored.
 */
public final class CancellationToken {

  private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

  public enum Reason {
    DEADLINE_EXCEEDED,
    INTERRUPTED,
    FAILED
  }

  /**
   * Handle returned by {@link #onCancel(Runnable)}; closing it removes the
   * callback.
   */
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  /**
   * Thrown by {@link #throwIfCancelled()}.
   */
  public static class CancelledException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Reason reason;

    public CancelledException(Reason reason) {
      super("operation cancelled: " + reason);
      this.reason = reason;
    }

    public Reason getReason() {
      return reason;
    }
  }

  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<Runnable>();
  private volatile Reason reason;
  private volatile Throwable cause;

  /**
   * Cancels the token.
   *
   * @return true if this call cancelled the token, false if it was already
   *         cancelled
   */
  public boolean cancel(Reason why, Throwable failure) {
    Preconditions.checkNotNull(why, "reason");
    synchronized (this) {
      if (reason != null) {
        return false;
      }
      cause = failure;
      reason = why;
    }
    cancelled.countDown();
    List<Runnable> toRun = new ArrayList<Runnable>(callbacks);
    callbacks.clear();
    for (Runnable callback : toRun) {
      runCallback(callback);
    }
    return true;
  }

  public boolean cancel(Reason why) {
    return cancel(why, null);
  }

  public boolean isCancelled() {
    return reason != null;
  }

  /**
   * @return the reason of the first cancellation, null while not cancelled
   */
  public Reason getReason() {
    return reason;
  }

  public Throwable getCause() {
    return cause;
  }

  public void throwIfCancelled() {
    Reason r = reason;
    if (r != null) {
      throw new CancelledException(r);
    }
  }

  /**
   * Registers a callback run once on cancellation, immediately if the token
   * is already cancelled.
   */
  public Registration onCancel(final Runnable callback) {
    Preconditions.checkNotNull(callback, "callback");
    callbacks.add(callback);
    if (isCancelled() && callbacks.remove(callback)) {
      runCallback(callback);
    }
    return new Registration() {
      @Override
      public void close() {
        callbacks.remove(callback);
      }
    };
  }

  /**
   * Sleeps for the given time unless the token is cancelled first. An
   * interrupt of the sleeping thread cancels the token.
   *
   * @return true if the token is cancelled
   */
  public boolean sleep(long millis) {
    if (millis <= 0) {
      return isCancelled();
    }
    try {
      return cancelled.await(millis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(Reason.INTERRUPTED, e);
      return true;
    }
  }

  /**
   * Cancels the token with {@link Reason#DEADLINE_EXCEEDED} once the given
   * duration elapses. The scheduled task is dropped if the token is cancelled
   * earlier for another reason.
   */
  public void scheduleDeadline(Duration timeout, ScheduledExecutorService scheduler) {
    Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
        "deadline must be positive: %s", timeout);
    final ScheduledFuture<?> deadline = scheduler.schedule(new Runnable() {
      @Override
      public void run() {
        cancel(Reason.DEADLINE_EXCEEDED);
      }
    }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    onCancel(new Runnable() {
      @Override
      public void run() {
        deadline.cancel(false);
      }
    });
  }

  private void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOG.warn("Cancellation callback failed", e);
    }
  }
}
