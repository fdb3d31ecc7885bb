/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancels one execution. Fetches register a callback that interrupts their in-flight service call;
 * callbacks registered after cancellation run immediately.
 */
public class CancellationSignal {

  private final AtomicReference<String> reason = new AtomicReference<>();

  private final List<Runnable> callbacks = new ArrayList<>();

  /**
   * Requests cancellation.
   *
   * @return false when the signal was already cancelled
   */
  public boolean cancel(String reason) {
    Preconditions.checkNotNull(reason, "reason");
    if (!this.reason.compareAndSet(null, reason)) {
      return false;
    }
    List<Runnable> pending;
    synchronized (callbacks) {
      pending = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    pending.forEach(Runnable::run);
    return true;
  }

  public boolean isCancelled() {
    return reason.get() != null;
  }

  /** Why the signal was cancelled, or {@code null} while it is not. */
  public String getReason() {
    return reason.get();
  }

  /**
   * Registers a callback to run on cancellation.
   *
   * @return a handle that removes the callback
   */
  public Runnable onCancel(Runnable callback) {
    synchronized (callbacks) {
      if (!isCancelled()) {
        callbacks.add(callback);
        return () -> {
          synchronized (callbacks) {
            callbacks.remove(callback);
          }
        };
      }
    }
    callback.run();
    return () -> {};
  }
}
