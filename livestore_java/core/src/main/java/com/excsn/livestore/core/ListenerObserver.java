package com.excsn.livestore.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.concurrent.Executor;

/**
 * Runs a {@link ChangeListener} on the given executor for each change. Alive until {@link #close()}.
 */
public class ListenerObserver implements Observer, AutoCloseable {

  private final ChangeListener _listener;
  private final Executor _executor;
  private volatile boolean _closed;

  public ListenerObserver(ChangeListener listener, Executor executor) {
    _listener = Preconditions.checkNotNull(listener, "listener");
    _executor = Preconditions.checkNotNull(executor, "executor");
  }

  /**
   * Calls the listener on the store's thread. Only for listeners that return quickly and never call back into a
   * synchronous operation of the same store.
   */
  public static ListenerObserver direct(ChangeListener listener) {
    return new ListenerObserver(listener, MoreExecutors.directExecutor());
  }

  @Override
  public boolean isAlive() {
    return !_closed;
  }

  @Override
  public void deliver(StoreChange change) {

    _executor.execute(() -> {
      if (!_closed) {
        _listener.onChange(change.key, change.value);
      }
    });
  }

  @Override
  public void close() {
    _closed = true;
  }
}
