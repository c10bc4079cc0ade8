package com.excsn.livestore.core;

import com.google.common.base.Preconditions;

import java.lang.ref.WeakReference;
import java.util.concurrent.Executor;

/**
 * Holds its {@link ChangeListener} weakly. The observer dies when the listener is garbage collected or when it is
 * closed, whichever comes first, so a store never keeps a listener's owner reachable.
 */
public class WeakListenerObserver implements Observer, AutoCloseable {

  private final WeakReference<ChangeListener> _listenerRef;
  private final Executor _executor;
  private volatile boolean _closed;

  public WeakListenerObserver(ChangeListener listener, Executor executor) {
    _listenerRef = new WeakReference<>(Preconditions.checkNotNull(listener, "listener"));
    _executor = Preconditions.checkNotNull(executor, "executor");
  }

  @Override
  public boolean isAlive() {
    return !_closed && _listenerRef.get() != null;
  }

  @Override
  public void deliver(StoreChange change) {

    var listener = _listenerRef.get();
    if (listener == null || _closed) {
      return;
    }

    _executor.execute(() -> listener.onChange(change.key, change.value));
  }

  @Override
  public void close() {
    _closed = true;
    _listenerRef.clear();
  }
}
