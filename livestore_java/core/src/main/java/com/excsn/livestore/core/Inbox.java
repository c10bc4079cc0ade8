package com.excsn.livestore.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Mailbox-style observer. Changes queue up until the owner takes them with {@link #receive(Duration)} or
 * {@link #poll()}. Once closed it reports itself dead and stores prune it on their next change for a subscribed key.
 */
public class Inbox implements Observer, AutoCloseable {

  private final BlockingQueue<StoreChange> _messages = new LinkedBlockingQueue<>();
  private volatile boolean _closed;

  @Override
  public boolean isAlive() {
    return !_closed;
  }

  @Override
  public void deliver(StoreChange change) {

    if (_closed) {
      return;
    }

    _messages.offer(change);
  }

  /**
   * Waits up to {@code timeout} for the next change.
   *
   * @return the change, or null if none arrived in time
   */
  public StoreChange receive(Duration timeout) throws InterruptedException {
    return _messages.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * @return the next queued change, or null if there is none
   */
  public StoreChange poll() {
    return _messages.poll();
  }

  public List<StoreChange> drain() {

    var drained = new ArrayList<StoreChange>();
    _messages.drainTo(drained);

    return drained;
  }

  public int size() {
    return _messages.size();
  }

  @Override
  public void close() {
    _closed = true;
    _messages.clear();
  }
}
