package com.excsn.livestore.core;

import com.excsn.livestore.core.telemetry.Logger;
import com.excsn.livestore.core.telemetry.StatsRecorder;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * The store actor. One thread drains an unbounded mailbox and applies each request to the {@link StoreState} it
 * alone owns.
 */
class LiveStoreActor implements LiveStore {

  private final String _name;
  private final Duration _callTimeout;
  private final Logger _logger;
  private final StatsRecorder _statsRecorder;
  private final Map<String, Object> _statsTags;
  private final BlockingQueue<StoreRequest> _mailbox;
  private final StoreState _state;
  private final Thread _thread;
  private final CountDownLatch _terminated;

  private volatile boolean _alive;
  private volatile Throwable _failure;

  LiveStoreActor(
    String name,
    Map<String, Object> initialAssigns,
    Duration callTimeout,
    ThreadFactory threadFactory,
    Logger logger,
    StatsRecorder statsRecorder
  ) {
    _name = name;
    _callTimeout = callTimeout;
    _logger = logger;
    _statsRecorder = statsRecorder;
    _statsTags = Map.of("group", "livestore", "store", name);
    _mailbox = new LinkedBlockingQueue<>();
    _state = new StoreState(
      initialAssigns,
      new StoreSubscriptions(name, logger, statsRecorder, _statsTags),
      statsRecorder,
      _statsTags
    );
    _thread = threadFactory.newThread(this::_run);
    _terminated = new CountDownLatch(1);
    _alive = true;
  }

  void start() {
    _thread.start();
  }

  @Override
  public String name() {
    return _name;
  }

  @Override
  public <T> T get(String key) {
    return get(key, null, _callTimeout);
  }

  @Override
  public <T> T get(String key, T defaultValue) {
    return get(key, defaultValue, _callTimeout);
  }

  @Override
  public <T> T get(String key, T defaultValue, Duration timeout) {

    _statsRecorder.recordCounterIncrement(_statsTags, "get_attempts");
    //noinspection unchecked
    return (T) _call(new StoreRequest.Get(key, defaultValue), timeout);
  }

  @Override
  public Map<String, Object> take(Collection<String> keys) {
    return take(keys, _callTimeout);
  }

  @Override
  public Map<String, Object> take(Collection<String> keys, Duration timeout) {

    Preconditions.checkNotNull(keys, "keys");
    _statsRecorder.recordCounterIncrement(_statsTags, "take_attempts");

    return _call(new StoreRequest.Take(new ArrayList<>(keys)), timeout);
  }

  @Override
  public LiveStore assign(String key, Object value) {
    return assign(List.of(Maps.immutableEntry(key, value)));
  }

  @Override
  public LiveStore assign(Map<String, ?> attrs) {

    Preconditions.checkNotNull(attrs, "attrs");
    return assign(attrs.entrySet());
  }

  @Override
  public LiveStore assign(Iterable<? extends Map.Entry<String, ?>> pairs) {

    Preconditions.checkNotNull(pairs, "pairs");
    _statsRecorder.recordCounterIncrement(_statsTags, "assign_attempts");

    return _cast(new StoreRequest.Assign(LiveStoreUtils.copyPairs(pairs)));
  }

  @Override
  public <T> LiveStore update(String key, UnaryOperator<T> updateFn) {

    Preconditions.checkNotNull(updateFn, "updateFn");
    _statsRecorder.recordCounterIncrement(_statsTags, "update_attempts");

    //noinspection unchecked
    return _cast(new StoreRequest.Update(key, (UnaryOperator<Object>) updateFn));
  }

  @Override
  public LiveStore subscribe(Observer observer, Collection<String> keys) {

    Preconditions.checkNotNull(observer, "observer");
    Preconditions.checkNotNull(keys, "keys");
    _statsRecorder.recordCounterIncrement(_statsTags, "subscribe_attempts");

    return _cast(new StoreRequest.Subscribe(observer, new ArrayList<>(keys)));
  }

  @Override
  public void stop() {
    _cast(StoreRequest.STOP);
  }

  @Override
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return _terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public boolean isAlive() {
    return _alive;
  }

  @Override
  public Optional<Throwable> terminationCause() {
    return Optional.ofNullable(_failure);
  }

  StoreState state() {
    return _state;
  }

  @Override
  public String toString() {
    return "LiveStore[" + _name + (_alive ? "" : ", terminated") + "]";
  }

  private <R> R _call(StoreRequest.Call<R> request, Duration timeout) {

    Preconditions.checkNotNull(timeout, "timeout");
    Preconditions.checkState(Thread.currentThread() != _thread,
      "Store `%s` cannot make a synchronous call to itself", _name);

    if (!_alive) {
      throw _terminatedException();
    }

    _enqueue(request);

    try {
      return request.reply().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (ExecutionException e) {

      if (e.getCause() instanceof StoreTerminatedException) {
        throw (StoreTerminatedException) e.getCause();
      }

      throw new StoreTerminatedException(_name, e.getCause());
    } catch (TimeoutException e) {

      _logger.warn("Call `" + request.name() + "` to store `" + _name + "` timed out after " + timeout.toMillis()
        + "ms, its reply will be discarded");
      throw new StoreCallTimeoutException(_name, timeout);
    } catch (InterruptedException e) {

      Thread.currentThread().interrupt();
      throw new StoreCallInterruptedException(_name, e);
    }
  }

  private LiveStore _cast(StoreRequest request) {

    if (!_alive) {
      _logger.debug("Dropping `" + request.name() + "` sent to terminated store `" + _name + "`");
      return this;
    }

    _enqueue(request);

    return this;
  }

  private void _enqueue(StoreRequest request) {

    _mailbox.add(request);
    _statsRecorder.recordGauge(_statsTags, "mailbox_size", _mailbox.size());

    // the actor may have finished draining between the liveness check and the add
    if (!_alive) {
      _rejectPending();
    }
  }

  private void _run() {

    _logger.debug("Store `" + _name + "` started");
    StoreRequest request = null;

    try {
      while (true) {

        request = _mailbox.take();

        if (request == StoreRequest.STOP) {
          _logger.debug("Store `" + _name + "` stopping");
          break;
        }

        var startNanos = System.nanoTime();
        request.handle(_state);
        _statsRecorder.recordTimer(_statsTags, "request_duration", Duration.ofNanos(System.nanoTime() - startNanos));
      }
    } catch (InterruptedException e) {

      Thread.currentThread().interrupt();
      _failure = e;
      _logger.warn("Store `" + _name + "` was interrupted and is terminating");
    } catch (RuntimeException | Error e) {

      _failure = e;
      _statsRecorder.recordCounterIncrement(_statsTags, request.name() + "_errors");
      _logger.error("Store `" + _name + "` crashed while handling `" + request.name() + "`", e);
    } finally {

      _alive = false;
      _rejectPending();
      _terminated.countDown();
      _logger.debug("Store `" + _name + "` terminated");
    }
  }

  private void _rejectPending() {

    StoreRequest pending;

    while ((pending = _mailbox.poll()) != null) {
      pending.reject(_terminatedException());
    }
  }

  private StoreTerminatedException _terminatedException() {

    var failure = _failure;
    return failure == null ? new StoreTerminatedException(_name) : new StoreTerminatedException(_name, failure);
  }
}
