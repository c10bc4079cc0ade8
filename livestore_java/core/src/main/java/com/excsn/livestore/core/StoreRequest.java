package com.excsn.livestore.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Messages a store's actor takes from its mailbox. {@link Call}s carry a reply the caller waits on, every other
 * request is fire-and-forget.
 */
abstract class StoreRequest {

  static final Stop STOP = new Stop();

  private final String _name;

  private StoreRequest(String name) {
    _name = name;
  }

  String name() {
    return _name;
  }

  abstract void handle(StoreState state);

  /**
   * Called instead of {@link #handle(StoreState)} when the store terminated before reaching this request.
   */
  void reject(StoreTerminatedException reason) {}

  abstract static class Call<R> extends StoreRequest {

    private final CompletableFuture<R> _reply = new CompletableFuture<>();

    private Call(String name) {
      super(name);
    }

    abstract R compute(StoreState state);

    @Override
    final void handle(StoreState state) {
      _reply.complete(compute(state));
    }

    @Override
    final void reject(StoreTerminatedException reason) {
      _reply.completeExceptionally(reason);
    }

    CompletableFuture<R> reply() {
      return _reply;
    }
  }

  static final class Get extends Call<Object> {

    private final String _key;
    private final Object _defaultValue;

    Get(String key, Object defaultValue) {
      super("get");
      _key = key;
      _defaultValue = defaultValue;
    }

    @Override
    Object compute(StoreState state) {
      return state.get(_key, _defaultValue);
    }
  }

  static final class Take extends Call<Map<String, Object>> {

    private final Collection<String> _keys;

    Take(Collection<String> keys) {
      super("take");
      _keys = keys;
    }

    @Override
    Map<String, Object> compute(StoreState state) {
      return state.take(_keys);
    }
  }

  static final class Assign extends StoreRequest {

    private final List<Map.Entry<String, Object>> _pairs;

    Assign(List<Map.Entry<String, Object>> pairs) {
      super("assign");
      _pairs = pairs;
    }

    @Override
    void handle(StoreState state) {

      for (var pair : _pairs) {
        state.assign(pair.getKey(), pair.getValue());
      }
    }
  }

  static final class Update extends StoreRequest {

    private final String _key;
    private final UnaryOperator<Object> _updateFn;

    Update(String key, UnaryOperator<Object> updateFn) {
      super("update");
      _key = key;
      _updateFn = updateFn;
    }

    @Override
    void handle(StoreState state) {
      state.update(_key, _updateFn);
    }
  }

  static final class Subscribe extends StoreRequest {

    private final Observer _observer;
    private final List<String> _keys;

    Subscribe(Observer observer, List<String> keys) {
      super("subscribe");
      _observer = observer;
      _keys = keys;
    }

    @Override
    void handle(StoreState state) {
      state.subscribe(_observer, _keys);
    }
  }

  /**
   * Marker that ends the actor loop. Never handled.
   */
  static final class Stop extends StoreRequest {

    private Stop() {
      super("stop");
    }

    @Override
    void handle(StoreState state) {
      throw new IllegalStateException("stop is consumed by the actor loop");
    }
  }
}
