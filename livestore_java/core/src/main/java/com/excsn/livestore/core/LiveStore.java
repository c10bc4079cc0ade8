package com.excsn.livestore.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Handle to a running store. Every operation is a message to the store's single actor thread, so operations on one
 * store never run concurrently and apply in arrival order.
 *
 * <p>{@code get} and {@code take} block until the store replies. {@code assign}, {@code update} and
 * {@code subscribe} only enqueue their request and return this handle for chaining; returning says nothing about
 * whether the mutation or its notifications have happened yet.
 */
public interface LiveStore {

  String name();

  /**
   * @return the value for {@code key}, or null if the key was never assigned
   */
  <T> T get(String key);

  /**
   * @return the value for {@code key}, or {@code defaultValue} if the key was never assigned
   */
  <T> T get(String key, T defaultValue);

  <T> T get(String key, T defaultValue, Duration timeout);

  /**
   * Keys that were never assigned are left out of the result.
   */
  Map<String, Object> take(Collection<String> keys);

  Map<String, Object> take(Collection<String> keys, Duration timeout);

  LiveStore assign(String key, Object value);

  /**
   * Assigns each pair in iteration order. Observers of a key are notified only when its value actually changes.
   */
  LiveStore assign(Map<String, ?> attrs);

  LiveStore assign(Iterable<? extends Map.Entry<String, ?>> pairs);

  /**
   * Replaces the value of {@code key} with {@code updateFn} applied to it (null when absent), with the same change
   * detection as {@link #assign(String, Object)}. If {@code updateFn} throws, nothing is written and the store
   * terminates.
   */
  <T> LiveStore update(String key, UnaryOperator<T> updateFn);

  /**
   * Registers {@code observer} for changes to each of {@code keys}. Subscribing twice to the same key means two
   * deliveries per change. Observers subscribed later are notified first.
   */
  LiveStore subscribe(Observer observer, Collection<String> keys);

  /**
   * Lets already queued requests finish, then terminates the store.
   */
  void stop();

  boolean awaitTermination(Duration timeout) throws InterruptedException;

  boolean isAlive();

  /**
   * @return the failure that terminated the store, empty while running or after a clean stop
   */
  Optional<Throwable> terminationCause();
}
