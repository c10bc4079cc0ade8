package com.excsn.livestore.core;

/**
 * A recipient of {@link StoreChange} messages. Stores never own observers: they only ask whether one is still alive
 * before each dispatch and forget it once it is not.
 */
public interface Observer {

  /**
   * @return false once this observer can no longer receive changes. Must not block.
   */
  boolean isAlive();

  /**
   * Hands a change to the observer. Called on the store's own thread, so implementations must return without
   * waiting on the recipient.
   */
  void deliver(StoreChange change);
}
