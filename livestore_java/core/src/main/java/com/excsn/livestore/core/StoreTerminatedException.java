package com.excsn.livestore.core;

/**
 * A synchronous call reached a store whose actor is no longer running. When the actor crashed, the failure that
 * crashed it is the cause.
 */
public class StoreTerminatedException extends LiveStoreException {

  public StoreTerminatedException(String storeName) {
    super("Store `" + storeName + "` is not running");
  }

  public StoreTerminatedException(String storeName, Throwable cause) {
    super("Store `" + storeName + "` terminated after a failure", cause);
  }
}
