package com.excsn.livestore.core;

public class StoreCallInterruptedException extends LiveStoreException {

  public StoreCallInterruptedException(String storeName, InterruptedException cause) {
    super("Interrupted while waiting on store `" + storeName + "`", cause);
  }
}
