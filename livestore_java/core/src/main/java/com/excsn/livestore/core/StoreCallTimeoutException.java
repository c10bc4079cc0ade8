package com.excsn.livestore.core;

import java.time.Duration;

public class StoreCallTimeoutException extends LiveStoreException {

  public StoreCallTimeoutException(String storeName, Duration timeout) {
    super("Store `" + storeName + "` did not reply within " + timeout.toMillis() + "ms");
  }
}
