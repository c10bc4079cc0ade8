package com.excsn.livestore.core;

/**
 * Base class for failures surfaced to callers of a {@link LiveStore}.
 */
public abstract class LiveStoreException extends RuntimeException {

  protected LiveStoreException(String message) {
    super(message);
  }

  protected LiveStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
