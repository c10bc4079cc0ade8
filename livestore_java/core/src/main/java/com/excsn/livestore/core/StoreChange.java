package com.excsn.livestore.core;

import com.excsn.livestore.core.utils.DeepEquals;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Message delivered to an {@link Observer} when a subscribed key takes a new value. Values compare with
 * {@link DeepEquals}, the same equality the store uses to skip unchanged assigns.
 */
public final class StoreChange {

  public static final String TAG = "store_change";

  public final String key;
  public final Object value;

  public StoreChange(String key, Object value) {
    this.key = key;
    this.value = value;
  }

  public String tag() {
    return TAG;
  }

  @SuppressWarnings("unchecked")
  public <T> T value() {
    return (T) value;
  }

  @Override
  public boolean equals(Object other) {

    if (this == other) {
      return true;
    }

    if (!(other instanceof StoreChange)) {
      return false;
    }

    var that = (StoreChange) other;
    return Objects.equal(key, that.key) && DeepEquals.deepEquals(value, that.value);
  }

  // value left out, arrays inside it hash by identity
  @Override
  public int hashCode() {
    return Objects.hashCode(TAG, key);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(TAG)
      .add("key", key)
      .add("value", value)
      .toString();
  }
}
