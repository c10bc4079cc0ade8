package com.excsn.livestore.core;

import com.excsn.livestore.core.telemetry.StatsRecorder;
import com.excsn.livestore.core.utils.DeepEquals;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Assigns and subscriptions of one store. Owned by the store's actor thread, which is the only caller.
 */
class StoreState {

  private final Map<String, Object> _assigns;
  private final StoreSubscriptions _subscriptions;
  private final StatsRecorder _statsRecorder;
  private final Map<String, Object> _statsTags;

  StoreState(
    Map<String, Object> initialAssigns,
    StoreSubscriptions subscriptions,
    StatsRecorder statsRecorder,
    Map<String, Object> statsTags
  ) {
    _assigns = new LinkedHashMap<>(initialAssigns);
    _subscriptions = subscriptions;
    _statsRecorder = statsRecorder;
    _statsTags = statsTags;
  }

  Object get(String key, Object defaultValue) {

    if (!_assigns.containsKey(key)) {
      return defaultValue;
    }

    return _assigns.get(key);
  }

  Map<String, Object> take(Collection<String> keys) {

    var taken = new LinkedHashMap<String, Object>();

    for (var key : keys) {
      if (_assigns.containsKey(key)) {
        taken.put(key, _assigns.get(key));
      }
    }

    return Collections.unmodifiableMap(taken);
  }

  /**
   * @return true if the value changed and subscribers were notified
   */
  boolean assign(String key, Object value) {

    if (_assigns.containsKey(key) && DeepEquals.deepEquals(_assigns.get(key), value)) {
      _statsRecorder.recordCounterIncrement(_statsTags, "assign_unchanged");
      return false;
    }

    _assigns.put(key, value);
    _subscriptions.notifyValueChange(key, value);

    return true;
  }

  /**
   * Any exception thrown by {@code updateFn} escapes before the new value is committed.
   */
  boolean update(String key, UnaryOperator<Object> updateFn) {

    var newValue = updateFn.apply(_assigns.get(key));

    return assign(key, newValue);
  }

  void subscribe(Observer observer, Collection<String> keys) {

    for (var key : keys) {
      _subscriptions.add(key, observer);
    }
  }

  StoreSubscriptions subscriptions() {
    return _subscriptions;
  }
}
