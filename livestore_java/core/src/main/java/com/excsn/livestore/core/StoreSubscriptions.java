package com.excsn.livestore.core;

import com.excsn.livestore.core.telemetry.Logger;
import com.excsn.livestore.core.telemetry.StatsRecorder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Observers per key, most recent subscriber first. Only the owning store's thread touches an instance.
 */
class StoreSubscriptions {

  private final String _storeName;
  private final Logger _logger;
  private final StatsRecorder _statsRecorder;
  private final Map<String, Object> _statsTags;
  private final ListMultimap<String, Observer> _observers;

  StoreSubscriptions(String storeName, Logger logger, StatsRecorder statsRecorder, Map<String, Object> statsTags) {
    _storeName = storeName;
    _logger = logger;
    _statsRecorder = statsRecorder;
    _statsTags = statsTags;
    _observers = MultimapBuilder.hashKeys().arrayListValues().build();
  }

  public void add(String key, Observer observer) {
    _observers.get(key).add(0, observer);
  }

  public List<Observer> getSubscribers(String key) {
    return ImmutableList.copyOf(_observers.get(key));
  }

  public void notifyValueChange(String key, Object value) {

    var observers = _observers.get(key);

    if (observers.isEmpty()) {
      return;
    }

    var pruned = 0;
    var observersIter = observers.iterator();

    while (observersIter.hasNext()) {
      if (!_isAlive(observersIter.next(), key)) {
        observersIter.remove();
        _statsRecorder.recordCounterIncrement(_statsTags, "observers_pruned");
        pruned++;
      }
    }

    if (pruned > 0) {
      _logger.debug("Store `" + _storeName + "` pruned " + pruned + " dead observer(s) of `" + key + "`");
    }

    var change = new StoreChange(key, value);

    for (var observer : new ArrayList<>(observers)) {

      try {
        observer.deliver(change);
        _statsRecorder.recordCounterIncrement(_statsTags, "notifications_sent");
      } catch (RuntimeException e) {

        _logger.warn("Store `" + _storeName + "` could not deliver change of `" + key + "` to " + observer + ": " + e);
        _statsRecorder.recordCounterIncrement(_statsTags, "notify_errors");
      }
    }
  }

  private boolean _isAlive(Observer observer, String key) {

    try {
      return observer.isAlive();
    } catch (RuntimeException e) {

      _logger.warn("Store `" + _storeName + "` dropped observer " + observer + " of `" + key
        + "` whose liveness check failed: " + e);
      _statsRecorder.recordCounterIncrement(_statsTags, "liveness_errors");
      return false;
    }
  }
}
