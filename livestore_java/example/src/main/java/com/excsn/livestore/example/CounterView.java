package com.excsn.livestore.example;

import com.excsn.livestore.core.Inbox;
import com.excsn.livestore.core.LiveStore;
import com.excsn.livestore.core.StoreChange;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A view that copies the store keys it renders into its own assigns and keeps them current from change messages.
 */
class CounterView implements AutoCloseable {

  private final String _label;
  private final LiveStore _store;
  private final Inbox _inbox = new Inbox();
  private final Map<String, Object> _assigns = new HashMap<>();

  CounterView(String label, LiveStore store, List<String> keys) {
    _label = label;
    _store = store;

    _store.subscribe(_inbox, keys);
    _assigns.putAll(_store.take(keys));
  }

  void increment() {
    _store.<Integer>update("val", val -> val + 1);
  }

  /**
   * Applies every change that arrives within {@code wait}.
   */
  void handleChanges(Duration wait) throws InterruptedException {

    StoreChange change;

    while ((change = _inbox.receive(wait)) != null) {
      _assigns.put(change.key, change.value);
      System.out.println(_label + " received " + change);
    }
  }

  String render() {
    return _label + ": " + _assigns.get("title") + " = " + _assigns.get("val");
  }

  @Override
  public void close() {
    _inbox.close();
  }
}
