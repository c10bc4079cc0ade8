package com.excsn.livestore.core;

import java.util.Map;

/**
 * Shortcuts for creating stores with default settings. Use {@link LiveStoreBuilder} for anything else.
 */
public final class LiveStores {

  private LiveStores() {}

  /**
   * <pre>
   * var store = LiveStores.create(Map.of("name", "Elixir"));
   * </pre>
   */
  public static LiveStore create(Map<String, ?> initialAssigns) {
    return LiveStoreBuilder.builder().setInitialAssigns(initialAssigns).build();
  }

  /**
   * Creates a store from ordered pairs. A key that appears more than once keeps its last value.
   */
  public static LiveStore create(Iterable<? extends Map.Entry<String, ?>> initialPairs) {
    return LiveStoreBuilder.builder().setInitialAssigns(initialPairs).build();
  }

  /**
   * <pre>
   * var store = LiveStores.create("name", "Elixir", "logo", "drop");
   * </pre>
   */
  public static LiveStore create(String key, Object value, Object... more) {
    return create(LiveStoreUtils.pairs(key, value, more));
  }
}
