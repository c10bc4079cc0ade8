package com.excsn.livestore.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class LiveStoreUtils {

  private LiveStoreUtils() {}

  /**
   * Seed files for an environment, lowest precedence first: {@code common.yaml} then {@code <env>.yaml}.
   */
  public static Collection<Path> defaultSeedFilePaths(String seedDir, String env) {

    var filePaths = new ArrayList<Path>();

    filePaths.add(Path.of(seedDir, "common.yaml").toAbsolutePath());
    filePaths.add(Path.of(seedDir, env + ".yaml").toAbsolutePath());

    return filePaths;
  }

  /**
   * Coerces ordered pairs into a mapping. A key that appears more than once keeps its last value.
   */
  public static Map<String, Object> toAssigns(Iterable<? extends Map.Entry<String, ?>> pairs) {

    var assigns = new LinkedHashMap<String, Object>();

    for (var pair : pairs) {
      assigns.put(pair.getKey(), pair.getValue());
    }

    return assigns;
  }

  /**
   * Builds ordered pairs from alternating keys and values, e.g. {@code pairs("name", "Elixir", "logo", "drop")}.
   */
  public static List<Map.Entry<String, Object>> pairs(String key, Object value, Object... more) {

    Preconditions.checkArgument(more.length % 2 == 0, "expected key/value pairs, got a dangling key");

    var pairs = new ArrayList<Map.Entry<String, Object>>();
    pairs.add(Maps.immutableEntry(key, value));

    for (int idx = 0; idx < more.length; idx += 2) {

      Preconditions.checkArgument(more[idx] instanceof String, "key at position %s is not a String: %s",
        idx + 2, more[idx]);
      pairs.add(Maps.immutableEntry((String) more[idx], more[idx + 1]));
    }

    return pairs;
  }

  static List<Map.Entry<String, Object>> copyPairs(Iterable<? extends Map.Entry<String, ?>> pairs) {

    var copied = new ArrayList<Map.Entry<String, Object>>();

    for (var pair : pairs) {
      copied.add(Maps.immutableEntry(pair.getKey(), pair.getValue()));
    }

    return copied;
  }

  /**
   * Merges newMap into original. Nested maps are merged key by key, any other value in newMap replaces the one in
   * original.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  static void deepMerge(Map original, Map newMap) {

    if (original == null || newMap == null) {
      return;
    }

    for (var entry : (Iterable<Map.Entry>) newMap.entrySet()) {

      var key = entry.getKey();
      var value = entry.getValue();
      var originalValue = original.get(key);

      if (originalValue instanceof Map && value instanceof Map) {
        deepMerge((Map) originalValue, (Map) value);
        continue;
      }

      original.put(key, value);
    }
  }
}
