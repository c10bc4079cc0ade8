package com.excsn.livestore.core.utils;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural equality for stored values. Unlike {@link Object#equals(Object)}, arrays nested anywhere inside lists,
 * sets or maps are compared element by element.
 */
public final class DeepEquals {

  private DeepEquals() {}

  public static boolean deepEquals(Object left, Object right) {

    if (left == right) {
      return true;
    }

    if (left == null || right == null) {
      return false;
    }

    if (left.getClass().isArray() && right.getClass().isArray()) {
      return _arraysEqual(left, right);
    }

    if (left instanceof List && right instanceof List) {
      return _listsEqual((List<?>) left, (List<?>) right);
    }

    if (left instanceof Map && right instanceof Map) {
      return _mapsEqual((Map<?, ?>) left, (Map<?, ?>) right);
    }

    if (left instanceof Set && right instanceof Set) {
      return _setsEqual((Set<?>) left, (Set<?>) right);
    }

    return left.equals(right);
  }

  private static boolean _arraysEqual(Object left, Object right) {

    if (left instanceof Object[] && right instanceof Object[]) {

      var leftArray = (Object[]) left;
      var rightArray = (Object[]) right;

      if (leftArray.length != rightArray.length) {
        return false;
      }

      for (int idx = 0; idx < leftArray.length; idx++) {
        if (!deepEquals(leftArray[idx], rightArray[idx])) {
          return false;
        }
      }

      return true;
    }

    // primitive arrays, Objects.deepEquals dispatches to the matching Arrays.equals
    return Objects.deepEquals(left, right);
  }

  private static boolean _listsEqual(List<?> left, List<?> right) {

    if (left.size() != right.size()) {
      return false;
    }

    Iterator<?> leftIter = left.iterator();
    Iterator<?> rightIter = right.iterator();

    while (leftIter.hasNext()) {
      if (!deepEquals(leftIter.next(), rightIter.next())) {
        return false;
      }
    }

    return true;
  }

  private static boolean _mapsEqual(Map<?, ?> left, Map<?, ?> right) {

    if (left.size() != right.size()) {
      return false;
    }

    // right.containsKey is unusable: immutable maps reject null keys and array keys only match by identity
    var unmatched = new ArrayList<Map.Entry<?, ?>>(right.size());

    for (var rightEntry : right.entrySet()) {
      unmatched.add(new AbstractMap.SimpleImmutableEntry<>(rightEntry));
    }

    for (var leftEntry : left.entrySet()) {

      var matched = false;
      var unmatchedIter = unmatched.iterator();

      while (unmatchedIter.hasNext()) {

        var rightEntry = unmatchedIter.next();

        if (deepEquals(leftEntry.getKey(), rightEntry.getKey())
          && deepEquals(leftEntry.getValue(), rightEntry.getValue())) {
          unmatchedIter.remove();
          matched = true;
          break;
        }
      }

      if (!matched) {
        return false;
      }
    }

    return true;
  }

  private static boolean _setsEqual(Set<?> left, Set<?> right) {

    if (left.size() != right.size()) {
      return false;
    }

    // each right element may match at most one left element
    var unmatched = new ArrayList<Object>(right);

    for (var leftElement : left) {

      var matched = false;
      var unmatchedIter = unmatched.iterator();

      while (unmatchedIter.hasNext()) {
        if (deepEquals(leftElement, unmatchedIter.next())) {
          unmatchedIter.remove();
          matched = true;
          break;
        }
      }

      if (!matched) {
        return false;
      }
    }

    return true;
  }
}
