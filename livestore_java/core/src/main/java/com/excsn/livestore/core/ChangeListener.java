package com.excsn.livestore.core;

@FunctionalInterface
public interface ChangeListener {
  void onChange(String key, Object value);
}
