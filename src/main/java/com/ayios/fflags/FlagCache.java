package com.ayios.fflags;

import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.sdk.LDValue;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The in-memory map from {@code (kind, id)} to the flag's current value. This is the only place that
 * reads are served from.
 * <p>
 * Each kind has its own partition, so the same id can exist as both a fast and a dynamic flag.
 * Reads never block. Writes only come from {@link FastFlagLoader} and {@link DynamicFlagRefresher}.
 */
final class FlagCache {
  private final Map<FlagKind, ConcurrentHashMap<String, LDValue>> partitions = new EnumMap<>(FlagKind.class);

  FlagCache() {
    for (FlagKind kind: FlagKind.values()) {
      partitions.put(kind, new ConcurrentHashMap<>());
    }
  }

  /**
   * Returns the cached value, or null if the flag has never been cached.
   */
  LDValue get(FlagKind kind, String id) {
    if (id == null) {
      return null;
    }
    return partitions.get(kind).get(id);
  }

  /**
   * Stores a value and returns the one it replaced, or null if this is the first sighting.
   */
  LDValue put(FlagKind kind, String id, LDValue value) {
    return partitions.get(kind).put(id, LDValue.normalize(value));
  }

  LDValue remove(FlagKind kind, String id) {
    return partitions.get(kind).remove(id);
  }

  Set<String> ids(FlagKind kind) {
    return ImmutableSet.copyOf(partitions.get(kind).keySet());
  }

  Map<String, LDValue> snapshot(FlagKind kind) {
    return ImmutableMap.copyOf(partitions.get(kind));
  }

  int size(FlagKind kind) {
    return partitions.get(kind).size();
  }
}
