package com.ayios.fflags;

import com.ayios.fflags.interfaces.InvalidQueryFilterException;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;

/**
 * Builds the {@link FlagQuery} for one load or refresh cycle by merging the kind's type tag with
 * whatever the application's {@link QueryFilter} returns.
 */
abstract class FlagQueries {
  private FlagQueries() {}

  static final String TYPE_PROPERTY = "type";

  /**
   * Calls the filter and validates its result.
   *
   * @throws InvalidQueryFilterException if the filter threw, or returned something other than
   *   false, null, or an object
   */
  static FlagQuery buildQuery(FlagKind kind, QueryFilter filter, LDLogger logger) {
    LDValue extra;
    try {
      extra = filter == null ? null : filter.extraPredicates(kind);
    } catch (RuntimeException e) {
      throw new InvalidQueryFilterException("query filter threw an exception", e);
    }
    if (extra == null || extra.isNull() || extra.equals(LDValue.of(false))) {
      return FlagQuery.allOf(kind);
    }
    if (extra.getType() != LDValueType.OBJECT) {
      throw new InvalidQueryFilterException("query filter must return false or an object, but returned "
          + extra.toJsonString());
    }
    ImmutableMap.Builder<String, LDValue> predicates = ImmutableMap.builder();
    for (String key: extra.keys()) {
      if (key.equals(TYPE_PROPERTY)) {
        logger.warn("Query filter returned a \"{}\" predicate; it was ignored, the {} tag is always used",
            TYPE_PROPERTY, kind.getTag());
        continue;
      }
      predicates.put(key, extra.get(key));
    }
    return new FlagQuery(kind, predicates.build());
  }
}
