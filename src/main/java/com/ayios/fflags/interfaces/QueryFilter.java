package com.ayios.fflags.interfaces;

import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.launchdarkly.sdk.LDValue;

/**
 * A hook that lets the application narrow down which records are fetched from the store, for
 * instance to partition flags by tenant or environment.
 * <p>
 * The client calls the filter once per load or refresh cycle, so it can return different scoping on
 * different calls. The result must be one of:
 * <ul>
 * <li> {@code LDValue.of(false)} or {@link LDValue#ofNull()}: use the default query, which fetches
 * every record of the kind; </li>
 * <li> a JSON object: each property is added to the query as an equality predicate, alongside the
 * kind's type tag. </li>
 * </ul>
 * Any other result makes the cycle fail with an {@link InvalidQueryFilterException}.
 *
 * <pre><code>
 *     QueryFilter byEnv = kind -&gt; LDValue.buildObject().put("env", currentEnvironment()).build();
 * </code></pre>
 */
@FunctionalInterface
public interface QueryFilter {
  /**
   * A filter that never adds predicates.
   */
  public static final QueryFilter NONE = kind -> LDValue.of(false);

  /**
   * Computes the extra predicates for one query.
   *
   * @param kind the kind of flags about to be queried
   * @return {@code false}, null, or an object of predicates
   */
  LDValue extraPredicates(FlagKind kind);
}
