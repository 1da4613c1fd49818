package com.ayios.fflags;

import com.ayios.fflags.interfaces.InvalidQueryFilterException;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.sdk.LDValue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class FlagQueriesTest extends BaseTest {
  @Test
  public void noFilterQueriesAllFlagsOfKind() {
    assertThat(FlagQueries.buildQuery(FlagKind.FAST, QueryFilter.NONE, testLogger),
        equalTo(FlagQuery.allOf(FlagKind.FAST)));
    assertThat(FlagQueries.buildQuery(FlagKind.DYNAMIC, null, testLogger),
        equalTo(FlagQuery.allOf(FlagKind.DYNAMIC)));
  }

  @Test
  public void filterReturningNullOrFalseQueriesAllFlagsOfKind() {
    assertThat(FlagQueries.buildQuery(FlagKind.FAST, kind -> null, testLogger),
        equalTo(FlagQuery.allOf(FlagKind.FAST)));
    assertThat(FlagQueries.buildQuery(FlagKind.FAST, kind -> LDValue.ofNull(), testLogger),
        equalTo(FlagQuery.allOf(FlagKind.FAST)));
    assertThat(FlagQueries.buildQuery(FlagKind.FAST, kind -> LDValue.of(false), testLogger),
        equalTo(FlagQuery.allOf(FlagKind.FAST)));
  }

  @Test
  public void filterObjectBecomesPredicates() {
    QueryFilter filter = kind -> LDValue.buildObject().put("env", "prod").put("region", "eu").build();
    FlagQuery query = FlagQueries.buildQuery(FlagKind.DYNAMIC, filter, testLogger);

    assertThat(query.getKind(), equalTo(FlagKind.DYNAMIC));
    assertThat(query.getPredicates(), equalTo(ImmutableMap.of(
        "env", LDValue.of("prod"), "region", LDValue.of("eu"))));
  }

  @Test
  public void filterIsToldWhichKindIsQueried() {
    List<FlagKind> kinds = new ArrayList<>();
    QueryFilter filter = kind -> {
      kinds.add(kind);
      return LDValue.of(false);
    };
    FlagQueries.buildQuery(FlagKind.FAST, filter, testLogger);
    FlagQueries.buildQuery(FlagKind.DYNAMIC, filter, testLogger);

    assertThat(kinds, contains(FlagKind.FAST, FlagKind.DYNAMIC));
  }

  @Test
  public void typePredicateIsIgnoredWithWarning() {
    QueryFilter filter = kind -> LDValue.buildObject().put("type", "fast").put("env", "prod").build();
    FlagQuery query = FlagQueries.buildQuery(FlagKind.DYNAMIC, filter, testLogger);

    assertThat(query.getPredicates(), equalTo(ImmutableMap.of("env", LDValue.of("prod"))));
    assertThat(query.toFilter().get("type"), equalTo(LDValue.of("dynamic")));
    assertThat(wasLogged(LDLogLevel.WARN, "\"type\" predicate"), is(true));
  }

  @Test
  public void filterReturningTrueIsInvalid() {
    expectInvalid(kind -> LDValue.of(true));
  }

  @Test
  public void filterReturningStringIsInvalid() {
    expectInvalid(kind -> LDValue.of("env=prod"));
  }

  @Test
  public void filterReturningArrayIsInvalid() {
    expectInvalid(kind -> LDValue.arrayOf(LDValue.of("prod")));
  }

  @Test
  public void filterThatThrowsIsInvalid() {
    RuntimeException error = new IllegalStateException("no environment");
    try {
      FlagQueries.buildQuery(FlagKind.FAST, kind -> { throw error; }, testLogger);
      fail("expected exception");
    } catch (InvalidQueryFilterException e) {
      assertThat(e.getCause(), is((Throwable)error));
    }
  }

  private void expectInvalid(QueryFilter filter) {
    try {
      FlagQueries.buildQuery(FlagKind.FAST, filter, testLogger);
      fail("expected exception");
    } catch (RuntimeException e) {
      assertThat(e, instanceOf(InvalidQueryFilterException.class));
    }
  }
}
