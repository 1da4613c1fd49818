package com.ayios.fflags.integrations;

import com.ayios.fflags.subsystems.ClientContext;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagKind;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.google.common.collect.ImmutableList;
import com.launchdarkly.sdk.LDValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An in-memory flag store for tests and for applications that supply flags from their own code.
 * <p>
 * Records can be added, changed, and removed at any time; the next load or refresh sees the
 * current contents. Queries are answered with {@link FlagQuery#matches(FlagRecord)}, in the order
 * that records were first added.
 *
 * <pre><code>
 *     TestFlagStore store = TestFlagStore.flagStore()
 *         .fast("new-checkout", LDValue.of(true))
 *         .dynamic("checkout-timeout", LDValue.of(5000));
 *
 *     FFlagsClient client = new FFlagsClient(new FFlagsConfig.Builder().flagStore(store).build());
 *
 *     // later; the next refresh cycle reports the change
 *     store.dynamic("checkout-timeout", LDValue.of(8000));
 * </code></pre>
 * <p>
 * The same instance can be given to several clients; it is never closed by them.
 */
public final class TestFlagStore implements FlagStore, ComponentConfigurer<FlagStore> {
  private final Object lock = new Object();
  private final Map<String, FlagRecord> records = new LinkedHashMap<>();
  private final List<FlagQuery> queries = new ArrayList<>();
  private IOException queryError = null;

  /**
   * Creates a new, empty store.
   *
   * @return a store
   */
  public static TestFlagStore flagStore() {
    return new TestFlagStore();
  }

  private TestFlagStore() {}

  /**
   * Adds or replaces a record. A replaced record keeps its original position.
   *
   * @param record the record
   * @return the store
   */
  public TestFlagStore update(FlagRecord record) {
    synchronized (lock) {
      records.put(keyOf(record.getKind(), record.getId()), record);
    }
    return this;
  }

  /**
   * Adds or replaces a fast flag with only a value.
   *
   * @param id the flag id
   * @param value the value
   * @return the store
   */
  public TestFlagStore fast(String id, LDValue value) {
    return update(FlagRecord.of(id, FlagKind.FAST, value));
  }

  /**
   * Adds or replaces a dynamic flag with only a value.
   *
   * @param id the flag id
   * @param value the value
   * @return the store
   */
  public TestFlagStore dynamic(String id, LDValue value) {
    return update(FlagRecord.of(id, FlagKind.DYNAMIC, value));
  }

  /**
   * Removes a record if it exists.
   *
   * @param kind the flag kind
   * @param id the flag id
   * @return the store
   */
  public TestFlagStore remove(FlagKind kind, String id) {
    synchronized (lock) {
      records.remove(keyOf(kind, id));
    }
    return this;
  }

  /**
   * Makes every subsequent query fail with the given exception, or succeed again if it is null.
   *
   * @param error the exception to throw, or null
   * @return the store
   */
  public TestFlagStore failQueriesWith(IOException error) {
    synchronized (lock) {
      this.queryError = error;
    }
    return this;
  }

  /**
   * Returns every query received so far, including failed ones, in order.
   *
   * @return a list of queries
   */
  public List<FlagQuery> getQueries() {
    synchronized (lock) {
      return ImmutableList.copyOf(queries);
    }
  }

  /**
   * Returns the number of queries received for one kind.
   *
   * @param kind the flag kind
   * @return the query count
   */
  public int getQueryCount(FlagKind kind) {
    synchronized (lock) {
      int n = 0;
      for (FlagQuery q: queries) {
        if (q.getKind() == kind) {
          n++;
        }
      }
      return n;
    }
  }

  @Override
  public List<FlagRecord> query(FlagQuery query) throws IOException {
    synchronized (lock) {
      queries.add(query);
      if (queryError != null) {
        throw queryError;
      }
      ImmutableList.Builder<FlagRecord> result = ImmutableList.builder();
      for (FlagRecord r: records.values()) {
        if (query.matches(r)) {
          result.add(r);
        }
      }
      return result.build();
    }
  }

  @Override
  public FlagStore build(ClientContext clientContext) {
    return new Unclosable(this);
  }

  @Override
  public void close() {}

  private static String keyOf(FlagKind kind, String id) {
    return kind.getTag() + ":" + id;
  }

  // The client closes the store it was given; the shared test store must outlive any one client.
  private static final class Unclosable implements FlagStore {
    private final TestFlagStore store;

    Unclosable(TestFlagStore store) {
      this.store = store;
    }

    @Override
    public List<FlagRecord> query(FlagQuery query) throws IOException {
      return store.query(query);
    }

    @Override
    public void close() {}
  }
}
