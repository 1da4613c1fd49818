package com.ayios.fflags;

import com.ayios.fflags.integrations.DynamicRefreshBuilder;
import com.ayios.fflags.integrations.TestFlagStore;
import com.ayios.fflags.interfaces.FlagValueChangeEvent;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.interfaces.RefreshRateChangeEvent;
import com.ayios.fflags.interfaces.RefreshRateChangeListener;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.sdk.LDValue;

import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.launchdarkly.testhelpers.ConcurrentHelpers.assertNoMoreValues;
import static com.launchdarkly.testhelpers.ConcurrentHelpers.awaitValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

@SuppressWarnings("javadoc")
public class RefreshRateMonitorTest extends BaseTest {
  private static final Duration INITIAL_INTERVAL = Duration.ofSeconds(30);
  private static final String FLAG_ID = DynamicRefreshBuilder.REFRESH_RATE_FLAG_ID;

  private final ScheduledExecutorService executor = TestComponents.newExecutor();
  private final EventBroadcasterImpl<RefreshRateChangeListener, RefreshRateChangeEvent> broadcaster =
      EventBroadcasterImpl.forRefreshRateChanges(executor, testLogger);
  private final DynamicRefreshScheduler scheduler = new DynamicRefreshScheduler(() -> true,
      new DynamicFlagRefresher(TestFlagStore.flagStore(), new FlagCache(), QueryFilter.NONE,
          EventBroadcasterImpl.forFlagValueChanges(executor, testLogger), executor, false, testLogger),
      executor, INITIAL_INTERVAL, testLogger);
  private final RefreshRateMonitor monitor = new RefreshRateMonitor(scheduler, broadcaster, testLogger);
  private final BlockingQueue<RefreshRateChangeEvent> events = new LinkedBlockingQueue<>();

  public RefreshRateMonitorTest() {
    broadcaster.register(events::add);
  }

  @After
  public void tearDown() {
    scheduler.close();
    executor.shutdownNow();
  }

  private static FlagValueChangeEvent rateChange(LDValue oldValue, LDValue newValue) {
    return new FlagValueChangeEvent(FLAG_ID, oldValue, newValue);
  }

  @Test
  public void newRateIsAppliedAndAnnounced() throws Exception {
    monitor.onFlagValueChange(rateChange(LDValue.of(30000), LDValue.of(5000)));

    assertThat(scheduler.getRefreshInterval(), equalTo(Duration.ofMillis(5000)));
    RefreshRateChangeEvent event = awaitValue(events, 1, TimeUnit.SECONDS);
    assertThat(event.getCurrent(), equalTo(Duration.ofMillis(5000)));
    assertThat(event.getPrevious(), equalTo(INITIAL_INTERVAL));
  }

  @Test
  public void fractionalRateIsTruncatedToMilliseconds() throws Exception {
    monitor.onFlagValueChange(rateChange(LDValue.of(30000), LDValue.of(1500.7)));

    assertThat(scheduler.getRefreshInterval(), equalTo(Duration.ofMillis(1500)));
  }

  @Test
  public void rateEqualToCurrentIntervalIsNotAnnounced() throws Exception {
    monitor.onFlagValueChange(rateChange(LDValue.of(1000), LDValue.of(30000)));

    assertThat(scheduler.getRefreshInterval(), equalTo(INITIAL_INTERVAL));
    assertNoMoreValues(events, 100, TimeUnit.MILLISECONDS);
  }

  @Test
  public void nonNumericRateIsIgnored() throws Exception {
    expectIgnored(LDValue.of("fast please"));
  }

  @Test
  public void zeroRateIsIgnored() throws Exception {
    expectIgnored(LDValue.of(0));
  }

  @Test
  public void negativeRateIsIgnored() throws Exception {
    expectIgnored(LDValue.of(-5000));
  }

  @Test
  public void removedRateIsIgnored() throws Exception {
    expectIgnored(LDValue.ofNull());
  }

  private void expectIgnored(LDValue newValue) throws Exception {
    monitor.onFlagValueChange(rateChange(LDValue.of(30000), newValue));

    assertThat(scheduler.getRefreshInterval(), equalTo(INITIAL_INTERVAL));
    assertNoMoreValues(events, 100, TimeUnit.MILLISECONDS);
    assertThat(wasLogged(LDLogLevel.WARN, "Ignoring refresh rate flag"), is(true));
  }
}
