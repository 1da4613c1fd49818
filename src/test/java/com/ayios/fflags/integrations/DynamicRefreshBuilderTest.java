package com.ayios.fflags.integrations;

import com.ayios.fflags.Components;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;
import com.launchdarkly.logging.Logs;

import org.junit.Test;

import java.time.Duration;

import static com.ayios.fflags.TestComponents.clientContext;
import static com.ayios.fflags.integrations.DynamicRefreshBuilder.DEFAULT_REFRESH_INTERVAL;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;


@SuppressWarnings("javadoc")
public class DynamicRefreshBuilderTest {
  private static DynamicRefreshConfiguration build(DynamicRefreshBuilder builder) {
    return builder.build(clientContext(Logs.none()));
  }

  @Test
  public void defaults() {
    DynamicRefreshConfiguration config = build(Components.dynamicRefresh());

    assertThat(config.getRefreshInterval(), equalTo(DEFAULT_REFRESH_INTERVAL));
    assertThat(config.isSelfReconfigure(), is(false));
    assertThat(config.isEvictStaleFlags(), is(false));
  }

  @Test
  public void defaultIntervalIsThirtySeconds() {
    assertThat(DEFAULT_REFRESH_INTERVAL, equalTo(Duration.ofMillis(30000)));
  }

  @Test
  public void refreshInterval() {
    assertThat(build(Components.dynamicRefresh().refreshInterval(Duration.ofMillis(250))).getRefreshInterval(),
        equalTo(Duration.ofMillis(250)));
  }

  @Test
  public void nullRefreshIntervalMeansDefault() {
    DynamicRefreshBuilder builder = Components.dynamicRefresh()
        .refreshInterval(Duration.ofSeconds(5))
        .refreshInterval(null);

    assertThat(build(builder).getRefreshInterval(), equalTo(DEFAULT_REFRESH_INTERVAL));
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroRefreshIntervalIsRejected() {
    Components.dynamicRefresh().refreshInterval(Duration.ZERO);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeRefreshIntervalIsRejected() {
    Components.dynamicRefresh().refreshInterval(Duration.ofSeconds(-1));
  }

  @Test
  public void selfReconfigure() {
    assertThat(build(Components.dynamicRefresh().selfReconfigure(true)).isSelfReconfigure(), is(true));
  }

  @Test
  public void evictStaleFlags() {
    assertThat(build(Components.dynamicRefresh().evictStaleFlags(true)).isEvictStaleFlags(), is(true));
  }

  @Test
  public void refreshRateFlagId() {
    assertThat(DynamicRefreshBuilder.REFRESH_RATE_FLAG_ID, equalTo("DynamicFFlagRefreshRate"));
  }
}
