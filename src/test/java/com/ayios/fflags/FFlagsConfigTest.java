package com.ayios.fflags;

import com.ayios.fflags.integrations.TestFlagStore;
import com.ayios.fflags.interfaces.QueryFilter;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;

@SuppressWarnings("javadoc")
public class FFlagsConfigTest {
  @Test
  public void defaults() {
    FFlagsConfig config = new FFlagsConfig.Builder().build();

    assertThat(config.flagStore, sameInstance(ComponentsImpl.NullFlagStoreFactory.INSTANCE));
    assertThat(config.logging, instanceOf(ComponentsImpl.LoggingConfigurationBuilderImpl.class));
    assertThat(config.queryFilter, sameInstance(QueryFilter.NONE));
    assertThat(config.refresh, instanceOf(ComponentsImpl.DynamicRefreshBuilderImpl.class));
    assertThat(config.threadPriority, equalTo(Thread.MIN_PRIORITY));
  }

  @Test
  public void flagStore() {
    TestFlagStore store = TestFlagStore.flagStore();
    FFlagsConfig config = new FFlagsConfig.Builder().flagStore(store).build();
    assertThat(config.flagStore, sameInstance(store));
  }

  @Test
  public void queryFilter() {
    QueryFilter filter = kind -> null;
    FFlagsConfig config = new FFlagsConfig.Builder().queryFilter(filter).build();
    assertThat(config.queryFilter, sameInstance(filter));
  }

  @Test
  public void refresh() {
    ComponentConfigurer<DynamicRefreshConfiguration> refresh = Components.dynamicRefresh().selfReconfigure(true);
    FFlagsConfig config = new FFlagsConfig.Builder().refresh(refresh).build();
    assertThat(config.refresh, sameInstance(refresh));
  }

  @Test
  public void threadPriority() {
    FFlagsConfig config = new FFlagsConfig.Builder().threadPriority(Thread.NORM_PRIORITY).build();
    assertThat(config.threadPriority, equalTo(Thread.NORM_PRIORITY));
  }

  @Test
  public void threadPriorityIsClampedToValidRange() {
    assertThat(new FFlagsConfig.Builder().threadPriority(100).build().threadPriority,
        equalTo(Thread.MAX_PRIORITY));
    assertThat(new FFlagsConfig.Builder().threadPriority(-1).build().threadPriority,
        equalTo(Thread.MIN_PRIORITY));
  }
}
