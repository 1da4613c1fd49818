package com.ayios.fflags;

import com.ayios.fflags.integrations.DynamicRefreshBuilder;
import com.ayios.fflags.integrations.LoggingConfigurationBuilder;
import com.ayios.fflags.subsystems.ClientContext;
import com.ayios.fflags.subsystems.ComponentConfigurer;
import com.ayios.fflags.subsystems.DynamicRefreshConfiguration;
import com.ayios.fflags.subsystems.FlagStore;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagQuery;
import com.ayios.fflags.subsystems.FlagStoreTypes.FlagRecord;
import com.ayios.fflags.subsystems.LoggingConfiguration;
import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;

import java.util.List;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final class NullFlagStoreFactory implements ComponentConfigurer<FlagStore> {
    static final NullFlagStoreFactory INSTANCE = new NullFlagStoreFactory();

    @Override
    public FlagStore build(ClientContext context) {
      context.getBaseLogger().subLogger(Loggers.STORE_LOGGER_NAME)
        .warn("No flag store was configured; all flags will use their fallback values");
      return NullFlagStore.INSTANCE;
    }
  }

  // exposed as a singleton because it is stateless
  static final class NullFlagStore implements FlagStore {
    static final FlagStore INSTANCE = new NullFlagStore();

    @Override
    public List<FlagRecord> query(FlagQuery query) {
      return ImmutableList.of();
    }

    @Override
    public void close() {}
  }

  static final class DynamicRefreshBuilderImpl extends DynamicRefreshBuilder {
    @Override
    public DynamicRefreshConfiguration build(ClientContext context) {
      return new DynamicRefreshConfiguration(refreshInterval, selfReconfigure, evictStaleFlags);
    }
  }

  static final class LoggingConfigurationBuilderImpl extends LoggingConfigurationBuilder {
    @Override
    public LoggingConfiguration build(ClientContext clientContext) {
      LDLogAdapter adapter = logAdapter == null ? getDefaultLogAdapter() : logAdapter;
      LDLogAdapter filteredAdapter = Logs.level(adapter,
          minimumLevel == null ? LDLogLevel.INFO : minimumLevel);
      // If the adapter is for a framework like SLF4J that has its own external configuration
      // system, then calling Logs.level here has no effect and filteredAdapter is just adapter.
      String name = baseName == null ? Loggers.BASE_LOGGER_NAME : baseName;
      return new LoggingConfiguration(name, filteredAdapter);
    }

    private static LDLogAdapter getDefaultLogAdapter() {
      // If SLF4J is present in the classpath, use that by default; otherwise use the console.
      try {
        Class.forName("org.slf4j.LoggerFactory");
        return LDSLF4J.adapter();
      } catch (ClassNotFoundException e) {
        return Logs.toConsole();
      }
    }
  }
}
