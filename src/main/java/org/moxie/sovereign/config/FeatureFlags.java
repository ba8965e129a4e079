package org.moxie.sovereign.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Feature gates, loaded once at startup. Until {@link #load(Collection)} runs every flag
 * reads as disabled. A name prefixed with {@code -} turns its flag off.
 */
public class FeatureFlags {

  private static final Logger log = LoggerFactory.getLogger(FeatureFlags.class);

  public enum Flag {
    UNIFIED_IDENTITY("Unified-Identity", true),
    TEST_FLAG("i_am_a_test_flag", false);

    private final String  configName;
    private final boolean enabledByDefault;

    Flag(String configName, boolean enabledByDefault) {
      this.configName       = configName;
      this.enabledByDefault = enabledByDefault;
    }

    public String configName() {
      return configName;
    }

    static Flag fromConfigName(String name) {
      for (Flag flag : values()) {
        if (flag.configName.equals(name)) return flag;
      }

      return null;
    }
  }

  private volatile Map<Flag, Boolean> values;

  public synchronized void load(Collection<String> names) {
    if (values != null) {
      throw new IllegalStateException("Feature flags already loaded");
    }

    Map<Flag, Boolean> loaded  = new EnumMap<>(Flag.class);
    TreeSet<String>    unknown = new TreeSet<>();

    for (Flag flag : Flag.values()) {
      loaded.put(flag, flag.enabledByDefault);
    }

    if (names != null) {
      for (String raw : names) {
        if (raw == null || raw.isBlank()) continue;

        String  name    = raw.trim();
        boolean enabled = !name.startsWith("-");
        Flag    flag    = Flag.fromConfigName(enabled ? name : name.substring(1));

        if (flag == null) {
          unknown.add(name);
        } else {
          loaded.put(flag, enabled);
        }
      }
    }

    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("Unknown feature flags: " + String.join(", ", unknown));
    }

    values = Collections.unmodifiableMap(loaded);
    log.info("Feature flags loaded: {}", values);
  }

  public boolean isEnabled(Flag flag) {
    Map<Flag, Boolean> current = values;
    return current != null && current.get(flag);
  }

  public boolean isLoaded() {
    return values != null;
  }

  /**
   * Drop loaded values so a test can load again.
   */
  public synchronized void reset() {
    if (values == null) {
      throw new IllegalStateException("Feature flags were never loaded");
    }

    values = null;
  }
}
