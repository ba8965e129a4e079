package org.moxie.sovereign.verifier;

import java.util.Locale;

public enum HostIntegrityStatus {
  UNKNOWN,
  PASSED_ALL_CHECKS,
  PARTIAL,
  FAILED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse the verifier's spelling ({@code passed_all_checks}, {@code PASSED_ALL_CHECKS},
   * ...). Unrecognized or missing values are {@link #UNKNOWN}.
   */
  public static HostIntegrityStatus fromWire(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }

    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }
}
