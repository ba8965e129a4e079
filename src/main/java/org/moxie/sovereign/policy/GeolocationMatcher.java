package org.moxie.sovereign.policy;

import java.util.Collection;

/**
 * Matches a reported location against allow-list entries. An entry is either an exact
 * location or a country wildcard such as {@code "Spain:*"} (also written
 * {@code "Spain: *"}), which accepts any location reported as {@code "Spain: ..."}.
 */
final class GeolocationMatcher {

  private GeolocationMatcher() {}

  static boolean matchesAny(String geolocation, Collection<String> patterns) {
    for (String pattern : patterns) {
      if (matches(geolocation, pattern)) {
        return true;
      }
    }

    return false;
  }

  static boolean matches(String geolocation, String pattern) {
    if (geolocation == null || pattern == null) {
      return false;
    }

    String location = geolocation.trim();
    String entry    = pattern.trim();

    if (entry.endsWith("*")) {
      String prefix = entry.substring(0, entry.length() - 1).trim();

      if (!prefix.endsWith(":")) {
        return false;
      }

      return location.startsWith(prefix);
    }

    return location.equals(entry);
  }
}
