package org.moxie.sovereign.evidence;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * What a ring measured about itself before quoting.
 *
 * @param identity            Image or sandbox identity (e.g. image digest, workload code hash)
 * @param integrityLogSummary Summary of the integrity measurement log
 * @param metadata            Role-specific extras, sorted by key
 */
public record MeasuredState(String identity, String integrityLogSummary, Map<String, String> metadata) {

  public MeasuredState {
    identity            = identity == null ? "" : identity;
    integrityLogSummary = integrityLogSummary == null ? "" : integrityLogSummary;
    metadata            = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
  }

  public static MeasuredState of(String identity, String integrityLogSummary) {
    return new MeasuredState(identity, integrityLogSummary, Map.of());
  }
}
