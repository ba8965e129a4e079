package org.moxie.sovereign.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PolicyResult(@JsonProperty("allowed") boolean allowed,
                           @JsonProperty("reason") String reason)
{

  static final String ALL_CHECKS_PASSED = "all policy checks passed";

  public static PolicyResult allow() {
    return new PolicyResult(true, ALL_CHECKS_PASSED);
  }

  public static PolicyResult deny(String reason) {
    return new PolicyResult(false, reason);
  }
}
