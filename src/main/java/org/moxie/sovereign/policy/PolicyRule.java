package org.moxie.sovereign.policy;

import org.moxie.sovereign.verifier.AttestedClaims;

import java.util.Optional;

/**
 * An additional check run after the built-in ones. Rules must be side-effect free.
 */
@FunctionalInterface
public interface PolicyRule {

  /**
   * @return A denial reason, or empty if the rule has no objection
   */
  Optional<String> veto(AttestedClaims claims);
}
