package org.moxie.sovereign.evidence;

import org.moxie.sovereign.attestation.AttestationException;

/**
 * Produces a quote whose authenticated payload contains {@code qualifyingData}.
 * Implementations sit in front of the TPM access layer, which is not part of this
 * codebase.
 */
@FunctionalInterface
public interface QuoteSource {

  Quote quote(Ring ring, byte[] qualifyingData) throws AttestationException;
}
