package org.moxie.sovereign.agent;

import org.moxie.sovereign.attestation.AttestationException;

/**
 * Obtains an App Key certificate bound to a challenge nonce.
 */
@FunctionalInterface
public interface AppKeyCertifier {

  byte[] certify(String challengeNonce) throws AttestationException;
}
