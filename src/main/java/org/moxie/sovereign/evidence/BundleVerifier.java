package org.moxie.sovereign.evidence;

import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.signing.PublicKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.util.EnumSet;
import java.util.Set;

/**
 * Server-side binding checks run before a bundle is shipped to the remote verifier:
 * every ring must answer the challenge of {@code session}, and the aggregator's
 * signature must cover exactly what was received. Quote signatures themselves are the
 * remote verifier's business.
 */
public class BundleVerifier {

  private static final Logger log = LoggerFactory.getLogger(BundleVerifier.class);

  private final BundleCodec   codec;
  private final EnumSet<Ring> requiredRings;

  public BundleVerifier(BundleCodec codec, Set<Ring> requiredRings) {
    this.codec         = codec;
    this.requiredRings = requiredRings.isEmpty() ? EnumSet.noneOf(Ring.class) : EnumSet.copyOf(requiredRings);
  }

  public void verify(EvidenceBundle bundle, Session session) throws BundleException {
    if (!session.sessionId().equals(bundle.sessionId())) {
      throw new BundleException(BundleException.Kind.SESSION_MISMATCH,
                                "bundle names session " + bundle.sessionId() + ", expected " + session.sessionId());
    }

    Set<Ring> present = EnumSet.noneOf(Ring.class);

    for (Evidence evidence : bundle.evidence()) {
      if (evidence.ring() == null) {
        throw new BundleException(BundleException.Kind.BINDING_MISMATCH, "evidence without ring");
      }

      if (!session.sessionId().equals(evidence.sessionId())) {
        throw new BundleException(BundleException.Kind.SESSION_MISMATCH,
                                  "ring " + evidence.ring() + " carries session " + evidence.sessionId());
      }

      if (!present.add(evidence.ring())) {
        throw new BundleException(BundleException.Kind.DUPLICATE_RING, "ring " + evidence.ring() + " supplied twice");
      }

      verifyBinding(evidence, session);
    }

    Set<Ring> missing = EnumSet.copyOf(requiredRings);
    missing.removeAll(present);

    if (!missing.isEmpty()) {
      throw new BundleException(BundleException.Kind.INCOMPLETE_BUNDLE, "missing evidence for " + missing);
    }

    verifySignature(bundle);
    log.debug("Bundle for session {} passed binding checks", session.sessionId());
  }

  private void verifyBinding(Evidence evidence, Session session) throws BundleException {
    String expectedNonce = session.nonceFor(evidence.ring());

    if (!expectedNonce.equals(evidence.nonce())) {
      throw new BundleException(BundleException.Kind.BINDING_MISMATCH, "ring " + evidence.ring() + " answered a different nonce");
    }

    if (evidence.claimsDigest() == null || evidence.bindingHash() == null) {
      throw new BundleException(BundleException.Kind.BINDING_MISMATCH, "ring " + evidence.ring() + " has no binding");
    }

    byte[] expected = EvidenceDigests.bindingHash(session.sessionId(), expectedNonce, evidence.claimsDigest());

    if (!MessageDigest.isEqual(expected, evidence.bindingHash())) {
      throw new BundleException(BundleException.Kind.BINDING_MISMATCH, "ring " + evidence.ring() + " binding hash does not match");
    }
  }

  private void verifySignature(EvidenceBundle bundle) throws BundleException {
    if (bundle.signature() == null) {
      throw new BundleException(BundleException.Kind.BAD_SIGNATURE, "bundle is unsigned");
    }

    RSAPublicKey aggregatorKey;

    try {
      aggregatorKey = PublicKeys.parseRsa(bundle.aggregatorPublicKey());
    } catch (IllegalArgumentException e) {
      throw new BundleException(BundleException.Kind.BAD_SIGNATURE, "unusable aggregator key", e);
    }

    try {
      Signature verifier = Signature.getInstance("SHA256withRSA");
      verifier.initVerify(aggregatorKey);
      verifier.update(codec.signingPayload(bundle));

      if (!verifier.verify(bundle.signature())) {
        throw new BundleException(BundleException.Kind.BAD_SIGNATURE, "aggregator signature does not verify");
      }
    } catch (GeneralSecurityException e) {
      throw new BundleException(BundleException.Kind.BAD_SIGNATURE, "aggregator signature is malformed", e);
    }
  }
}
