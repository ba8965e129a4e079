package org.moxie.sovereign.evidence;

import org.moxie.sovereign.signing.DelegatedSigner;
import org.moxie.sovereign.signing.PublicKeys;
import org.moxie.sovereign.signing.SignOptions;
import org.moxie.sovereign.signing.SigningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregates ring evidence into a bundle and signs it with the App Key through the
 * delegated signer.
 */
public class EvidenceBundler {

  private static final Logger log = LoggerFactory.getLogger(EvidenceBundler.class);

  private final DelegatedSigner signer;
  private final BundleCodec     codec;
  private final EnumSet<Ring>   requiredRings;
  private final byte[]          aggregatorCertificate;

  public EvidenceBundler(DelegatedSigner signer, BundleCodec codec, Set<Ring> requiredRings, byte[] aggregatorCertificate) {
    this.signer                = signer;
    this.codec                 = codec;
    this.requiredRings         = requiredRings.isEmpty() ? EnumSet.noneOf(Ring.class) : EnumSet.copyOf(requiredRings);
    this.aggregatorCertificate = aggregatorCertificate;
  }

  /**
   * @throws BundleException  {@code INCOMPLETE_BUNDLE} when a required ring is missing,
   *                          {@code SESSION_MISMATCH} when rings disagree on the session,
   *                          {@code DUPLICATE_RING} when a ring appears twice
   * @throws SigningException when the gateway cannot sign the bundle
   */
  public EvidenceBundle bundle(List<Evidence> evidence) throws BundleException, SigningException {
    return bundle(evidence, aggregatorCertificate);
  }

  /**
   * Bundle with a certificate obtained for this attempt, e.g. an App Key certificate
   * bound to the current challenge.
   */
  public EvidenceBundle bundle(List<Evidence> evidence, byte[] certificate) throws BundleException, SigningException {
    if (evidence == null || evidence.isEmpty()) {
      throw new BundleException(BundleException.Kind.INCOMPLETE_BUNDLE, "no evidence supplied");
    }

    String    sessionId = evidence.get(0).sessionId();
    Set<Ring> present   = EnumSet.noneOf(Ring.class);

    for (Evidence entry : evidence) {
      if (sessionId == null || !sessionId.equals(entry.sessionId())) {
        throw new BundleException(BundleException.Kind.SESSION_MISMATCH,
                                  "ring " + entry.ring() + " carries session " + entry.sessionId() + ", expected " + sessionId);
      }

      if (!present.add(entry.ring())) {
        throw new BundleException(BundleException.Kind.DUPLICATE_RING, "ring " + entry.ring() + " supplied twice");
      }
    }

    Set<Ring> missing = EnumSet.copyOf(requiredRings);
    missing.removeAll(present);

    if (!missing.isEmpty()) {
      throw new BundleException(BundleException.Kind.INCOMPLETE_BUNDLE, "missing evidence for " + missing);
    }

    List<Evidence> ordered = new ArrayList<>(evidence);
    ordered.sort(Comparator.comparing(Evidence::ring));

    String aggregatorKey = PublicKeys.toPem(signer.getPublic());
    byte[] payload       = codec.signingPayload(sessionId, ordered, aggregatorKey);
    byte[] signature     = signer.sign(EvidenceDigests.sha256(payload), SignOptions.pkcs1("sha256"));

    log.info("Bundled {} rings for session {}", ordered.size(), sessionId);

    return new EvidenceBundle(sessionId, ordered, aggregatorKey, certificate, signature);
  }
}
