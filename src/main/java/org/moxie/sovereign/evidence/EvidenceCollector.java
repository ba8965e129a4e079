package org.moxie.sovereign.evidence;

import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Produces per-ring evidence bound to the current challenge. The qualifying data of
 * every quote is {@link EvidenceDigests#bindingHash}, so a quote taken for an older
 * challenge cannot be replayed against a new one.
 */
public class EvidenceCollector {

  private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

  private final Map<Ring, QuoteSource> quoteSources;

  public EvidenceCollector(Map<Ring, QuoteSource> quoteSources) {
    this.quoteSources = new EnumMap<>(quoteSources);
  }

  /**
   * Collect evidence for {@code ring} under {@code session}.
   *
   * @throws AttestationException if the ring has no quote source or quoting fails
   */
  public Evidence collect(Session session, Ring ring, MeasuredState state) throws AttestationException {
    QuoteSource source = quoteSources.get(ring);

    if (source == null) {
      throw new AttestationException("No quote source configured for ring " + ring);
    }

    String nonce        = session.nonceFor(ring);
    byte[] claimsDigest = EvidenceDigests.claimsDigest(ring, state);
    byte[] bindingHash  = EvidenceDigests.bindingHash(session.sessionId(), nonce, claimsDigest);
    Quote  quote        = source.quote(ring, bindingHash);

    log.debug("Collected {} evidence for session {} ({} measurements)",
              ring, session.sessionId(), quote.platformMeasurements().size());

    Map<String, String> metadata = new TreeMap<>(state.metadata());
    metadata.put(Evidence.IDENTITY_METADATA, state.identity());

    return new Evidence(ring,
                        session.sessionId(),
                        nonce,
                        quote.quoteBytes(),
                        quote.signerPublicKeyId(),
                        quote.platformMeasurements(),
                        quote.eventLog(),
                        claimsDigest,
                        bindingHash,
                        metadata);
  }
}
