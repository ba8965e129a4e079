package org.moxie.sovereign.evidence;

import org.moxie.sovereign.signing.DelegatedSigner;
import org.moxie.sovereign.signing.PublicKeys;
import org.moxie.sovereign.signing.SignOptions;
import org.moxie.sovereign.signing.SigningException;

import java.util.List;

/**
 * Quotes for the workload ring: an App Key signature over the qualifying data. The App
 * Key lives in the TPM and is certified by the attestation key, so the signature is
 * hardware rooted even though no PCRs are reported with it.
 */
public class AppKeyQuoteSource implements QuoteSource {

  private final DelegatedSigner signer;

  public AppKeyQuoteSource(DelegatedSigner signer) {
    this.signer = signer;
  }

  @Override
  public Quote quote(Ring ring, byte[] qualifyingData) throws SigningException {
    byte[] signature = signer.sign(EvidenceDigests.sha256(qualifyingData), SignOptions.pkcs1("sha256"));
    return new Quote(signature, PublicKeys.fingerprint(signer.getPublic()), List.of(), new byte[0]);
  }
}
