package org.moxie.sovereign.evidence;

import org.junit.jupiter.api.Test;
import org.moxie.sovereign.signing.DelegatedSigner;
import org.moxie.sovereign.signing.PublicKeys;

import java.nio.charset.StandardCharsets;
import java.security.Signature;

import static org.junit.jupiter.api.Assertions.*;

class AppKeyQuoteSourceTest {

  @Test
  void quote_signsQualifyingDataWithAppKey() throws Exception {
    DelegatedSigner   signer = EvidenceFixtures.signer();
    AppKeyQuoteSource source = new AppKeyQuoteSource(signer);
    byte[]            data   = EvidenceDigests.sha256("binding".getBytes(StandardCharsets.UTF_8));

    Quote quote = source.quote(Ring.WORKLOAD, data);

    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(signer.getPublic());
    verifier.update(data);

    assertTrue(verifier.verify(quote.quoteBytes()));
    assertEquals(PublicKeys.fingerprint(signer.getPublic()), quote.signerPublicKeyId());
    assertTrue(quote.platformMeasurements().isEmpty());
  }

  @Test
  void quote_differentQualifyingData_doesNotVerify() throws Exception {
    DelegatedSigner   signer = EvidenceFixtures.signer();
    AppKeyQuoteSource source = new AppKeyQuoteSource(signer);

    Quote quote = source.quote(Ring.WORKLOAD, EvidenceDigests.sha256("session-a".getBytes(StandardCharsets.UTF_8)));

    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(signer.getPublic());
    verifier.update(EvidenceDigests.sha256("session-b".getBytes(StandardCharsets.UTF_8)));

    assertFalse(verifier.verify(quote.quoteBytes()));
  }
}
