package org.moxie.sovereign.evidence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.session.SessionManager;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceCollectorTest {

  private Session session;

  @BeforeEach
  void setUp() {
    session = new SessionManager(Duration.ofMinutes(5)).issueChallenge();
  }

  @Test
  void collect_quotesOverBindingHash() throws AttestationException {
    AtomicReference<byte[]> qualifying = new AtomicReference<>();
    QuoteSource             source     = (ring, data) -> {
      qualifying.set(data);
      return new Quote(new byte[] {1}, "ak", null, null);
    };

    MeasuredState state    = MeasuredState.of("vm-image-7", "ima:ok");
    Evidence      evidence = new EvidenceCollector(Map.of(Ring.VM, source)).collect(session, Ring.VM, state);

    byte[] claimsDigest = EvidenceDigests.claimsDigest(Ring.VM, state);

    assertArrayEquals(claimsDigest, evidence.claimsDigest());
    assertArrayEquals(EvidenceDigests.bindingHash(session.sessionId(), session.nonceVm(), claimsDigest), qualifying.get());
    assertArrayEquals(qualifying.get(), evidence.bindingHash());
    assertEquals(session.nonceVm(), evidence.nonce());
    assertEquals(session.sessionId(), evidence.sessionId());
    assertEquals("vm-image-7", evidence.extraMetadata().get(Evidence.IDENTITY_METADATA));
  }

  @Test
  void collect_differentSessions_produceDifferentBindings() throws AttestationException {
    Session other = new SessionManager(Duration.ofMinutes(5)).issueChallenge();

    Evidence first  = EvidenceFixtures.collect(session, Ring.HOST).get(0);
    Evidence second = EvidenceFixtures.collect(other, Ring.HOST).get(0);

    assertArrayEquals(first.claimsDigest(), second.claimsDigest());
    assertFalse(Arrays.equals(first.bindingHash(), second.bindingHash()));
  }

  @Test
  void collect_ringWithoutSource_fails() {
    EvidenceCollector collector = new EvidenceCollector(Map.of());

    assertThrows(AttestationException.class, () -> collector.collect(session, Ring.HOST, MeasuredState.of("x", "y")));
  }

  @Test
  void collect_quoteFailure_propagates() {
    AttestationException failure   = new AttestationException("tpm unavailable");
    EvidenceCollector    collector = new EvidenceCollector(Map.of(Ring.HOST, (ring, data) -> {
      throw failure;
    }));

    assertSame(failure, assertThrows(AttestationException.class,
                                     () -> collector.collect(session, Ring.HOST, MeasuredState.of("x", "y"))));
  }
}
