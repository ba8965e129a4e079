package org.moxie.sovereign.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.moxie.sovereign.evidence.Ring;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

  private MutableClock   clock;
  private SessionManager manager;

  @BeforeEach
  void setUp() {
    clock   = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    manager = new SessionManager(Duration.ofMinutes(5), clock);
  }

  @Test
  void issueChallenge_returnsFreshDistinctNonces() {
    Session first  = manager.issueChallenge();
    Session second = manager.issueChallenge();

    assertNotEquals(first.sessionId(), second.sessionId());
    assertNotEquals(first.nonceHost(), first.nonceVm());
    assertNotEquals(first.nonceHost(), second.nonceHost());
    assertEquals(SessionManager.NONCE_BYTES * 2, first.nonceHost().length());
    assertEquals(clock.instant().plus(Duration.ofMinutes(5)), first.expiresAt());
    assertFalse(first.consumed());
  }

  @Test
  void nonceFor_workloadSharesVmNonce() {
    Session session = manager.issueChallenge();

    assertEquals(session.nonceHost(), session.nonceFor(Ring.HOST));
    assertEquals(session.nonceVm(), session.nonceFor(Ring.VM));
    assertEquals(session.nonceVm(), session.nonceFor(Ring.WORKLOAD));
  }

  @Test
  void consume_firstCallSucceeds_secondIsRejected() throws SessionException {
    Session session  = manager.issueChallenge();
    Session consumed = manager.consume(session.sessionId());

    assertTrue(consumed.consumed());

    SessionException e = assertThrows(SessionException.class, () -> manager.consume(session.sessionId()));
    assertEquals(SessionException.Reason.ALREADY_CONSUMED, e.getReason());
  }

  @Test
  void lookup_consumedSession_isRejected() throws SessionException {
    Session session = manager.issueChallenge();
    manager.consume(session.sessionId());

    SessionException e = assertThrows(SessionException.class, () -> manager.lookup(session.sessionId()));
    assertEquals(SessionException.Reason.ALREADY_CONSUMED, e.getReason());
  }

  @Test
  void consume_unknownSession_isNotFound() {
    SessionException e = assertThrows(SessionException.class, () -> manager.consume("nope"));

    assertEquals(SessionException.Reason.NOT_FOUND, e.getReason());
    assertEquals("nope", e.getSessionId());
  }

  @Test
  void consume_afterExpiry_isRejected() {
    Session session = manager.issueChallenge();

    clock.advance(Duration.ofMinutes(5));

    SessionException e = assertThrows(SessionException.class, () -> manager.consume(session.sessionId()));
    assertEquals(SessionException.Reason.EXPIRED, e.getReason());
  }

  @Test
  void lookup_afterExpiry_isRejectedEvenIfConsumed() throws SessionException {
    Session session = manager.issueChallenge();
    manager.consume(session.sessionId());

    clock.advance(Duration.ofMinutes(6));

    SessionException e = assertThrows(SessionException.class, () -> manager.lookup(session.sessionId()));
    assertEquals(SessionException.Reason.EXPIRED, e.getReason());
  }

  @Test
  void lookup_justBeforeExpiry_succeeds() throws SessionException {
    Session session = manager.issueChallenge();

    clock.advance(Duration.ofMinutes(5).minusMillis(1));

    assertEquals(session.sessionId(), manager.lookup(session.sessionId()).sessionId());
  }

  @Test
  void purgeExpired_removesOnlyExpiredSessions() {
    manager.issueChallenge();
    clock.advance(Duration.ofMinutes(3));
    Session live = manager.issueChallenge();
    clock.advance(Duration.ofMinutes(3));

    assertEquals(1, manager.purgeExpired());
    assertEquals(1, manager.size());
    assertDoesNotThrow(() -> manager.lookup(live.sessionId()));
  }

  @Test
  void issueChallenge_purgesExpiredSessions() {
    manager.issueChallenge();
    clock.advance(Duration.ofMinutes(10));

    manager.issueChallenge();

    assertEquals(1, manager.size());
  }

  @Test
  void consume_concurrentCallers_exactlyOneWins() throws Exception {
    int             callers  = 16;
    Session         session  = manager.issueChallenge();
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    CountDownLatch  start    = new CountDownLatch(1);

    try {
      List<Future<Boolean>> results = new ArrayList<>();

      for (int i = 0; i < callers; i++) {
        results.add(executor.submit(() -> {
          start.await();
          try {
            manager.consume(session.sessionId());
            return true;
          } catch (SessionException e) {
            assertEquals(SessionException.Reason.ALREADY_CONSUMED, e.getReason());
            return false;
          }
        }));
      }

      start.countDown();

      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) winners++;
      }

      assertEquals(1, winners);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void constructor_nonPositiveTtl_throws() {
    assertThrows(IllegalArgumentException.class, () -> new SessionManager(Duration.ZERO, clock));
  }

  private static class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
