package org.moxie.sovereign.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Issues and consumes challenges. The session table is the only mutable state shared
 * between concurrent attestation attempts; each entry's consumed flag flips through a
 * compare-and-set so exactly one consumer wins, while distinct sessions never contend.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  static final int NONCE_BYTES = 32;

  private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
  private final SecureRandom       random   = new SecureRandom();
  private final Duration           ttl;
  private final Clock              clock;

  private record Entry(Session issued, AtomicBoolean consumed) {
    Session snapshot() {
      Session s = issued;
      return new Session(s.sessionId(), s.nonceHost(), s.nonceVm(), s.issuedAt(), s.expiresAt(), consumed.get());
    }
  }

  public SessionManager(Duration ttl) {
    this(ttl, Clock.systemUTC());
  }

  public SessionManager(Duration ttl, Clock clock) {
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Session TTL must be positive: " + ttl);
    }
    this.ttl   = ttl;
    this.clock = clock;
  }

  /**
   * Create a session with fresh host and VM nonces.
   */
  public Session issueChallenge() {
    Instant now = clock.instant();
    purgeExpired(now);

    Session session = new Session(UUID.randomUUID().toString(), newNonce(), newNonce(), now, now.plus(ttl), false);
    sessions.put(session.sessionId(), new Entry(session, new AtomicBoolean(false)));

    log.debug("Issued challenge {} expiring at {}", session.sessionId(), session.expiresAt());
    return session;
  }

  /**
   * Look up a session that is still usable: present, unconsumed and unexpired.
   *
   * @throws SessionException otherwise
   */
  public Session lookup(String sessionId) throws SessionException {
    Entry entry = requireLive(sessionId, clock.instant());

    if (entry.consumed().get()) {
      throw new SessionException(SessionException.Reason.ALREADY_CONSUMED, sessionId);
    }

    return entry.snapshot();
  }

  /**
   * Atomically mark a session consumed. Of any number of concurrent callers on the same
   * session, exactly one returns normally.
   *
   * @return The consumed session
   * @throws SessionException if the session is unknown, expired or already consumed
   */
  public Session consume(String sessionId) throws SessionException {
    Entry entry = requireLive(sessionId, clock.instant());

    if (!entry.consumed().compareAndSet(false, true)) {
      log.warn("Replay attempt on consumed session {}", sessionId);
      throw new SessionException(SessionException.Reason.ALREADY_CONSUMED, sessionId);
    }

    log.debug("Consumed session {}", sessionId);
    return entry.snapshot();
  }

  /**
   * Drop sessions past their expiry. Later lookups report them as not found.
   *
   * @return Number of sessions removed
   */
  public int purgeExpired() {
    return purgeExpired(clock.instant());
  }

  public int size() {
    return sessions.size();
  }

  private Entry requireLive(String sessionId, Instant now) throws SessionException {
    Entry entry = sessionId == null ? null : sessions.get(sessionId);

    if (entry == null) {
      throw new SessionException(SessionException.Reason.NOT_FOUND, sessionId);
    }

    if (entry.issued().isExpiredAt(now)) {
      throw new SessionException(SessionException.Reason.EXPIRED, sessionId);
    }

    return entry;
  }

  private int purgeExpired(Instant now) {
    int removed = 0;

    for (Map.Entry<String, Entry> entry : sessions.entrySet()) {
      if (entry.getValue().issued().isExpiredAt(now) && sessions.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }

    if (removed > 0) {
      log.debug("Purged {} expired sessions", removed);
    }

    return removed;
  }

  private String newNonce() {
    byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    return HexFormat.of().formatHex(nonce);
  }
}
