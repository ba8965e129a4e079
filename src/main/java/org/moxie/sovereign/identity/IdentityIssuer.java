package org.moxie.sovereign.identity;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.moxie.sovereign.policy.PolicyResult;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.verifier.AttestedClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an allowed policy verdict into a short-lived credential whose selectors fuse the
 * attested facts with what the node asked for.
 */
public class IdentityIssuer {

  private static final Logger log = LoggerFactory.getLogger(IdentityIssuer.class);

  static final String ISSUER          = "sovereign-identity";
  static final String SELECTOR_PREFIX = "unified_identity:";

  private final Algorithm algorithm;
  private final String    trustDomain;
  private final Duration  ttl;
  private final Clock     clock;

  public IdentityIssuer(Algorithm algorithm, String trustDomain, Duration ttl, Clock clock) {
    if (trustDomain == null || trustDomain.isBlank()) {
      throw new IllegalArgumentException("Trust domain is required");
    }

    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Credential TTL must be positive: " + ttl);
    }

    this.algorithm   = algorithm;
    this.trustDomain = trustDomain;
    this.ttl         = ttl;
    this.clock       = clock;
  }

  public IdentityIssuer(String signingSecret, String trustDomain, Duration ttl) {
    this(Algorithm.HMAC256(signingSecret), trustDomain, ttl, Clock.systemUTC());
  }

  /**
   * @param session Session whose nonces were consumed for this attempt
   * @throws IllegalStateException if the verdict is a denial or the session was not consumed
   */
  public Credential issue(Session session, PolicyResult verdict, IdentityRequest request, AttestedClaims claims) {
    return issue(session, verdict, request, claims, null, null);
  }

  public Credential issue(Session session,
                          PolicyResult verdict,
                          IdentityRequest request,
                          AttestedClaims claims,
                          String appKeyPublic,
                          String workloadCodeHash)
  {
    if (verdict == null || !verdict.allowed()) {
      throw new IllegalStateException("Refusing to issue identity without an allow verdict");
    }

    if (session == null || !session.consumed()) {
      throw new IllegalStateException("Refusing to issue identity for an unconsumed session");
    }

    String      subjectId = subjectId(request.path());
    Set<String> selectors = selectors(claims, request.selectors());
    Instant     issuedAt  = clock.instant();
    Instant     expiresAt = issuedAt.plus(ttl);

    JWTCreator.Builder builder = JWT.create()
                                    .withIssuer(ISSUER)
                                    .withSubject(subjectId)
                                    .withIssuedAt(issuedAt)
                                    .withExpiresAt(expiresAt)
                                    .withClaim("session_id", session.sessionId())
                                    .withClaim("selectors", new ArrayList<>(selectors));

    if (request.parentId() != null) {
      builder.withClaim("parent_id", request.parentId());
    }

    for (Map.Entry<String, Map<String, Object>> block : IdentityClaims.build(subjectId, session, claims, appKeyPublic, workloadCodeHash).entrySet()) {
      builder.withClaim(block.getKey(), block.getValue());
    }

    String token = builder.sign(algorithm);

    log.info("Issued {} (parent={}, expires={})", subjectId, request.parentId(), expiresAt);

    return new Credential(subjectId, ttl, selectors, request.parentId(), issuedAt, expiresAt, token);
  }

  /**
   * Check a token issued by this issuer.
   *
   * @throws com.auth0.jwt.exceptions.JWTVerificationException if the token is invalid or expired
   */
  public DecodedJWT verify(String token) {
    return JWT.require(algorithm)
              .withIssuer(ISSUER)
              .build()
              .verify(token);
  }

  private String subjectId(String path) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("Identity path is required");
    }

    String normalized = path.startsWith("/") ? path : "/" + path;

    return "spiffe://" + trustDomain + normalized;
  }

  static Set<String> selectors(AttestedClaims claims, List<String> requested) {
    Set<String> selectors = new LinkedHashSet<>();

    selectors.add(SELECTOR_PREFIX + "geolocation:" + claims.geolocation());
    selectors.add(SELECTOR_PREFIX + "host_integrity:" + claims.hostIntegrityStatus().wireName());
    claims.gpuMetrics().ifPresent(gpu -> selectors.add(SELECTOR_PREFIX + "gpu_status:" + gpu.status()));

    if (requested != null) {
      selectors.addAll(requested);
    }

    return selectors;
  }
}
