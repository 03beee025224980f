package com.example.auth.service;

import com.example.auth.config.AuthTokenProperties;
import com.example.auth.model.IssuedToken;
import com.example.auth.model.TokenClaims;
import com.example.auth.model.TokenKind;
import com.example.auth.model.TokenPair;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.Set;
import javax.crypto.SecretKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HMAC-signed session tokens.
 *
 * <p>The codec holds no mutable state: the signing key and TTLs come from {@link
 * AuthTokenProperties} once at construction, and time comes from the injected {@link Clock}.
 * Every verification failure other than expiry is reported as {@link
 * TokenVerificationException.Reason#INVALID_TOKEN} so callers cannot tell a forged token from a
 * garbled or misclassified one.
 */
@Service
public class TokenCodec {

  private static final Logger logger = LoggerFactory.getLogger(TokenCodec.class);

  static final String CLAIM_USER_ID = "user_id";
  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_TYPE = "type";

  private static final Set<String> HMAC_ALGORITHMS = Set.of("HS256", "HS384", "HS512");
  // HS256 / HS384 / HS512 の MAC 長 (バイト)
  private static final Set<Integer> HMAC_SIGNATURE_LENGTHS = Set.of(32, 48, 64);
  private static final Base64.Encoder SIGNATURE_ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final SecretKey signingKey;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final String issuer;
  private final Clock clock;
  private final JwtParser parser;

  public TokenCodec(AuthTokenProperties properties, Clock clock) {
    if (properties.usesDevelopmentSecret()) {
      logger.warn(
          "auth.token.secret is not set; using the built-in development secret."
              + " Set JWT_SECRET before deploying.");
    }
    this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    this.accessTtl = properties.accessTtl();
    this.refreshTtl = properties.refreshTtl();
    this.issuer = properties.issuer();
    this.clock = clock;
    this.parser =
        Jwts.parser()
            .keyLocator(new HmacOnlyKeyLocator(signingKey))
            .requireIssuer(issuer)
            .clock(() -> Date.from(clock.instant()))
            .build();
  }

  public IssuedToken issue(
      String userId, String email, String role, TokenKind kind, Duration ttl) {
    // exp/iat は秒精度で直列化されるため、返却値も秒に揃える
    final Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    final Instant expiresAt = issuedAt.plus(ttl);
    try {
      final String token =
          Jwts.builder()
              .issuer(issuer)
              .subject(userId)
              .issuedAt(Date.from(issuedAt))
              .expiration(Date.from(expiresAt))
              .claim(CLAIM_USER_ID, userId)
              .claim(CLAIM_EMAIL, email)
              .claim(CLAIM_ROLE, role)
              .claim(CLAIM_TYPE, kind.claimValue())
              .signWith(signingKey, Jwts.SIG.HS256)
              .compact();
      return new IssuedToken(token, expiresAt);
    } catch (JwtException ex) {
      throw new IllegalStateException("failed to sign session token", ex);
    }
  }

  public TokenPair issuePair(String userId, String email, String role) {
    final IssuedToken access = issue(userId, email, role, TokenKind.ACCESS, accessTtl);
    final IssuedToken refresh = issue(userId, email, role, TokenKind.REFRESH, refreshTtl);
    return new TokenPair(access.token(), refresh.token(), access.expiresAt());
  }

  public TokenClaims verify(String token) {
    if (token == null || token.isBlank()) {
      throw TokenVerificationException.invalid();
    }
    requireCanonicalSignature(token);
    final Claims claims;
    try {
      claims = parser.parseSignedClaims(token).getPayload();
    } catch (ExpiredJwtException ex) {
      throw TokenVerificationException.expired(ex);
    } catch (JwtException | IllegalArgumentException ex) {
      logger.debug("session token rejected: {}", ex.getClass().getSimpleName());
      throw TokenVerificationException.invalid(ex);
    }
    return toTokenClaims(claims);
  }

  public TokenClaims verifyAccess(String token) {
    return verifyKind(token, TokenKind.ACCESS);
  }

  public TokenClaims verifyRefresh(String token) {
    return verifyKind(token, TokenKind.REFRESH);
  }

  /**
   * Exchanges a refresh token for a new pair. The presented refresh token is not invalidated and
   * remains usable until its own expiry.
   */
  public TokenPair refresh(String refreshToken) {
    final TokenClaims claims = verifyRefresh(refreshToken);
    return issuePair(claims.userId(), claims.email(), claims.role());
  }

  /**
   * Rejects signature segments that are not the canonical unpadded base64url form of an HMAC.
   *
   * <p>The last character of a 43-character HS256 signature carries two unused bits, and the
   * parser ignores them when decoding. Without this check several distinct strings would verify
   * as the same signature.
   */
  private static void requireCanonicalSignature(String token) {
    final String signature = token.substring(token.lastIndexOf('.') + 1);
    final byte[] decoded;
    try {
      decoded = Base64.getUrlDecoder().decode(signature);
    } catch (IllegalArgumentException ex) {
      throw TokenVerificationException.invalid(ex);
    }
    if (!HMAC_SIGNATURE_LENGTHS.contains(decoded.length)
        || !SIGNATURE_ENCODER.encodeToString(decoded).equals(signature)) {
      logger.debug("session token rejected: non-canonical signature segment");
      throw TokenVerificationException.invalid();
    }
  }

  private TokenClaims verifyKind(String token, TokenKind expected) {
    final TokenClaims claims = verify(token);
    if (claims.kind() != expected) {
      logger.debug("session token rejected: kind mismatch");
      throw TokenVerificationException.invalid();
    }
    return claims;
  }

  private TokenClaims toTokenClaims(Claims claims) {
    try {
      final String userId = claims.get(CLAIM_USER_ID, String.class);
      final String subject = claims.getSubject();
      if (userId == null || userId.isBlank() || !userId.equals(subject)) {
        throw TokenVerificationException.invalid();
      }
      final TokenKind kind =
          TokenKind.fromClaimValue(claims.get(CLAIM_TYPE, String.class))
              .orElseThrow(TokenVerificationException::invalid);
      final Date issuedAt = claims.getIssuedAt();
      final Date expiresAt = claims.getExpiration();
      if (issuedAt == null || expiresAt == null) {
        throw TokenVerificationException.invalid();
      }
      return new TokenClaims(
          userId,
          claims.get(CLAIM_EMAIL, String.class),
          claims.get(CLAIM_ROLE, String.class),
          kind,
          claims.getIssuer(),
          subject,
          issuedAt.toInstant(),
          expiresAt.toInstant());
    } catch (JwtException ex) {
      throw TokenVerificationException.invalid(ex);
    }
  }

  /** Resolves the verification key only for HMAC-signed tokens; any other algorithm is refused. */
  private static final class HmacOnlyKeyLocator extends LocatorAdapter<Key> {

    private final SecretKey key;

    private HmacOnlyKeyLocator(SecretKey key) {
      this.key = key;
    }

    @Override
    protected Key locate(JwsHeader header) {
      final String algorithm = header.getAlgorithm();
      if (algorithm == null || !HMAC_ALGORITHMS.contains(algorithm)) {
        throw new UnsupportedJwtException("unexpected signing algorithm");
      }
      return key;
    }
  }
}
