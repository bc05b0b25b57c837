// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.errors.UnauthenticatedCallException;
import dev.tekton.results.authorizer.identity.BuiltInIdentityExtractors.IdentityExtractors;
import java.security.PublicKey;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.kafka.common.utils.Time;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the caller identity from a JWT bearer token in the `authorization` header.
 *
 * <p>The token must have a subject `sub` claim and an expiration time `exp` claim. Group
 * memberships are read from the `groups` claim. Kubernetes service account tokens don't
 * carry groups, for subjects of the form `system:serviceaccount:namespace:name` the groups
 * Kubernetes assigns to service accounts are derived instead.
 *
 * <p>If a verification key is provided, the token signature is verified with it. Otherwise
 * the signature is assumed to have been verified by the transport.
 */
public class BearerTokenIdentityExtractor implements IdentityExtractor {
  private static final Logger log = LoggerFactory.getLogger(BearerTokenIdentityExtractor.class);

  public static final String AUTHORIZATION_HEADER = "authorization";
  public static final String GROUPS_CLAIM = "groups";

  static final String SERVICE_ACCOUNT_PREFIX = "system:serviceaccount:";
  static final String SERVICE_ACCOUNTS_GROUP = "system:serviceaccounts";
  static final String AUTHENTICATED_GROUP = "system:authenticated";

  private static final String BEARER_SCHEME = "bearer ";

  private final PublicKey verificationKey;
  private final Time time;

  public BearerTokenIdentityExtractor(Time time) {
    this(null, time);
  }

  public BearerTokenIdentityExtractor(PublicKey verificationKey, Time time) {
    this.verificationKey = verificationKey;
    this.time = time;
  }

  @Override
  public String extractorName() {
    return IdentityExtractors.BEARER_TOKEN.name();
  }

  @Override
  public Optional<CallIdentity> extract(TransportContext context) {
    String header = context.header(AUTHORIZATION_HEADER);
    if (header == null)
      return Optional.empty();

    if (header.length() <= BEARER_SCHEME.length()
        || !header.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length()))
      throw new UnauthenticatedCallException("Authorization header is not a bearer token");

    String token = header.substring(BEARER_SCHEME.length()).trim();
    if (token.isEmpty())
      throw new UnauthenticatedCallException("Bearer token is empty");

    JwtClaims claims = processToken(token);
    try {
      String subject = claims.getSubject();
      if (subject == null || subject.trim().isEmpty())
        throw new UnauthenticatedCallException("Bearer token has an empty subject");
      Map<String, String> extra = new HashMap<>();
      if (claims.getIssuer() != null)
        extra.put("iss", claims.getIssuer());
      if (claims.getJwtId() != null)
        extra.put("jti", claims.getJwtId());
      return Optional.of(new CallIdentity(subject, groups(subject, claims), extra));
    } catch (MalformedClaimException e) {
      throw new UnauthenticatedCallException("Bearer token has malformed claims", e);
    }
  }

  private JwtClaims processToken(String token) {
    JwtConsumerBuilder builder = new JwtConsumerBuilder()
        .setRequireSubject()
        .setRequireExpirationTime()
        .setSkipDefaultAudienceValidation()
        .setEvaluationTime(NumericDate.fromMilliseconds(time.milliseconds()));
    if (verificationKey != null)
      builder.setVerificationKey(verificationKey);
    else
      builder.setSkipSignatureVerification();

    try {
      return builder.build().processToClaims(token);
    } catch (InvalidJwtException e) {
      log.debug("Rejected bearer token: {}", e.getMessage());
      if (e.hasExpired())
        throw new UnauthenticatedCallException("Bearer token has expired", e);
      throw new UnauthenticatedCallException("Bearer token is malformed", e);
    }
  }

  private Set<String> groups(String subject, JwtClaims claims) throws MalformedClaimException {
    Set<String> groups = new LinkedHashSet<>();
    if (claims.hasClaim(GROUPS_CLAIM)) {
      List<String> claimed = claims.getStringListClaimValue(GROUPS_CLAIM);
      for (String group : claimed) {
        if (group == null || group.trim().isEmpty())
          throw new UnauthenticatedCallException("Bearer token has an empty group");
        groups.add(group);
      }
    } else if (subject.startsWith(SERVICE_ACCOUNT_PREFIX)) {
      String[] parts = subject.substring(SERVICE_ACCOUNT_PREFIX.length()).split(":", 2);
      if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty())
        throw new UnauthenticatedCallException("Invalid service account subject " + subject);
      groups.add(SERVICE_ACCOUNTS_GROUP);
      groups.add(SERVICE_ACCOUNTS_GROUP + ":" + parts[0]);
      groups.add(AUTHENTICATED_GROUP);
    }
    return groups;
  }
}
