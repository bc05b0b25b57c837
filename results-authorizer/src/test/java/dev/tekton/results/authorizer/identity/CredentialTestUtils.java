// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Date;
import java.util.List;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;

/**
 * Mints bearer tokens and client certificates for tests.
 */
public class CredentialTestUtils {

  public static KeyPair generateKeyPair() throws Exception {
    KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
    keyGen.initialize(2048);
    return keyGen.genKeyPair();
  }

  /**
   * Creates a signed JWS token.
   *
   * @param key Signing key
   * @param subject Subject claim, omitted if null
   * @param expiresAtMs Expiration time, omitted if null
   * @param groups Groups claim, omitted if null
   */
  public static String token(PrivateKey key, String subject, Long expiresAtMs, List<String> groups) throws Exception {
    JwtClaims claims = new JwtClaims();
    claims.setIssuer("kubernetes/serviceaccount");
    claims.setGeneratedJwtId();
    claims.setIssuedAtToNow();
    if (expiresAtMs != null)
      claims.setExpirationTime(NumericDate.fromMilliseconds(expiresAtMs));
    if (subject != null)
      claims.setSubject(subject);
    if (groups != null)
      claims.setStringListClaim("groups", groups);

    JsonWebSignature jws = new JsonWebSignature();
    jws.setPayload(claims.toJson());
    jws.setKey(key);
    jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
    return jws.getCompactSerialization();
  }

  public static X509Certificate certificate(String subject, long notBeforeMs, long notAfterMs) throws Exception {
    KeyPair keyPair = generateKeyPair();
    X500Name name = new X500Name(subject);
    JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        name,
        BigInteger.valueOf(System.nanoTime()),
        new Date(notBeforeMs),
        new Date(notAfterMs),
        name,
        keyPair.getPublic());
    return new JcaX509CertificateConverter().getCertificate(
        builder.build(new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate())));
  }
}
