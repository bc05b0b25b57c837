// (Copyright) [2018 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.utils;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.security.PublicKey;

public class PemUtils {

  private static final Charset US_ASCII = Charset.forName("US-ASCII");

  /**
   * Loads a public key from a PEM stream containing either a bare public key or an
   * X.509 certificate, as used for service account token signing keys.
   */
  public static PublicKey loadPublicKey(InputStream inputStream) throws IOException {
    try (InputStreamReader reader = new InputStreamReader(inputStream, US_ASCII)) {
      PEMParser pemParser = new PEMParser(new BufferedReader(reader));
      Object pemObject = pemParser.readObject();
      if (pemObject == null)
        throw new IOException("No PEM object found");
      SubjectPublicKeyInfo keyInfo = pemObject instanceof X509CertificateHolder
          ? ((X509CertificateHolder) pemObject).getSubjectPublicKeyInfo()
          : SubjectPublicKeyInfo.getInstance(pemObject);
      return new JcaPEMKeyConverter().getPublicKey(keyInfo);
    }
  }
}
