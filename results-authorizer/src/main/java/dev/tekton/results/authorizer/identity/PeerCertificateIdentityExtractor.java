// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.errors.UnauthenticatedCallException;
import dev.tekton.results.authorizer.identity.BuiltInIdentityExtractors.IdentityExtractors;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import org.apache.kafka.common.utils.Time;

/**
 * Extracts the caller identity from the TLS client certificate, following the Kubernetes
 * convention: the subject common name is the user and each organization is a group.
 */
public class PeerCertificateIdentityExtractor implements IdentityExtractor {

  private final Time time;

  public PeerCertificateIdentityExtractor(Time time) {
    this.time = time;
  }

  @Override
  public String extractorName() {
    return IdentityExtractors.PEER_CERTIFICATE.name();
  }

  @Override
  public Optional<CallIdentity> extract(TransportContext context) {
    List<X509Certificate> chain = context.peerCertificates();
    if (chain == null || chain.isEmpty())
      return Optional.empty();

    X509Certificate leaf = chain.get(0);
    try {
      leaf.checkValidity(new Date(time.milliseconds()));
    } catch (CertificateExpiredException e) {
      throw new UnauthenticatedCallException("Peer certificate has expired", e);
    } catch (CertificateNotYetValidException e) {
      throw new UnauthenticatedCallException("Peer certificate is not yet valid", e);
    }

    String commonName = null;
    Set<String> organizations = new LinkedHashSet<>();
    try {
      LdapName subject = new LdapName(leaf.getSubjectX500Principal().getName());
      for (Rdn rdn : subject.getRdns()) {
        if ("CN".equalsIgnoreCase(rdn.getType()))
          commonName = rdn.getValue().toString();
        else if ("O".equalsIgnoreCase(rdn.getType()))
          organizations.add(rdn.getValue().toString());
      }
    } catch (InvalidNameException e) {
      throw new UnauthenticatedCallException("Peer certificate has a malformed subject", e);
    }
    if (commonName == null || commonName.isEmpty())
      throw new UnauthenticatedCallException("Peer certificate subject has no common name");

    return Optional.of(new CallIdentity(commonName, organizations, Collections.emptyMap()));
  }
}
