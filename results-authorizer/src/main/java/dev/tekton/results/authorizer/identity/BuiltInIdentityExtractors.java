// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.apache.kafka.common.utils.Utils;

public class BuiltInIdentityExtractors {

  public enum IdentityExtractors {
    BEARER_TOKEN,      // JWT bearer token in the authorization header
    PEER_CERTIFICATE   // TLS client certificate
  }

  public static Set<String> builtInIdentityExtractors() {
    return Utils.mkSet(IdentityExtractors.values()).stream()
        .map(IdentityExtractors::name).collect(Collectors.toSet());
  }

  /**
   * Creates a composite extractor from the configured extractor names, preserving order.
   *
   * @param names Names of built-in extractors
   * @param tokenVerificationKey Key used to verify bearer tokens, or null to skip verification
   * @param time Clock used for expiry checks
   */
  public static IdentityExtractor create(List<String> names, PublicKey tokenVerificationKey, Time time) {
    if (names.isEmpty())
      throw new ConfigException("No identity extractors specified");

    List<IdentityExtractor> extractors = new ArrayList<>(names.size());
    for (String name : names) {
      if (name.equals(IdentityExtractors.BEARER_TOKEN.name()))
        extractors.add(new BearerTokenIdentityExtractor(tokenVerificationKey, time));
      else if (name.equals(IdentityExtractors.PEER_CERTIFICATE.name()))
        extractors.add(new PeerCertificateIdentityExtractor(time));
      else
        throw new ConfigException("Identity extractor not found for " + name
            + ", supported extractors are " + builtInIdentityExtractors());
    }
    return extractors.size() == 1 ? extractors.get(0) : new CompositeIdentityExtractor(extractors);
  }
}
