// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.provider;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;

public class BuiltInCredentialProviders {

  public enum CredentialProviders {
    TOKEN_FILE, // Bearer token read from a file, e.g. the service account token
    USER_INFO,  // HTTP basic authentication
    NONE,       // Requests are sent without credentials
  }

  public static Set<String> builtInCredentialProviders() {
    return Utils.mkSet(CredentialProviders.values()).stream()
        .map(CredentialProviders::name).collect(Collectors.toSet());
  }

  public static CredentialProvider loadCredentialProvider(String name) {
    if (name.equals(CredentialProviders.NONE.name()))
      return new NoCredentialProvider();

    CredentialProvider credentialProvider = null;
    ServiceLoader<CredentialProvider> providers = ServiceLoader.load(CredentialProvider.class);
    for (CredentialProvider provider : providers) {
      if (provider.providerName().equals(name)) {
        credentialProvider = provider;
        break;
      }
    }
    if (credentialProvider == null)
      throw new ConfigException("CredentialProvider not found for " + name);
    return credentialProvider;
  }

  private static class NoCredentialProvider implements CredentialProvider {

    @Override
    public void configure(Map<String, ?> configs) {
    }

    @Override
    public String providerName() {
      return CredentialProviders.NONE.name();
    }

    @Override
    public String authorizationHeader() {
      return null;
    }
  }
}
