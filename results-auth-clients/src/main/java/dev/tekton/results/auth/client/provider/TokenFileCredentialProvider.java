// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.provider;

import dev.tekton.results.auth.client.AuthorityClientConfig;
import dev.tekton.results.auth.client.provider.BuiltInCredentialProviders.CredentialProviders;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;

/**
 * Sends the bearer token stored in a file. Kubernetes rotates projected service account
 * tokens in place, so the file is read again for every request.
 */
public class TokenFileCredentialProvider implements CredentialProvider {

  private String tokenPath;

  @Override
  public String providerName() {
    return CredentialProviders.TOKEN_FILE.name();
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object path = configs.get(AuthorityClientConfig.TOKEN_PATH_PROP);
    tokenPath = path == null ? AuthorityClientConfig.TOKEN_PATH_DEFAULT : path.toString();
    if (!Files.isReadable(Paths.get(tokenPath)))
      throw new ConfigException(AuthorityClientConfig.TOKEN_PATH_PROP, tokenPath,
          "Token file is not readable, it is required when " + AuthorityClientConfig.CREDENTIALS_PROVIDER_PROP
              + " is set to " + CredentialProviders.TOKEN_FILE.name());
  }

  @Override
  public String authorizationHeader() {
    String token;
    try {
      token = Utils.readFileAsString(tokenPath).trim();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read token file " + tokenPath, e);
    }
    return token.isEmpty() ? null : "Bearer " + token;
  }
}
