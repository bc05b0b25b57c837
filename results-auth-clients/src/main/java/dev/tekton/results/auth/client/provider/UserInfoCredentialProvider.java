// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.provider;

import dev.tekton.results.auth.client.AuthorityClientConfig;
import dev.tekton.results.auth.client.provider.BuiltInCredentialProviders.CredentialProviders;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;

public class UserInfoCredentialProvider implements CredentialProvider {

  private String userInfo;

  @Override
  public String providerName() {
    return CredentialProviders.USER_INFO.name();
  }

  @Override
  public void configure(Map<String, ?> configs) {
    userInfo = (String) configs.get(AuthorityClientConfig.BASIC_AUTH_USER_INFO_PROP);
    if (userInfo != null && !userInfo.isEmpty()) {
      return;
    }

    throw new ConfigException(AuthorityClientConfig.BASIC_AUTH_USER_INFO_PROP + " must be provided when "
        + AuthorityClientConfig.CREDENTIALS_PROVIDER_PROP + " is set to " + CredentialProviders.USER_INFO.name());
  }

  public String userInfo() {
    return userInfo;
  }

  @Override
  public String authorizationHeader() {
    return "Basic " + Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
  }
}
