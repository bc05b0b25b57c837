// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.provider;

import org.apache.kafka.common.Configurable;

/**
 * Interface used by providers of the credentials sent to the API server
 */
public interface CredentialProvider extends Configurable {

  /**
   * Returns the name of this provider.
   * @return provider name
   */
  String providerName();

  /**
   * Returns the value of the HTTP Authorization header, e.g. "Bearer token".
   * @return header value or null if requests are sent without credentials
   */
  String authorizationHeader();
}
