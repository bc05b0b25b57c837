// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.errors;

import org.apache.kafka.common.errors.AuthenticationException;

/**
 * Thrown when a call carries no credential, or a credential that is malformed or expired.
 */
public class UnauthenticatedCallException extends AuthenticationException {

  public UnauthenticatedCallException(String message) {
    super(message);
  }

  public UnauthenticatedCallException(String message, Throwable cause) {
    super(message, cause);
  }
}
