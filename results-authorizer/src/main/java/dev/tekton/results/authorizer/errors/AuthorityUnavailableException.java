// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.errors;

import org.apache.kafka.common.errors.ApiException;

/**
 * Thrown when the RBAC authority could not be consulted, because it was unreachable,
 * timed out or answered with an error. Always results in a denial.
 */
public class AuthorityUnavailableException extends ApiException {

  public AuthorityUnavailableException(String message) {
    super(message);
  }

  public AuthorityUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
