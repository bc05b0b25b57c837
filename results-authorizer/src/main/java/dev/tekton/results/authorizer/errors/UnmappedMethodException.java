// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.errors;

import org.apache.kafka.common.errors.ApiException;

public class UnmappedMethodException extends ApiException {

  public UnmappedMethodException(String message) {
    super(message);
  }
}
