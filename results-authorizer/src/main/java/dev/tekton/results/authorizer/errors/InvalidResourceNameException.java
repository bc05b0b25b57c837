// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.errors;

import org.apache.kafka.common.errors.InvalidRequestException;

public class InvalidResourceNameException extends InvalidRequestException {

  public InvalidResourceNameException(String message) {
    super(message);
  }
}
