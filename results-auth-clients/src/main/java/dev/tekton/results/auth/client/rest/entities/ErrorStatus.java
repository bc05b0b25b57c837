// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kubernetes `Status` object returned with failed API requests.
 */
public class ErrorStatus {

  private final int code;
  private final String reason;
  private final String message;

  public ErrorStatus(@JsonProperty("code") int code,
                     @JsonProperty("reason") String reason,
                     @JsonProperty("message") String message) {
    this.code = code;
    this.reason = reason;
    this.message = message;
  }

  @JsonProperty
  public int code() {
    return code;
  }

  @JsonProperty
  public String reason() {
    return reason;
  }

  @JsonProperty
  public String message() {
    return message;
  }
}
