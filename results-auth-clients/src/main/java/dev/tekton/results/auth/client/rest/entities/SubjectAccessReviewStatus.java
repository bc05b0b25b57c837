// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision of the API server. `denied` may only be true if `allowed` is false.
 */
public class SubjectAccessReviewStatus {

  private final boolean allowed;
  private final boolean denied;
  private final String reason;
  private final String evaluationError;

  @JsonCreator
  public SubjectAccessReviewStatus(@JsonProperty("allowed") boolean allowed,
                                   @JsonProperty("denied") boolean denied,
                                   @JsonProperty("reason") String reason,
                                   @JsonProperty("evaluationError") String evaluationError) {
    this.allowed = allowed;
    this.denied = denied;
    this.reason = reason;
    this.evaluationError = evaluationError;
  }

  @JsonProperty
  public boolean allowed() {
    return allowed;
  }

  @JsonProperty
  public boolean denied() {
    return denied;
  }

  @JsonProperty
  public String reason() {
    return reason;
  }

  @JsonProperty
  public String evaluationError() {
    return evaluationError;
  }
}
