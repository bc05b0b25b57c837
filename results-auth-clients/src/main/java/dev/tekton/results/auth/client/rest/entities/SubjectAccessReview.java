// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.utils.JsonMapper;

/**
 * Kubernetes `authorization.k8s.io/v1` SubjectAccessReview. Requests carry the spec,
 * responses carry the spec and the status.
 */
public class SubjectAccessReview {

  public static final String API_VERSION = "authorization.k8s.io/v1";
  public static final String KIND = "SubjectAccessReview";

  private final String apiVersion;
  private final String kind;
  private final SubjectAccessReviewSpec spec;
  private final SubjectAccessReviewStatus status;

  @JsonCreator
  public SubjectAccessReview(@JsonProperty("apiVersion") String apiVersion,
                             @JsonProperty("kind") String kind,
                             @JsonProperty("spec") SubjectAccessReviewSpec spec,
                             @JsonProperty("status") SubjectAccessReviewStatus status) {
    this.apiVersion = apiVersion;
    this.kind = kind;
    this.spec = spec;
    this.status = status;
  }

  public static SubjectAccessReview request(CallIdentity identity, AuthorizationTuple tuple) {
    return new SubjectAccessReview(API_VERSION, KIND, SubjectAccessReviewSpec.of(identity, tuple), null);
  }

  @JsonProperty
  public String apiVersion() {
    return apiVersion;
  }

  @JsonProperty
  public String kind() {
    return kind;
  }

  @JsonProperty
  public SubjectAccessReviewSpec spec() {
    return spec;
  }

  @JsonProperty
  public SubjectAccessReviewStatus status() {
    return status;
  }

  public String toJson() {
    return JsonMapper.toJson(this);
  }
}
