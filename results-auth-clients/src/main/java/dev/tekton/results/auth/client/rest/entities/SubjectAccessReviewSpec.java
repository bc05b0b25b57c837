// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.CallIdentity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class SubjectAccessReviewSpec {

  private final String user;
  private final List<String> groups;
  private final Map<String, List<String>> extra;
  private final ResourceAttributes resourceAttributes;

  @JsonCreator
  public SubjectAccessReviewSpec(@JsonProperty("user") String user,
                                 @JsonProperty("groups") List<String> groups,
                                 @JsonProperty("extra") Map<String, List<String>> extra,
                                 @JsonProperty("resourceAttributes") ResourceAttributes resourceAttributes) {
    this.user = user;
    this.groups = groups == null ? Collections.emptyList() : groups;
    this.extra = extra == null ? Collections.emptyMap() : extra;
    this.resourceAttributes = resourceAttributes;
  }

  public static SubjectAccessReviewSpec of(CallIdentity identity, AuthorizationTuple tuple) {
    Map<String, List<String>> extra = new TreeMap<>();
    identity.extra().forEach((key, value) -> extra.put(key, Collections.singletonList(value)));
    return new SubjectAccessReviewSpec(identity.name(),
        new ArrayList<>(identity.groups()),
        extra,
        ResourceAttributes.of(tuple));
  }

  @JsonProperty
  public String user() {
    return user;
  }

  @JsonProperty
  public List<String> groups() {
    return groups;
  }

  @JsonProperty
  public Map<String, List<String>> extra() {
    return extra;
  }

  @JsonProperty
  public ResourceAttributes resourceAttributes() {
    return resourceAttributes;
  }
}
