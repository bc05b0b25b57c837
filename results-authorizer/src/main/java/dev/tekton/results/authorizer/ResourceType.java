// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

/**
 * Resource types of the results API group. Each resource type corresponds to a
 * Kubernetes resource that RBAC roles may grant verbs on.
 */
public enum ResourceType {
  RESULTS("results"),
  RECORDS("records");

  public static final String API_GROUP = "results.tekton.dev";

  private final String resource;

  ResourceType(String resource) {
    this.resource = resource;
  }

  public String resource() {
    return resource;
  }

  public String group() {
    return API_GROUP;
  }

  @Override
  public String toString() {
    return resource;
  }
}
