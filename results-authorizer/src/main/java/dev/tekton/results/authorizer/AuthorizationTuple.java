// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Normalized description of what a call is attempting to do: a verb on a resource of
 * a resource type within a namespace. Resource name is optional, collection operations
 * like list and create don't target a named resource.
 */
public class AuthorizationTuple {

  private final String namespace;
  private final ResourceType resourceType;
  private final Verb verb;
  private final String resourceName;

  public AuthorizationTuple(String namespace, ResourceType resourceType, Verb verb) {
    this(namespace, resourceType, verb, null);
  }

  public AuthorizationTuple(String namespace,
                            ResourceType resourceType,
                            Verb verb,
                            String resourceName) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    this.verb = Objects.requireNonNull(verb, "verb");
    this.resourceName = resourceName == null || resourceName.isEmpty() ? null : resourceName;
  }

  public String namespace() {
    return namespace;
  }

  public ResourceType resourceType() {
    return resourceType;
  }

  public Verb verb() {
    return verb;
  }

  public Optional<String> resourceName() {
    return Optional.ofNullable(resourceName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AuthorizationTuple)) {
      return false;
    }

    AuthorizationTuple that = (AuthorizationTuple) o;
    return Objects.equals(this.namespace, that.namespace) &&
        Objects.equals(this.resourceType, that.resourceType) &&
        Objects.equals(this.verb, that.verb) &&
        Objects.equals(this.resourceName, that.resourceName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, resourceType, verb, resourceName);
  }

  @Override
  public String toString() {
    return String.format("%s:%s/%s:%s", verb, namespace, resourceType,
        resourceName == null ? "*" : resourceName);
  }
}
