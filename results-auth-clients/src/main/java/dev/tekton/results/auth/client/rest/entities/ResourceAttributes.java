// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.entities;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.tekton.results.authorizer.AuthorizationTuple;
import java.util.Objects;

/**
 * Resource a subject access review is made for.
 */
public class ResourceAttributes {

  private final String namespace;
  private final String verb;
  private final String group;
  private final String resource;
  private final String name;

  @JsonCreator
  public ResourceAttributes(@JsonProperty("namespace") String namespace,
                            @JsonProperty("verb") String verb,
                            @JsonProperty("group") String group,
                            @JsonProperty("resource") String resource,
                            @JsonProperty("name") String name) {
    this.namespace = namespace;
    this.verb = verb;
    this.group = group;
    this.resource = resource;
    this.name = name;
  }

  public static ResourceAttributes of(AuthorizationTuple tuple) {
    return new ResourceAttributes(tuple.namespace(),
        tuple.verb().verb(),
        tuple.resourceType().group(),
        tuple.resourceType().resource(),
        tuple.resourceName().orElse(null));
  }

  @JsonProperty
  public String namespace() {
    return namespace;
  }

  @JsonProperty
  public String verb() {
    return verb;
  }

  @JsonProperty
  public String group() {
    return group;
  }

  @JsonProperty
  public String resource() {
    return resource;
  }

  @JsonProperty
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourceAttributes)) {
      return false;
    }

    ResourceAttributes that = (ResourceAttributes) o;
    return Objects.equals(this.namespace, that.namespace) &&
        Objects.equals(this.verb, that.verb) &&
        Objects.equals(this.group, that.group) &&
        Objects.equals(this.resource, that.resource) &&
        Objects.equals(this.name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, verb, group, resource, name);
  }

  @Override
  public String toString() {
    return "ResourceAttributes(" +
        "namespace='" + namespace + '\'' +
        ", verb='" + verb + '\'' +
        ", group='" + group + '\'' +
        ", resource='" + resource + '\'' +
        ", name='" + name + '\'' +
        ')';
  }
}
