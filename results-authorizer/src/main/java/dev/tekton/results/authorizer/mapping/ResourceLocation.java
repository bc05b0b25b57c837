// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.mapping;

import java.util.Objects;

/**
 * Namespace and optional resource name pulled out of a request payload.
 */
public class ResourceLocation {

  private final String namespace;
  private final String name;

  private ResourceLocation(String namespace, String name) {
    this.namespace = namespace;
    this.name = name;
  }

  public static ResourceLocation namespace(String namespace) {
    return new ResourceLocation(namespace, null);
  }

  public static ResourceLocation named(String namespace, String name) {
    return new ResourceLocation(namespace, name);
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourceLocation)) {
      return false;
    }

    ResourceLocation that = (ResourceLocation) o;
    return Objects.equals(this.namespace, that.namespace) &&
        Objects.equals(this.name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }

  @Override
  public String toString() {
    return name == null ? namespace : namespace + "/" + name;
  }
}
