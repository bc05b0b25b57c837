// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.mapping;

import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.errors.InvalidResourceNameException;
import java.util.Objects;
import org.apache.kafka.common.errors.InvalidRequestException;

/**
 * Static mapping rule of one method: the resource type and verb it requires, and the
 * extractor that locates the resource in the request.
 */
public class MethodMapping<T> {

  private final String method;
  private final Class<T> requestType;
  private final ResourceType resourceType;
  private final Verb verb;
  private final ResourceExtractor<T> extractor;

  public MethodMapping(String method,
                       Class<T> requestType,
                       ResourceType resourceType,
                       Verb verb,
                       ResourceExtractor<T> extractor) {
    this.method = Objects.requireNonNull(method, "method");
    this.requestType = Objects.requireNonNull(requestType, "requestType");
    this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    this.verb = Objects.requireNonNull(verb, "verb");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  public String method() {
    return method;
  }

  public ResourceType resourceType() {
    return resourceType;
  }

  public Verb verb() {
    return verb;
  }

  AuthorizationTuple toTuple(Object request) {
    if (request == null)
      throw new InvalidRequestException("Request for " + method + " is missing");
    if (!requestType.isInstance(request))
      throw new InvalidRequestException("Unexpected request type " + request.getClass().getName()
          + " for " + method + ", expected " + requestType.getName());

    ResourceLocation location = extractor.extract(requestType.cast(request));
    if (location == null || location.namespace() == null || location.namespace().isEmpty())
      throw new InvalidResourceNameException("Request for " + method + " does not name a namespace");
    return new AuthorizationTuple(location.namespace(), resourceType, verb, location.name());
  }

  @Override
  public String toString() {
    return method + " -> " + verb + " " + resourceType;
  }
}
