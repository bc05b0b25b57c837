// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.mapping;

import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.errors.UnmappedMethodException;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.apache.kafka.common.config.ConfigException;

/**
 * Registry of method mapping rules. Maps a method and its decoded request to the
 * authorization tuple the caller needs to be granted.
 *
 * <p>Methods without a registered rule are never mapped: {@link #map(String, Object)} fails
 * with {@link UnmappedMethodException}, which callers must treat as a denial.
 */
public class ResourceMapper {

  private final Map<String, MethodMapping<?>> mappings = new ConcurrentHashMap<>();

  public <T> ResourceMapper register(String method,
                                     Class<T> requestType,
                                     ResourceType resourceType,
                                     Verb verb,
                                     ResourceExtractor<T> extractor) {
    return register(new MethodMapping<>(method, requestType, resourceType, verb, extractor));
  }

  public ResourceMapper register(MethodMapping<?> mapping) {
    MethodMapping<?> existing = mappings.putIfAbsent(mapping.method(), mapping);
    if (existing != null)
      throw new ConfigException("Duplicate mapping rule for method " + mapping.method()
          + ": " + existing + " and " + mapping);
    return this;
  }

  /**
   * Returns the authorization tuple for a call of `method` with the given request.
   *
   * @throws UnmappedMethodException if no rule is registered for the method
   * @throws org.apache.kafka.common.errors.InvalidRequestException if the request does not
   *         locate a resource
   */
  public AuthorizationTuple map(String method, Object request) {
    MethodMapping<?> mapping = mappings.get(method);
    if (mapping == null)
      throw new UnmappedMethodException("No authorization mapping registered for method " + method);
    return mapping.toTuple(request);
  }

  public boolean isMapped(String method) {
    return mappings.containsKey(method);
  }

  public Set<String> methods() {
    return Collections.unmodifiableSet(new TreeSet<>(mappings.keySet()));
  }

  /**
   * Verifies that every exposed method has a mapping rule.
   *
   * @throws ConfigException listing the methods without a rule
   */
  public void verifyCovers(Collection<String> exposedMethods) {
    Set<String> unmapped = exposedMethods.stream()
        .filter(method -> !mappings.containsKey(method))
        .collect(Collectors.toCollection(TreeSet::new));
    if (!unmapped.isEmpty())
      throw new ConfigException("Methods without an authorization mapping rule: " + unmapped);
  }
}
