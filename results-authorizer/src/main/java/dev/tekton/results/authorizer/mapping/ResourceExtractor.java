// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.mapping;

/**
 * Pulls the dynamic parts of an authorization tuple out of a decoded request. Must be
 * pure: no side effects and the same result for the same request.
 *
 * @param <T> request type
 */
@FunctionalInterface
public interface ResourceExtractor<T> {

  /**
   * @throws dev.tekton.results.authorizer.errors.InvalidResourceNameException if the
   *         request does not name a valid resource
   */
  ResourceLocation extract(T request);
}
