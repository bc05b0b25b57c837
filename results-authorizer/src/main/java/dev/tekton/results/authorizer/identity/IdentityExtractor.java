// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import dev.tekton.results.authorizer.CallIdentity;
import java.util.Optional;

/**
 * Derives the identity of a caller from transport credentials. Credentials have already
 * been validated by the transport, so extractors must not perform network I/O.
 */
public interface IdentityExtractor {

  /**
   * Returns the name of this extractor.
   */
  String extractorName();

  /**
   * Returns the caller identity, or empty if the call carries no credential of the kind
   * handled by this extractor.
   *
   * @throws dev.tekton.results.authorizer.errors.UnauthenticatedCallException if a
   *         credential is present but malformed or expired
   */
  Optional<CallIdentity> extract(TransportContext context);
}
