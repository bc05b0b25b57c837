// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import dev.tekton.results.authorizer.errors.AuthorityUnavailableException;
import java.io.Closeable;
import java.time.Duration;

/**
 * Authorization capability consulted by the {@link AuthorizationGate}. Implementations
 * query an RBAC authority, e.g. the Kubernetes API server.
 */
public interface Authorizer extends Closeable {

  /**
   * Decides whether `identity` may perform the operation described by `tuple`.
   *
   * @param identity Identity of the caller, extracted from the transport credentials.
   * @param tuple    Namespace, resource type, verb and optional resource name of the call.
   * @param timeout  Maximum time the caller is prepared to wait for a decision.
   *                 Implementations must not block for longer than this.
   *
   * @return decision of the authority
   * @throws AuthorityUnavailableException if the authority could not be reached or did not
   *         answer within the timeout. Callers must treat this as a denial.
   */
  Decision authorize(CallIdentity identity, AuthorizationTuple tuple, Duration timeout);
}
