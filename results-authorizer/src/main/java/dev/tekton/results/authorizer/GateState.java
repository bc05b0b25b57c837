// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

/**
 * States of a single call passing through the {@link AuthorizationGate}. ALLOWED, DENIED
 * and ERRORED are terminal; only ALLOWED lets the call reach its handler.
 */
public enum GateState {
  RECEIVED,
  IDENTITY_EXTRACTED,
  TUPLE_MAPPED,
  DECISION_PENDING,
  ALLOWED,
  DENIED,
  ERRORED;

  public boolean isTerminal() {
    return this == ALLOWED || this == DENIED || this == ERRORED;
  }

  boolean canTransitionTo(GateState next) {
    switch (this) {
      case RECEIVED:
        return next == IDENTITY_EXTRACTED || next == ERRORED;
      case IDENTITY_EXTRACTED:
        return next == TUPLE_MAPPED || next == DENIED;
      case TUPLE_MAPPED:
        // Cached decisions complete without a pending authority request
        return next == DECISION_PENDING || next == ALLOWED || next == DENIED;
      case DECISION_PENDING:
        return next == ALLOWED || next == DENIED;
      default:
        return false;
    }
  }
}
