// (Copyright) [2018 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

/**
 * Terminal result of gating a call, with the reason reported to the caller when the call
 * is rejected. Reasons distinguish policy denials from infrastructure failures without
 * exposing the authority's own explanation.
 */
public enum AuthorizeResult {
  ALLOWED(null),
  DENIED("not authorized"),
  UNMAPPED_METHOD("not authorized"),
  UNAUTHENTICATED("not authenticated"),
  AUTHORIZER_FAILED("authorization service unavailable");

  private final String reason;

  AuthorizeResult(String reason) {
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
