// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.util.Optional;

/**
 * Terminal outcome of gating one call.
 */
public class GateOutcome {

  private final String method;
  private final GateState state;
  private final AuthorizeResult result;
  private final CallIdentity identity;
  private final AuthorizationTuple tuple;

  GateOutcome(String method,
              GateState state,
              AuthorizeResult result,
              CallIdentity identity,
              AuthorizationTuple tuple) {
    this.method = method;
    this.state = state;
    this.result = result;
    this.identity = identity;
    this.tuple = tuple;
  }

  public String method() {
    return method;
  }

  public GateState state() {
    return state;
  }

  public AuthorizeResult result() {
    return result;
  }

  public boolean allowed() {
    return state == GateState.ALLOWED;
  }

  /**
   * Reason reported to the caller if the call was rejected, empty if it was allowed.
   */
  public Optional<String> reason() {
    return Optional.ofNullable(result.reason());
  }

  public Optional<CallIdentity> identity() {
    return Optional.ofNullable(identity);
  }

  public Optional<AuthorizationTuple> tuple() {
    return Optional.ofNullable(tuple);
  }

  @Override
  public String toString() {
    return "GateOutcome(method=" + method +
        ", state=" + state +
        ", result=" + result +
        ", identity=" + identity +
        ", tuple=" + tuple +
        ")";
  }
}
