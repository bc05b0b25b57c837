// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import dev.tekton.results.authorizer.cache.DecisionCache;
import dev.tekton.results.authorizer.errors.AuthorityUnavailableException;
import dev.tekton.results.authorizer.errors.UnauthenticatedCallException;
import dev.tekton.results.authorizer.errors.UnmappedMethodException;
import dev.tekton.results.authorizer.identity.IdentityExtractor;
import dev.tekton.results.authorizer.identity.TransportContext;
import dev.tekton.results.authorizer.mapping.ResourceMapper;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.common.errors.InvalidRequestException;
import org.apache.kafka.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizes every inbound call before it reaches its handler. For each call the gate
 * extracts the caller identity, maps the method and request to an authorization tuple
 * and asks the {@link Authorizer} for a decision.
 *
 * <p>The gate fails closed: a call is allowed only if the authority allowed exactly this
 * identity and tuple. Missing credentials, unmapped methods, invalid requests, authority
 * errors and authority timeouts all reject the call.
 *
 * <p>The gate keeps no per-call state between calls. The only shared state is the optional
 * {@link DecisionCache}, which is safe for concurrent use.
 */
public class AuthorizationGate implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

  private final IdentityExtractor identityExtractor;
  private final ResourceMapper resourceMapper;
  private final Authorizer authorizer;
  private final DecisionCache decisionCache;
  private final Duration callTimeout;
  private final ExecutorService executor;

  /**
   * @param identityExtractor Extracts the caller identity from transport credentials
   * @param resourceMapper    Mapping rules of all protected methods
   * @param authorizer        RBAC authority
   * @param decisionCache     Decision cache, or null to consult the authority on every call
   * @param callTimeout       Maximum time to wait for the authority on each call
   */
  public AuthorizationGate(IdentityExtractor identityExtractor,
                           ResourceMapper resourceMapper,
                           Authorizer authorizer,
                           DecisionCache decisionCache,
                           Duration callTimeout) {
    this.identityExtractor = Objects.requireNonNull(identityExtractor, "identityExtractor");
    this.resourceMapper = Objects.requireNonNull(resourceMapper, "resourceMapper");
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    this.decisionCache = decisionCache;
    if (callTimeout.isZero() || callTimeout.isNegative())
      throw new IllegalArgumentException("Call timeout must be positive, got " + callTimeout);
    this.callTimeout = callTimeout;
    this.executor = new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        1,
        TimeUnit.MINUTES,
        new SynchronousQueue<>(),
        r -> {
          Thread t = Executors.defaultThreadFactory().newThread(r);
          t.setName("authorization-gate-" + t.getName());
          t.setDaemon(true);
          return t;
        });
  }

  public ResourceMapper resourceMapper() {
    return resourceMapper;
  }

  /**
   * Gates one call.
   *
   * @param method  Name of the invoked method
   * @param request Decoded request payload
   * @param context Transport credentials of the call
   * @return outcome of the call, the handler may be invoked only if it is allowed
   */
  public GateOutcome authorize(String method, Object request, TransportContext context) {
    CallAuthorization call = new CallAuthorization(method);

    CallIdentity identity;
    try {
      Optional<CallIdentity> extracted = identityExtractor.extract(context);
      if (!extracted.isPresent())
        throw new UnauthenticatedCallException("No credential presented");
      identity = extracted.get();
    } catch (UnauthenticatedCallException e) {
      log.debug("Rejecting unauthenticated call to {}: {}", method, e.getMessage());
      return call.complete(GateState.ERRORED, AuthorizeResult.UNAUTHENTICATED);
    } catch (RuntimeException e) {
      log.warn("Rejecting call to {}, identity extractor {} failed on the presented credential",
          method, identityExtractor.extractorName(), e);
      return call.complete(GateState.ERRORED, AuthorizeResult.UNAUTHENTICATED);
    }
    call.identityExtracted(identity);

    AuthorizationTuple tuple;
    try {
      tuple = resourceMapper.map(method, request);
    } catch (UnmappedMethodException e) {
      log.error("Denying call to {} by {}, the method has no authorization mapping", method, identity);
      return call.complete(GateState.DENIED, AuthorizeResult.UNMAPPED_METHOD);
    } catch (InvalidRequestException e) {
      log.debug("Denying call to {} by {}: {}", method, identity, e.getMessage());
      return call.complete(GateState.DENIED, AuthorizeResult.DENIED);
    }
    call.tupleMapped(tuple);

    if (decisionCache != null) {
      Optional<Decision> cached = decisionCache.get(identity, tuple);
      if (cached.isPresent()) {
        log.trace("Using cached decision {} for {} on {}", cached.get(), identity, tuple);
        return complete(call, cached.get());
      }
    }

    call.decisionPending();
    Decision decision;
    try {
      decision = decide(identity, tuple);
    } catch (AuthorityUnavailableException e) {
      log.warn("Denying call to {} by {} on {}, authorization service unavailable: {}",
          method, identity, tuple, e.getMessage());
      return call.complete(GateState.DENIED, AuthorizeResult.AUTHORIZER_FAILED);
    }
    if (decisionCache != null)
      decisionCache.put(identity, tuple, decision);
    return complete(call, decision);
  }

  private GateOutcome complete(CallAuthorization call, Decision decision) {
    if (decision.allowed())
      return call.complete(GateState.ALLOWED, AuthorizeResult.ALLOWED);

    log.info("Denied {} on {} for {}: {}", call.identity, call.tuple, call.method,
        decision.reason().orElse("no reason given"));
    return call.complete(GateState.DENIED, AuthorizeResult.DENIED);
  }

  private Decision decide(CallIdentity identity, AuthorizationTuple tuple) {
    Future<Decision> future;
    try {
      future = executor.submit(() -> authorizer.authorize(identity, tuple, callTimeout));
    } catch (RuntimeException e) {
      throw new AuthorityUnavailableException("Could not submit authorization request", e);
    }

    try {
      Decision decision = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (decision == null)
        throw new AuthorityUnavailableException("Authority returned no decision");
      return decision;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new AuthorityUnavailableException("Authorization request timed out after "
          + callTimeout.toMillis() + " ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new AuthorityUnavailableException("Interrupted while waiting for authorization", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AuthorityUnavailableException)
        throw (AuthorityUnavailableException) cause;
      throw new AuthorityUnavailableException("Authorization request failed", cause);
    }
  }

  @Override
  public void close() throws IOException {
    executor.shutdownNow();
    Utils.closeQuietly(authorizer, "authorizer");
  }

  /**
   * Request-scoped state machine of one call.
   */
  private static class CallAuthorization {
    private final String method;
    private GateState state = GateState.RECEIVED;
    private CallIdentity identity;
    private AuthorizationTuple tuple;

    CallAuthorization(String method) {
      this.method = method;
    }

    void identityExtracted(CallIdentity identity) {
      transition(GateState.IDENTITY_EXTRACTED);
      this.identity = identity;
    }

    void tupleMapped(AuthorizationTuple tuple) {
      transition(GateState.TUPLE_MAPPED);
      this.tuple = tuple;
    }

    void decisionPending() {
      transition(GateState.DECISION_PENDING);
    }

    GateOutcome complete(GateState terminal, AuthorizeResult result) {
      if (!terminal.isTerminal())
        throw new IllegalArgumentException("Not a terminal state " + terminal);
      transition(terminal);
      return new GateOutcome(method, state, result, identity, tuple);
    }

    private void transition(GateState next) {
      if (!state.canTransitionTo(next))
        throw new IllegalStateException("Invalid transition from " + state + " to " + next
            + " for call to " + method);
      state = next;
    }
  }
}
