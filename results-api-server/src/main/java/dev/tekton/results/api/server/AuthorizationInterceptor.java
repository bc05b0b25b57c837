// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import dev.tekton.results.authorizer.AuthorizationGate;
import dev.tekton.results.authorizer.AuthorizeResult;
import dev.tekton.results.authorizer.GateOutcome;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every call through the {@link AuthorizationGate} before its handler is started.
 *
 * <p>Authorization needs the decoded request, so the interceptor requests the first
 * message itself and holds it. The real handler is started, and the message replayed to
 * it, only if the gate allowed the call. Otherwise the call is closed with
 * `UNAUTHENTICATED` or `PERMISSION_DENIED` and the handler never sees it.
 */
public class AuthorizationInterceptor implements ServerInterceptor {
  private static final Logger log = LoggerFactory.getLogger(AuthorizationInterceptor.class);

  private final AuthorizationGate gate;

  public AuthorizationInterceptor(AuthorizationGate gate) {
    this.gate = gate;
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                               Metadata headers,
                                                               ServerCallHandler<ReqT, RespT> next) {
    GatedListener<ReqT, RespT> listener = new GatedListener<>(call, headers, next);
    call.request(1);
    return listener;
  }

  static Status status(GateOutcome outcome) {
    Status status = outcome.result() == AuthorizeResult.UNAUTHENTICATED
        ? Status.UNAUTHENTICATED : Status.PERMISSION_DENIED;
    return status.withDescription(outcome.reason().orElse(AuthorizeResult.DENIED.reason()));
  }

  /**
   * Listener that holds the call until the gate has decided. Listener callbacks of one
   * call are serialized by gRPC.
   */
  private class GatedListener<ReqT, RespT> extends ServerCall.Listener<ReqT> {
    private final ServerCall<ReqT, RespT> call;
    private final Metadata headers;
    private final ServerCallHandler<ReqT, RespT> next;
    private ServerCall.Listener<ReqT> delegate;
    private boolean closed;

    GatedListener(ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
      this.call = call;
      this.headers = headers;
      this.next = next;
    }

    @Override
    public void onMessage(ReqT message) {
      if (delegate != null) {
        delegate.onMessage(message);
        return;
      }
      if (closed)
        return;
      if (authorize(message)) {
        delegate = next.startCall(call, headers);
        delegate.onMessage(message);
      }
    }

    @Override
    public void onHalfClose() {
      if (delegate != null) {
        delegate.onHalfClose();
      } else if (!closed) {
        // No request message, the gate decides on the call alone
        authorize(null);
        if (!closed)
          close(Status.INVALID_ARGUMENT.withDescription("missing request"));
      }
    }

    @Override
    public void onCancel() {
      if (delegate != null)
        delegate.onCancel();
    }

    @Override
    public void onComplete() {
      if (delegate != null)
        delegate.onComplete();
    }

    @Override
    public void onReady() {
      if (delegate != null)
        delegate.onReady();
    }

    private boolean authorize(ReqT message) {
      String method = call.getMethodDescriptor().getFullMethodName();
      GateOutcome outcome;
      try {
        outcome = gate.authorize(method, message, new GrpcTransportContext(headers, call));
      } catch (RuntimeException e) {
        log.error("Internal error while authorizing call to {}, denying it", method, e);
        close(Status.PERMISSION_DENIED.withDescription(AuthorizeResult.DENIED.reason()));
        return false;
      }
      if (outcome.allowed())
        return true;
      close(status(outcome));
      return false;
    }

    private void close(Status status) {
      closed = true;
      call.close(status, new Metadata());
    }
  }
}
