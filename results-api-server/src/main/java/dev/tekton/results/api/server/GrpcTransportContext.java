// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import dev.tekton.results.authorizer.identity.TransportContext;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;

/**
 * Credentials of a gRPC call: request metadata and the TLS session of the transport.
 */
public class GrpcTransportContext implements TransportContext {

  private final Metadata headers;
  private final SSLSession sslSession;

  public GrpcTransportContext(Metadata headers, ServerCall<?, ?> call) {
    this(headers, call.getAttributes().get(Grpc.TRANSPORT_ATTR_SSL_SESSION));
  }

  GrpcTransportContext(Metadata headers, SSLSession sslSession) {
    this.headers = headers;
    this.sslSession = sslSession;
  }

  @Override
  public String header(String name) {
    if (name.endsWith(Metadata.BINARY_HEADER_SUFFIX))
      return null;
    return headers.get(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER));
  }

  @Override
  public List<X509Certificate> peerCertificates() {
    if (sslSession == null)
      return Collections.emptyList();
    Certificate[] chain;
    try {
      chain = sslSession.getPeerCertificates();
    } catch (SSLPeerUnverifiedException e) {
      // The client did not present a certificate
      return Collections.emptyList();
    }
    List<X509Certificate> certificates = new ArrayList<>(chain.length);
    for (Certificate cert : chain) {
      if (cert instanceof X509Certificate)
        certificates.add((X509Certificate) cert);
    }
    return certificates;
  }
}
