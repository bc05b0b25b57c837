// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Transport-level view of an inbound call, exposing the credentials attached to it.
 * Implemented by the RPC layer for each call.
 */
public interface TransportContext {

  /**
   * Returns the value of the request header `name`, or null if the header is absent.
   */
  String header(String name);

  /**
   * Returns the verified peer certificate chain, leaf first, or an empty list if the
   * peer did not present a certificate.
   */
  List<X509Certificate> peerCertificates();
}
