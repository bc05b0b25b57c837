// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest.exceptions;

public class RestClientException extends Exception {

  private final int status;
  private final String reason;

  public RestClientException(final String message, final int status, final String reason) {
    super(message + "; status: " + status + (reason == null ? "" : ", reason: " + reason));
    this.status = status;
    this.reason = reason;
  }

  public int status() {
    return status;
  }

  public String reason() {
    return reason;
  }

  /**
   * Server errors and throttling may succeed on another attempt or another url.
   */
  public boolean retriable() {
    return status >= 500 || status == 429;
  }
}
