// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Allow or deny decision returned by an {@link Authorizer} for one identity and tuple.
 * The reason is the authority's explanation, it is meant for logs and is not returned
 * to callers.
 */
public class Decision {

  private final boolean allowed;
  private final String reason;

  private Decision(boolean allowed, String reason) {
    this.allowed = allowed;
    this.reason = reason == null || reason.isEmpty() ? null : reason;
  }

  public static Decision allow() {
    return new Decision(true, null);
  }

  public static Decision allow(String reason) {
    return new Decision(true, reason);
  }

  public static Decision deny(String reason) {
    return new Decision(false, reason);
  }

  public boolean allowed() {
    return allowed;
  }

  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Decision)) {
      return false;
    }

    Decision that = (Decision) o;
    return this.allowed == that.allowed && Objects.equals(this.reason, that.reason);
  }

  @Override
  public int hashCode() {
    return Objects.hash(allowed, reason);
  }

  @Override
  public String toString() {
    return (allowed ? "ALLOW" : "DENY") + (reason == null ? "" : " (" + reason + ")");
  }
}
