// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.util.Locale;

/**
 * Kubernetes RBAC verbs that a results API call may request.
 */
public enum Verb {
  GET,
  LIST,
  CREATE,
  UPDATE,
  DELETE,
  WATCH;

  /**
   * Returns the verb as it appears in RBAC rules, e.g. "create".
   */
  public String verb() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return verb();
  }
}
