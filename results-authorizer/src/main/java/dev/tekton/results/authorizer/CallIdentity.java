// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identity of the caller of a single call, derived from transport credentials.
 * Instances are immutable and live for the duration of one call.
 */
public class CallIdentity {

  private final String name;
  private final Set<String> groups;
  private final Map<String, String> extra;

  public CallIdentity(String name) {
    this(name, Collections.emptySet(), Collections.emptyMap());
  }

  public CallIdentity(String name, Set<String> groups, Map<String, String> extra) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Identity name must not be empty");
    this.name = name;
    this.groups = Collections.unmodifiableSet(new TreeSet<>(groups));
    this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public String name() {
    return name;
  }

  /**
   * Group memberships of the caller, which may be empty.
   */
  public Set<String> groups() {
    return groups;
  }

  /**
   * Additional attributes of the credential, e.g. the token issuer.
   */
  public Map<String, String> extra() {
    return extra;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CallIdentity)) {
      return false;
    }

    CallIdentity that = (CallIdentity) o;
    return Objects.equals(this.name, that.name) &&
        Objects.equals(this.groups, that.groups) &&
        Objects.equals(this.extra, that.extra);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, groups, extra);
  }

  @Override
  public String toString() {
    return groups.isEmpty() ? name : name + groups;
  }
}
