// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.Decision;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;

/**
 * Short-lived cache of authority decisions keyed by identity and tuple, shared by all
 * in-flight calls.
 *
 * <p>Allow and deny decisions are kept in separate caches with their own time-to-live.
 * Entries expire a fixed time after they were written, so an allow is never returned
 * once its TTL has elapsed. A TTL of zero disables caching of that kind of decision.
 */
public class DecisionCache {

  private final Cache<Key, Decision> allowed;
  private final Cache<Key, Decision> denied;

  public DecisionCache(Duration allowTtl, Duration denyTtl, long maxEntries, Time time) {
    Ticker ticker = new Ticker() {
      @Override
      public long read() {
        return time.nanoseconds();
      }
    };
    this.allowed = createCache(allowTtl, maxEntries, ticker);
    this.denied = createCache(denyTtl, maxEntries, ticker);
  }

  private static Cache<Key, Decision> createCache(Duration ttl, long maxEntries, Ticker ticker) {
    if (ttl.isZero() || ttl.isNegative())
      return null;
    return CacheBuilder.newBuilder()
        .ticker(ticker)
        .expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS)
        .maximumSize(maxEntries)
        .build();
  }

  public Optional<Decision> get(CallIdentity identity, AuthorizationTuple tuple) {
    Key key = new Key(identity, tuple);
    Decision decision = allowed == null ? null : allowed.getIfPresent(key);
    if (decision == null && denied != null)
      decision = denied.getIfPresent(key);
    return Optional.ofNullable(decision);
  }

  public void put(CallIdentity identity, AuthorizationTuple tuple, Decision decision) {
    Key key = new Key(identity, tuple);
    if (decision.allowed()) {
      if (denied != null)
        denied.invalidate(key);
      if (allowed != null)
        allowed.put(key, decision);
    } else {
      if (allowed != null)
        allowed.invalidate(key);
      if (denied != null)
        denied.put(key, decision);
    }
  }

  public void clear() {
    if (allowed != null)
      allowed.invalidateAll();
    if (denied != null)
      denied.invalidateAll();
  }

  // Visible for testing
  long size() {
    long size = 0;
    if (allowed != null) {
      allowed.cleanUp();
      size += allowed.size();
    }
    if (denied != null) {
      denied.cleanUp();
      size += denied.size();
    }
    return size;
  }

  private static class Key {
    private final CallIdentity identity;
    private final AuthorizationTuple tuple;

    Key(CallIdentity identity, AuthorizationTuple tuple) {
      this.identity = Objects.requireNonNull(identity, "identity");
      this.tuple = Objects.requireNonNull(tuple, "tuple");
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }

      Key that = (Key) o;
      return this.identity.equals(that.identity) && this.tuple.equals(that.tuple);
    }

    @Override
    public int hashCode() {
      return Objects.hash(identity, tuple);
    }
  }
}
