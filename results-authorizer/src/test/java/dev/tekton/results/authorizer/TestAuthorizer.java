// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Authorizer that allows the identity names granted for each tuple and denies everything
 * else. Can be made to fail or stall to simulate an unavailable authority.
 */
public class TestAuthorizer implements Authorizer {

  private final Map<AuthorizationTuple, Set<String>> grants = new HashMap<>();
  private final AtomicInteger requests = new AtomicInteger();
  private volatile RuntimeException exception;
  private volatile long delayMs;
  private volatile boolean closed;
  private final Set<String> stalledIdentities = ConcurrentHashMap.newKeySet();
  private final CountDownLatch stalledRequest = new CountDownLatch(1);
  private final CountDownLatch release = new CountDownLatch(1);

  public synchronized TestAuthorizer grant(String identityName, AuthorizationTuple tuple) {
    grants.computeIfAbsent(tuple, t -> new HashSet<>()).add(identityName);
    return this;
  }

  public synchronized TestAuthorizer revoke(String identityName, AuthorizationTuple tuple) {
    grants.getOrDefault(tuple, new HashSet<>()).remove(identityName);
    return this;
  }

  public void failWith(RuntimeException exception) {
    this.exception = exception;
  }

  public void delay(long delayMs) {
    this.delayMs = delayMs;
  }

  /**
   * Requests for the identity block until {@link #release()} is called or the request
   * thread is interrupted.
   */
  public TestAuthorizer stall(String identityName) {
    stalledIdentities.add(identityName);
    return this;
  }

  public boolean awaitStalledRequest(long timeoutMs) throws InterruptedException {
    return stalledRequest.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  public void release() {
    release.countDown();
  }

  public int requests() {
    return requests.get();
  }

  public boolean closed() {
    return closed;
  }

  @Override
  public Decision authorize(CallIdentity identity, AuthorizationTuple tuple, Duration timeout) {
    requests.incrementAndGet();
    if (stalledIdentities.contains(identity.name())) {
      stalledRequest.countDown();
      try {
        release.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted", e);
      }
    }
    if (delayMs > 0) {
      try {
        Thread.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted", e);
      }
    }
    if (exception != null)
      throw exception;
    synchronized (this) {
      if (grants.getOrDefault(tuple, new HashSet<>()).contains(identity.name()))
        return Decision.allow("RBAC: allowed by test grant");
      return Decision.deny("no test grant for " + identity.name());
    }
  }

  @Override
  public void close() {
    closed = true;
  }
}
