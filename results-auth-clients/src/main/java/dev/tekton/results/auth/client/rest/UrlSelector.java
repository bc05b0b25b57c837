// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Failover order of the authority URLs of one client, shared by concurrent reviews.
 * Reviews start with the URL that answered last. A URL that fails is moved behind the
 * others until another URL fails or it answers again.
 */
public class UrlSelector {

  private final List<String> urls;
  private final AtomicInteger preferred = new AtomicInteger();

  public UrlSelector(List<String> urls) {
    if (urls == null || urls.isEmpty())
      throw new IllegalArgumentException("Expected at least one authority URL");
    this.urls = Collections.unmodifiableList(new ArrayList<>(urls));
  }

  /**
   * Returns all URLs, starting with the preferred one.
   */
  public List<String> attemptOrder() {
    int start = preferred.get();
    List<String> order = new ArrayList<>(urls.size());
    for (int i = 0; i < urls.size(); i++)
      order.add(urls.get((start + i) % urls.size()));
    return order;
  }

  public void succeeded(String url) {
    int index = urls.indexOf(url);
    if (index >= 0)
      preferred.set(index);
  }

  /**
   * Moves the preference to the next URL if `url` is the preferred one. Failures of
   * other URLs, e.g. reported late by a concurrent review, leave the preference unchanged.
   */
  public void failed(String url) {
    int index = urls.indexOf(url);
    if (index >= 0)
      preferred.compareAndSet(index, (index + 1) % urls.size());
  }

  public int size() {
    return urls.size();
  }

  @Override
  public String toString() {
    return urls.toString();
  }
}
