// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.JsonNode;
import dev.tekton.results.auth.client.AuthorityClientConfig;
import dev.tekton.results.auth.client.rest.entities.SubjectAccessReview;
import dev.tekton.results.auth.client.rest.exceptions.RestClientException;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.utils.JsonMapper;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.utils.MockTime;
import org.apache.kafka.common.utils.Utils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SubjectAccessReviewClientTest {

  private static final String ALLOWED = "{\"apiVersion\":\"authorization.k8s.io/v1\","
      + "\"kind\":\"SubjectAccessReview\",\"status\":{\"allowed\":true,"
      + "\"reason\":\"RBAC: allowed by RoleBinding \\\"writer/ns1\\\"\"}}";

  private final SubjectAccessReview review = SubjectAccessReview.request(
      new CallIdentity("system:serviceaccount:ns1:watcher",
          Utils.mkSet("system:serviceaccounts", "system:authenticated"),
          Collections.singletonMap("iss", "kubernetes/serviceaccount")),
      new AuthorizationTuple("ns1", ResourceType.RECORDS, Verb.GET, "rec1"));

  private MockTime time;
  private SubjectAccessReviewClient client;

  @Before
  public void setUp() {
    time = new MockTime();
  }

  @After
  public void tearDown() {
    if (client != null)
      client.close();
  }

  @Test
  public void testRequestBody() throws Exception {
    client = createClient(Collections.emptyMap());
    TestRequestSender sender = new TestRequestSender(time, 10).respond(ALLOWED);
    TestRequestSender.install(client, sender);

    SubjectAccessReview response = client.review(review, 1000);
    assertTrue(response.status().allowed());
    assertTrue(sender.triedUrls.get(0).endsWith(SubjectAccessReviewClient.SUBJECT_ACCESS_REVIEW_END_POINT));

    JsonNode body = JsonMapper.objectMapper().readTree(sender.requestBodies().get(0));
    assertEquals("authorization.k8s.io/v1", body.get("apiVersion").asText());
    assertEquals("SubjectAccessReview", body.get("kind").asText());
    assertFalse(body.has("status"));
    JsonNode spec = body.get("spec");
    assertEquals("system:serviceaccount:ns1:watcher", spec.get("user").asText());
    assertEquals(2, spec.get("groups").size());
    assertEquals("kubernetes/serviceaccount", spec.get("extra").get("iss").get(0).asText());
    JsonNode attributes = spec.get("resourceAttributes");
    assertEquals("ns1", attributes.get("namespace").asText());
    assertEquals("get", attributes.get("verb").asText());
    assertEquals("results.tekton.dev", attributes.get("group").asText());
    assertEquals("records", attributes.get("resource").asText());
    assertEquals("rec1", attributes.get("name").asText());
  }

  @Test
  public void testFailOver() throws Exception {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.MAX_RETRIES_PROP, "2");
    client = createClient(configs);

    TestRequestSender sender = new TestRequestSender(time, 10)
        .fail(new IOException("Connection refused"))
        .fail(new RestClientException("etcdserver: request timed out", 503, "ServiceUnavailable"))
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    assertTrue(client.review(review, 1000).status().allowed());
    assertEquals(3, sender.attempts());
    assertEquals(3, new HashSet<>(sender.triedUrls).size());
  }

  @Test
  public void testFailedUrlIsNotTriedFirstOnNextReview() throws Exception {
    client = createClient(Collections.emptyMap());
    TestRequestSender sender = new TestRequestSender(time, 10)
        .fail(new IOException("Connection refused"))
        .respond(ALLOWED)
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    assertTrue(client.review(review, 1000).status().allowed());
    assertTrue(sender.triedUrls.get(0).startsWith("https://api1:6443/"));
    assertTrue(sender.triedUrls.get(1).startsWith("https://api2:6443/"));

    assertTrue(client.review(review, 1000).status().allowed());
    assertEquals(3, sender.attempts());
    assertTrue(sender.triedUrls.get(2).startsWith("https://api2:6443/"));
  }

  @Test
  public void testRetriesExhausted() throws Exception {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.MAX_RETRIES_PROP, "1");
    client = createClient(configs);

    TestRequestSender sender = new TestRequestSender(time, 10)
        .fail(new IOException("Connection refused"))
        .fail(new IOException("Connection refused"))
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    try {
      client.review(review, 1000);
      fail("Request should have failed");
    } catch (IOException e) {
      assertEquals(2, sender.attempts());
    }
  }

  @Test
  public void testClientErrorIsNotRetried() throws Exception {
    client = createClient(Collections.emptyMap());
    TestRequestSender sender = new TestRequestSender(time, 10)
        .fail(new RestClientException("subjectaccessreviews.authorization.k8s.io is forbidden", 403, "Forbidden"))
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    try {
      client.review(review, 1000);
      fail("Request should have failed");
    } catch (RestClientException e) {
      assertEquals(403, e.status());
      assertEquals(1, sender.attempts());
    }
  }

  @Test
  public void testCallerTimeout() throws Exception {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.MAX_RETRIES_PROP, "5");
    configs.put(AuthorityClientConfig.RETRY_BACKOFF_MS_PROP, "100");
    client = createClient(configs);

    TestRequestSender sender = new TestRequestSender(time, 400)
        .fail(new IOException("Read timed out"))
        .fail(new IOException("Read timed out"))
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    try {
      client.review(review, 800);
      fail("Request should have timed out");
    } catch (TimeoutException e) {
      assertEquals(2, sender.attempts());
    }
  }

  @Test
  public void testConfiguredTimeoutCapsCallerTimeout() throws Exception {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.MAX_RETRIES_PROP, "5");
    configs.put(AuthorityClientConfig.REQUEST_TIMEOUT_MS_PROP, "500");
    configs.put(AuthorityClientConfig.HTTP_REQUEST_TIMEOUT_MS_PROP, "300");
    configs.put(AuthorityClientConfig.RETRY_BACKOFF_MS_PROP, "250");
    client = createClient(configs);

    TestRequestSender sender = new TestRequestSender(time, 300)
        .fail(new IOException("Read timed out"))
        .respond(ALLOWED);
    TestRequestSender.install(client, sender);

    try {
      client.review(review, 60000);
      fail("Request should have timed out");
    } catch (TimeoutException e) {
      assertEquals(1, sender.attempts());
    }
  }

  private SubjectAccessReviewClient createClient(Map<String, Object> overrides) {
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.AUTHORITY_URLS_PROP, "https://api1:6443,https://api2:6443,https://api3:6443");
    configs.put(AuthorityClientConfig.CREDENTIALS_PROVIDER_PROP, "NONE");
    configs.putAll(overrides);
    return new SubjectAccessReviewClient(configs, time);
  }
}
