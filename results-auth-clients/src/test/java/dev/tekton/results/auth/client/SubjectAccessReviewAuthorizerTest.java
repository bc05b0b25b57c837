// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import dev.tekton.results.auth.client.rest.SubjectAccessReviewClient;
import dev.tekton.results.auth.client.rest.TestRequestSender;
import dev.tekton.results.auth.client.rest.exceptions.RestClientException;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.Decision;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.errors.AuthorityUnavailableException;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.common.utils.MockTime;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SubjectAccessReviewAuthorizerTest {

  private final CallIdentity writer = new CallIdentity("svc:writer");
  private final AuthorizationTuple createResult = new AuthorizationTuple("ns1", ResourceType.RESULTS, Verb.CREATE);

  private MockTime time;
  private TestRequestSender sender;
  private SubjectAccessReviewAuthorizer authorizer;

  @Before
  public void setUp() {
    time = new MockTime();
    Map<String, Object> configs = new HashMap<>();
    configs.put(AuthorityClientConfig.AUTHORITY_URLS_PROP, "https://api1:6443");
    configs.put(AuthorityClientConfig.CREDENTIALS_PROVIDER_PROP, "NONE");
    configs.put(AuthorityClientConfig.MAX_RETRIES_PROP, "0");
    SubjectAccessReviewClient client = new SubjectAccessReviewClient(configs, time);
    sender = new TestRequestSender(time, 5);
    TestRequestSender.install(client, sender);
    authorizer = new SubjectAccessReviewAuthorizer(client);
  }

  @After
  public void tearDown() {
    authorizer.close();
  }

  @Test
  public void testAllowed() {
    sender.respond("{\"status\":{\"allowed\":true,\"reason\":\"RBAC: allowed by RoleBinding\"}}");
    Decision decision = authorizer.authorize(writer, createResult, Duration.ofSeconds(1));
    assertTrue(decision.allowed());
    assertEquals("RBAC: allowed by RoleBinding", decision.reason().get());
  }

  @Test
  public void testNotAllowed() {
    sender.respond("{\"status\":{\"allowed\":false}}");
    Decision decision = authorizer.authorize(writer, createResult, Duration.ofSeconds(1));
    assertFalse(decision.allowed());
    assertTrue(decision.reason().isPresent());
  }

  @Test
  public void testExplicitDeny() {
    sender.respond("{\"status\":{\"allowed\":true,\"denied\":true,\"reason\":\"webhook denied\"}}");
    assertFalse(authorizer.authorize(writer, createResult, Duration.ofSeconds(1)).allowed());
  }

  @Test(expected = AuthorityUnavailableException.class)
  public void testMissingStatus() {
    sender.respond("{\"kind\":\"SubjectAccessReview\"}");
    authorizer.authorize(writer, createResult, Duration.ofSeconds(1));
  }

  @Test(expected = AuthorityUnavailableException.class)
  public void testConnectionFailure() {
    sender.fail(new IOException("Connection refused"));
    authorizer.authorize(writer, createResult, Duration.ofSeconds(1));
  }

  @Test(expected = AuthorityUnavailableException.class)
  public void testErrorStatusIsNotAllow() {
    sender.fail(new RestClientException("Unauthorized", 401, "Unauthorized"));
    authorizer.authorize(writer, createResult, Duration.ofSeconds(1));
  }
}
