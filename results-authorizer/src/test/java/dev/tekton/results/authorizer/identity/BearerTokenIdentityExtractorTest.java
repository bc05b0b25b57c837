// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.errors.UnauthenticatedCallException;
import java.security.KeyPair;
import java.util.Arrays;
import java.util.Optional;
import org.apache.kafka.common.utils.MockTime;
import org.apache.kafka.common.utils.Utils;
import org.junit.Before;
import org.junit.Test;

public class BearerTokenIdentityExtractorTest {

  private MockTime time;
  private KeyPair keyPair;

  @Before
  public void setUp() throws Exception {
    time = new MockTime();
    keyPair = CredentialTestUtils.generateKeyPair();
  }

  @Test
  public void testNoAuthorizationHeader() {
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(time);
    assertFalse(extractor.extract(TestTransportContext.anonymous()).isPresent());
  }

  @Test
  public void testSubjectAndGroups() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer",
        time.milliseconds() + 60000, Arrays.asList("writers", "team-a"));
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(time);

    CallIdentity identity = extractor.extract(TestTransportContext.bearer(token)).get();
    assertEquals("svc:writer", identity.name());
    assertEquals(Utils.mkSet("writers", "team-a"), identity.groups());
    assertEquals("kubernetes/serviceaccount", identity.extra().get("iss"));
    assertTrue(identity.extra().containsKey("jti"));
  }

  @Test
  public void testServiceAccountGroupsAreDerived() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(),
        "system:serviceaccount:tekton-pipelines:tekton-results-watcher",
        time.milliseconds() + 60000, null);
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(time);

    CallIdentity identity = extractor.extract(TestTransportContext.bearer(token)).get();
    assertEquals("system:serviceaccount:tekton-pipelines:tekton-results-watcher", identity.name());
    assertEquals(Utils.mkSet("system:serviceaccounts", "system:serviceaccounts:tekton-pipelines",
        "system:authenticated"), identity.groups());
  }

  @Test
  public void testExpiredToken() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer",
        time.milliseconds() + 60000, null);
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(time);
    assertTrue(extractor.extract(TestTransportContext.bearer(token)).isPresent());

    time.sleep(5 * 60 * 1000);
    verifyRejected(extractor, TestTransportContext.bearer(token), "expired");
  }

  @Test
  public void testTokenWithoutExpiration() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer", null, null);
    verifyRejected(new BearerTokenIdentityExtractor(time), TestTransportContext.bearer(token), "malformed");
  }

  @Test
  public void testTokenWithoutSubject() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), null,
        time.milliseconds() + 60000, null);
    verifyRejected(new BearerTokenIdentityExtractor(time), TestTransportContext.bearer(token), "malformed");
  }

  @Test
  public void testEmptySubject() throws Exception {
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(keyPair.getPublic(), time);
    for (String subject : Arrays.asList("", "  ")) {
      String token = CredentialTestUtils.token(keyPair.getPrivate(), subject,
          time.milliseconds() + 60000, null);
      verifyRejected(extractor, TestTransportContext.bearer(token), "empty subject");
    }
  }

  @Test
  public void testEmptyGroups() throws Exception {
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(keyPair.getPublic(), time);
    String withNull = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer",
        time.milliseconds() + 60000, Arrays.asList("g1", null));
    verifyRejected(extractor, TestTransportContext.bearer(withNull), "empty group");

    String withEmpty = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer",
        time.milliseconds() + 60000, Arrays.asList("g1", ""));
    verifyRejected(extractor, TestTransportContext.bearer(withEmpty), "empty group");
  }

  @Test
  public void testMalformedHeaders() {
    BearerTokenIdentityExtractor extractor = new BearerTokenIdentityExtractor(time);
    verifyRejected(extractor, TestTransportContext.anonymous()
        .header(BearerTokenIdentityExtractor.AUTHORIZATION_HEADER, "Basic dXNlcjpwYXNzd29yZA=="), "bearer");
    verifyRejected(extractor, TestTransportContext.anonymous()
        .header(BearerTokenIdentityExtractor.AUTHORIZATION_HEADER, "Bearer    "), "empty");
    verifyRejected(extractor, TestTransportContext.bearer("not-a-jwt"), "malformed");
  }

  @Test
  public void testSignatureVerification() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:writer",
        time.milliseconds() + 60000, null);

    BearerTokenIdentityExtractor verifying = new BearerTokenIdentityExtractor(keyPair.getPublic(), time);
    Optional<CallIdentity> identity = verifying.extract(TestTransportContext.bearer(token));
    assertEquals("svc:writer", identity.get().name());

    KeyPair otherKeyPair = CredentialTestUtils.generateKeyPair();
    BearerTokenIdentityExtractor otherKey = new BearerTokenIdentityExtractor(otherKeyPair.getPublic(), time);
    verifyRejected(otherKey, TestTransportContext.bearer(token), "malformed");
  }

  @Test
  public void testLowerCaseScheme() throws Exception {
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:reader",
        time.milliseconds() + 60000, null);
    TestTransportContext context = TestTransportContext.anonymous()
        .header(BearerTokenIdentityExtractor.AUTHORIZATION_HEADER, "bearer " + token);
    assertEquals("svc:reader", new BearerTokenIdentityExtractor(time).extract(context).get().name());
  }

  private void verifyRejected(IdentityExtractor extractor, TransportContext context, String expectedMessage) {
    try {
      extractor.extract(context);
      fail("Credential should have been rejected");
    } catch (UnauthenticatedCallException e) {
      assertTrue("Unexpected message " + e.getMessage(), e.getMessage().contains(expectedMessage));
    }
  }
}
