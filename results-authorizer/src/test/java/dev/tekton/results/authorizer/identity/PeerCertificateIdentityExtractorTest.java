// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.errors.UnauthenticatedCallException;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.apache.kafka.common.utils.Utils;
import org.junit.Before;
import org.junit.Test;

public class PeerCertificateIdentityExtractorTest {

  private static final long DAY_MS = TimeUnit.DAYS.toMillis(1);

  private MockTime time;
  private PeerCertificateIdentityExtractor extractor;

  @Before
  public void setUp() {
    time = new MockTime();
    extractor = new PeerCertificateIdentityExtractor(time);
  }

  @Test
  public void testNoPeerCertificate() {
    assertFalse(extractor.extract(TestTransportContext.anonymous()).isPresent());
  }

  @Test
  public void testCommonNameAndOrganizations() throws Exception {
    X509Certificate cert = CredentialTestUtils.certificate("CN=svc:writer,O=writers,O=team-a",
        time.milliseconds() - DAY_MS, time.milliseconds() + DAY_MS);

    CallIdentity identity = extractor.extract(TestTransportContext.peer(cert)).get();
    assertEquals("svc:writer", identity.name());
    assertEquals(Utils.mkSet("writers", "team-a"), identity.groups());
  }

  @Test(expected = UnauthenticatedCallException.class)
  public void testExpiredCertificate() throws Exception {
    X509Certificate cert = CredentialTestUtils.certificate("CN=svc:writer",
        time.milliseconds() - 2 * DAY_MS, time.milliseconds() + DAY_MS);
    assertTrue(extractor.extract(TestTransportContext.peer(cert)).isPresent());

    time.sleep(2 * DAY_MS);
    extractor.extract(TestTransportContext.peer(cert));
  }

  @Test(expected = UnauthenticatedCallException.class)
  public void testNotYetValidCertificate() throws Exception {
    X509Certificate cert = CredentialTestUtils.certificate("CN=svc:writer",
        time.milliseconds() + DAY_MS, time.milliseconds() + 2 * DAY_MS);
    extractor.extract(TestTransportContext.peer(cert));
  }

  @Test(expected = UnauthenticatedCallException.class)
  public void testNoCommonName() throws Exception {
    X509Certificate cert = CredentialTestUtils.certificate("O=writers",
        time.milliseconds() - DAY_MS, time.milliseconds() + DAY_MS);
    extractor.extract(TestTransportContext.peer(cert));
  }

  @Test
  public void testCompositeExtractorOrder() throws Exception {
    KeyPair keyPair = CredentialTestUtils.generateKeyPair();
    X509Certificate cert = CredentialTestUtils.certificate("CN=svc:cert-user",
        time.milliseconds() - DAY_MS, time.milliseconds() + DAY_MS);
    String token = CredentialTestUtils.token(keyPair.getPrivate(), "svc:token-user",
        time.milliseconds() + DAY_MS, null);

    IdentityExtractor composite = BuiltInIdentityExtractors.create(
        Arrays.asList("BEARER_TOKEN", "PEER_CERTIFICATE"), null, time);
    assertEquals("BEARER_TOKEN,PEER_CERTIFICATE", composite.extractorName());

    TestTransportContext both = TestTransportContext.peer(cert)
        .header(BearerTokenIdentityExtractor.AUTHORIZATION_HEADER, "Bearer " + token);
    assertEquals("svc:token-user", composite.extract(both).get().name());
    assertEquals("svc:cert-user", composite.extract(TestTransportContext.peer(cert)).get().name());
    assertFalse(composite.extract(TestTransportContext.anonymous()).isPresent());
  }

  @Test(expected = UnauthenticatedCallException.class)
  public void testCompositeFailsOnMalformedCredential() throws Exception {
    X509Certificate cert = CredentialTestUtils.certificate("CN=svc:cert-user",
        time.milliseconds() - DAY_MS, time.milliseconds() + DAY_MS);
    IdentityExtractor composite = BuiltInIdentityExtractors.create(
        Arrays.asList("BEARER_TOKEN", "PEER_CERTIFICATE"), null, time);

    composite.extract(TestTransportContext.peer(cert)
        .header(BearerTokenIdentityExtractor.AUTHORIZATION_HEADER, "Bearer garbage"));
  }
}
