// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.mapping;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.ResourceType;
import dev.tekton.results.authorizer.Verb;
import dev.tekton.results.authorizer.errors.InvalidResourceNameException;
import dev.tekton.results.authorizer.errors.UnmappedMethodException;
import java.util.Arrays;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.errors.InvalidRequestException;
import org.apache.kafka.common.utils.Utils;
import org.junit.Before;
import org.junit.Test;

public class ResourceMapperTest {

  private ResourceMapper mapper;

  @Before
  public void setUp() {
    mapper = new ResourceMapper()
        .register("svc/CreateThing", String.class, ResourceType.RESULTS, Verb.CREATE,
            parent -> ResourceLocation.namespace(parent))
        .register("svc/GetThing", String.class, ResourceType.RECORDS, Verb.GET,
            name -> {
              String[] parts = name.split("/");
              return ResourceLocation.named(parts[0], parts[parts.length - 1]);
            });
  }

  @Test
  public void testMap() {
    assertEquals(new AuthorizationTuple("ns1", ResourceType.RESULTS, Verb.CREATE),
        mapper.map("svc/CreateThing", "ns1"));
    AuthorizationTuple tuple = mapper.map("svc/GetThing", "ns1/results/r1/records/rec1");
    assertEquals(new AuthorizationTuple("ns1", ResourceType.RECORDS, Verb.GET, "rec1"), tuple);
    assertEquals("rec1", tuple.resourceName().get());
  }

  @Test(expected = UnmappedMethodException.class)
  public void testUnmappedMethod() {
    mapper.map("svc/DeleteThing", "ns1");
  }

  @Test
  public void testInvalidRequests() {
    verifyInvalid(null);
    verifyInvalid(42);
    try {
      mapper.map("svc/CreateThing", "");
      fail("Empty namespace should have been rejected");
    } catch (InvalidResourceNameException e) {
      // Expected
    }
  }

  @Test(expected = ConfigException.class)
  public void testDuplicateRule() {
    mapper.register("svc/CreateThing", String.class, ResourceType.RESULTS, Verb.UPDATE,
        ResourceLocation::namespace);
  }

  @Test
  public void testCoverage() {
    assertEquals(Utils.mkSet("svc/CreateThing", "svc/GetThing"), mapper.methods());
    assertTrue(mapper.isMapped("svc/GetThing"));
    assertFalse(mapper.isMapped("svc/ListThings"));
    mapper.verifyCovers(Arrays.asList("svc/CreateThing", "svc/GetThing"));

    try {
      mapper.verifyCovers(Arrays.asList("svc/CreateThing", "svc/ListThings", "svc/DeleteThing"));
      fail("Unmapped methods should have been reported");
    } catch (ConfigException e) {
      assertTrue(e.getMessage().contains("[svc/DeleteThing, svc/ListThings]"));
    }
  }

  private void verifyInvalid(Object request) {
    try {
      mapper.map("svc/CreateThing", request);
      fail("Request should have been rejected " + request);
    } catch (InvalidRequestException e) {
      // Expected
    }
  }
}
