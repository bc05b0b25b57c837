// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;

public class ResultsApiServerConfigTest {

  @Test
  public void testDefaults() {
    ResultsApiServerConfig config = new ResultsApiServerConfig(Collections.emptyMap(), Collections.emptyMap());
    assertEquals(50051, config.port());
    assertTrue(config.tlsEnabled());
    assertEquals("/etc/tls/tls.crt", config.getString(ResultsApiServerConfig.TLS_CERT_PATH_PROP));
    assertNull(config.getString(ResultsApiServerConfig.TLS_CLIENT_CA_PATH_PROP));
    assertEquals(10000L, (long) config.getLong(ResultsApiServerConfig.SHUTDOWN_TIMEOUT_MS_PROP));
  }

  @Test
  public void testPortEnvironmentOverridesProperty() {
    Map<String, Object> props = new HashMap<>();
    props.put(ResultsApiServerConfig.LISTENER_PORT_PROP, "9000");
    assertEquals(9000, new ResultsApiServerConfig(props, Collections.emptyMap()).port());
    assertEquals(8443, new ResultsApiServerConfig(props,
        Collections.singletonMap(ResultsApiServerConfig.PORT_ENV, " 8443 ")).port());
    assertEquals(9000, new ResultsApiServerConfig(props,
        Collections.singletonMap(ResultsApiServerConfig.PORT_ENV, "")).port());
  }

  @Test(expected = ConfigException.class)
  public void testNonNumericPortEnvironment() {
    new ResultsApiServerConfig(Collections.emptyMap(),
        Collections.singletonMap(ResultsApiServerConfig.PORT_ENV, "http"));
  }

  @Test(expected = ConfigException.class)
  public void testPortOutOfRange() {
    new ResultsApiServerConfig(Collections.emptyMap(),
        Collections.singletonMap(ResultsApiServerConfig.PORT_ENV, "70000"));
  }
}
