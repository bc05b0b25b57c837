// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import static org.apache.kafka.common.config.ConfigDef.Range.between;

import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;

public class ResultsApiServerConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  /**
   * Environment variable that overrides {@link #LISTENER_PORT_PROP}.
   */
  public static final String PORT_ENV = "PORT";

  public static final String LISTENER_PORT_PROP = "listener.port";
  private static final int LISTENER_PORT_DEFAULT = 50051;
  private static final String LISTENER_PORT_DOC = "The port of the gRPC listener. The " + PORT_ENV
      + " environment variable takes precedence if it is set.";

  public static final String TLS_ENABLED_PROP = "tls.enabled";
  private static final String TLS_ENABLED_DOC = "Boolean flag that indicates if the listener uses TLS.";

  public static final String TLS_CERT_PATH_PROP = "tls.cert.path";
  private static final String TLS_CERT_PATH_DEFAULT = "/etc/tls/tls.crt";
  private static final String TLS_CERT_PATH_DOC = "Path of the PEM certificate chain of the listener.";

  public static final String TLS_KEY_PATH_PROP = "tls.key.path";
  private static final String TLS_KEY_PATH_DEFAULT = "/etc/tls/tls.key";
  private static final String TLS_KEY_PATH_DOC = "Path of the PEM private key of the listener.";

  public static final String TLS_CLIENT_CA_PATH_PROP = "tls.client.ca.path";
  private static final String TLS_CLIENT_CA_PATH_DOC = "Path of a PEM bundle of CA certificates used"
      + " to verify client certificates. If set, clients may authenticate with a certificate.";

  public static final String SHUTDOWN_TIMEOUT_MS_PROP = "shutdown.timeout.ms";
  private static final String SHUTDOWN_TIMEOUT_MS_DOC = "The maximum time to wait for in-flight"
      + " calls to complete on shutdown.";

  static {
    CONFIG = new ConfigDef()
        .define(LISTENER_PORT_PROP, Type.INT, LISTENER_PORT_DEFAULT, between(0, 65535),
            Importance.HIGH, LISTENER_PORT_DOC)
        .define(TLS_ENABLED_PROP, Type.BOOLEAN, true, Importance.HIGH, TLS_ENABLED_DOC)
        .define(TLS_CERT_PATH_PROP, Type.STRING, TLS_CERT_PATH_DEFAULT, Importance.HIGH, TLS_CERT_PATH_DOC)
        .define(TLS_KEY_PATH_PROP, Type.STRING, TLS_KEY_PATH_DEFAULT, Importance.HIGH, TLS_KEY_PATH_DOC)
        .define(TLS_CLIENT_CA_PATH_PROP, Type.STRING, null, Importance.MEDIUM, TLS_CLIENT_CA_PATH_DOC)
        .define(SHUTDOWN_TIMEOUT_MS_PROP, Type.LONG, 10000L, Importance.LOW, SHUTDOWN_TIMEOUT_MS_DOC);
  }

  public ResultsApiServerConfig(Map<?, ?> props) {
    this(props, System.getenv());
  }

  public ResultsApiServerConfig(Map<?, ?> props, Map<String, String> env) {
    super(CONFIG, withEnvOverrides(props, env));
  }

  private static Map<Object, Object> withEnvOverrides(Map<?, ?> props, Map<String, String> env) {
    Map<Object, Object> merged = new HashMap<>(props);
    String port = env.get(PORT_ENV);
    if (port != null && !port.trim().isEmpty()) {
      try {
        merged.put(LISTENER_PORT_PROP, Integer.parseInt(port.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigException(PORT_ENV, port, "Port must be a number");
      }
    }
    return merged;
  }

  public int port() {
    return getInt(LISTENER_PORT_PROP);
  }

  public boolean tlsEnabled() {
    return getBoolean(TLS_ENABLED_PROP);
  }

  @Override
  public String toString() {
    return Utils.mkString(values(), "", "", "=", "%n\t");
  }

  public static void main(String[] args) throws Exception {
    try (PrintStream out = args.length == 0 ? System.out
        : new PrintStream(new FileOutputStream(args[0]), false, StandardCharsets.UTF_8.name())) {
      out.println(CONFIG.toHtmlTable());
      if (out != System.out) {
        out.close();
      }
    }
  }
}
