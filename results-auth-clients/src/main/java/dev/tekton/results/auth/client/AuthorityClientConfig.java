// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;

import dev.tekton.results.auth.client.provider.BuiltInCredentialProviders;
import dev.tekton.results.auth.client.provider.BuiltInCredentialProviders.CredentialProviders;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;

public class AuthorityClientConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  public static final String AUTHORITY_URLS_PROP = "authority.urls";
  private static final String AUTHORITY_URLS_DEFAULT = "https://kubernetes.default.svc";
  private static final String AUTHORITY_URLS_DOC = "Comma separated list of Kubernetes API server urls"
      + " that answer subject access reviews. For ex: https://10.0.0.1:6443,https://10.0.0.2:6443";

  public static final String CREDENTIALS_PROVIDER_PROP = "authority.credentials.provider";
  public static final String CREDENTIALS_PROVIDER_DEFAULT = CredentialProviders.TOKEN_FILE.name();
  private static final String CREDENTIALS_PROVIDER_DOC = "Credentials used to authenticate to the"
      + " API server. Supported providers are " + BuiltInCredentialProviders.builtInCredentialProviders()
      + ". The in-cluster service account token is used by default.";

  public static final String TOKEN_PATH_PROP = "authority.token.path";
  public static final String TOKEN_PATH_DEFAULT = "/var/run/secrets/kubernetes.io/serviceaccount/token";
  private static final String TOKEN_PATH_DOC = "Path of the bearer token file used by the "
      + CredentialProviders.TOKEN_FILE.name() + " provider. The file is read for every request.";

  public static final String BASIC_AUTH_USER_INFO_PROP = "authority.basic.auth.user.info";
  private static final String BASIC_AUTH_USER_INFO_DOC = "Basic user credentials info in the format"
      + " user:password. This is required for " + CredentialProviders.USER_INFO.name() + " provider.";

  public static final String CA_CERT_PATH_PROP = "authority.ca.cert.path";
  private static final String CA_CERT_PATH_DOC = "Path of a PEM bundle of CA certificates trusted for"
      + " https connections to the API server. The JVM trust store is used if not set.";

  public static final String REQUEST_TIMEOUT_MS_PROP = "authority.request.timeout.ms";
  private static final String REQUEST_TIMEOUT_MS_DOC = "The maximum amount of time the client will wait"
      + " for the decision of each authorization request, including retries. Callers may impose a"
      + " shorter limit.";

  public static final String HTTP_REQUEST_TIMEOUT_MS_PROP = "authority.http.request.timeout.ms";
  private static final String HTTP_REQUEST_TIMEOUT_MS_DOC = "The maximum amount of time the client will"
      + " wait for the response of a single http request. This value should be less than or equal to "
      + REQUEST_TIMEOUT_MS_PROP + " config";

  public static final String MAX_RETRIES_PROP = "authority.max.retries";
  private static final String MAX_RETRIES_DOC = "The number of times a failed request is retried,"
      + " rotating through the configured urls.";

  public static final String RETRY_BACKOFF_MS_PROP = "authority.retry.backoff.ms";
  private static final String RETRY_BACKOFF_MS_DOC = "The amount of time to wait before retrying a"
      + " failed request.";

  static {
    CONFIG = new ConfigDef()
        .define(AUTHORITY_URLS_PROP, Type.LIST, AUTHORITY_URLS_DEFAULT, Importance.HIGH,
            AUTHORITY_URLS_DOC)
        .define(CREDENTIALS_PROVIDER_PROP, Type.STRING, CREDENTIALS_PROVIDER_DEFAULT, Importance.HIGH,
            CREDENTIALS_PROVIDER_DOC)
        .define(TOKEN_PATH_PROP, Type.STRING, TOKEN_PATH_DEFAULT, Importance.MEDIUM, TOKEN_PATH_DOC)
        .define(BASIC_AUTH_USER_INFO_PROP, Type.STRING, null, Importance.MEDIUM,
            BASIC_AUTH_USER_INFO_DOC)
        .define(CA_CERT_PATH_PROP, Type.STRING, null, Importance.MEDIUM, CA_CERT_PATH_DOC)
        .define(REQUEST_TIMEOUT_MS_PROP, Type.INT, 2000, atLeast(1), Importance.MEDIUM,
            REQUEST_TIMEOUT_MS_DOC)
        .define(HTTP_REQUEST_TIMEOUT_MS_PROP, Type.INT, 1000, atLeast(1), Importance.MEDIUM,
            HTTP_REQUEST_TIMEOUT_MS_DOC)
        .define(MAX_RETRIES_PROP, Type.INT, 2, atLeast(0), Importance.LOW, MAX_RETRIES_DOC)
        .define(RETRY_BACKOFF_MS_PROP, Type.LONG, 100L, atLeast(0), Importance.LOW,
            RETRY_BACKOFF_MS_DOC);
  }

  public AuthorityClientConfig(Map<?, ?> props) {
    super(CONFIG, props);
    validate();
  }

  private void validate() {
    if (getList(AUTHORITY_URLS_PROP).isEmpty())
      throw new ConfigException("Missing required authority url list.");
    if (getInt(HTTP_REQUEST_TIMEOUT_MS_PROP) > getInt(REQUEST_TIMEOUT_MS_PROP))
      throw new ConfigException(HTTP_REQUEST_TIMEOUT_MS_PROP
          + " config value should be less than or equal to " + REQUEST_TIMEOUT_MS_PROP);
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
