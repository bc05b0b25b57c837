// (Copyright) [2018 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;

import dev.tekton.results.authorizer.cache.DecisionCache;
import dev.tekton.results.authorizer.identity.BuiltInIdentityExtractors;
import dev.tekton.results.authorizer.identity.BuiltInIdentityExtractors.IdentityExtractors;
import dev.tekton.results.authorizer.identity.IdentityExtractor;
import dev.tekton.results.authorizer.utils.PemUtils;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Duration;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Time;
import org.apache.kafka.common.utils.Utils;

public class ResultsAuthorizerConfig extends AbstractConfig {

  private static final ConfigDef CONFIG;

  public static final String CALL_TIMEOUT_PROP = "authorizer.call.timeout.ms";
  private static final int CALL_TIMEOUT_DEFAULT = 2000;
  private static final String CALL_TIMEOUT_DOC = "The maximum number of milliseconds a call waits"
      + " for the RBAC authority. Calls are denied if the authority does not answer in time.";

  public static final String CACHE_ENABLED_PROP = "authorizer.cache.enabled";
  private static final boolean CACHE_ENABLED_DEFAULT = true;
  private static final String CACHE_ENABLED_DOC = "Boolean flag that indicates if authority decisions"
      + " are cached per identity and resource.";

  public static final String CACHE_ALLOW_TTL_PROP = "authorizer.cache.allow.ttl.ms";
  private static final long CACHE_ALLOW_TTL_DEFAULT = 5000L;
  private static final String CACHE_ALLOW_TTL_DOC = "The number of milliseconds an allow decision"
      + " is cached. Allow decisions are never used after this time has elapsed.";

  public static final String CACHE_DENY_TTL_PROP = "authorizer.cache.deny.ttl.ms";
  private static final String CACHE_DENY_TTL_DOC = "The number of milliseconds a deny decision"
      + " is cached. Defaults to " + CACHE_ALLOW_TTL_PROP + ".";

  public static final String CACHE_MAX_ENTRIES_PROP = "authorizer.cache.max.entries";
  private static final long CACHE_MAX_ENTRIES_DEFAULT = 10000L;
  private static final String CACHE_MAX_ENTRIES_DOC = "The maximum number of cached decisions"
      + " of each kind.";

  public static final String IDENTITY_EXTRACTORS_PROP = "authorizer.identity.extractors";
  private static final String IDENTITY_EXTRACTORS_DEFAULT =
      IdentityExtractors.BEARER_TOKEN.name() + "," + IdentityExtractors.PEER_CERTIFICATE.name();
  private static final String IDENTITY_EXTRACTORS_DOC = "Ordered list of identity extractors used"
      + " to identify callers. Supported extractors are "
      + BuiltInIdentityExtractors.builtInIdentityExtractors() + ".";

  public static final String TOKEN_PUBLIC_KEY_PATH_PROP = "authorizer.token.public.key.path";
  private static final String TOKEN_PUBLIC_KEY_PATH_DOC = "Path of a PEM public key or certificate"
      + " used to verify the signature of bearer tokens. If not set, token signatures are"
      + " expected to have been verified upstream.";

  static {
    CONFIG = new ConfigDef()
        .define(CALL_TIMEOUT_PROP, Type.INT, CALL_TIMEOUT_DEFAULT,
            atLeast(1), Importance.MEDIUM, CALL_TIMEOUT_DOC)
        .define(CACHE_ENABLED_PROP, Type.BOOLEAN, CACHE_ENABLED_DEFAULT,
            Importance.MEDIUM, CACHE_ENABLED_DOC)
        .define(CACHE_ALLOW_TTL_PROP, Type.LONG, CACHE_ALLOW_TTL_DEFAULT,
            atLeast(0), Importance.MEDIUM, CACHE_ALLOW_TTL_DOC)
        .define(CACHE_DENY_TTL_PROP, Type.LONG, null,
            Importance.LOW, CACHE_DENY_TTL_DOC)
        .define(CACHE_MAX_ENTRIES_PROP, Type.LONG, CACHE_MAX_ENTRIES_DEFAULT,
            atLeast(1), Importance.LOW, CACHE_MAX_ENTRIES_DOC)
        .define(IDENTITY_EXTRACTORS_PROP, Type.LIST, IDENTITY_EXTRACTORS_DEFAULT,
            Importance.HIGH, IDENTITY_EXTRACTORS_DOC)
        .define(TOKEN_PUBLIC_KEY_PATH_PROP, Type.STRING, null,
            Importance.MEDIUM, TOKEN_PUBLIC_KEY_PATH_DOC);
  }

  public final Duration callTimeout;
  public final boolean cacheEnabled;
  public final Duration cacheAllowTtl;
  public final Duration cacheDenyTtl;

  public ResultsAuthorizerConfig(Map<?, ?> props) {
    super(CONFIG, props);

    if (getList(IDENTITY_EXTRACTORS_PROP).isEmpty())
      throw new ConfigException("No identity extractors specified");

    callTimeout = Duration.ofMillis(getInt(CALL_TIMEOUT_PROP));
    cacheEnabled = getBoolean(CACHE_ENABLED_PROP);
    cacheAllowTtl = Duration.ofMillis(getLong(CACHE_ALLOW_TTL_PROP));
    Long denyTtl = getLong(CACHE_DENY_TTL_PROP);
    if (denyTtl != null && denyTtl < 0)
      throw new ConfigException(CACHE_DENY_TTL_PROP, denyTtl, "Value must be at least 0");
    cacheDenyTtl = denyTtl == null ? cacheAllowTtl : Duration.ofMillis(denyTtl);
  }

  public final IdentityExtractor createIdentityExtractor(Time time) {
    return BuiltInIdentityExtractors.create(getList(IDENTITY_EXTRACTORS_PROP),
        tokenVerificationKey(), time);
  }

  /**
   * Returns the decision cache, or null if caching is disabled.
   */
  public final DecisionCache createDecisionCache(Time time) {
    if (!cacheEnabled)
      return null;
    return new DecisionCache(cacheAllowTtl, cacheDenyTtl, getLong(CACHE_MAX_ENTRIES_PROP), time);
  }

  private PublicKey tokenVerificationKey() {
    String path = getString(TOKEN_PUBLIC_KEY_PATH_PROP);
    if (path == null || path.isEmpty())
      return null;
    try (InputStream in = new FileInputStream(path)) {
      return PemUtils.loadPublicKey(in);
    } catch (IOException | RuntimeException e) {
      throw new ConfigException(TOKEN_PUBLIC_KEY_PATH_PROP, path,
          "Could not load the token public key: " + e.getMessage());
    }
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
