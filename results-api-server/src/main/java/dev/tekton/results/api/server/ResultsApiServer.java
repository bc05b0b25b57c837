// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.api.server;

import static net.sourceforge.argparse4j.impl.Arguments.store;

import dev.tekton.results.api.v1alpha2.ResultsGrpc;
import dev.tekton.results.auth.client.SubjectAccessReviewAuthorizer;
import dev.tekton.results.authorizer.AuthorizationGate;
import dev.tekton.results.authorizer.Authorizer;
import dev.tekton.results.authorizer.ResultsAuthorizerConfig;
import dev.tekton.results.authorizer.mapping.ResourceMapper;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerCredentials;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.TlsServerCredentials;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Exit;
import org.apache.kafka.common.utils.Time;
import org.apache.kafka.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The gRPC server of the Results API. Every call to the Results service passes the
 * authorization gate. The health and reflection services are not gated.
 */
public class ResultsApiServer implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(ResultsApiServer.class);

  private final ResultsApiServerConfig config;
  private final AuthorizationGate gate;
  private final HealthStatusManager health;
  private final Server server;

  public ResultsApiServer(ResultsApiServerConfig config, AuthorizationGate gate, ResultsHandler handler) {
    this.config = config;
    this.gate = gate;
    this.health = new HealthStatusManager();
    this.server = Grpc.newServerBuilderForPort(config.port(), serverCredentials(config))
        .addService(gatedService(gate, handler))
        .addService(health.getHealthService())
        .addService(ProtoReflectionService.newInstance())
        .build();
  }

  /**
   * Returns the Results service with the authorization gate in front of it.
   *
   * @throws ConfigException if a method of the service has no authorization mapping
   */
  public static ServerServiceDefinition gatedService(AuthorizationGate gate, ResultsHandler handler) {
    gate.resourceMapper().verifyCovers(ResultsService.methodNames());
    return ServerInterceptors.intercept(new ResultsService(handler),
        new AuthorizationInterceptor(gate));
  }

  private static ServerCredentials serverCredentials(ResultsApiServerConfig config) {
    if (!config.tlsEnabled()) {
      log.warn("TLS is disabled, credentials are sent in plaintext");
      return InsecureServerCredentials.create();
    }
    String certPath = config.getString(ResultsApiServerConfig.TLS_CERT_PATH_PROP);
    String keyPath = config.getString(ResultsApiServerConfig.TLS_KEY_PATH_PROP);
    String clientCaPath = config.getString(ResultsApiServerConfig.TLS_CLIENT_CA_PATH_PROP);
    try {
      TlsServerCredentials.Builder builder = TlsServerCredentials.newBuilder()
          .keyManager(new File(certPath), new File(keyPath));
      if (clientCaPath != null && !clientCaPath.isEmpty()) {
        builder.trustManager(new File(clientCaPath))
            .clientAuth(TlsServerCredentials.ClientAuth.OPTIONAL);
      }
      return builder.build();
    } catch (IOException | RuntimeException e) {
      throw new ConfigException("Could not load TLS credentials from " + certPath + " and " + keyPath
          + ": " + e.getMessage());
    }
  }

  public void start() throws IOException {
    server.start();
    health.setStatus(ResultsGrpc.SERVICE_NAME, ServingStatus.SERVING);
    log.info("Results API listening on port {}", server.getPort());
  }

  public int port() {
    return server.getPort();
  }

  public void awaitTermination() throws InterruptedException {
    server.awaitTermination();
  }

  @Override
  public void close() throws IOException {
    health.enterTerminalState();
    server.shutdown();
    try {
      long timeoutMs = config.getLong(ResultsApiServerConfig.SHUTDOWN_TIMEOUT_MS_PROP);
      if (!server.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        log.warn("Calls still in progress after {} ms, cancelling them", timeoutMs);
        server.shutdownNow();
      }
    } catch (InterruptedException e) {
      server.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      gate.close();
    }
  }

  /**
   * Builds the server with the Kubernetes API server as authority and the in-memory
   * results handler.
   */
  public static ResultsApiServer create(Properties props, Time time) {
    Map<String, Object> configs = new HashMap<>();
    props.stringPropertyNames().forEach(name -> configs.put(name, props.getProperty(name)));

    ResultsAuthorizerConfig authorizerConfig = new ResultsAuthorizerConfig(configs);
    ResultsApiServerConfig serverConfig = new ResultsApiServerConfig(configs);
    ResourceMapper resourceMapper = ResultsAuthorizationMappings.create();
    Authorizer authorizer = new SubjectAccessReviewAuthorizer(configs);
    AuthorizationGate gate = new AuthorizationGate(
        authorizerConfig.createIdentityExtractor(time),
        resourceMapper,
        authorizer,
        authorizerConfig.createDecisionCache(time),
        authorizerConfig.callTimeout);
    try {
      return new ResultsApiServer(serverConfig, gate, new InMemoryResultsHandler(time));
    } catch (RuntimeException e) {
      Utils.closeQuietly(gate, "authorization gate");
      throw e;
    }
  }

  public static void main(String[] args) throws Exception {
    ArgumentParser parser = ArgumentParsers
        .newFor("results-api").build()
        .defaultHelp(true)
        .description("The Tekton Results API server");
    parser.addArgument("conf")
        .action(store())
        .required(true)
        .type(String.class)
        .dest("conf")
        .metavar("CONF")
        .help("The server configuration file to use.");

    Namespace res = null;
    try {
      res = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      if (args.length == 0) {
        parser.printHelp();
        Exit.exit(0);
      } else {
        parser.handleError(e);
        Exit.exit(1);
      }
    }
    String configPath = res.getString("conf");
    Properties props = Utils.loadProps(configPath);
    ResultsApiServer server = create(props, Time.SYSTEM);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.warn("Running Results API shutdown hook.");
      try {
        server.close();
      } catch (Exception e) {
        log.error("Got exception while running Results API shutdown hook.", e);
      }
    }));
    server.start();
    server.awaitTermination();
  }
}
