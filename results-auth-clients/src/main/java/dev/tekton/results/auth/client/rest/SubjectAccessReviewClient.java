// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tekton.results.auth.client.AuthorityClientConfig;
import dev.tekton.results.auth.client.provider.BuiltInCredentialProviders;
import dev.tekton.results.auth.client.provider.CredentialProvider;
import dev.tekton.results.auth.client.rest.entities.ErrorStatus;
import dev.tekton.results.auth.client.rest.entities.SubjectAccessReview;
import dev.tekton.results.auth.client.rest.exceptions.RestClientException;
import dev.tekton.results.authorizer.utils.JsonMapper;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rest client for sending subject access reviews to the Kubernetes API server.
 */
public class SubjectAccessReviewClient implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(SubjectAccessReviewClient.class);

  static final String SUBJECT_ACCESS_REVIEW_END_POINT = "/apis/authorization.k8s.io/v1/subjectaccessreviews";

  private static final TypeReference<SubjectAccessReview> REVIEW_RESPONSE_TYPE =
      new TypeReference<SubjectAccessReview>() {
      };

  private final Time time;
  private final UrlSelector urlSelector;
  private final int requestTimeout;
  private final int httpRequestTimeout;
  private final int maxRetries;
  private final long retryBackoffMs;

  private SSLSocketFactory sslSocketFactory;
  private CredentialProvider credentialProvider;
  private RequestSender requestSender;

  public SubjectAccessReviewClient(final Map<String, ?> configs) {
    this(configs, Time.SYSTEM);
  }

  public SubjectAccessReviewClient(final Map<String, ?> configs, final Time time) {
    this.time = time;
    AuthorityClientConfig config = new AuthorityClientConfig(configs);
    this.urlSelector = new UrlSelector(config.getList(AuthorityClientConfig.AUTHORITY_URLS_PROP));
    this.requestTimeout = config.getInt(AuthorityClientConfig.REQUEST_TIMEOUT_MS_PROP);
    this.httpRequestTimeout = config.getInt(AuthorityClientConfig.HTTP_REQUEST_TIMEOUT_MS_PROP);
    this.maxRetries = config.getInt(AuthorityClientConfig.MAX_RETRIES_PROP);
    this.retryBackoffMs = config.getLong(AuthorityClientConfig.RETRY_BACKOFF_MS_PROP);

    credentialProvider = BuiltInCredentialProviders.loadCredentialProvider(
        config.getString(AuthorityClientConfig.CREDENTIALS_PROVIDER_PROP));
    credentialProvider.configure(config.values());

    String caCertPath = config.getString(AuthorityClientConfig.CA_CERT_PATH_PROP);
    if (caCertPath != null && !caCertPath.isEmpty())
      sslSocketFactory = createSslSocketFactory(caCertPath);

    requestSender = new HTTPRequestSender();
  }

  private static SSLSocketFactory createSslSocketFactory(String caCertPath) {
    try (InputStream in = new FileInputStream(caCertPath)) {
      KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
      trustStore.load(null, null);
      int i = 0;
      for (Certificate cert : CertificateFactory.getInstance("X.509").generateCertificates(in))
        trustStore.setCertificateEntry("ca-" + i++, cert);
      if (i == 0)
        throw new ConfigException(AuthorityClientConfig.CA_CERT_PATH_PROP, caCertPath, "No certificates found");

      TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      tmf.init(trustStore);
      SSLContext sslContext = SSLContext.getInstance("TLS");
      sslContext.init(null, tmf.getTrustManagers(), null);
      return sslContext.getSocketFactory();
    } catch (IOException | GeneralSecurityException e) {
      throw new ConfigException(AuthorityClientConfig.CA_CERT_PATH_PROP, caCertPath,
          "Could not load CA certificates: " + e.getMessage());
    }
  }

  /**
   * Sends a subject access review and returns the reviewed object with its status.
   *
   * @param review  review request
   * @param timeout maximum time in milliseconds for the review, including retries. The
   *                configured request timeout applies if it is shorter.
   * @throws TimeoutException if no answer was received in time
   */
  public SubjectAccessReview review(SubjectAccessReview review, long timeout)
      throws IOException, RestClientException {
    return httpRequest(SUBJECT_ACCESS_REVIEW_END_POINT,
        "POST",
        review.toJson().getBytes(StandardCharsets.UTF_8),
        REVIEW_RESPONSE_TYPE,
        Math.min(timeout, requestTimeout));
  }

  private <T> T httpRequest(String path,
                            String method,
                            byte[] requestBodyData,
                            TypeReference<T> responseFormat,
                            long timeout) throws IOException, RestClientException {
    List<String> urls = urlSelector.attemptOrder();
    long begin = time.milliseconds();
    long remainingWaitMs = timeout;

    for (int attempt = 0; ; attempt++) {
      String baseUrl = urls.get(attempt % urls.size());
      String requestUrl = buildRequestUrl(baseUrl, path);
      try {
        T response = requestSender.send(requestUrl,
            method,
            requestBodyData,
            responseFormat,
            remainingWaitMs);
        urlSelector.succeeded(baseUrl);
        return response;
      } catch (IOException e) {
        log.debug("Request to {} failed on attempt {}", requestUrl, attempt + 1, e);
        urlSelector.failed(baseUrl);
        if (attempt >= maxRetries)
          throw e;
      } catch (RestClientException e) {
        if (!e.retriable()) {
          urlSelector.succeeded(baseUrl);
          throw e;
        }
        log.debug("Request to {} failed on attempt {}: {}", requestUrl, attempt + 1, e.getMessage());
        urlSelector.failed(baseUrl);
        if (attempt >= maxRetries)
          throw e;
      }

      long elapsed = time.milliseconds() - begin;
      if (elapsed + retryBackoffMs >= timeout)
        throw new TimeoutException("Request aborted due to timeout after " + elapsed + " ms.");
      if (retryBackoffMs > 0)
        time.sleep(retryBackoffMs);
      remainingWaitMs = timeout - (time.milliseconds() - begin);
    }
  }

  private String buildRequestUrl(String baseUrl, String path) {
    // Join base URL and path, collapsing any duplicate forward slash delimiters
    return baseUrl.replaceFirst("/$", "") + "/" + path.replaceFirst("^/", "");
  }

  private void setupSsl(HttpURLConnection connection) {
    if (connection instanceof HttpsURLConnection && sslSocketFactory != null) {
      ((HttpsURLConnection) connection).setSSLSocketFactory(sslSocketFactory);
    }
  }

  private void setAuthorizationHeader(HttpURLConnection connection) {
    String header;
    if (credentialProvider != null && (header = credentialProvider.authorizationHeader()) != null) {
      connection.setRequestProperty("Authorization", header);
    }
  }

  public void credentialProvider(final CredentialProvider credentialProvider) {
    this.credentialProvider = credentialProvider;
  }

  void requestSender(RequestSender requestSender) {
    this.requestSender = requestSender;
  }

  @Override
  public void close() {
    if (requestSender instanceof HTTPRequestSender)
      ((HTTPRequestSender) requestSender).executor.shutdownNow();
  }

  private class HTTPRequestSender implements RequestSender {

    private final ObjectMapper objectMapper = JsonMapper.objectMapper();

    final ExecutorService executor = new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        1,
        TimeUnit.MINUTES,
        new SynchronousQueue<>(),
        r -> {
          Thread t = Executors.defaultThreadFactory().newThread(r);
          t.setName("authority-client-" + t.getName());
          t.setDaemon(true);
          return t;
        });

    @Override
    public <T> T send(final String requestUrl, final String method, final byte[] requestBodyData,
                      final TypeReference<T> responseFormat, final long requestTimeout)
        throws IOException, RestClientException {
      Future<T> f = submit(requestUrl, method, requestBodyData, responseFormat);
      try {
        return f.get(Math.min(requestTimeout, httpRequestTimeout), TimeUnit.MILLISECONDS);
      } catch (java.util.concurrent.TimeoutException e) {
        f.cancel(true);
        throw new IOException("No response from " + requestUrl + " within "
            + Math.min(requestTimeout, httpRequestTimeout) + " ms", e);
      } catch (InterruptedException e) {
        f.cancel(true);
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while waiting for " + requestUrl, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RestClientException) {
          throw (RestClientException) cause;
        } else if (cause instanceof IOException) {
          throw (IOException) cause;
        } else {
          throw new RuntimeException(cause);
        }
      }
    }

    private <T> Future<T> submit(final String requestUrl, final String method, final byte[] requestBodyData,
                                 final TypeReference<T> responseFormat) {
      return executor.submit(() -> {
        log.trace("Sending {} with input {} to {}", method,
            requestBodyData == null ? "null" : new String(requestBodyData, StandardCharsets.UTF_8), requestUrl);
        HttpURLConnection connection = null;
        try {
          URL url = new URL(requestUrl);
          connection = (HttpURLConnection) url.openConnection();

          connection.setConnectTimeout(httpRequestTimeout);
          connection.setReadTimeout(httpRequestTimeout);

          setupSsl(connection);
          connection.setRequestMethod(method);
          setAuthorizationHeader(connection);
          connection.setDoInput(true);
          connection.setRequestProperty("Content-Type", "application/json");
          connection.setRequestProperty("Accept", "application/json");
          connection.setUseCaches(false);

          if (requestBodyData != null) {
            connection.setDoOutput(true);
            try (OutputStream os = connection.getOutputStream()) {
              os.write(requestBodyData);
              os.flush();
            }
          }

          int responseCode = connection.getResponseCode();
          if (responseCode == HttpURLConnection.HTTP_OK || responseCode == HttpURLConnection.HTTP_CREATED) {
            try (InputStream is = connection.getInputStream()) {
              return objectMapper.readValue(is, responseFormat);
            }
          } else {
            ErrorStatus errorStatus;
            try (InputStream es = connection.getErrorStream()) {
              errorStatus = es == null ? new ErrorStatus(responseCode, null, connection.getResponseMessage())
                  : objectMapper.readValue(es, ErrorStatus.class);
            } catch (JsonProcessingException e) {
              errorStatus = new ErrorStatus(responseCode, null, e.getMessage());
            }
            throw new RestClientException(String.valueOf(errorStatus.message()), responseCode,
                errorStatus.reason());
          }
        } finally {
          if (connection != null) {
            connection.disconnect();
          }
        }
      });
    }
  }
}
