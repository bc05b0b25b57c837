// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.auth.client;

import dev.tekton.results.auth.client.rest.SubjectAccessReviewClient;
import dev.tekton.results.auth.client.rest.entities.SubjectAccessReview;
import dev.tekton.results.auth.client.rest.entities.SubjectAccessReviewStatus;
import dev.tekton.results.auth.client.rest.exceptions.RestClientException;
import dev.tekton.results.authorizer.AuthorizationTuple;
import dev.tekton.results.authorizer.Authorizer;
import dev.tekton.results.authorizer.CallIdentity;
import dev.tekton.results.authorizer.Decision;
import dev.tekton.results.authorizer.errors.AuthorityUnavailableException;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authorizer that asks the Kubernetes API server for each decision using
 * SubjectAccessReviews, so that Results access follows the cluster's RBAC role bindings.
 */
public class SubjectAccessReviewAuthorizer implements Authorizer {
  private static final Logger log = LoggerFactory.getLogger(SubjectAccessReviewAuthorizer.class);

  private final SubjectAccessReviewClient client;

  public SubjectAccessReviewAuthorizer(Map<String, ?> configs) {
    this(new SubjectAccessReviewClient(configs, Time.SYSTEM));
  }

  public SubjectAccessReviewAuthorizer(SubjectAccessReviewClient client) {
    this.client = client;
  }

  @Override
  public Decision authorize(CallIdentity identity, AuthorizationTuple tuple, Duration timeout) {
    SubjectAccessReview response;
    try {
      response = client.review(SubjectAccessReview.request(identity, tuple), timeout.toMillis());
    } catch (IOException | RestClientException | KafkaException e) {
      throw new AuthorityUnavailableException("Subject access review for " + identity + " on " + tuple
          + " failed: " + e.getMessage(), e);
    }

    SubjectAccessReviewStatus status = response == null ? null : response.status();
    if (status == null)
      throw new AuthorityUnavailableException("Subject access review for " + identity + " on " + tuple
          + " returned no status");
    if (status.evaluationError() != null && !status.evaluationError().isEmpty())
      log.debug("Subject access review for {} on {} had evaluation errors: {}", identity, tuple,
          status.evaluationError());

    if (status.allowed() && !status.denied())
      return Decision.allow(status.reason());
    return Decision.deny(status.reason() == null || status.reason().isEmpty()
        ? "no RBAC rule allows " + tuple : status.reason());
  }

  @Override
  public void close() {
    client.close();
  }
}
