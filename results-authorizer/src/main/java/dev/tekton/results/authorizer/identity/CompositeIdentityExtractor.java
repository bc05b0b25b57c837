// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.identity;

import dev.tekton.results.authorizer.CallIdentity;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tries a list of extractors in order and returns the first identity found. A malformed
 * credential seen by any extractor fails the call, later extractors are not consulted.
 */
public class CompositeIdentityExtractor implements IdentityExtractor {

  private final List<IdentityExtractor> extractors;

  public CompositeIdentityExtractor(List<IdentityExtractor> extractors) {
    if (extractors.isEmpty())
      throw new IllegalArgumentException("At least one identity extractor must be provided");
    this.extractors = new ArrayList<>(extractors);
  }

  @Override
  public String extractorName() {
    return extractors.stream()
        .map(IdentityExtractor::extractorName)
        .collect(Collectors.joining(","));
  }

  @Override
  public Optional<CallIdentity> extract(TransportContext context) {
    for (IdentityExtractor extractor : extractors) {
      Optional<CallIdentity> identity = extractor.extract(context);
      if (identity.isPresent())
        return identity;
    }
    return Optional.empty();
  }
}
