package de.ialistannen.ocmirror.translate;

import de.ialistannen.ocmirror.image.ImageReference;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites registry endpoints using an ordered list of substitutions. The first matching rule wins, later rules are
 * never consulted.
 */
public class EndpointTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(EndpointTranslator.class);

  private final List<RegexSubstitution> substitutions;

  public EndpointTranslator(List<RegexSubstitution> substitutions) {
    this.substitutions = List.copyOf(substitutions);
  }

  /**
   * @param endpoint the endpoint to translate
   * @return the translated endpoint, or the input if no rule matched
   */
  public String translate(String endpoint) {
    for (RegexSubstitution substitution : substitutions) {
      Optional<String> result = substitution.apply(endpoint);
      if (result.isPresent()) {
        LOGGER.trace("Translated '{}' to '{}' via {}", endpoint, result.get(), substitution);
        return result.get();
      }
    }
    return endpoint;
  }

  /**
   * Translates the endpoint of a reference. Unqualified references are left alone.
   *
   * @param reference the reference
   * @return a reference with a translated endpoint
   */
  public ImageReference translate(ImageReference reference) {
    if (reference.endpoint() == null) {
      return reference;
    }
    return reference.withEndpoint(translate(reference.endpoint()));
  }

  public List<RegexSubstitution> substitutions() {
    return substitutions;
  }
}
