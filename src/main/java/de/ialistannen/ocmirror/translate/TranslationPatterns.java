package de.ialistannen.ocmirror.translate;

import de.ialistannen.ocmirror.image.ImageReference;
import java.util.List;

/**
 * Well known registries OpenShift release and operator content is published to.
 */
public final class TranslationPatterns {

  /**
   * Anchored endpoint patterns. A translated endpoint must never match one of these again, so pointing them at a
   * mirror is stable under repeated translation.
   */
  public static final List<String> DEFAULT = List.of(
    "^quay\\.io$",
    "^registry\\.redhat\\.io$",
    "^registry\\.access\\.redhat\\.com$",
    "^registry\\.connect\\.redhat\\.com$",
    "^registry\\.stage\\.redhat\\.io$"
  );

  private TranslationPatterns() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Builds a translator redirecting every well known registry to a single endpoint.
   *
   * @param endpoint the endpoint to redirect to
   * @return the translator
   */
  public static EndpointTranslator forEndpoint(String endpoint) {
    return new EndpointTranslator(
      DEFAULT.stream()
        .map(pattern -> RegexSubstitution.of(pattern, endpoint))
        .toList()
    );
  }

  /**
   * Builds a translator redirecting every well known registry to the registry an image lives in. Unqualified images
   * live in {@value ImageReference#DEFAULT_ENDPOINT}.
   *
   * @param image the image whose registry to redirect to
   * @return the translator
   */
  public static EndpointTranslator forImage(ImageReference image) {
    return forEndpoint(image.resolveEndpoint());
  }
}
