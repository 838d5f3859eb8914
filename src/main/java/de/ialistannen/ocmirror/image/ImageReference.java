package de.ialistannen.ocmirror.image;

import java.util.Objects;

/**
 * A reference to an image in a registry: {@code [endpoint/]repository[:tag][@digest]}.
 * <p>
 * References are immutable; the {@code with*} methods derive copies. Two references are equal iff their string
 * forms match.
 *
 * @param endpoint the registry host (and port), null if the reference is unqualified
 * @param repository the repository path inside the registry
 * @param tag the tag, may be null
 * @param digest the manifest digest, may be null
 */
public record ImageReference(String endpoint, String repository, String tag, BlobDigest digest) {

  public static final String DEFAULT_ENDPOINT = "index.docker.io";
  public static final String DEFAULT_TAG = "latest";

  public ImageReference {
    if (repository == null || repository.isBlank()) {
      throw new IllegalArgumentException("Repository must not be empty");
    }
    if (endpoint != null && endpoint.isBlank()) {
      endpoint = null;
    }
  }

  /**
   * Converts a string of the form {@code [endpoint/]repository[:tag][@digest]} to an {@link ImageReference}.
   *
   * @param asString the image string
   * @return the created reference
   * @throws IllegalArgumentException if the string is not a valid reference
   */
  public static ImageReference parse(String asString) {
    String rest = asString.trim();

    BlobDigest digest = null;
    int digestStart = rest.indexOf('@');
    if (digestStart >= 0) {
      digest = BlobDigest.parse(rest.substring(digestStart + 1));
      rest = rest.substring(0, digestStart);
    }

    String tag = null;
    int imageStart = rest.lastIndexOf('/');
    int tagStart = rest.lastIndexOf(':');
    if (tagStart > imageStart) {
      tag = rest.substring(tagStart + 1);
      rest = rest.substring(0, tagStart);
    }

    String endpoint = null;
    int firstSlash = rest.indexOf('/');
    if (firstSlash > 0) {
      String head = rest.substring(0, firstSlash);
      if (head.contains(".") || head.contains(":") || head.equals("localhost")) {
        endpoint = head;
        rest = rest.substring(firstSlash + 1);
      }
    }

    return new ImageReference(endpoint, rest, tag, digest);
  }

  public ImageReference withEndpoint(String newEndpoint) {
    return new ImageReference(newEndpoint, repository, tag, digest);
  }

  public ImageReference withTag(String newTag) {
    return new ImageReference(endpoint, repository, newTag, digest);
  }

  public ImageReference withDigest(BlobDigest newDigest) {
    return new ImageReference(endpoint, repository, tag, newDigest);
  }

  /**
   * @return the endpoint used to talk to the registry, {@value DEFAULT_ENDPOINT} for unqualified references
   */
  public String resolveEndpoint() {
    if (endpoint == null || endpoint.equals("docker.io")) {
      return DEFAULT_ENDPOINT;
    }
    return endpoint;
  }

  /**
   * @return the repository as the registry API expects it, with the implicit {@code library/} prefix for official
   *   docker hub images
   */
  public String resolveRepository() {
    if (resolveEndpoint().equals(DEFAULT_ENDPOINT) && !repository.contains("/")) {
      return "library/" + repository;
    }
    return repository;
  }

  /**
   * @return the tag or digest to address the manifest with; the digest wins if both are present
   */
  public String resolveManifestReference() {
    if (digest != null) {
      return digest.toString();
    }
    return Objects.requireNonNullElse(tag, DEFAULT_TAG);
  }

  /**
   * @return the fully qualified name, with the default endpoint and tag filled in
   */
  public String resolveName() {
    String name = resolveEndpoint() + "/" + resolveRepository();
    if (digest != null) {
      return name + (tag != null ? ":" + tag : "") + "@" + digest;
    }
    return name + ":" + Objects.requireNonNullElse(tag, DEFAULT_TAG);
  }

  /**
   * Returns the repository namespace ({@code endpoint/repository}) used to track where a blob originates from.
   *
   * @return the namespace
   */
  public String namespace() {
    return endpoint == null ? repository : endpoint + "/" + repository;
  }

  /**
   * Compares two references without considering their endpoints.
   *
   * @param other the other reference
   * @return true if both references are equal apart from their endpoint
   */
  public boolean equalsUnqualified(ImageReference other) {
    return withEndpoint(null).toString().equals(other.withEndpoint(null).toString());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImageReference)) {
      return false;
    }
    return toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    if (endpoint != null) {
      result.append(endpoint).append('/');
    }
    result.append(repository);
    if (tag != null) {
      result.append(':').append(tag);
    }
    if (digest != null) {
      result.append('@').append(digest);
    }
    return result.toString();
  }
}
