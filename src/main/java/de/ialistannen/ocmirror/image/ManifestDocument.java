package de.ialistannen.ocmirror.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A manifest exactly as the registry served it. The raw bytes are kept so the manifest can be replicated without
 * changing its digest.
 */
public final class ManifestDocument {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final byte[] raw;
  private final String mediaType;
  private final BlobDigest digest;
  private final JsonNode root;

  private ManifestDocument(byte[] raw, String mediaType, JsonNode root) {
    this.raw = raw;
    this.mediaType = mediaType;
    this.root = root;
    this.digest = BlobDigest.of(raw);
  }

  /**
   * Decodes a manifest.
   *
   * @param raw the raw manifest bytes
   * @param contentType the content type the registry reported, may be null
   * @return the decoded manifest
   * @throws UncheckedIOException if the manifest is no valid json
   */
  public static ManifestDocument parse(byte[] raw, String contentType) {
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(raw);
    } catch (IOException e) {
      throw new UncheckedIOException("Manifest is not valid json", e);
    }

    String mediaType = root.path("mediaType").asText(null);
    if (mediaType == null && contentType != null && !contentType.isBlank()) {
      mediaType = contentType.split(";")[0].trim();
    }
    if (mediaType == null) {
      mediaType = root.has("manifests") ? MediaTypes.OCI_IMAGE_INDEX_V1 : MediaTypes.OCI_IMAGE_MANIFEST_V1;
    }

    return new ManifestDocument(raw.clone(), mediaType, root);
  }

  public byte[] raw() {
    return raw.clone();
  }

  public String mediaType() {
    return mediaType;
  }

  /**
   * @return the sha256 digest of the raw bytes
   */
  public BlobDigest digest() {
    return digest;
  }

  public boolean isList() {
    return MediaTypes.isList(mediaType) || root.has("manifests");
  }

  /**
   * @return the config blob of an image manifest
   */
  public Optional<BlobDigest> config() {
    JsonNode config = root.path("config").path("digest");
    if (config.isMissingNode() || config.isNull()) {
      return Optional.empty();
    }
    return Optional.of(BlobDigest.parse(config.asText()));
  }

  /**
   * @return the layers of an image manifest, base layer first
   */
  public List<BlobDigest> layers() {
    List<BlobDigest> layers = new ArrayList<>();
    for (JsonNode layer : root.path("layers")) {
      layers.add(BlobDigest.parse(layer.path("digest").asText()));
    }
    return layers;
  }

  /**
   * @return the config followed by all layers
   */
  public List<BlobDigest> blobs() {
    List<BlobDigest> blobs = new ArrayList<>();
    config().ifPresent(blobs::add);
    blobs.addAll(layers());
    return blobs;
  }

  /**
   * @return the entries of a manifest list
   */
  public List<Entry> entries() {
    List<Entry> entries = new ArrayList<>();
    for (JsonNode manifest : root.path("manifests")) {
      JsonNode platform = manifest.path("platform");
      entries.add(new Entry(
        BlobDigest.parse(manifest.path("digest").asText()),
        manifest.path("mediaType").asText(null),
        platform.isMissingNode()
          ? null
          : new Platform(
            platform.path("os").asText(),
            platform.path("architecture").asText(),
            platform.path("variant").asText(null)
          )
      ));
    }
    return entries;
  }

  /**
   * Selects the entry of a manifest list matching the given platform.
   *
   * @param platform the wanted platform
   * @return the matching entry, if any
   */
  public Optional<Entry> entryFor(Platform platform) {
    return entries().stream()
      .filter(it -> platform.matches(it.platform()))
      .findFirst();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ManifestDocument that)) {
      return false;
    }
    return Arrays.equals(raw, that.raw) && mediaType.equals(that.mediaType);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "ManifestDocument{" + mediaType + ", " + digest + "}";
  }

  /**
   * An entry of a manifest list.
   *
   * @param digest the digest of the referenced manifest
   * @param mediaType the media type of the referenced manifest
   * @param platform the platform, may be null
   */
  public record Entry(BlobDigest digest, String mediaType, Platform platform) {

  }
}
