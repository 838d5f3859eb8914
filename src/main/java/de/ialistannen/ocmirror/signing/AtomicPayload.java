package de.ialistannen.ocmirror.signing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.ocmirror.image.BlobDigest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * The signed document of an atomic container signature, as understood by {@code containers/image}.
 *
 * @param dockerReference the image the signature was made for
 * @param manifestDigest the signed manifest digest
 * @param creator the creating tool, may be null
 * @param timestamp the creation time in epoch seconds, may be null
 */
public record AtomicPayload(String dockerReference, BlobDigest manifestDigest, String creator, Long timestamp) {

  public static final String TYPE = "atomic container signature";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * @return the payload json
   */
  public byte[] toJson() {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();

    ObjectNode critical = root.putObject("critical");
    critical.putObject("identity").put("docker-reference", dockerReference);
    critical.putObject("image").put("docker-manifest-digest", manifestDigest.toString());
    critical.put("type", TYPE);

    ObjectNode optional = root.putObject("optional");
    if (creator != null) {
      optional.put("creator", creator);
    }
    if (timestamp != null) {
      optional.put("timestamp", timestamp);
    }

    try {
      return OBJECT_MAPPER.writeValueAsBytes(root);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Decodes a payload.
   *
   * @param json the signed content
   * @return the payload, or an empty optional if the content is no atomic container signature
   */
  public static Optional<AtomicPayload> parse(byte[] json) {
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(json);
    } catch (IOException e) {
      return Optional.empty();
    }
    if (root == null) {
      return Optional.empty();
    }

    JsonNode critical = root.path("critical");
    if (!TYPE.equals(critical.path("type").asText(null))) {
      return Optional.empty();
    }
    String digest = critical.path("image").path("docker-manifest-digest").asText(null);
    if (digest == null) {
      return Optional.empty();
    }

    BlobDigest manifestDigest;
    try {
      manifestDigest = BlobDigest.parse(digest);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }

    JsonNode optional = root.path("optional");
    return Optional.of(new AtomicPayload(
      critical.path("identity").path("docker-reference").asText(null),
      manifestDigest,
      optional.path("creator").asText(null),
      optional.path("timestamp").isNumber() ? optional.path("timestamp").asLong() : null
    ));
  }
}
