package de.ialistannen.ocmirror.release;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.ocmirror.image.ImageReference;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The {@code image-references} ImageStream of a release payload. Each tag names one component image.
 */
public final class ImageReferences {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final ObjectNode root;

  private ImageReferences(ObjectNode root) {
    this.root = root;
  }

  /**
   * @param json the ImageStream json
   * @return the parsed document
   * @throws UncheckedIOException if the document is no json object
   */
  public static ImageReferences parse(String json) {
    try {
      JsonNode node = OBJECT_MAPPER.readTree(json);
      if (!(node instanceof ObjectNode)) {
        throw new IOException("Expected a json object, got " + (node == null ? "nothing" : node.getNodeType()));
      }
      return new ImageReferences((ObjectNode) node);
    } catch (IOException e) {
      throw new UncheckedIOException("Invalid image-references document", e);
    }
  }

  /**
   * @return the release version, the name of the ImageStream
   */
  public String name() {
    return root.path("metadata").path("name").asText(null);
  }

  /**
   * @return all tags pointing to an image, in document order
   */
  public List<Tag> tags() {
    List<Tag> tags = new ArrayList<>();
    for (JsonNode tag : root.path("spec").path("tags")) {
      String from = tag.path("from").path("name").asText(null);
      if (from != null && !from.isBlank()) {
        tags.add(new Tag(tag.path("name").asText(), ImageReference.parse(from)));
      }
    }
    return tags;
  }

  /**
   * Rewrites every tag's image reference. Tags without an image are left alone and the document is
   * written compactly, so it only differs from a compact input in the rewritten references.
   *
   * @param rewrite the rewrite to apply
   * @return the rewritten json document
   */
  public String rewrite(UnaryOperator<ImageReference> rewrite) {
    ObjectNode copy = root.deepCopy();
    for (JsonNode tag : copy.path("spec").path("tags")) {
      JsonNode from = tag.path("from");
      if (from instanceof ObjectNode fromObject && !from.path("name").asText("").isBlank()) {
        fromObject.put("name", rewrite.apply(ImageReference.parse(from.get("name").asText())).toString());
      }
    }
    try {
      return OBJECT_MAPPER.writeValueAsString(copy);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * A component of the release.
   *
   * @param name the component name, e.g. {@code cli}
   * @param image the component image
   */
  public record Tag(String name, ImageReference image) {

  }
}
