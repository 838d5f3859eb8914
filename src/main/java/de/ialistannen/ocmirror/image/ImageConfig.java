package de.ialistannen.ocmirror.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of an image config blob we care about.
 *
 * @param labels the image labels
 */
public record ImageConfig(Map<String, String> labels) {

  /**
   * Decodes a config blob.
   *
   * @param raw the raw blob
   * @return the config
   * @throws IOException if the blob is no valid json
   */
  public static ImageConfig parse(byte[] raw) throws IOException {
    JsonNode root = new ObjectMapper().readTree(raw);
    Map<String, String> labels = new LinkedHashMap<>();

    var iterator = root.path("config").path("Labels").fields();
    while (iterator.hasNext()) {
      var entry = iterator.next();
      labels.put(entry.getKey(), entry.getValue().asText());
    }

    return new ImageConfig(Collections.unmodifiableMap(labels));
  }

  public Optional<String> label(String name) {
    return Optional.ofNullable(labels.get(name));
  }
}
