package de.ialistannen.ocmirror.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.Optional;

/**
 * Credentials for a single registry, as stored in the {@code auths} section of a docker {@code config.json}.
 *
 * @param url the registry the credentials are for, usually {@code host[:port]} but sometimes a full url
 * @param encodedAuth the base64 encoded {@code user:password}
 */
public record DockerRegistryAuth(String url, String encodedAuth) {

  /**
   * Loads the docker authentications from a given config file.
   *
   * @param pathToConfig the path to the docker config
   * @return the stored authentications
   * @throws IOException if an error occurs
   */
  public static List<DockerRegistryAuth> loadAuthentications(Path pathToConfig) throws IOException {
    ObjectNode root = new ObjectMapper().readValue(Files.readString(pathToConfig), ObjectNode.class);

    JsonNode auths = root.get("auths");
    if (!(auths instanceof ObjectNode)) {
      return List.of();
    }
    return fromJson((ObjectNode) auths);
  }

  /**
   * Extracts the stored registry authentications from the "auths" part of the config file. Entries without an
   * inline {@code auth} (e.g. handled by a credential helper) are skipped.
   *
   * @param authsNode the auths node
   * @return the found docker registry authentications
   */
  private static List<DockerRegistryAuth> fromJson(ObjectNode authsNode) {
    List<DockerRegistryAuth> auths = new ArrayList<>();

    var iterator = authsNode.fields();
    while (iterator.hasNext()) {
      Entry<String, JsonNode> entry = iterator.next();
      JsonNode auth = entry.getValue().get("auth");
      if (auth != null && !auth.asText().isBlank()) {
        auths.add(new DockerRegistryAuth(entry.getKey(), auth.asText()));
      }
    }

    return auths;
  }

  /**
   * Finds the credentials for a registry endpoint.
   *
   * @param auths all known credentials
   * @param endpoint the registry endpoint ({@code host[:port]})
   * @return the encoded credentials, if any
   */
  public static Optional<String> findFor(List<DockerRegistryAuth> auths, String endpoint) {
    return auths.stream()
      .filter(auth -> auth.matches(endpoint))
      .findFirst()
      .map(DockerRegistryAuth::encodedAuth);
  }

  private boolean matches(String endpoint) {
    if (url.equalsIgnoreCase(endpoint)) {
      return true;
    }
    try {
      URI configUri = url.contains("://") ? new URI(url) : new URI("https://" + url);
      String configEndpoint = configUri.getHost();
      if (configUri.getPort() >= 0) {
        configEndpoint += ":" + configUri.getPort();
      }
      if (endpoint.equalsIgnoreCase(configEndpoint)) {
        return true;
      }
      // docker login stores docker hub credentials under its index url
      return endpoint.equals("index.docker.io") && "index.docker.io".equalsIgnoreCase(configUri.getHost());
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
