package de.ialistannen.ocmirror.signing;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Talks to signature stores served over http(s) or living on the local file system.
 */
public class DefaultSignatureStoreClient implements SignatureStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultSignatureStoreClient.class);

  private final HttpClient client;

  public DefaultSignatureStoreClient(HttpClient client) {
    this.client = client;
  }

  @Override
  public Optional<byte[]> get(URI location) throws IOException, InterruptedException {
    if (isFile(location)) {
      Path path = Path.of(location);
      if (!Files.isRegularFile(path)) {
        return Optional.empty();
      }
      return Optional.of(Files.readAllBytes(path));
    }

    HttpRequest request = HttpRequest.newBuilder(location).GET().build();
    LOGGER.debug("Sending request to {}, ({})", request.uri(), request.method());
    HttpResponse<byte[]> response = client.send(request, BodyHandlers.ofByteArray());

    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    if (response.statusCode() != 200) {
      throw new SignatureStoreException(location, "fetch", response.statusCode());
    }
    return Optional.of(response.body());
  }

  @Override
  public void put(URI location, byte[] signature) throws IOException, InterruptedException {
    if (isFile(location)) {
      Path path = Path.of(location);
      Files.createDirectories(path.getParent());
      Files.write(path, signature);
      return;
    }

    HttpRequest request = HttpRequest.newBuilder(location)
      .header("Content-Type", "application/octet-stream")
      .PUT(BodyPublishers.ofByteArray(signature))
      .build();
    LOGGER.debug("Sending request to {}, ({})", request.uri(), request.method());
    HttpResponse<String> response = client.send(request, BodyHandlers.ofString());

    int status = response.statusCode();
    if (status != 200 && status != 201 && status != 204) {
      LOGGER.info("Signature store refused upload to {} ({}): {}", location, status, response.body());
      throw new SignatureStoreException(location, "store", status);
    }
  }

  private static boolean isFile(URI location) {
    return location.getScheme() != null && location.getScheme().toLowerCase(Locale.ROOT).equals("file");
  }
}
