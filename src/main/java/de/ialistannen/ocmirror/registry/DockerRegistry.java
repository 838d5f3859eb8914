package de.ialistannen.ocmirror.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.image.MediaTypes;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements docker registry authentication, manifest and blob transfer using the v2 API.
 */
public class DockerRegistry implements RegistryClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerRegistry.class);

  private static final Pattern REALM_PATTERN = Pattern.compile("realm=\"(.+?)\"");
  private static final Pattern SERVICE_PATTERN = Pattern.compile("service=\"(.+?)\"");
  private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);
  private static final String USER_AGENT = "oc-mirror";

  private final HttpClient client;
  private final ObjectMapper objectMapper;
  private final List<DockerRegistryAuth> registryAuths;
  private final Cache<String, Optional<String>> authHeaders;

  /**
   * Creates a new registry client. The http client should not follow redirects on its own, blob downloads are
   * redirected to storage backends that reject our registry credentials.
   *
   * @param client the http client to use
   * @param registryAuths the known registry credentials
   */
  public DockerRegistry(HttpClient client, List<DockerRegistryAuth> registryAuths) {
    this.client = client;
    this.registryAuths = List.copyOf(registryAuths);

    this.objectMapper = new ObjectMapper();
    // Registries hand out tokens valid for at least 300 seconds, release them a bit before that
    this.authHeaders = Caffeine.newBuilder()
      .expireAfterWrite(Duration.ofSeconds(240))
      .build();
  }

  @Override
  public ManifestDocument fetchManifest(ImageReference reference) throws IOException, InterruptedException {
    LOGGER.debug("Fetching manifest for '{}'", reference);

    URI uri = registryUri(reference, "/v2/%s/manifests/%s".formatted(
      reference.resolveRepository(),
      reference.resolveManifestReference()
    ));
    HttpRequest.Builder builder = authorized(uri, reference.resolveEndpoint(), pullScope(reference)).GET();
    for (String mediaType : MediaTypes.ACCEPTED_MANIFESTS) {
      builder.header("Accept", mediaType);
    }

    HttpResponse<byte[]> response = client.send(builder.build(), BodyHandlers.ofByteArray());
    if (response.statusCode() != 200) {
      LOGGER.info(
        "Failed to fetch manifest for '{}' ({}): {}",
        reference,
        response.statusCode(),
        new String(response.body(), StandardCharsets.UTF_8)
      );
      throw new ManifestFetchException(reference, response.statusCode());
    }

    ManifestDocument manifest = ManifestDocument.parse(
      response.body(),
      response.headers().firstValue("content-type").orElse(null)
    );
    if (reference.digest() != null && !reference.digest().equals(manifest.digest())) {
      throw new ManifestFetchException(
        "Manifest for '" + reference + "' has digest " + manifest.digest() + ", refusing to use it"
      );
    }
    return manifest;
  }

  @Override
  public InputStream openBlob(ImageReference reference, BlobDigest digest) throws IOException, InterruptedException {
    LOGGER.debug("Fetching blob '{}' from '{}'", digest, reference.namespace());

    URI uri = registryUri(reference, "/v2/%s/blobs/%s".formatted(reference.resolveRepository(), digest));
    HttpRequest request = authorized(uri, reference.resolveEndpoint(), pullScope(reference)).GET().build();
    HttpResponse<InputStream> response = client.send(request, BodyHandlers.ofInputStream());

    if (REDIRECT_CODES.contains(response.statusCode())) {
      response.body().close();
      URI location = uri.resolve(response.headers().firstValue("location").orElseThrow(
        () -> new BlobTransferException(reference, digest, "follow redirect for", response.statusCode())
      ));
      LOGGER.debug("Following blob redirect to {}", location.getHost());
      HttpRequest redirected = HttpRequest.newBuilder(location)
        .header("User-Agent", USER_AGENT)
        .GET()
        .build();
      return expectBlob(reference, digest, client.send(redirected, BodyHandlers.ofInputStream()));
    }

    return expectBlob(reference, digest, response);
  }

  private InputStream expectBlob(ImageReference reference, BlobDigest digest, HttpResponse<InputStream> response)
    throws IOException {
    if (response.statusCode() != 200) {
      response.body().close();
      throw new BlobTransferException(reference, digest, "fetch", response.statusCode());
    }
    return response.body();
  }

  @Override
  public boolean blobExists(ImageReference reference, BlobDigest digest) throws IOException, InterruptedException {
    URI uri = registryUri(reference, "/v2/%s/blobs/%s".formatted(reference.resolveRepository(), digest));
    HttpRequest request = authorized(uri, reference.resolveEndpoint(), pushScope(reference))
      .method("HEAD", BodyPublishers.noBody())
      .build();

    HttpResponse<Void> response = client.send(request, BodyHandlers.discarding());
    if (response.statusCode() == 200 || REDIRECT_CODES.contains(response.statusCode())) {
      return true;
    }
    if (response.statusCode() == 404) {
      return false;
    }
    throw new BlobTransferException(reference, digest, "check", response.statusCode());
  }

  @Override
  public void pushBlob(ImageReference reference, BlobDigest digest, Path content)
    throws IOException, InterruptedException {
    LOGGER.debug("Uploading blob '{}' to '{}'", digest, reference.namespace());

    URI start = registryUri(reference, "/v2/%s/blobs/uploads/".formatted(reference.resolveRepository()));
    String scope = pushScope(reference);
    HttpResponse<String> started = client.send(
      authorized(start, reference.resolveEndpoint(), scope).POST(BodyPublishers.noBody()).build(),
      BodyHandlers.ofString()
    );
    if (started.statusCode() != 202) {
      LOGGER.info("Upload for '{}' was refused ({}): {}", digest, started.statusCode(), started.body());
      throw new BlobTransferException(reference, digest, "start upload of", started.statusCode());
    }

    URI location = start.resolve(started.headers().firstValue("location").orElseThrow(
      () -> new BlobTransferException("Registry did not send an upload location for '" + digest + "'")
    ));
    URI target = appendQuery(location, "digest=" + encode(digest.toString()));

    HttpResponse<String> finished = client.send(
      authorized(target, reference.resolveEndpoint(), scope)
        .header("Content-Type", "application/octet-stream")
        .PUT(BodyPublishers.ofFile(content))
        .build(),
      BodyHandlers.ofString()
    );
    if (finished.statusCode() != 201) {
      LOGGER.info("Upload of '{}' failed ({}): {}", digest, finished.statusCode(), finished.body());
      throw new BlobTransferException(reference, digest, "upload", finished.statusCode());
    }
  }

  @Override
  public boolean mountBlob(ImageReference reference, BlobDigest digest, String fromRepository)
    throws IOException, InterruptedException {
    URI uri = registryUri(reference, "/v2/%s/blobs/uploads/?mount=%s&from=%s".formatted(
      reference.resolveRepository(),
      encode(digest.toString()),
      encode(fromRepository)
    ));
    String scopes = pushScope(reference) + " repository:" + fromRepository + ":pull";

    HttpResponse<String> response = client.send(
      authorized(uri, reference.resolveEndpoint(), scopes).POST(BodyPublishers.noBody()).build(),
      BodyHandlers.ofString()
    );
    if (response.statusCode() == 201) {
      return true;
    }
    if (response.statusCode() == 202) {
      LOGGER.debug("Registry declined to mount '{}' from '{}' into '{}'", digest, fromRepository, reference);
      return false;
    }
    throw new BlobTransferException(reference, digest, "mount", response.statusCode());
  }

  @Override
  public void pushManifest(ImageReference reference, ManifestDocument manifest)
    throws IOException, InterruptedException {
    String target = reference.tag() != null ? reference.tag() : manifest.digest().toString();
    LOGGER.debug("Uploading manifest '{}' to '{}' as '{}'", manifest.digest(), reference.namespace(), target);

    URI uri = registryUri(reference, "/v2/%s/manifests/%s".formatted(reference.resolveRepository(), target));
    HttpRequest request = authorized(uri, reference.resolveEndpoint(), pushScope(reference))
      .header("Content-Type", manifest.mediaType())
      .PUT(BodyPublishers.ofByteArray(manifest.raw()))
      .build();

    HttpResponse<String> response = client.send(request, BodyHandlers.ofString());
    if (response.statusCode() != 201 && response.statusCode() != 200) {
      LOGGER.info("Manifest upload to '{}' failed ({}): {}", reference, response.statusCode(), response.body());
      throw new ManifestPushException(reference, response.statusCode());
    }
  }

  @Override
  public void close() {
    authHeaders.invalidateAll();
    authHeaders.cleanUp();
  }

  private HttpRequest.Builder authorized(URI uri, String endpoint, String scopes)
    throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri).header("User-Agent", USER_AGENT);
    getAuthHeader(endpoint, scopes).ifPresent(header -> builder.header("Authorization", header));
    return builder;
  }

  /**
   * Returns the value of the {@code "Authorization"} header to use for communicating with a registry.
   *
   * @param endpoint the registry endpoint
   * @param scopes the space separated token scopes
   * @return the header or an empty optional if the registry allows anonymous access
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws TokenFetchException if fetching failed
   */
  private Optional<String> getAuthHeader(String endpoint, String scopes) throws IOException, InterruptedException {
    try {
      return authHeaders.get(endpoint + " " + scopes, key -> {
        try {
          return fetchAuthHeader(endpoint, scopes);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
          throw new InterruptedFetch(e);
        }
      });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (InterruptedFetch e) {
      throw e.getCause();
    }
  }

  private Optional<String> fetchAuthHeader(String endpoint, String scopes) throws IOException, InterruptedException {
    HttpRequest challengeRequest = HttpRequest.newBuilder(URI.create("https://" + endpoint + "/v2/"))
      .header("User-Agent", USER_AGENT)
      .GET()
      .build();

    LOGGER.debug("Sending request to {}, ({})", challengeRequest.uri(), challengeRequest.method());
    HttpResponse<Void> challengeResponse = client.send(challengeRequest, BodyHandlers.discarding());
    LOGGER.debug(
      "Got response {}-{}: {}",
      challengeResponse.uri(),
      challengeResponse.statusCode(),
      challengeResponse.headers()
    );

    Optional<String> challenge = challengeResponse.headers().firstValue("www-authenticate");
    if (challenge.isEmpty()) {
      if (challengeResponse.statusCode() == 401) {
        throw new TokenFetchException("Could not find www-authenticate header for '" + endpoint + "'");
      }
      return Optional.empty();
    }

    String header = challenge.get();
    LOGGER.debug("Received header: '{}'", header);

    if (header.toLowerCase(Locale.ROOT).startsWith("basic")) {
      return Optional.of("Basic " + DockerRegistryAuth.findFor(registryAuths, endpoint)
        .orElseThrow(() -> new TokenFetchException("Did not have credentials for '" + endpoint + "'")));
    }
    if (!header.toLowerCase(Locale.ROOT).startsWith("bearer")) {
      throw new TokenFetchException("Unknown challenge type: '" + header + "'");
    }

    String realm = getFromAuthenticateHeader(header, REALM_PATTERN)
      .orElseThrow(() -> new TokenFetchException("Could not find realm in header '" + header + "'"));
    StringBuilder authUrl = new StringBuilder(realm).append(realm.contains("?") ? "&" : "?");
    getFromAuthenticateHeader(header, SERVICE_PATTERN)
      .ifPresent(service -> authUrl.append("service=").append(encode(service)).append("&"));
    authUrl.append(
      List.of(scopes.split(" ")).stream()
        .map(scope -> "scope=" + encode(scope))
        .collect(Collectors.joining("&"))
    );

    LOGGER.debug("Build auth URL '{}' for '{}'", authUrl, endpoint);
    return Optional.of(getBearerHeader(URI.create(authUrl.toString()), endpoint));
  }

  private String getBearerHeader(URI authUrl, String endpoint) throws IOException, InterruptedException {
    var requestBuilder = HttpRequest.newBuilder(authUrl).header("User-Agent", USER_AGENT).GET();
    DockerRegistryAuth.findFor(registryAuths, endpoint)
      .ifPresent(auth -> requestBuilder.header("Authorization", "Basic " + auth));

    HttpResponse<String> response = client.send(requestBuilder.build(), BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      LOGGER.error(
        "Unsuccessful request to registry at {} with status {}. Body: {}",
        authUrl, response.statusCode(), response.body()
      );
      throw new TokenFetchException("Could not fetch token as response returned status " + response.statusCode());
    }
    ObjectNode body = objectMapper.readValue(response.body(), ObjectNode.class);
    JsonNode tokenNode = body.has("token") ? body.get("token") : body.get("access_token");
    if (tokenNode == null) {
      LOGGER.error(
        "Weird response to registry auth request at {} with status {}. Body: {}",
        authUrl, response.statusCode(), response.body()
      );
      throw new TokenFetchException("Could not fetch token as response does not contain a valid token");
    }

    return "Bearer " + tokenNode.asText();
  }

  /**
   * Carries an interrupt out of the token cache loader.
   */
  private static final class InterruptedFetch extends RuntimeException {

    private InterruptedFetch(InterruptedException cause) {
      super(cause);
    }

    @Override
    public synchronized InterruptedException getCause() {
      return (InterruptedException) super.getCause();
    }
  }

  private static Optional<String> getFromAuthenticateHeader(String input, Pattern regex) {
    Matcher matcher = regex.matcher(input);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(matcher.group(1));
  }

  private static URI registryUri(ImageReference reference, String path) {
    return URI.create("https://" + reference.resolveEndpoint() + path);
  }

  private static URI appendQuery(URI uri, String query) {
    String asString = uri.toString();
    return URI.create(asString + (asString.contains("?") ? "&" : "?") + query);
  }

  private static String pullScope(ImageReference reference) {
    return "repository:" + reference.resolveRepository() + ":pull";
  }

  private static String pushScope(ImageReference reference) {
    return "repository:" + reference.resolveRepository() + ":pull,push";
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
