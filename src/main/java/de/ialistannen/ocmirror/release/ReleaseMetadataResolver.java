package de.ialistannen.ocmirror.release;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.google.common.collect.ImmutableList;
import de.ialistannen.ocmirror.concurrent.ParallelTasks;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.graph.ContentGraphBuilder;
import de.ialistannen.ocmirror.graph.PlatformImage;
import de.ialistannen.ocmirror.graph.ReferenceResolutionException;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.registry.LayerReader;
import de.ialistannen.ocmirror.registry.RegistryClient;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import de.ialistannen.ocmirror.signing.SignatureVerifier;
import de.ialistannen.ocmirror.signing.VerificationConfig;
import de.ialistannen.ocmirror.translate.EndpointTranslator;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers every manifest and blob making up an OpenShift release image.
 */
public class ReleaseMetadataResolver {

  public static final String IMAGE_REFERENCES = "release-manifests/image-references";
  public static final String RELEASE_METADATA = "release-manifests/release-metadata";
  public static final String VERIFICATION_ANNOTATION = "release.openshift.io/verification-config-map";

  private static final Logger LOGGER = LoggerFactory.getLogger(ReleaseMetadataResolver.class);
  private static final String MANIFESTS_DIRECTORY = "release-manifests/";
  private static final String KEY_PREFIX = "verifier-public-key-";
  private static final String STORE_PREFIX = "store-";

  private final RegistryClient registry;
  private final Executor executor;
  private final SignatureVerifier verifier;
  private final Platform platform;
  private final YAMLMapper yamlMapper;

  /**
   * Creates a new resolver.
   *
   * @param registry the registry to read from
   * @param executor the executor components are fetched on
   * @param verifier checks the release signature
   * @param platform the platform whose payload is read if the release is a manifest list
   */
  public ReleaseMetadataResolver(
    RegistryClient registry,
    Executor executor,
    SignatureVerifier verifier,
    Platform platform
  ) {
    this.registry = registry;
    this.executor = executor;
    this.verifier = verifier;
    this.platform = platform;
    this.yamlMapper = new YAMLMapper();
  }

  /**
   * Resolves a release.
   *
   * @param indexRef the release image
   * @param translator rewrites component endpoints before they are fetched, may be null
   * @param verification how to check the release signature
   * @return the release metadata
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws ReferenceResolutionException if the image is no release or a component is missing
   * @throws de.ialistannen.ocmirror.signing.SignatureRequirementException if verification is requested and fails
   */
  public ReleaseMetadata resolve(
    ImageReference indexRef,
    EndpointTranslator translator,
    VerificationConfig verification
  ) throws IOException, InterruptedException {
    LOGGER.debug("Resolving release '{}'", indexRef);

    ManifestDocument rootManifest = registry.fetchManifest(indexRef);
    PlatformImage image = PlatformImage.select(registry, indexRef, rootManifest, platform);
    ReleasePayload payload = readPayload(image);
    ImageReferences imageReferences = ImageReferences.parse(payload.imageReferences());
    LOGGER.info("Release '{}' has {} components", imageReferences.name(), imageReferences.tags().size());

    ContentGraphBuilder builder = new ContentGraphBuilder(registry);
    builder.addRoot(indexRef, rootManifest);

    List<Callable<ManifestDocument>> tasks = new ArrayList<>();
    for (ImageReferences.Tag tag : imageReferences.tags()) {
      ImageReference component = translator == null ? tag.image() : translator.translate(tag.image());
      tasks.add(() -> builder.add(component, tag.name()));
    }
    ParallelTasks.invokeAll(executor, tasks);
    ContentGraph graph = builder.build();

    List<URI> stores = verification.signatureStores().isEmpty()
      ? payload.signatureStores()
      : verification.signatureStores();
    List<String> keys = verification.signingKeys().isEmpty()
      ? payload.signingKeys()
      : verification.signingKeys();

    List<SignatureVerification> signatures = List.of();
    if (verification.verify()) {
      signatures = verifier.requireValid(graph.rootDigest(), indexRef, stores, keys);
    }

    LOGGER.debug(
      "Resolved '{}': {} blobs, {} manifests",
      indexRef,
      graph.blobs().size(),
      graph.manifests().size()
    );
    return new ReleaseMetadata(
      graph,
      payload.imageReferences(),
      payload.releaseMetadata(),
      ImmutableList.copyOf(stores),
      ImmutableList.copyOf(keys),
      ImmutableList.copyOf(signatures)
    );
  }

  /**
   * Points every component of a release at another registry. Nothing is written anywhere.
   *
   * @param destRef the release location in the other registry
   * @param metadata the release
   * @return the rewritten {@code image-references} document
   */
  public String translate(ImageReference destRef, ReleaseMetadata metadata) {
    return ImageReferences.parse(metadata.rawImageReferences())
      .rewrite(reference -> reference.withEndpoint(destRef.endpoint()));
  }

  private ReleasePayload readPayload(PlatformImage image) throws IOException, InterruptedException {
    Map<String, byte[]> files = new LayerReader(registry).readNewestFirst(
      image.reference(),
      image.manifest().layers(),
      path -> path.startsWith(MANIFESTS_DIRECTORY),
      found -> found.containsKey(IMAGE_REFERENCES)
    );

    byte[] imageReferences = files.get(IMAGE_REFERENCES);
    if (imageReferences == null) {
      throw new ReferenceResolutionException("'" + image.reference() + "' contains no " + IMAGE_REFERENCES);
    }
    byte[] releaseMetadata = files.getOrDefault(RELEASE_METADATA, new byte[0]);

    List<URI> stores = new ArrayList<>();
    List<String> keys = new ArrayList<>();
    for (Entry<String, byte[]> file : files.entrySet()) {
      if (file.getKey().endsWith(".yaml") || file.getKey().endsWith(".yml")) {
        readVerificationConfig(file.getKey(), file.getValue(), stores, keys);
      }
    }

    return new ReleasePayload(
      new String(imageReferences, StandardCharsets.UTF_8),
      new String(releaseMetadata, StandardCharsets.UTF_8),
      stores,
      keys
    );
  }

  private void readVerificationConfig(String path, byte[] content, List<URI> stores, List<String> keys)
    throws IOException {
    MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(content);
    while (documents.hasNext()) {
      JsonNode document = documents.next();
      if (document == null || !"ConfigMap".equals(document.path("kind").asText())) {
        continue;
      }
      if (!document.path("metadata").path("annotations").has(VERIFICATION_ANNOTATION)) {
        continue;
      }
      LOGGER.debug("Reading verification config from '{}'", path);

      Iterator<Entry<String, JsonNode>> data = document.path("data").fields();
      while (data.hasNext()) {
        Entry<String, JsonNode> entry = data.next();
        if (entry.getKey().startsWith(KEY_PREFIX)) {
          keys.add(entry.getValue().asText());
        } else if (entry.getKey().startsWith(STORE_PREFIX)) {
          stores.add(URI.create(entry.getValue().asText().trim()));
        }
      }
    }
  }

  private record ReleasePayload(
    String imageReferences,
    String releaseMetadata,
    List<URI> signatureStores,
    List<String> signingKeys
  ) {

  }
}
