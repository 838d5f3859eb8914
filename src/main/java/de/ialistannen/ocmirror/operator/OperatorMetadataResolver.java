package de.ialistannen.ocmirror.operator;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves operator packages in a catalog index image to their bundles and the images those bundles need.
 */
public class OperatorMetadataResolver {

  public static final String DATABASE_LABEL = "operators.operatorframework.io.index.database.v1";
  public static final String DEFAULT_DATABASE = "/database/index.db";

  private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMetadataResolver.class);
  private static final String CSV_SUFFIX = ".clusterserviceversion.yaml";

  private final RegistryClient registry;
  private final Executor executor;
  private final SignatureVerifier verifier;
  private final IndexDatabaseDecoder decoder;
  private final Platform platform;
  private final YAMLMapper yamlMapper;

  /**
   * Creates a new resolver.
   *
   * @param registry the registry to read from
   * @param executor the executor bundles and related images are fetched on
   * @param verifier checks the index signature
   * @param decoder reads the index database
   * @param platform the platform whose images are read if an image is a manifest list
   */
  public OperatorMetadataResolver(
    RegistryClient registry,
    Executor executor,
    SignatureVerifier verifier,
    IndexDatabaseDecoder decoder,
    Platform platform
  ) {
    this.registry = registry;
    this.executor = executor;
    this.verifier = verifier;
    this.decoder = decoder;
    this.platform = platform;
    this.yamlMapper = new YAMLMapper();
  }

  /**
   * Resolves operators from an index.
   *
   * @param indexRef the index image
   * @param packageChannel the packages to resolve, empty for every package on its default channel
   * @param translator rewrites bundle and related image endpoints before they are fetched, may be null
   * @param verification how to check the index signature
   * @return the resolved operators
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws PackageNotFoundException if a requested package does not exist
   * @throws ChannelNotFoundException if a requested channel does not exist
   */
  public OperatorMetadata resolve(
    ImageReference indexRef,
    Map<String, ChannelSelection> packageChannel,
    EndpointTranslator translator,
    VerificationConfig verification
  ) throws IOException, InterruptedException {
    LOGGER.debug("Resolving operator index '{}'", indexRef);

    ManifestDocument rootManifest = registry.fetchManifest(indexRef);
    PlatformImage index = PlatformImage.select(registry, indexRef, rootManifest, platform);

    String databasePath = index.config().label(DATABASE_LABEL).orElse(DEFAULT_DATABASE);
    String normalizedPath = LayerReader.normalize(databasePath);
    byte[] database = new LayerReader(registry).readNewestFirst(
      index.reference(),
      index.manifest().layers(),
      normalizedPath::equals,
      found -> !found.isEmpty()
    ).get(normalizedPath);
    if (database == null) {
      throw new ReferenceResolutionException("'" + indexRef + "' contains no index database at " + databasePath);
    }

    List<IndexRow> selected = select(decoder.decode(database), packageChannel);
    LOGGER.info("Selected {} operators from '{}'", selected.size(), indexRef);

    ContentGraphBuilder builder = new ContentGraphBuilder(registry);
    builder.addRoot(indexRef, rootManifest);

    List<Callable<OperatorRecord>> bundleTasks = new ArrayList<>();
    for (IndexRow row : selected) {
      bundleTasks.add(() -> resolveBundle(builder, row, translator));
    }
    List<OperatorRecord> operators = ParallelTasks.invokeAll(executor, bundleTasks);

    Map<ImageReference, String> relatedImages = new LinkedHashMap<>();
    for (OperatorRecord operator : operators) {
      for (ImageReference image : operator.relatedImages()) {
        relatedImages.putIfAbsent(image, operator.packageName());
      }
    }
    List<Callable<ManifestDocument>> relatedTasks = new ArrayList<>();
    for (Entry<ImageReference, String> related : relatedImages.entrySet()) {
      relatedTasks.add(() -> builder.add(related.getKey(), related.getValue()));
    }
    ParallelTasks.invokeAll(executor, relatedTasks);

    ContentGraph graph = builder.build();

    List<SignatureVerification> signatures = List.of();
    if (verification.verify()) {
      signatures = verifier.requireValid(
        graph.rootDigest(),
        indexRef,
        verification.signatureStores(),
        verification.signingKeys()
      );
    }

    return new OperatorMetadata(
      databasePath,
      database,
      ImmutableList.copyOf(operators),
      graph,
      ImmutableList.copyOf(verification.signatureStores()),
      ImmutableList.copyOf(verification.signingKeys()),
      ImmutableList.copyOf(signatures)
    );
  }

  /**
   * Picks the channel heads for the requested packages.
   *
   * @param rows all channel heads of the index
   * @param packageChannel the requested packages, empty for all packages on their default channel
   * @return the selected rows, in request order
   */
  static List<IndexRow> select(List<IndexRow> rows, Map<String, ChannelSelection> packageChannel) {
    Map<String, List<IndexRow>> byPackage = new LinkedHashMap<>();
    for (IndexRow row : rows) {
      byPackage.computeIfAbsent(row.packageName(), ignored -> new ArrayList<>()).add(row);
    }

    Map<String, ChannelSelection> wanted = packageChannel;
    if (wanted.isEmpty()) {
      wanted = new LinkedHashMap<>();
      for (String packageName : byPackage.keySet()) {
        wanted.put(packageName, new ChannelSelection.DefaultChannel());
      }
    }

    List<IndexRow> selected = new ArrayList<>();
    for (Entry<String, ChannelSelection> entry : wanted.entrySet()) {
      List<IndexRow> channels = byPackage.get(entry.getKey());
      if (channels == null) {
        throw new PackageNotFoundException(entry.getKey());
      }

      ChannelSelection selection = entry.getValue();
      IndexRow row = channels.stream()
        .filter(it -> selection instanceof ChannelSelection.Explicit explicit
          ? it.channel().equals(explicit.name())
          : it.isDefaultChannel())
        .findFirst()
        .orElseThrow(() -> new ChannelNotFoundException(entry.getKey(), selection));
      selected.add(row);
    }

    return selected;
  }

  private OperatorRecord resolveBundle(ContentGraphBuilder builder, IndexRow row, EndpointTranslator translator)
    throws IOException, InterruptedException {
    if (row.bundleImage() == null || row.bundleImage().isBlank()) {
      throw new ReferenceResolutionException(
        "Bundle '" + row.bundleName() + "' of '" + row.packageName() + "' has no image"
      );
    }

    ImageReference bundleImage = ImageReference.parse(row.bundleImage());
    if (translator != null) {
      bundleImage = translator.translate(bundleImage);
    }
    ManifestDocument manifest = builder.add(bundleImage, row.packageName() + ":" + row.channel());

    Set<ImageReference> relatedImages = new LinkedHashSet<>();
    for (ImageReference related : readRelatedImages(bundleImage, manifest)) {
      relatedImages.add(translator == null ? related : translator.translate(related));
    }
    LOGGER.debug("Bundle '{}' has {} related images", row.bundleName(), relatedImages.size());

    return new OperatorRecord(
      row.packageName(),
      row.channel(),
      bundleImage,
      row.bundleName(),
      ImmutableList.copyOf(relatedImages)
    );
  }

  private List<ImageReference> readRelatedImages(ImageReference bundleImage, ManifestDocument manifest)
    throws IOException, InterruptedException {
    PlatformImage bundle = PlatformImage.select(registry, bundleImage, manifest, platform);
    Map<String, byte[]> files = new LayerReader(registry).readNewestFirst(
      bundle.reference(),
      bundle.manifest().layers(),
      path -> path.startsWith("manifests/") && path.endsWith(CSV_SUFFIX),
      found -> !found.isEmpty()
    );

    List<ImageReference> images = new ArrayList<>();
    for (byte[] csv : files.values()) {
      JsonNode root = yamlMapper.readTree(csv);
      for (JsonNode related : root.path("spec").path("relatedImages")) {
        String image = related.path("image").asText(null);
        if (image != null && !image.isBlank()) {
          images.add(ImageReference.parse(image));
        }
      }
    }
    return images;
  }
}
