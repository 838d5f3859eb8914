package de.ialistannen.ocmirror.mirror;

import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;
import com.google.common.hash.HashingInputStream;
import de.ialistannen.ocmirror.concurrent.ParallelTasks;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.graph.MirrorableMetadata;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.registry.RegistryClient;
import de.ialistannen.ocmirror.registry.TransportException;
import de.ialistannen.ocmirror.signing.AtomicSigner;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicates a resolved content graph to another registry. Blobs are copied first, then image manifests, then
 * manifest lists and finally the root, so a manifest never lands before the content it references.
 */
public class MirrorEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(MirrorEngine.class);

  private final RegistryClient source;
  private final RegistryClient destination;
  private final Executor executor;
  private final boolean dryRun;

  /**
   * Creates a new engine.
   *
   * @param source the registry content is read from
   * @param destination the registry content is written to
   * @param executor the executor transfers run on
   * @param dryRun if true, every write is only logged
   */
  public MirrorEngine(RegistryClient source, RegistryClient destination, Executor executor, boolean dryRun) {
    this.source = source;
    this.destination = destination;
    this.executor = executor;
    this.dryRun = dryRun;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  /**
   * Replicates a graph.
   *
   * @param destRef where the root should end up. Its tag (or the root digest) addresses the root.
   * @param metadata the resolved release or operator index
   * @param verify whether to re-hash all content before writing it
   * @throws InterruptedException ?
   * @throws MirrorException if any transfer failed
   */
  public void put(ImageReference destRef, MirrorableMetadata metadata, boolean verify) throws InterruptedException {
    ContentGraph graph = metadata.graph();
    DestinationMapping mapping = new DestinationMapping(graph, destRef);

    try {
      copyBlobs(graph, mapping, verify);
      copyManifests(graph, mapping, verify);

      ManifestDocument root = graph.rootManifest();
      checkManifest(graph.root(), root, verify);
      pushManifest(destRef.withDigest(null), root);
    } catch (IOException | TransportException e) {
      throw new MirrorException("Mirroring to '" + destRef + "' failed: " + e.getMessage(), e);
    }
  }

  /**
   * Publishes a signature for a mirrored root.
   *
   * @param signer the signer holding the key and stores
   * @param destRef the mirrored root
   * @param digest the root manifest digest
   * @return the location of the signature in the first store, empty in a dry run
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   */
  public Optional<URI> sign(AtomicSigner signer, ImageReference destRef, BlobDigest digest)
    throws IOException, InterruptedException {
    if (dryRun) {
      LOGGER.info("Would sign '{}' ({}) with key {}", destRef, digest, signer.keyId().orElse("<none>"));
      return Optional.empty();
    }
    return Optional.of(signer.atomicsign(digest, destRef));
  }

  private void copyBlobs(ContentGraph graph, DestinationMapping mapping, boolean verify)
    throws IOException, InterruptedException {
    LOGGER.info("Copying {} blobs", graph.blobs().size());

    List<Callable<Void>> tasks = new ArrayList<>();
    for (Entry<BlobDigest, ImmutableSet<String>> blob : graph.blobs().entrySet()) {
      tasks.add(() -> {
        copyBlob(blob.getKey(), blob.getValue(), mapping, verify);
        return null;
      });
    }
    ParallelTasks.invokeAll(executor, tasks);
  }

  private void copyBlob(BlobDigest digest, ImmutableSet<String> namespaces, DestinationMapping mapping, boolean verify)
    throws IOException, InterruptedException {
    ImageReference origin = mapping.sourceRepository(namespaces.iterator().next());
    List<ImageReference> targets = namespaces.stream()
      .map(mapping::destinationRepository)
      .distinct()
      .toList();

    ImageReference first = targets.get(0);
    if (dryRun) {
      LOGGER.info("Would copy blob '{}' from '{}' to '{}'", digest, origin.namespace(), first.namespace());
    } else if (destination.blobExists(first, digest)) {
      LOGGER.debug("Blob '{}' already exists in '{}'", digest, first.namespace());
    } else {
      transfer(origin, first, digest, verify);
    }

    for (ImageReference target : targets.subList(1, targets.size())) {
      if (dryRun) {
        LOGGER.info("Would mount blob '{}' from '{}' into '{}'", digest, first.namespace(), target.namespace());
        continue;
      }
      if (destination.blobExists(target, digest)) {
        continue;
      }
      if (!destination.mountBlob(target, digest, first.resolveRepository())) {
        transfer(origin, target, digest, verify);
      }
    }
  }

  private void transfer(ImageReference origin, ImageReference target, BlobDigest digest, boolean verify)
    throws IOException, InterruptedException {
    Path staging = Files.createTempFile("oc-mirror-blob", ".tmp");
    try {
      BlobDigest actual;
      try (HashingInputStream inputStream = new HashingInputStream(
        Hashing.sha256(),
        source.openBlob(origin, digest)
      )) {
        Files.copy(inputStream, staging, StandardCopyOption.REPLACE_EXISTING);
        actual = new BlobDigest("sha256", inputStream.hash().toString());
      }

      if (verify && "sha256".equals(digest.algorithm()) && !actual.equals(digest)) {
        throw new MirrorException("Blob '" + digest + "' from '" + origin.namespace() + "' hashes to " + actual);
      }

      LOGGER.debug("Uploading blob '{}' to '{}'", digest, target.namespace());
      destination.pushBlob(target, digest, staging);
    } finally {
      Files.deleteIfExists(staging);
    }
  }

  private void copyManifests(ContentGraph graph, DestinationMapping mapping, boolean verify)
    throws IOException, InterruptedException {
    List<Entry<ImageReference, ManifestDocument>> images = new ArrayList<>();
    List<Entry<ImageReference, ManifestDocument>> lists = new ArrayList<>();
    for (Entry<ImageReference, ManifestDocument> entry : graph.documents().entrySet()) {
      if (entry.getKey().equals(graph.root())) {
        continue;
      }
      (entry.getValue().isList() ? lists : images).add(entry);
    }

    LOGGER.info("Copying {} image manifests and {} manifest lists", images.size(), lists.size());
    pushAll(images, mapping, verify);
    pushAll(lists, mapping, verify);
  }

  private void pushAll(
    List<Entry<ImageReference, ManifestDocument>> manifests,
    DestinationMapping mapping,
    boolean verify
  ) throws IOException, InterruptedException {
    List<Callable<Void>> tasks = new ArrayList<>();
    for (Entry<ImageReference, ManifestDocument> entry : manifests) {
      tasks.add(() -> {
        ImageReference key = entry.getKey();
        checkManifest(key, entry.getValue(), verify);
        pushManifest(mapping.destinationRepository(key.namespace()).withTag(key.tag()), entry.getValue());
        return null;
      });
    }
    ParallelTasks.invokeAll(executor, tasks);
  }

  private void checkManifest(ImageReference key, ManifestDocument manifest, boolean verify) {
    if (verify && key.digest() != null && !key.digest().matches(manifest.raw())) {
      throw new MirrorException("Manifest '" + key + "' does not match its digest");
    }
  }

  private void pushManifest(ImageReference target, ManifestDocument manifest)
    throws IOException, InterruptedException {
    if (dryRun) {
      LOGGER.info(
        "Would push manifest '{}' to '{}'",
        manifest.digest(),
        target.tag() != null ? target : target.withDigest(manifest.digest())
      );
      return;
    }
    destination.pushManifest(target, manifest);
  }

  /**
   * Maps source namespaces to destination repositories. The root's namespace maps to the destination repository,
   * every other namespace keeps its repository and moves to the destination registry.
   */
  private static final class DestinationMapping {

    private final String rootNamespace;
    private final ImageReference destRepository;
    private final Map<String, ImageReference> sourceRepositories;

    private DestinationMapping(ContentGraph graph, ImageReference destRef) {
      this.rootNamespace = graph.root().namespace();
      this.destRepository = new ImageReference(destRef.endpoint(), destRef.repository(), null, null);
      this.sourceRepositories = new HashMap<>();
      for (ImageReference manifest : graph.manifests().keySet()) {
        ImageReference repository = new ImageReference(manifest.endpoint(), manifest.repository(), null, null);
        sourceRepositories.putIfAbsent(repository.namespace(), repository);
      }
    }

    ImageReference sourceRepository(String namespace) {
      ImageReference repository = sourceRepositories.get(namespace);
      if (repository == null) {
        throw new MirrorException("Blob namespace '" + namespace + "' belongs to no recorded manifest");
      }
      return repository;
    }

    ImageReference destinationRepository(String namespace) {
      if (namespace.equals(rootNamespace)) {
        return destRepository;
      }
      return sourceRepository(namespace).withEndpoint(destRepository.endpoint());
    }
  }
}
