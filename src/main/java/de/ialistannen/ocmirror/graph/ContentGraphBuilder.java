package de.ialistannen.ocmirror.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.registry.ManifestFetchException;
import de.ialistannen.ocmirror.registry.RegistryClient;
import java.io.IOException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the manifests and blobs reachable from a set of images. {@link #add(ImageReference, String)} may be called
 * from many threads at once, each blob digest is merged atomically.
 */
public class ContentGraphBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentGraphBuilder.class);

  private final RegistryClient registry;
  private final Map<BlobDigest, Set<String>> blobs;
  private final Map<ImageReference, String> manifests;
  private final Map<ImageReference, ManifestDocument> documents;

  private ImageReference root;

  public ContentGraphBuilder(RegistryClient registry) {
    this.registry = registry;
    this.blobs = new ConcurrentHashMap<>();
    this.manifests = new ConcurrentHashMap<>();
    this.documents = new ConcurrentHashMap<>();
  }

  /**
   * Records the root image and everything below it.
   *
   * @param reference the root image
   * @param manifest the manifest the reference points to
   * @return the key of the root: the reference without its tag, addressed by digest
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   */
  public ImageReference addRoot(ImageReference reference, ManifestDocument manifest)
    throws IOException, InterruptedException {
    ImageReference untagged = reference.withTag(null);
    String label = reference.tag() != null ? reference.tag() : manifest.digest().toString();

    collect(untagged, manifest, label);
    this.root = untagged.withDigest(manifest.digest());
    return root;
  }

  /**
   * Fetches an image and records it with everything below it.
   *
   * @param reference the image
   * @param label a descriptive label, e.g. the tag name in a release
   * @return the manifest of the image
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws ReferenceResolutionException if the image does not exist
   */
  public ManifestDocument add(ImageReference reference, String label) throws IOException, InterruptedException {
    ManifestDocument manifest;
    try {
      manifest = registry.fetchManifest(reference);
    } catch (ManifestFetchException e) {
      throw new ReferenceResolutionException("Could not resolve '" + reference + "' (" + label + ")", e);
    }
    collect(reference, manifest, label);
    return manifest;
  }

  private void collect(ImageReference reference, ManifestDocument manifest, String label)
    throws IOException, InterruptedException {
    ImageReference key = reference.withDigest(manifest.digest());
    if (documents.putIfAbsent(key, manifest) != null) {
      return;
    }
    manifests.put(key, label);

    if (manifest.isList()) {
      for (ManifestDocument.Entry entry : manifest.entries()) {
        ImageReference child = reference.withTag(null).withDigest(entry.digest());
        ManifestDocument childManifest;
        try {
          childManifest = registry.fetchManifest(child);
        } catch (ManifestFetchException e) {
          throw new ReferenceResolutionException("Manifest list '" + key + "' references missing '" + child + "'", e);
        }
        collect(child, childManifest, label);
      }
      return;
    }

    String namespace = reference.namespace();
    for (BlobDigest blob : manifest.blobs()) {
      blobs.compute(blob, (digest, namespaces) -> {
        Set<String> result = namespaces == null ? new HashSet<>() : namespaces;
        result.add(namespace);
        return result;
      });
    }
    LOGGER.trace("Collected '{}' with {} blobs", key, manifest.blobs().size());
  }

  /**
   * @return an immutable snapshot, with blobs and manifests sorted for stable output
   * @throws IllegalStateException if no root was added
   */
  public ContentGraph build() {
    if (root == null) {
      throw new IllegalStateException("No root image added");
    }

    ImmutableMap.Builder<BlobDigest, ImmutableSet<String>> blobsBuilder = ImmutableMap.builder();
    blobs.entrySet().stream()
      .sorted(Map.Entry.comparingByKey())
      .forEach(entry -> blobsBuilder.put(
        entry.getKey(),
        ImmutableSet.copyOf(entry.getValue().stream().sorted().toList())
      ));

    ImmutableMap.Builder<ImageReference, String> manifestsBuilder = ImmutableMap.builder();
    ImmutableMap.Builder<ImageReference, ManifestDocument> documentsBuilder = ImmutableMap.builder();
    manifests.keySet().stream()
      .sorted(Comparator.comparing(ImageReference::toString))
      .forEach(key -> {
        manifestsBuilder.put(key, manifests.get(key));
        documentsBuilder.put(key, documents.get(key));
      });

    return new ContentGraph(root, blobsBuilder.build(), manifestsBuilder.build(), documentsBuilder.build());
  }
}
