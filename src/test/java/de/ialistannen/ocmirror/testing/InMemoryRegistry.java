package de.ialistannen.ocmirror.testing;

import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.registry.BlobTransferException;
import de.ialistannen.ocmirror.registry.ManifestFetchException;
import de.ialistannen.ocmirror.registry.RegistryClient;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * A registry kept in memory. Repositories are keyed by {@link ImageReference#namespace()}, every write is recorded.
 */
public class InMemoryRegistry implements RegistryClient {

  private final Map<String, Map<String, ManifestDocument>> manifests;
  private final Map<String, Map<BlobDigest, byte[]>> blobs;
  private final List<String> writes;
  private volatile boolean mountSupported;
  private volatile Predicate<BlobDigest> failingBlobs;

  public InMemoryRegistry() {
    this.manifests = new ConcurrentHashMap<>();
    this.blobs = new ConcurrentHashMap<>();
    this.writes = Collections.synchronizedList(new ArrayList<>());
    this.mountSupported = true;
    this.failingBlobs = ignored -> false;
  }

  public InMemoryRegistry withoutMounts() {
    this.mountSupported = false;
    return this;
  }

  /**
   * @param failing blobs whose download should fail
   * @return this registry
   */
  public InMemoryRegistry failingFor(Predicate<BlobDigest> failing) {
    this.failingBlobs = failing;
    return this;
  }

  /**
   * Stores a blob.
   *
   * @param repository the repository
   * @param content the content
   * @return the digest of the content
   */
  public BlobDigest putBlob(ImageReference repository, byte[] content) {
    BlobDigest digest = BlobDigest.of(content);
    putBlob(repository, digest, content);
    return digest;
  }

  public void putBlob(ImageReference repository, BlobDigest digest, byte[] content) {
    blobs.computeIfAbsent(repository.namespace(), ignored -> new ConcurrentHashMap<>()).put(digest, content);
  }

  /**
   * Stores a manifest under its digest and, if the reference has one, its tag.
   *
   * @param reference the target
   * @param manifest the manifest
   * @return the reference with the manifest digest
   */
  public ImageReference putManifest(ImageReference reference, ManifestDocument manifest) {
    Map<String, ManifestDocument> repository = manifests.computeIfAbsent(
      reference.namespace(),
      ignored -> new ConcurrentHashMap<>()
    );
    repository.put(manifest.digest().toString(), manifest);
    if (reference.tag() != null) {
      repository.put(reference.tag(), manifest);
    }
    return reference.withDigest(manifest.digest());
  }

  public boolean hasBlob(ImageReference repository, BlobDigest digest) {
    return blobs.getOrDefault(repository.namespace(), Map.of()).containsKey(digest);
  }

  public byte[] blob(ImageReference repository, BlobDigest digest) {
    return blobs.getOrDefault(repository.namespace(), Map.of()).get(digest);
  }

  public ManifestDocument manifest(ImageReference reference) {
    return manifests.getOrDefault(reference.namespace(), Map.of()).get(reference.resolveManifestReference());
  }

  /**
   * @return every write, as {@code action namespace digest-or-tag}
   */
  public List<String> writes() {
    synchronized (writes) {
      return List.copyOf(writes);
    }
  }

  @Override
  public ManifestDocument fetchManifest(ImageReference reference) {
    ManifestDocument manifest = manifest(reference);
    if (manifest == null) {
      throw new ManifestFetchException(reference, 404);
    }
    return manifest;
  }

  @Override
  public InputStream openBlob(ImageReference reference, BlobDigest digest) {
    byte[] content = blob(reference, digest);
    if (content == null || failingBlobs.test(digest)) {
      throw new BlobTransferException(reference, digest, "fetch", 404);
    }
    return new ByteArrayInputStream(content);
  }

  @Override
  public boolean blobExists(ImageReference reference, BlobDigest digest) {
    return hasBlob(reference, digest);
  }

  @Override
  public void pushBlob(ImageReference reference, BlobDigest digest, Path content) throws IOException {
    writes.add("blob " + reference.namespace() + " " + digest);
    putBlob(reference, digest, Files.readAllBytes(content));
  }

  @Override
  public boolean mountBlob(ImageReference reference, BlobDigest digest, String fromRepository) {
    ImageReference from = new ImageReference(reference.endpoint(), fromRepository, null, null);
    if (!mountSupported || !hasBlob(from, digest)) {
      return false;
    }
    writes.add("mount " + reference.namespace() + " " + digest);
    putBlob(reference, digest, blob(from, digest));
    return true;
  }

  @Override
  public void pushManifest(ImageReference reference, ManifestDocument manifest) {
    String target = reference.tag() != null ? reference.tag() : manifest.digest().toString();
    writes.add("manifest " + reference.namespace() + " " + target);
    putManifest(reference, manifest);
  }

  @Override
  public void close() {
  }
}
