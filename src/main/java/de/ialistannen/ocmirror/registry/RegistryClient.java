package de.ialistannen.ocmirror.registry;

import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Low level access to a registry speaking the docker registry v2 API. Implementations must be safe for use from
 * multiple threads.
 */
public interface RegistryClient extends AutoCloseable {

  /**
   * Fetches the manifest the reference points to.
   *
   * @param reference the image, addressed by digest if it has one and by tag otherwise
   * @return the manifest exactly as served
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   * @throws ManifestFetchException if the registry refused to serve the manifest
   */
  ManifestDocument fetchManifest(ImageReference reference) throws IOException, InterruptedException;

  /**
   * Opens a stream to a blob. The caller must close it.
   *
   * @param reference the repository to read from
   * @param digest the blob
   * @return the blob content
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   * @throws BlobTransferException if the registry refused to serve the blob
   */
  InputStream openBlob(ImageReference reference, BlobDigest digest) throws IOException, InterruptedException;

  /**
   * Reads a (small) blob fully into memory.
   *
   * @param reference the repository to read from
   * @param digest the blob
   * @return the blob content
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   */
  default byte[] fetchBlob(ImageReference reference, BlobDigest digest) throws IOException, InterruptedException {
    try (InputStream inputStream = openBlob(reference, digest)) {
      return inputStream.readAllBytes();
    }
  }

  boolean blobExists(ImageReference reference, BlobDigest digest) throws IOException, InterruptedException;

  /**
   * Uploads a blob in a single request.
   *
   * @param reference the repository to upload to
   * @param digest the digest of the content
   * @param content the file holding the content
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   * @throws BlobTransferException if the upload was rejected
   */
  void pushBlob(ImageReference reference, BlobDigest digest, Path content) throws IOException, InterruptedException;

  /**
   * Asks the registry to link an existing blob from another repository on the same registry.
   *
   * @param reference the repository to mount into
   * @param digest the blob
   * @param fromRepository the repository already holding the blob
   * @return true if the blob was mounted, false if the registry declined and the blob must be uploaded
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   */
  boolean mountBlob(ImageReference reference, BlobDigest digest, String fromRepository)
    throws IOException, InterruptedException;

  /**
   * Uploads a manifest. The manifest is stored under the tag of the reference if it has one, under its digest
   * otherwise.
   *
   * @param reference the target
   * @param manifest the manifest
   * @throws IOException if an error happens
   * @throws InterruptedException ?
   * @throws ManifestPushException if the upload was rejected
   */
  void pushManifest(ImageReference reference, ManifestDocument manifest) throws IOException, InterruptedException;

  @Override
  void close();
}
