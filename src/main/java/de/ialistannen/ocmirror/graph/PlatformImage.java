package de.ialistannen.ocmirror.graph;

import de.ialistannen.ocmirror.image.ImageConfig;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;
import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.registry.RegistryClient;
import java.io.IOException;

/**
 * A single platform image, the one whose layers are read for metadata.
 *
 * @param reference the image, addressed by digest
 * @param manifest its image manifest
 * @param config its config
 */
public record PlatformImage(ImageReference reference, ManifestDocument manifest, ImageConfig config) {

  /**
   * Selects the image for a platform. Image manifests are used as they are.
   *
   * @param registry the registry to fetch from
   * @param reference the image
   * @param manifest the manifest the reference points to
   * @param platform the wanted platform
   * @return the platform image
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws ReferenceResolutionException if a manifest list has no entry for the platform
   */
  public static PlatformImage select(
    RegistryClient registry,
    ImageReference reference,
    ManifestDocument manifest,
    Platform platform
  ) throws IOException, InterruptedException {
    ImageReference imageReference = reference.withTag(null).withDigest(manifest.digest());
    ManifestDocument imageManifest = manifest;

    if (manifest.isList()) {
      ManifestDocument.Entry entry = manifest.entryFor(platform).orElseThrow(
        () -> new ReferenceResolutionException("'" + reference + "' has no image for platform " + platform)
      );
      imageReference = imageReference.withDigest(entry.digest());
      imageManifest = registry.fetchManifest(imageReference);
    }

    if (imageManifest.config().isEmpty()) {
      throw new ReferenceResolutionException("'" + imageReference + "' has no config");
    }
    ImageConfig config = ImageConfig.parse(registry.fetchBlob(imageReference, imageManifest.config().get()));

    return new PlatformImage(imageReference, imageManifest, config);
  }
}
