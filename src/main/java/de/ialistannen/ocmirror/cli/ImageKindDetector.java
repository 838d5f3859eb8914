package de.ialistannen.ocmirror.cli;

import de.ialistannen.ocmirror.graph.PlatformImage;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.operator.OperatorMetadataResolver;
import de.ialistannen.ocmirror.registry.RegistryClient;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an image is a release or an operator index.
 */
public class ImageKindDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageKindDetector.class);

  private final RegistryClient registry;
  private final Platform platform;

  public ImageKindDetector(RegistryClient registry, Platform platform) {
    this.registry = registry;
    this.platform = platform;
  }

  /**
   * Packages are only meaningful for operator indices, so their presence decides. Otherwise the image config is
   * checked for the index database label.
   *
   * @param image the image
   * @param hasPackages whether packages were requested
   * @return the kind of image
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   */
  public ImageKind detect(ImageReference image, boolean hasPackages) throws IOException, InterruptedException {
    if (hasPackages) {
      return ImageKind.OPERATOR_INDEX;
    }
    PlatformImage platformImage = PlatformImage.select(registry, image, registry.fetchManifest(image), platform);
    ImageKind kind = platformImage.config().label(OperatorMetadataResolver.DATABASE_LABEL).isPresent()
      ? ImageKind.OPERATOR_INDEX
      : ImageKind.RELEASE;
    LOGGER.debug("'{}' is a {}", image, kind);
    return kind;
  }

  public enum ImageKind {
    RELEASE,
    OPERATOR_INDEX
  }
}
