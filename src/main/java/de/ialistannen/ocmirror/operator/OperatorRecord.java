package de.ialistannen.ocmirror.operator;

import com.google.common.collect.ImmutableList;
import de.ialistannen.ocmirror.image.ImageReference;

/**
 * A selected operator bundle.
 *
 * @param packageName the package
 * @param channel the resolved channel name
 * @param bundleImage the bundle image
 * @param bundleName the bundle (ClusterServiceVersion) name
 * @param relatedImages the images the operator needs at runtime
 */
public record OperatorRecord(
  String packageName,
  String channel,
  ImageReference bundleImage,
  String bundleName,
  ImmutableList<ImageReference> relatedImages
) {

}
