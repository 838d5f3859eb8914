package de.ialistannen.ocmirror.image;

import java.util.List;

public final class MediaTypes {

  public static final String DOCKER_MANIFEST_LIST_V2 = "application/vnd.docker.distribution.manifest.list.v2+json";
  public static final String DOCKER_MANIFEST_V2 = "application/vnd.docker.distribution.manifest.v2+json";
  public static final String OCI_IMAGE_INDEX_V1 = "application/vnd.oci.image.index.v1+json";
  public static final String OCI_IMAGE_MANIFEST_V1 = "application/vnd.oci.image.manifest.v1+json";

  /**
   * Everything we can handle, sent as {@code Accept} headers. We compare manifest digests, so the registry must not
   * convert the manifest to some older format.
   */
  public static final List<String> ACCEPTED_MANIFESTS = List.of(
    DOCKER_MANIFEST_LIST_V2,
    DOCKER_MANIFEST_V2,
    OCI_IMAGE_INDEX_V1,
    OCI_IMAGE_MANIFEST_V1
  );

  private MediaTypes() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static boolean isList(String mediaType) {
    return DOCKER_MANIFEST_LIST_V2.equals(mediaType) || OCI_IMAGE_INDEX_V1.equals(mediaType);
  }
}
