package de.ialistannen.ocmirror.release;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.graph.MirrorableMetadata;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import java.net.URI;

/**
 * Everything known about a release image.
 *
 * @param graph the release image and all of its components
 * @param rawImageReferences the {@code image-references} document as found in the payload
 * @param rawReleaseMetadata the {@code release-metadata} document, empty if the payload has none
 * @param signatureStores the stores signatures were looked up in
 * @param signingKeys the armored keys signatures were checked against
 * @param signatures the checked signatures, empty if signatures were not checked
 */
public record ReleaseMetadata(
  ContentGraph graph,
  String rawImageReferences,
  String rawReleaseMetadata,
  ImmutableList<URI> signatureStores,
  ImmutableList<String> signingKeys,
  ImmutableList<SignatureVerification> signatures
) implements MirrorableMetadata {

  public BlobDigest manifestDigest() {
    return graph.rootDigest();
  }

  public ImmutableMap<BlobDigest, ImmutableSet<String>> blobs() {
    return graph.blobs();
  }

  public ImmutableMap<ImageReference, String> manifests() {
    return graph.manifests();
  }

  /**
   * @param newSignatures the signatures to report instead
   * @return a copy carrying the given signatures
   */
  public ReleaseMetadata withSignatures(ImmutableList<SignatureVerification> newSignatures) {
    return new ReleaseMetadata(
      graph,
      rawImageReferences,
      rawReleaseMetadata,
      signatureStores,
      signingKeys,
      newSignatures
    );
  }
}
