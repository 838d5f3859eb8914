package de.ialistannen.ocmirror.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.image.ManifestDocument;

/**
 * Everything needed to replicate an image and the images it references.
 *
 * @param root the root image, without tag and with its manifest digest
 * @param blobs every blob by digest, with the namespaces ({@code endpoint/repository}) it was found in
 * @param manifests every manifest (the root included) by {@code reference@digest}, with a descriptive label
 * @param documents the manifests exactly as fetched, keyed like {@code manifests}
 */
public record ContentGraph(
  ImageReference root,
  ImmutableMap<BlobDigest, ImmutableSet<String>> blobs,
  ImmutableMap<ImageReference, String> manifests,
  ImmutableMap<ImageReference, ManifestDocument> documents
) {

  public BlobDigest rootDigest() {
    return root.digest();
  }

  public ManifestDocument rootManifest() {
    return documents.get(root);
  }
}
