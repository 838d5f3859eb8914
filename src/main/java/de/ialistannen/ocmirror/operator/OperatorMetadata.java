package de.ialistannen.ocmirror.operator;

import com.google.common.collect.ImmutableList;
import de.ialistannen.ocmirror.graph.ContentGraph;
import de.ialistannen.ocmirror.graph.MirrorableMetadata;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import java.net.URI;

/**
 * Everything known about an operator index and the selected operators.
 *
 * @param indexDatabasePath the path of the index database inside the image
 * @param indexDatabase the index database exactly as stored in the image
 * @param operators the selected operators
 * @param graph the index, bundle and related images
 * @param signatureStores the stores signatures were looked up in
 * @param signingKeys the armored keys signatures were checked against
 * @param signatures the checked signatures, empty if signatures were not checked
 */
public record OperatorMetadata(
  String indexDatabasePath,
  byte[] indexDatabase,
  ImmutableList<OperatorRecord> operators,
  ContentGraph graph,
  ImmutableList<URI> signatureStores,
  ImmutableList<String> signingKeys,
  ImmutableList<SignatureVerification> signatures
) implements MirrorableMetadata {

  public BlobDigest manifestDigest() {
    return graph.rootDigest();
  }

  /**
   * @param newSignatures the signatures to report instead
   * @return a copy carrying the given signatures
   */
  public OperatorMetadata withSignatures(ImmutableList<SignatureVerification> newSignatures) {
    return new OperatorMetadata(
      indexDatabasePath,
      indexDatabase,
      operators,
      graph,
      signatureStores,
      signingKeys,
      newSignatures
    );
  }
}
