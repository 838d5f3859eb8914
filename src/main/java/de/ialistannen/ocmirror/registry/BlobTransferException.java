package de.ialistannen.ocmirror.registry;

import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;

public class BlobTransferException extends TransportException {

  public BlobTransferException(ImageReference reference, BlobDigest digest, String action, int statusCode) {
    super("Error trying to " + action + " blob '" + digest + "' in '" + reference.namespace()
      + "', got status code " + statusCode);
  }

  public BlobTransferException(String message) {
    super(message);
  }
}
