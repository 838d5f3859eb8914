package de.ialistannen.ocmirror.registry;

import de.ialistannen.ocmirror.image.ImageReference;

public class ManifestPushException extends TransportException {

  public ManifestPushException(ImageReference reference, int statusCode) {
    super("Error pushing manifest to '" + reference + "', got status code " + statusCode);
  }
}
