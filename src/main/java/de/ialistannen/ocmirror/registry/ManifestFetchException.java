package de.ialistannen.ocmirror.registry;

import de.ialistannen.ocmirror.image.ImageReference;

public class ManifestFetchException extends TransportException {

  private final int statusCode;

  public ManifestFetchException(ImageReference reference, int statusCode) {
    super("Error fetching manifest for '" + reference + "', got status code " + statusCode);
    this.statusCode = statusCode;
  }

  public ManifestFetchException(String message) {
    super(message);
    this.statusCode = -1;
  }

  /**
   * @return the http status code, -1 if the request never got an answer
   */
  public int statusCode() {
    return statusCode;
  }
}
