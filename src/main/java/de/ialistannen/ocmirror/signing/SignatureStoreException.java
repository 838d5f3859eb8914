package de.ialistannen.ocmirror.signing;

import de.ialistannen.ocmirror.registry.TransportException;
import java.net.URI;

public class SignatureStoreException extends TransportException {

  public SignatureStoreException(URI location, String action, int statusCode) {
    super("Error trying to " + action + " signature at '" + location + "', got status code " + statusCode);
  }

  public SignatureStoreException(String message) {
    super(message);
  }

  public SignatureStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
