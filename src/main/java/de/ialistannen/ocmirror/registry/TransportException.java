package de.ialistannen.ocmirror.registry;

/**
 * A registry or signature store could not be reached or answered with an unexpected status.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
