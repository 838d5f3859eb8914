package de.ialistannen.ocmirror.graph;

/**
 * Content an image refers to could not be found.
 */
public class ReferenceResolutionException extends RuntimeException {

  public ReferenceResolutionException(String message) {
    super(message);
  }

  public ReferenceResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
