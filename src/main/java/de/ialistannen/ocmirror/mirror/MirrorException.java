package de.ialistannen.ocmirror.mirror;

/**
 * Replicating content failed. The destination may hold a partial copy until a later run succeeds.
 */
public class MirrorException extends RuntimeException {

  public MirrorException(String message) {
    super(message);
  }

  public MirrorException(String message, Throwable cause) {
    super(message, cause);
  }
}
