package de.ialistannen.ocmirror.gpg;

public class GpgException extends RuntimeException {

  public GpgException(String message) {
    super(message);
  }

  public GpgException(String message, Throwable cause) {
    super(message, cause);
  }
}
