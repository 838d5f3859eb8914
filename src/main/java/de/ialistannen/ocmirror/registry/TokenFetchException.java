package de.ialistannen.ocmirror.registry;

public class TokenFetchException extends TransportException {

  public TokenFetchException(String message) {
    super(message);
  }

  public TokenFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
