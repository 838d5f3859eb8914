package de.ialistannen.ocmirror.signing;

/**
 * Signature checking was requested but no valid signature was found.
 */
public class SignatureRequirementException extends RuntimeException {

  public SignatureRequirementException(String message) {
    super(message);
  }
}
