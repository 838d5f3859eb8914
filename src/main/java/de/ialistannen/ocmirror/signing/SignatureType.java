package de.ialistannen.ocmirror.signing;

/**
 * Which check produced a {@link SignatureVerification}.
 */
public enum SignatureType {
  /**
   * The GPG signature was checked and its payload is an atomic signature for the requested digest.
   */
  ATOMIC_SIGNER("atomicsigner"),
  /**
   * Only the GPG layer could be evaluated, the atomic payload was missing or did not match.
   */
  GPG("gpg");

  private final String label;

  SignatureType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
