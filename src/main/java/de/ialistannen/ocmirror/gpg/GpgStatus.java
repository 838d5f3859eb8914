package de.ialistannen.ocmirror.gpg;

/**
 * The outcome of checking an OpenPGP signature.
 */
public enum GpgStatus {
  VALID("signature valid"),
  BAD("signature bad"),
  NO_PUBLIC_KEY("no public key"),
  NO_SIGNATURE("no signature");

  private final String label;

  GpgStatus(String label) {
    this.label = label;
  }

  /**
   * @return the human readable status, as gpg reports it
   */
  public String label() {
    return label;
  }
}
