package de.ialistannen.ocmirror.gpg;

/**
 * Owner trust of a key, ordered from least to most trusted.
 */
public enum GpgTrust {
  UNDEFINED,
  NEVER,
  MARGINAL,
  FULLY,
  ULTIMATE;

  public boolean isAtLeast(GpgTrust threshold) {
    return compareTo(threshold) >= 0;
  }
}
