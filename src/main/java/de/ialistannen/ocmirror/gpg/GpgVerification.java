package de.ialistannen.ocmirror.gpg;

import java.time.Instant;

/**
 * The result of checking a signed message.
 *
 * @param fingerprint the fingerprint of the signing key, null if the key is unknown
 * @param keyId the long (16 hex digits) id of the signing key, null if the message was not signed
 * @param trust the trust of the signing key
 * @param status the signature status
 * @param payload the signed content, empty if it could not be extracted
 * @param username the primary user id of the signing key, may be null
 * @param timestamp the signature creation time, may be null
 */
public record GpgVerification(
  String fingerprint,
  String keyId,
  GpgTrust trust,
  GpgStatus status,
  byte[] payload,
  String username,
  Instant timestamp
) {

  public static GpgVerification noSignature() {
    return new GpgVerification(null, null, GpgTrust.UNDEFINED, GpgStatus.NO_SIGNATURE, new byte[0], null, null);
  }

  public boolean isValid() {
    return status == GpgStatus.VALID;
  }
}
