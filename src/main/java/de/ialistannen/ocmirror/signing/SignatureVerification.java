package de.ialistannen.ocmirror.signing;

import de.ialistannen.ocmirror.gpg.GpgTrust;
import java.net.URI;
import java.time.Instant;

/**
 * The result of checking one stored signature.
 *
 * @param fingerprint the fingerprint of the signing key, null unless the atomic payload matched
 * @param keyId the long id of the signing key, may be null
 * @param signerLong a description of the signature including the signer
 * @param signerShort a one line description of the signature
 * @param statusAtomic why the atomic payload was rejected, null if it was accepted
 * @param statusGpg the gpg status, e.g. {@code signature valid}
 * @param timestamp when the signature was made, null unless the atomic payload matched
 * @param trust the trust of the signing key
 * @param type which check produced this result
 * @param username the primary user id of the signing key, may be null
 * @param valid true if the signature is cryptographically valid, matches the digest and the key is trusted
 * @param url where the signature was read from
 */
public record SignatureVerification(
  String fingerprint,
  String keyId,
  String signerLong,
  String signerShort,
  String statusAtomic,
  String statusGpg,
  Instant timestamp,
  GpgTrust trust,
  SignatureType type,
  String username,
  boolean valid,
  URI url
) {

  static String describeShort(Instant timestamp, String keyId) {
    return "Signature made " + (timestamp == null ? "at an unknown time" : timestamp)
      + " using key ID " + (keyId == null ? "unknown" : keyId);
  }

  static String describeLong(Instant timestamp, String keyId, String username) {
    return describeShort(timestamp, keyId) + "\n" + (username == null ? "unknown signer" : username);
  }
}
