package de.ialistannen.ocmirror.gpg;

import java.time.Instant;

/**
 * Creates and checks OpenPGP signed messages.
 */
public interface GpgEngine {

  /**
   * Signs data, embedding it in the produced message.
   *
   * @param data the data to sign
   * @param keyId the fingerprint or key id of the secret key to use
   * @param passphrase the passphrase protecting the key, may be empty
   * @param signedAt the signature creation time, also used as the modification time of the embedded data
   * @return the signed message
   * @throws GpgException if the key is unknown or can not be unlocked
   */
  byte[] sign(byte[] data, String keyId, String passphrase, Instant signedAt);

  /**
   * Verifies a signed message. Never throws for malformed input, those messages report
   * {@link GpgStatus#NO_SIGNATURE}.
   *
   * @param signed the signed message, binary or ascii armored
   * @return the verification result
   */
  GpgVerification verify(byte[] signed);
}
