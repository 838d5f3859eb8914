package de.ialistannen.ocmirror.signing;

import java.net.URI;
import java.util.List;

/**
 * How resolvers check the signatures of the root image.
 *
 * @param signatureStores the stores to look in, empty to use the ones the image announces
 * @param signingKeys ascii armored public keys, empty to use the ones the image announces
 * @param verify whether a valid signature is required
 */
public record VerificationConfig(List<URI> signatureStores, List<String> signingKeys, boolean verify) {

  public VerificationConfig {
    signatureStores = List.copyOf(signatureStores);
    signingKeys = List.copyOf(signingKeys);
  }

  public static VerificationConfig disabled() {
    return new VerificationConfig(List.of(), List.of(), false);
  }
}
