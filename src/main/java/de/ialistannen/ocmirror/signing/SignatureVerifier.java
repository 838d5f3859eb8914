package de.ialistannen.ocmirror.signing;

import de.ialistannen.ocmirror.gpg.BouncyCastleGpgEngine;
import de.ialistannen.ocmirror.gpg.GpgTrust;
import de.ialistannen.ocmirror.gpg.Keyring;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces that the root image of a mirror run carries a valid signature from one of the given keys.
 */
public class SignatureVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(SignatureVerifier.class);

  private final SignatureStoreClient storeClient;
  private final Executor executor;
  private final GpgTrust trustThreshold;

  public SignatureVerifier(SignatureStoreClient storeClient, Executor executor, GpgTrust trustThreshold) {
    this.storeClient = storeClient;
    this.executor = executor;
    this.trustThreshold = trustThreshold;
  }

  /**
   * Checks the signatures of a digest against the given keys. The keys are trusted ultimately.
   *
   * @param digest the manifest digest
   * @param reference the image
   * @param stores the stores to look in
   * @param signingKeys the ascii armored public keys to accept
   * @return the accepted signature
   * @throws IOException if a store could not be read
   * @throws InterruptedException ?
   * @throws SignatureRequirementException if no signature is valid
   */
  public List<SignatureVerification> requireValid(
    BlobDigest digest,
    ImageReference reference,
    List<URI> stores,
    List<String> signingKeys
  ) throws IOException, InterruptedException {
    if (stores.isEmpty()) {
      throw new SignatureRequirementException("No signature stores known for '" + reference + "'");
    }
    if (signingKeys.isEmpty()) {
      throw new SignatureRequirementException("No signing keys known for '" + reference + "'");
    }

    Optional<SignatureVerification> result = signerFor(stores, signingKeys).atomicverify(digest, reference);
    if (result.isEmpty()) {
      throw new SignatureRequirementException("Unable to find any signatures for '" + reference + "' (" + digest + ")");
    }
    if (!result.get().valid()) {
      throw new SignatureRequirementException(
        "Unable to verify '" + reference + "' (" + digest + "): " + describeFailure(result.get())
      );
    }

    LOGGER.info("Verified '{}': {}", reference, result.get().signerShort());
    return List.of(result.get());
  }

  /**
   * Checks every stored signature of a digest without requiring any of them to be valid.
   *
   * @param digest the manifest digest
   * @param reference the image
   * @param stores the stores to look in
   * @param signingKeys the ascii armored public keys to accept
   * @return every checked signature in store and ordinal order, empty if no store is known
   * @throws IOException if a store could not be read
   * @throws InterruptedException ?
   */
  public List<SignatureVerification> inspectAll(
    BlobDigest digest,
    ImageReference reference,
    List<URI> stores,
    List<String> signingKeys
  ) throws IOException, InterruptedException {
    if (stores.isEmpty()) {
      return List.of();
    }
    List<SignatureVerification> results = signerFor(stores, signingKeys).atomicverifyAll(digest, reference);
    LOGGER.debug("Found {} signatures for '{}' ({})", results.size(), reference, digest);
    return results;
  }

  private AtomicSigner signerFor(List<URI> stores, List<String> signingKeys) throws IOException {
    Keyring keyring = new Keyring();
    for (String key : signingKeys) {
      keyring.importPublicKeys(key, GpgTrust.ULTIMATE);
    }

    return new AtomicSigner(
      new BouncyCastleGpgEngine(keyring),
      storeClient,
      executor,
      stores,
      trustThreshold
    );
  }

  private static String describeFailure(SignatureVerification verification) {
    if (verification.statusAtomic() != null) {
      return verification.statusAtomic();
    }
    if (!"signature valid".equals(verification.statusGpg())) {
      return verification.statusGpg();
    }
    return "key " + verification.keyId() + " has insufficient trust " + verification.trust();
  }
}
