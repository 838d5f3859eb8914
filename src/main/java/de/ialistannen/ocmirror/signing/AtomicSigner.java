package de.ialistannen.ocmirror.signing;

import de.ialistannen.ocmirror.concurrent.ParallelTasks;
import de.ialistannen.ocmirror.gpg.GpgEngine;
import de.ialistannen.ocmirror.gpg.GpgTrust;
import de.ialistannen.ocmirror.gpg.GpgVerification;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and checks atomic container signatures kept in signature stores. A store holds the signatures for a
 * manifest digest at {@code <store>/<algorithm>=<hex>/signature-<n>}, numbered from 1 without gaps.
 */
public class AtomicSigner {

  public static final String CREATOR = "oc-mirror";

  private static final Logger LOGGER = LoggerFactory.getLogger(AtomicSigner.class);
  private static final int MAX_SIGNATURES_PER_DIGEST = 256;

  private final GpgEngine gpg;
  private final SignatureStoreClient storeClient;
  private final Executor executor;
  private final List<URI> stores;
  private final GpgTrust trustThreshold;
  private final String keyId;
  private final String passphrase;
  private final Clock clock;

  /**
   * Creates a signer that can only verify.
   *
   * @param gpg the engine checking signatures
   * @param storeClient the store access
   * @param executor the executor stores are scanned on
   * @param stores the signature stores, in order of preference
   * @param trustThreshold the minimum trust of a signing key for a signature to be valid
   */
  public AtomicSigner(
    GpgEngine gpg,
    SignatureStoreClient storeClient,
    Executor executor,
    List<URI> stores,
    GpgTrust trustThreshold
  ) {
    this(gpg, storeClient, executor, stores, trustThreshold, null, null, Clock.systemUTC());
  }

  private AtomicSigner(
    GpgEngine gpg,
    SignatureStoreClient storeClient,
    Executor executor,
    List<URI> stores,
    GpgTrust trustThreshold,
    String keyId,
    String passphrase,
    Clock clock
  ) {
    this.gpg = gpg;
    this.storeClient = storeClient;
    this.executor = executor;
    this.stores = List.copyOf(stores);
    this.trustThreshold = trustThreshold;
    this.keyId = keyId;
    this.passphrase = passphrase;
    this.clock = clock;
  }

  /**
   * @param keyId the fingerprint or key id of the secret key to sign with
   * @param passphrase the passphrase of the key
   * @return a signer using the given key
   */
  public AtomicSigner withSigningKey(String keyId, String passphrase) {
    return new AtomicSigner(gpg, storeClient, executor, stores, trustThreshold, keyId, passphrase, clock);
  }

  public AtomicSigner withClock(Clock clock) {
    return new AtomicSigner(gpg, storeClient, executor, stores, trustThreshold, keyId, passphrase, clock);
  }

  public Optional<String> keyId() {
    return Optional.ofNullable(keyId);
  }

  public List<URI> stores() {
    return stores;
  }

  /**
   * Signs a manifest digest and writes the signature to the next free slot of every store.
   *
   * @param digest the manifest digest
   * @param reference the image the signature is for
   * @return the location in the first store
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws IllegalStateException if no key or store is configured
   */
  public URI atomicsign(BlobDigest digest, ImageReference reference) throws IOException, InterruptedException {
    if (keyId == null) {
      throw new IllegalStateException("No signing key configured");
    }
    if (stores.isEmpty()) {
      throw new IllegalStateException("No signature store configured");
    }

    Instant signedAt = clock.instant();
    AtomicPayload payload = new AtomicPayload(
      reference.withDigest(null).toString(),
      digest,
      CREATOR,
      signedAt.getEpochSecond()
    );
    byte[] signature = gpg.sign(payload.toJson(), keyId, passphrase, signedAt);

    URI first = null;
    for (URI store : stores) {
      URI location = nextFreeLocation(store, digest);
      storeClient.put(location, signature);
      LOGGER.info("Stored signature for '{}' at {}", digest, location);
      if (first == null) {
        first = location;
      }
    }
    return first;
  }

  private URI nextFreeLocation(URI store, BlobDigest digest) throws IOException, InterruptedException {
    for (int ordinal = 1; ordinal <= MAX_SIGNATURES_PER_DIGEST; ordinal++) {
      URI location = signatureLocation(store, digest, ordinal);
      if (storeClient.get(location).isEmpty()) {
        return location;
      }
    }
    throw new SignatureStoreException(
      "Store " + store + " already holds " + MAX_SIGNATURES_PER_DIGEST + " signatures for '" + digest + "'"
    );
  }

  /**
   * Verifies the signatures stored for a digest.
   *
   * @param digest the manifest digest
   * @param reference the image the digest belongs to
   * @return the first valid result in store order, the last checked one if none is valid, or an empty optional if no
   *   store holds a signature
   * @throws IOException if a store could not be read
   * @throws InterruptedException ?
   */
  public Optional<SignatureVerification> atomicverify(BlobDigest digest, ImageReference reference)
    throws IOException, InterruptedException {
    return select(scanStores(digest, reference, true));
  }

  /**
   * Verifies every signature stored for a digest.
   *
   * @param digest the manifest digest
   * @param reference the image the digest belongs to
   * @return all results, in store and ordinal order
   * @throws IOException if a store could not be read
   * @throws InterruptedException ?
   */
  public List<SignatureVerification> atomicverifyAll(BlobDigest digest, ImageReference reference)
    throws IOException, InterruptedException {
    List<SignatureVerification> all = new ArrayList<>();
    scanStores(digest, reference, false).forEach(all::addAll);
    return all;
  }

  static Optional<SignatureVerification> select(List<List<SignatureVerification>> perStore) {
    SignatureVerification last = null;
    for (List<SignatureVerification> results : perStore) {
      for (SignatureVerification result : results) {
        if (result.valid()) {
          return Optional.of(result);
        }
        last = result;
      }
    }
    return Optional.ofNullable(last);
  }

  private List<List<SignatureVerification>> scanStores(
    BlobDigest digest,
    ImageReference reference,
    boolean stopAtValid
  ) throws IOException, InterruptedException {
    LOGGER.debug("Looking for signatures of '{}' ({}) in {} stores", digest, reference, stores.size());

    List<Callable<List<SignatureVerification>>> tasks = new ArrayList<>();
    for (URI store : stores) {
      tasks.add(() -> scanStore(store, digest, stopAtValid));
    }
    return ParallelTasks.invokeAll(executor, tasks);
  }

  private List<SignatureVerification> scanStore(URI store, BlobDigest digest, boolean stopAtValid)
    throws IOException, InterruptedException {
    List<SignatureVerification> results = new ArrayList<>();

    for (int ordinal = 1; ordinal <= MAX_SIGNATURES_PER_DIGEST; ordinal++) {
      URI location = signatureLocation(store, digest, ordinal);
      Optional<byte[]> signature = storeClient.get(location);
      if (signature.isEmpty()) {
        break;
      }

      SignatureVerification result = check(signature.get(), location, digest);
      LOGGER.debug("{}: {} ({})", location, result.statusGpg(), result.valid() ? "valid" : "invalid");
      results.add(result);
      if (stopAtValid && result.valid()) {
        break;
      }
    }

    return results;
  }

  SignatureVerification check(byte[] signature, URI location, BlobDigest digest) {
    GpgVerification gpgResult = gpg.verify(signature);
    Optional<AtomicPayload> payload = AtomicPayload.parse(gpgResult.payload());

    String mismatch = null;
    if (payload.isEmpty()) {
      mismatch = "Signed content is no atomic container signature";
    } else if (!payload.get().manifestDigest().equals(digest)) {
      mismatch = "Signed digest " + payload.get().manifestDigest() + " does not match " + digest;
    }

    if (mismatch != null) {
      return new SignatureVerification(
        null,
        gpgResult.keyId(),
        SignatureVerification.describeLong(null, gpgResult.keyId(), gpgResult.username()),
        SignatureVerification.describeShort(null, gpgResult.keyId()),
        mismatch,
        gpgResult.status().label(),
        null,
        GpgTrust.UNDEFINED,
        SignatureType.GPG,
        gpgResult.username(),
        false,
        location
      );
    }

    boolean trusted = gpgResult.trust().isAtLeast(trustThreshold);
    if (gpgResult.isValid() && !trusted) {
      LOGGER.debug(
        "Signature at {} is made by {} with insufficient trust {}",
        location,
        gpgResult.keyId(),
        gpgResult.trust()
      );
    }
    return new SignatureVerification(
      gpgResult.fingerprint(),
      gpgResult.keyId(),
      SignatureVerification.describeLong(gpgResult.timestamp(), gpgResult.keyId(), gpgResult.username()),
      SignatureVerification.describeShort(gpgResult.timestamp(), gpgResult.keyId()),
      null,
      gpgResult.status().label(),
      gpgResult.timestamp(),
      gpgResult.trust(),
      SignatureType.ATOMIC_SIGNER,
      gpgResult.username(),
      gpgResult.isValid() && trusted,
      location
    );
  }

  /**
   * @param store the store base location
   * @param digest the manifest digest
   * @param ordinal the signature number, starting at 1
   * @return the location of the signature
   */
  public static URI signatureLocation(URI store, BlobDigest digest, int ordinal) {
    String base = store.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/" + digest.storagePathSegment() + "/signature-" + ordinal);
  }
}
