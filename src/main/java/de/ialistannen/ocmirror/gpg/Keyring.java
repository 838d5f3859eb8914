package de.ialistannen.ocmirror.gpg;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRingCollection;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPSecretKeyRingCollection;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in memory key store. Keys are looked up by the id of any key of their ring, so signatures made by subkeys
 * resolve to the owning ring.
 */
public class Keyring {

  private static final Logger LOGGER = LoggerFactory.getLogger(Keyring.class);

  private final Map<Long, Entry> publicKeys;
  private final Map<Long, PGPSecretKey> secretKeys;

  public Keyring() {
    this.publicKeys = new ConcurrentHashMap<>();
    this.secretKeys = new ConcurrentHashMap<>();
  }

  /**
   * Imports public keys.
   *
   * @param armored ascii armored public key rings
   * @param trust the trust to assign to them
   * @return the fingerprints of the imported primary keys
   * @throws IOException if the keys can not be read
   */
  public List<String> importPublicKeys(String armored, GpgTrust trust) throws IOException {
    List<String> fingerprints = new ArrayList<>();

    PGPPublicKeyRingCollection rings;
    try (InputStream inputStream = decoderStream(armored)) {
      rings = new PGPPublicKeyRingCollection(inputStream, new BcKeyFingerprintCalculator());
    } catch (PGPException e) {
      throw new GpgException("Could not read public keys", e);
    }

    Iterator<PGPPublicKeyRing> iterator = rings.getKeyRings();
    while (iterator.hasNext()) {
      fingerprints.add(add(iterator.next(), trust));
    }

    return fingerprints;
  }

  /**
   * Imports secret keys. Their public parts are trusted ultimately.
   *
   * @param armored ascii armored secret key rings
   * @return the fingerprints of the imported primary keys
   * @throws IOException if the keys can not be read
   */
  public List<String> importSecretKeys(String armored) throws IOException {
    List<String> fingerprints = new ArrayList<>();

    PGPSecretKeyRingCollection rings;
    try (InputStream inputStream = decoderStream(armored)) {
      rings = new PGPSecretKeyRingCollection(inputStream, new BcKeyFingerprintCalculator());
    } catch (PGPException e) {
      throw new GpgException("Could not read secret keys", e);
    }

    Iterator<PGPSecretKeyRing> iterator = rings.getKeyRings();
    while (iterator.hasNext()) {
      PGPSecretKeyRing ring = iterator.next();

      List<PGPPublicKey> publicParts = new ArrayList<>();
      ring.getPublicKeys().forEachRemaining(publicParts::add);
      fingerprints.add(add(new PGPPublicKeyRing(publicParts), GpgTrust.ULTIMATE));

      ring.getSecretKeys().forEachRemaining(key -> secretKeys.put(key.getKeyID(), key));
    }

    return fingerprints;
  }

  private String add(PGPPublicKeyRing ring, GpgTrust trust) {
    Entry entry = new Entry(ring, trust);
    ring.getPublicKeys().forEachRemaining(key -> publicKeys.put(key.getKeyID(), entry));

    String fingerprint = fingerprint(ring.getPublicKey());
    LOGGER.debug("Imported key {} ({}) with trust {}", fingerprint, entry.username(), trust);
    return fingerprint;
  }

  /**
   * @param keyId the id of the primary key or any subkey
   * @return the ring holding the key
   */
  public Optional<Entry> findPublicKey(long keyId) {
    return Optional.ofNullable(publicKeys.get(keyId));
  }

  /**
   * Finds a secret key able to sign.
   *
   * @param keyId a fingerprint or (long or short) key id, optionally prefixed with {@code 0x}
   * @return the secret key
   */
  public Optional<PGPSecretKey> findSecretKey(String keyId) {
    String wanted = keyId.toUpperCase(Locale.ROOT).replace(" ", "");
    if (wanted.startsWith("0X")) {
      wanted = wanted.substring(2);
    }
    String suffix = wanted;

    return secretKeys.values().stream()
      .filter(PGPSecretKey::isSigningKey)
      .filter(key -> fingerprint(key.getPublicKey()).endsWith(suffix))
      .findFirst();
  }

  /**
   * @param key the key
   * @return the upper case hex fingerprint
   */
  public static String fingerprint(PGPPublicKey key) {
    return Hex.toHexString(key.getFingerprint()).toUpperCase(Locale.ROOT);
  }

  /**
   * @param keyId the key id
   * @return the upper case, 16 digit hex key id
   */
  public static String formatKeyId(long keyId) {
    return String.format("%016X", keyId);
  }

  private static InputStream decoderStream(String keys) throws IOException {
    return PGPUtil.getDecoderStream(new ByteArrayInputStream(keys.getBytes(StandardCharsets.US_ASCII)));
  }

  /**
   * A public key ring with its trust.
   *
   * @param ring the key ring
   * @param trust the trust assigned on import
   */
  public record Entry(PGPPublicKeyRing ring, GpgTrust trust) {

    /**
     * @return the first user id of the primary key, null if it has none
     */
    public String username() {
      Iterator<String> userIds = ring.getPublicKey().getUserIDs();
      return userIds.hasNext() ? userIds.next() : null;
    }

    public PGPPublicKey publicKey(long keyId) {
      return ring.getPublicKey(keyId);
    }
  }
}
