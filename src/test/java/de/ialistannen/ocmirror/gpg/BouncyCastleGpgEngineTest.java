package de.ialistannen.ocmirror.gpg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.ocmirror.testing.TestKeys;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPOnePassSignatureList;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class BouncyCastleGpgEngineTest {

  private static final Instant SIGNED_AT = Instant.parse("2021-07-01T12:00:00Z");

  private static TestKeys signer;
  private static TestKeys stranger;

  @BeforeAll
  static void generateKeys() {
    signer = TestKeys.generate("Release Signer <release@example.com>", "secret");
    stranger = TestKeys.generate("Stranger <stranger@example.com>", "other");
  }

  @Test
  void signedMessageVerifiesWithImportedKey() throws Exception {
    Keyring signingRing = new Keyring();
    signingRing.importSecretKeys(signer.armoredSecretKey());
    byte[] signed = new BouncyCastleGpgEngine(signingRing).sign(data("payload"), signer.keyId(), "secret", SIGNED_AT);

    Keyring verifyingRing = new Keyring();
    verifyingRing.importPublicKeys(signer.armoredPublicKey(), GpgTrust.FULLY);
    GpgVerification result = new BouncyCastleGpgEngine(verifyingRing).verify(signed);

    assertThat(result.isValid()).isTrue();
    assertThat(result.status()).isEqualTo(GpgStatus.VALID);
    assertThat(result.fingerprint()).isEqualTo(signer.fingerprint());
    assertThat(result.keyId()).isEqualTo(signer.keyId());
    assertThat(result.trust()).isEqualTo(GpgTrust.FULLY);
    assertThat(result.username()).isEqualTo("Release Signer <release@example.com>");
    assertThat(result.timestamp()).isEqualTo(SIGNED_AT);
    assertThat(new String(result.payload(), StandardCharsets.UTF_8)).isEqualTo("payload");
  }

  @Test
  void embeddedDataCarriesSigningTime() throws Exception {
    Keyring signingRing = new Keyring();
    signingRing.importSecretKeys(signer.armoredSecretKey());
    byte[] signed = new BouncyCastleGpgEngine(signingRing).sign(data("payload"), signer.keyId(), "secret", SIGNED_AT);

    BcPGPObjectFactory factory = new BcPGPObjectFactory(signed);
    PGPCompressedData compressed = (PGPCompressedData) factory.nextObject();
    BcPGPObjectFactory inner = new BcPGPObjectFactory(compressed.getDataStream());
    assertThat(inner.nextObject()).isInstanceOf(PGPOnePassSignatureList.class);
    PGPLiteralData literalData = (PGPLiteralData) inner.nextObject();

    assertThat(literalData.getModificationTime().toInstant()).isEqualTo(SIGNED_AT);
  }

  @Test
  void unknownKeyIsReported() throws Exception {
    Keyring signingRing = new Keyring();
    signingRing.importSecretKeys(signer.armoredSecretKey());
    byte[] signed = new BouncyCastleGpgEngine(signingRing)
      .sign(data("payload"), signer.fingerprint(), "secret", SIGNED_AT);

    Keyring verifyingRing = new Keyring();
    verifyingRing.importPublicKeys(stranger.armoredPublicKey(), GpgTrust.ULTIMATE);
    GpgVerification result = new BouncyCastleGpgEngine(verifyingRing).verify(signed);

    assertThat(result.status()).isEqualTo(GpgStatus.NO_PUBLIC_KEY);
    assertThat(result.keyId()).isEqualTo(signer.keyId());
    assertThat(result.fingerprint()).isNull();
    assertThat(result.isValid()).isFalse();
  }

  @Test
  void garbageIsNoSignature() {
    GpgVerification result = new BouncyCastleGpgEngine(new Keyring()).verify(data("not a pgp message"));

    assertThat(result.status()).isEqualTo(GpgStatus.NO_SIGNATURE);
    assertThat(result.payload()).isEmpty();
  }

  @Test
  void wrongPassphraseFails() throws Exception {
    Keyring signingRing = new Keyring();
    signingRing.importSecretKeys(signer.armoredSecretKey());

    assertThatThrownBy(() -> new BouncyCastleGpgEngine(signingRing).sign(data("x"), signer.keyId(), "wrong", SIGNED_AT))
      .isInstanceOf(GpgException.class);
  }

  @Test
  void missingSecretKeyFails() {
    assertThatThrownBy(
      () -> new BouncyCastleGpgEngine(new Keyring()).sign(data("x"), "0xDEADBEEF", "secret", SIGNED_AT)
    )
      .isInstanceOf(GpgException.class)
      .hasMessageContaining("DEADBEEF");
  }

  private static byte[] data(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }
}
