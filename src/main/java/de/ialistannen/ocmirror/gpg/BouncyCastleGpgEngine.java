package de.ialistannen.ocmirror.gpg;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import org.bouncycastle.bcpg.BCPGOutputStream;
import org.bouncycastle.bcpg.CompressionAlgorithmTags;
import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPCompressedDataGenerator;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPOnePassSignature;
import org.bouncycastle.openpgp.PGPOnePassSignatureList;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureGenerator;
import org.bouncycastle.openpgp.PGPSignatureList;
import org.bouncycastle.openpgp.PGPSignatureSubpacketGenerator;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.bouncycastle.openpgp.operator.bc.BcPBESecretKeyDecryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPContentSignerBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPContentVerifierBuilderProvider;
import org.bouncycastle.openpgp.operator.bc.BcPGPDigestCalculatorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link GpgEngine} backed by the BouncyCastle OpenPGP implementation. Produces the same message layout as
 * {@code gpg --sign}: a compressed packet holding a one-pass signature, the literal data and the signature.
 */
public class BouncyCastleGpgEngine implements GpgEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(BouncyCastleGpgEngine.class);

  private final Keyring keyring;

  public BouncyCastleGpgEngine(Keyring keyring) {
    this.keyring = keyring;
  }

  @Override
  public byte[] sign(byte[] data, String keyId, String passphrase, Instant signedAt) {
    PGPSecretKey secretKey = keyring.findSecretKey(keyId)
      .orElseThrow(() -> new GpgException("No secret signing key found for '" + keyId + "'"));

    try {
      PGPPrivateKey privateKey = secretKey.extractPrivateKey(
        new BcPBESecretKeyDecryptorBuilder(new BcPGPDigestCalculatorProvider())
          .build(passphrase == null ? new char[0] : passphrase.toCharArray())
      );

      PGPSignatureGenerator signatureGenerator = new PGPSignatureGenerator(
        new BcPGPContentSignerBuilder(secretKey.getPublicKey().getAlgorithm(), HashAlgorithmTags.SHA256)
      );
      signatureGenerator.init(PGPSignature.BINARY_DOCUMENT, privateKey);
      Date signingTime = Date.from(signedAt);
      PGPSignatureSubpacketGenerator hashedSubpackets = new PGPSignatureSubpacketGenerator();
      hashedSubpackets.setSignatureCreationTime(false, signingTime);
      signatureGenerator.setHashedSubpackets(hashedSubpackets.generate());

      ByteArrayOutputStream result = new ByteArrayOutputStream();
      PGPCompressedDataGenerator compressedGenerator = new PGPCompressedDataGenerator(CompressionAlgorithmTags.ZLIB);
      BCPGOutputStream packetStream = new BCPGOutputStream(compressedGenerator.open(result));

      signatureGenerator.generateOnePassVersion(false).encode(packetStream);

      PGPLiteralDataGenerator literalGenerator = new PGPLiteralDataGenerator();
      OutputStream literalStream = literalGenerator.open(
        packetStream,
        PGPLiteralData.BINARY,
        PGPLiteralData.CONSOLE,
        data.length,
        signingTime
      );
      literalStream.write(data);
      signatureGenerator.update(data);
      literalGenerator.close();

      signatureGenerator.generate().encode(packetStream);
      compressedGenerator.close();

      LOGGER.debug("Signed {} bytes with key {}", data.length, Keyring.fingerprint(secretKey.getPublicKey()));
      return result.toByteArray();
    } catch (PGPException e) {
      throw new GpgException("Could not sign with key '" + keyId + "'", e);
    } catch (IOException e) {
      throw new GpgException("Could not write signature", e);
    }
  }

  @Override
  public GpgVerification verify(byte[] signed) {
    try {
      return doVerify(signed);
    } catch (IOException | PGPException e) {
      LOGGER.debug("Could not read signed message", e);
      return GpgVerification.noSignature();
    }
  }

  private GpgVerification doVerify(byte[] signed) throws IOException, PGPException {
    InputStream inputStream = PGPUtil.getDecoderStream(new ByteArrayInputStream(signed));
    BcPGPObjectFactory factory = new BcPGPObjectFactory(inputStream);

    Object next = factory.nextObject();
    if (next instanceof PGPCompressedData compressedData) {
      factory = new BcPGPObjectFactory(compressedData.getDataStream());
      next = factory.nextObject();
    }
    if (!(next instanceof PGPOnePassSignatureList onePassSignatures) || onePassSignatures.isEmpty()) {
      LOGGER.debug("Message does not start with a one-pass signature, got {}", next);
      return GpgVerification.noSignature();
    }
    PGPOnePassSignature onePassSignature = onePassSignatures.get(0);

    if (!(factory.nextObject() instanceof PGPLiteralData literalData)) {
      return GpgVerification.noSignature();
    }
    byte[] payload = literalData.getInputStream().readAllBytes();

    if (!(factory.nextObject() instanceof PGPSignatureList signatures) || signatures.isEmpty()) {
      return GpgVerification.noSignature();
    }
    PGPSignature signature = signatures.get(0);

    String keyId = Keyring.formatKeyId(onePassSignature.getKeyID());
    Instant timestamp = signature.getCreationTime().toInstant();

    Optional<Keyring.Entry> entry = keyring.findPublicKey(onePassSignature.getKeyID());
    if (entry.isEmpty()) {
      LOGGER.debug("No public key for {}", keyId);
      return new GpgVerification(
        null, keyId, GpgTrust.UNDEFINED, GpgStatus.NO_PUBLIC_KEY, payload, null, timestamp
      );
    }

    PGPPublicKey publicKey = entry.get().publicKey(onePassSignature.getKeyID());
    onePassSignature.init(new BcPGPContentVerifierBuilderProvider(), publicKey);
    onePassSignature.update(payload);
    GpgStatus status = onePassSignature.verify(signature) ? GpgStatus.VALID : GpgStatus.BAD;

    return new GpgVerification(
      Keyring.fingerprint(publicKey),
      keyId,
      entry.get().trust(),
      status,
      payload,
      entry.get().username(),
      timestamp
    );
  }
}
