package de.ialistannen.ocmirror.cli;

import java.util.List;
import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;
import net.jbock.Parameter;
import net.jbock.VarargsParameter;

@Command(
  name = "oc-mirror mirror",
  description = "Replicates a release or operator index between registries",
  publicParser = true
)
public interface MirrorArguments extends GlobalOptions {

  @Parameter(index = 0, description = "The source image", paramLabel = "SOURCE")
  String indexNameSource();

  @Parameter(index = 1, description = "The destination image", paramLabel = "DESTINATION")
  String indexNameDestination();

  @VarargsParameter(description = "Operator packages to mirror, as 'package[:channel]'", paramLabel = "PACKAGE")
  List<String> packageChannels();

  @Option(names = "--sign-key-id", description = "Sign the mirrored image with this secret key", paramLabel = "ID")
  Optional<String> signKeyId();

  @Option(names = "--sign-key", description = "Armored secret key file holding the signing key", paramLabel = "PATH")
  Optional<String> signKeyPath();

  @Option(names = "--sign-passphrase", description = "Passphrase of the signing key", paramLabel = "PASSPHRASE")
  Optional<String> signPassphrase();

  @Option(
    names = "--sign-store",
    description = "Signature store new signatures are written to (http(s) or file url)",
    paramLabel = "URL"
  )
  List<String> signStores();

  @Override
  @Option(names = "--no-check-signatures", description = "Only check integrity, not signatures")
  boolean noCheckSignatures();

  @Override
  @Option(names = "--check-signatures", description = "Check integrity and signatures. Default: true")
  boolean checkSignatures();

  @Override
  @Option(names = "--dry-run", description = "Do not write to destination image sources")
  boolean dryRun();

  @Override
  @Option(
    names = {"-s", "--signature-store"},
    description = "Url of a signature store to use for retrieving signatures. Env: OPM_SIGNATURE_STORE",
    paramLabel = "URL"
  )
  List<String> signatureStores();

  @Override
  @Option(
    names = {"-k", "--signing-key"},
    description = "Armored public key to use for signature verification. Env: OPM_SIGNING_KEY",
    paramLabel = "PATH"
  )
  List<String> signingKeys();

  @Override
  @Option(
    names = "--docker-config",
    description = "Path to docker config. Default: ~/.docker/config.json",
    paramLabel = "PATH"
  )
  Optional<String> dockerConfigPath();

  @Override
  @Option(names = "--concurrency", description = "Maximum parallel registry requests. Default: 8", paramLabel = "N")
  Optional<Integer> concurrency();

  @Override
  @Option(
    names = "--platform",
    description = "Platform of multi-arch images. Default: linux/amd64",
    paramLabel = "OS/ARCH"
  )
  Optional<String> platform();

  @Override
  @Option(
    names = {"-v", "--verbosity"},
    description = "0 = errors only, 2 = info (default), 4 = trace",
    paramLabel = "LEVEL"
  )
  Optional<Integer> verbosity();
}
