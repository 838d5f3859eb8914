package de.ialistannen.ocmirror.cli;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.logging.LoggingConfigurator;
import de.ialistannen.ocmirror.signing.VerificationConfig;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The global options, with environment fallbacks and defaults applied.
 *
 * @param checkSignatures whether a valid signature is required
 * @param dryRun whether writes are only logged
 * @param signatureStores the stores to read signatures from
 * @param signingKeys the armored public keys to accept
 * @param dockerConfigPath the docker config to read credentials from, may be null
 * @param concurrency the maximum number of parallel requests
 * @param platform the platform of multi-arch images
 * @param verbosity the log verbosity
 */
public record CommandContext(
  boolean checkSignatures,
  boolean dryRun,
  List<URI> signatureStores,
  List<String> signingKeys,
  Path dockerConfigPath,
  int concurrency,
  Platform platform,
  int verbosity
) {

  public static final String SIGNATURE_STORE_ENV = "OPM_SIGNATURE_STORE";
  public static final String SIGNING_KEY_ENV = "OPM_SIGNING_KEY";
  public static final int DEFAULT_CONCURRENCY = 8;
  public static final List<URI> OPENSHIFT_SIGNATURE_STORES = List.of(
    URI.create("https://mirror.openshift.com/pub/openshift-v4/signatures/openshift/release"),
    URI.create("https://storage.googleapis.com/openshift-release/official/signatures/openshift/release")
  );

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandContext.class);
  private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

  /**
   * Resolves the global options.
   *
   * @param options the parsed options
   * @param environment the process environment
   * @return the context
   * @throws IOException if a signing key can not be read
   */
  public static CommandContext create(GlobalOptions options, Map<String, String> environment) throws IOException {
    List<String> storeArguments = withFallback(options.signatureStores(), environment.get(SIGNATURE_STORE_ENV));
    List<URI> stores = storeArguments.isEmpty()
      ? OPENSHIFT_SIGNATURE_STORES
      : storeArguments.stream().map(URI::create).toList();

    List<String> keys = new ArrayList<>();
    for (String keyPath : withFallback(options.signingKeys(), environment.get(SIGNING_KEY_ENV))) {
      LOGGER.debug("Loading signing key: {}", keyPath);
      keys.add(Files.readString(Path.of(keyPath)));
    }

    return new CommandContext(
      !options.noCheckSignatures(),
      options.dryRun(),
      stores,
      keys,
      options.dockerConfigPath().map(Path::of).orElse(null),
      options.concurrency().orElse(DEFAULT_CONCURRENCY),
      options.platform().map(Platform::parse).orElse(Platform.LINUX_AMD64),
      verbosity(options)
    );
  }

  /**
   * @param options the parsed options
   * @return the requested verbosity, available before the rest of the context is resolved
   */
  public static int verbosity(GlobalOptions options) {
    return options.verbosity().orElse(LoggingConfigurator.DEFAULT_VERBOSITY);
  }

  public VerificationConfig verificationConfig() {
    return new VerificationConfig(signatureStores, signingKeys, checkSignatures);
  }

  private static List<String> withFallback(List<String> arguments, String environmentValue) {
    if (!arguments.isEmpty() || environmentValue == null) {
      return arguments;
    }
    return WHITESPACE.splitToList(environmentValue);
  }
}
