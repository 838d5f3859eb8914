package de.ialistannen.ocmirror;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import de.ialistannen.ocmirror.cli.CommandContext;
import de.ialistannen.ocmirror.cli.DumpArguments;
import de.ialistannen.ocmirror.cli.DumpArgumentsParser;
import de.ialistannen.ocmirror.cli.GlobalOptions;
import de.ialistannen.ocmirror.cli.ImageKindDetector;
import de.ialistannen.ocmirror.cli.ImageKindDetector.ImageKind;
import de.ialistannen.ocmirror.cli.MirrorArguments;
import de.ialistannen.ocmirror.cli.MirrorArgumentsParser;
import de.ialistannen.ocmirror.concurrent.ExecutorFactories;
import de.ialistannen.ocmirror.dump.MetadataLogger;
import de.ialistannen.ocmirror.gpg.BouncyCastleGpgEngine;
import de.ialistannen.ocmirror.gpg.GpgTrust;
import de.ialistannen.ocmirror.gpg.Keyring;
import de.ialistannen.ocmirror.graph.MirrorableMetadata;
import de.ialistannen.ocmirror.image.BlobDigest;
import de.ialistannen.ocmirror.image.ImageReference;
import de.ialistannen.ocmirror.logging.LoggingConfigurator;
import de.ialistannen.ocmirror.mirror.MirrorEngine;
import de.ialistannen.ocmirror.operator.ChannelSelection;
import de.ialistannen.ocmirror.operator.ChannelSelection.PackageChannel;
import de.ialistannen.ocmirror.operator.OperatorMetadata;
import de.ialistannen.ocmirror.operator.OperatorMetadataResolver;
import de.ialistannen.ocmirror.operator.SqliteIndexDatabaseDecoder;
import de.ialistannen.ocmirror.registry.DockerRegistry;
import de.ialistannen.ocmirror.registry.DockerRegistryAuth;
import de.ialistannen.ocmirror.release.ReleaseMetadata;
import de.ialistannen.ocmirror.release.ReleaseMetadataResolver;
import de.ialistannen.ocmirror.signing.AtomicSigner;
import de.ialistannen.ocmirror.signing.DefaultSignatureStoreClient;
import de.ialistannen.ocmirror.signing.SignatureStoreClient;
import de.ialistannen.ocmirror.signing.SignatureVerification;
import de.ialistannen.ocmirror.signing.SignatureVerifier;
import de.ialistannen.ocmirror.translate.EndpointTranslator;
import de.ialistannen.ocmirror.translate.TranslationPatterns;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);
  private static final List<String> COMMANDS = List.of("dump", "mirror");

  public static void main(String[] args) {
    List<String> remaining = new ArrayList<>(Arrays.asList(args));
    String command = remaining.stream().filter(COMMANDS::contains).findFirst().orElse(null);
    if (command == null) {
      System.err.println("Usage: oc-mirror <dump|mirror> [options...]");
      System.exit(1);
      return;
    }
    remaining.remove(command);
    String[] commandArgs = remaining.toArray(String[]::new);

    if (command.equals("dump")) {
      DumpArguments arguments = DumpArgumentsParser.parseOrExit(commandArgs);
      runGuarded(arguments, () -> dump(arguments));
    } else {
      MirrorArguments arguments = MirrorArgumentsParser.parseOrExit(commandArgs);
      runGuarded(arguments, () -> mirror(arguments));
    }
  }

  private static void runGuarded(GlobalOptions options, CommandAction action) {
    int verbosity = CommandContext.verbosity(options);
    LoggingConfigurator.applyVerbosity(verbosity);

    try {
      action.run();
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (verbosity > 0) {
        LOGGER.error("FATAL: {}", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      }
      if (verbosity > LoggingConfigurator.DEFAULT_VERBOSITY) {
        LOGGER.error(Throwables.getStackTraceAsString(e));
      }
      throw die("Command failed");
    }
  }

  private static void dump(DumpArguments arguments) throws IOException, InterruptedException {
    CommandContext context = CommandContext.create(arguments, System.getenv());
    ImageReference index = ImageReference.parse(arguments.indexName());
    Map<String, ChannelSelection> packageChannel = packageChannels(arguments.packageChannels());
    EndpointTranslator translator = arguments.translate()
      ? TranslationPatterns.forImage(index)
      : null;

    try (Services services = new Services(context)) {
      MetadataLogger metadataLogger = new MetadataLogger(arguments.sortMetadata());
      LOGGER.info("Retrieving metadata for index: {} ...", index.resolveName());

      ImageKind kind = services.detector.detect(index, !packageChannel.isEmpty());
      if (kind == ImageKind.RELEASE) {
        ReleaseMetadata metadata = services.releaseResolver.resolve(
          index,
          translator,
          context.verificationConfig()
        );
        metadataLogger.log(index, metadata.withSignatures(
          allSignatures(services, index, metadata.manifestDigest(), metadata.signatureStores(), metadata.signingKeys())
        ));
      } else {
        OperatorMetadata metadata = services.operatorResolver.resolve(
          index,
          packageChannel,
          translator,
          context.verificationConfig()
        );
        metadataLogger.log(index, metadata.withSignatures(
          allSignatures(services, index, metadata.manifestDigest(), metadata.signatureStores(), metadata.signingKeys())
        ));
      }
    }
  }

  private static ImmutableList<SignatureVerification> allSignatures(
    Services services,
    ImageReference index,
    BlobDigest digest,
    List<URI> stores,
    List<String> keys
  ) throws IOException, InterruptedException {
    return ImmutableList.copyOf(services.verifier.inspectAll(digest, index, stores, keys));
  }

  private static void mirror(MirrorArguments arguments) throws IOException, InterruptedException {
    CommandContext context = CommandContext.create(arguments, System.getenv());
    ImageReference source = ImageReference.parse(arguments.indexNameSource());
    ImageReference destination = ImageReference.parse(arguments.indexNameDestination());
    Map<String, ChannelSelection> packageChannel = packageChannels(arguments.packageChannels());
    // Content already copied next to the source is read from there instead of upstream.
    EndpointTranslator translator = TranslationPatterns.forImage(source);

    try (Services services = new Services(context)) {
      LOGGER.info("Retrieving metadata for index: {} ...", source.resolveName());
      MirrorableMetadata metadata;
      if (services.detector.detect(source, !packageChannel.isEmpty()) == ImageKind.RELEASE) {
        metadata = services.releaseResolver.resolve(source, translator, context.verificationConfig());
      } else {
        metadata = services.operatorResolver.resolve(
          source,
          packageChannel,
          translator,
          context.verificationConfig()
        );
      }

      LOGGER.info("Mirroring index to: {} ...", destination.resolveName());
      MirrorEngine engine = new MirrorEngine(services.registry, services.registry, services.executor, context.dryRun());
      // Verification already happened while resolving
      engine.put(destination, metadata, false);

      Optional<AtomicSigner> signer = buildSigner(arguments, services);
      if (signer.isPresent()) {
        engine.sign(signer.get(), destination, metadata.graph().rootDigest())
          .ifPresent(location -> LOGGER.info("Signature written to: {}", location));
      }

      if (context.dryRun()) {
        LOGGER.info("Dry run completed for index: {}", destination.resolveName());
      } else {
        LOGGER.info("Mirrored index to: {}", destination.resolveName());
      }
    }
  }

  private static Optional<AtomicSigner> buildSigner(MirrorArguments arguments, Services services)
    throws IOException {
    if (arguments.signKeyId().isEmpty()) {
      return Optional.empty();
    }
    if (arguments.signKeyPath().isEmpty()) {
      throw die("A secret key file (--sign-key) must be supplied when signing");
    }
    if (arguments.signStores().isEmpty()) {
      throw die("At least one signature store (--sign-store) must be supplied when signing");
    }

    Keyring keyring = new Keyring();
    keyring.importSecretKeys(Files.readString(Path.of(arguments.signKeyPath().get())));
    List<URI> stores = arguments.signStores().stream().map(URI::create).toList();

    return Optional.of(
      new AtomicSigner(
        new BouncyCastleGpgEngine(keyring),
        services.storeClient,
        services.executor,
        stores,
        GpgTrust.FULLY
      ).withSigningKey(arguments.signKeyId().get(), arguments.signPassphrase().orElse(null))
    );
  }

  private static Map<String, ChannelSelection> packageChannels(List<String> arguments) {
    Map<String, ChannelSelection> result = new LinkedHashMap<>();
    for (String argument : arguments) {
      PackageChannel parsed = ChannelSelection.parse(argument);
      result.put(parsed.packageName(), parsed.channel());
    }
    return result;
  }

  private static RuntimeException die(String msg) {
    LOGGER.error(msg);
    System.exit(1);

    return new RuntimeException();
  }

  private static List<DockerRegistryAuth> authsFromArgs(CommandContext context) throws IOException {
    Path pathToFile = Path.of(System.getProperty("user.home"), ".docker/config.json");

    if (context.dockerConfigPath() == null) {
      if (!Files.exists(pathToFile)) {
        return Collections.emptyList();
      }
      LOGGER.debug("Using default docker config path");
    } else {
      pathToFile = context.dockerConfigPath();
    }

    LOGGER.debug("Loading auth from '{}'", pathToFile);
    return DockerRegistryAuth.loadAuthentications(pathToFile);
  }

  @FunctionalInterface
  private interface CommandAction {

    void run() throws Exception;
  }

  /**
   * Everything a command talks to, wired from the resolved options.
   */
  private static final class Services implements AutoCloseable {

    private final ExecutorService executor;
    private final DockerRegistry registry;
    private final SignatureStoreClient storeClient;
    private final SignatureVerifier verifier;
    private final ImageKindDetector detector;
    private final ReleaseMetadataResolver releaseResolver;
    private final OperatorMetadataResolver operatorResolver;

    private Services(CommandContext context) throws IOException {
      // Blob redirects are followed by hand so credentials never leak to storage backends
      HttpClient registryHttpClient = HttpClient.newBuilder().followRedirects(Redirect.NEVER).build();
      HttpClient storeHttpClient = HttpClient.newBuilder().followRedirects(Redirect.NORMAL).build();

      this.executor = ExecutorFactories.newWorkerPool(context.concurrency(), "oc-mirror-worker");
      this.registry = new DockerRegistry(registryHttpClient, authsFromArgs(context));
      this.storeClient = new DefaultSignatureStoreClient(storeHttpClient);

      this.verifier = new SignatureVerifier(storeClient, executor, GpgTrust.FULLY);
      this.detector = new ImageKindDetector(registry, context.platform());
      this.releaseResolver = new ReleaseMetadataResolver(registry, executor, verifier, context.platform());
      this.operatorResolver = new OperatorMetadataResolver(
        registry,
        executor,
        verifier,
        new SqliteIndexDatabaseDecoder(),
        context.platform()
      );
    }

    @Override
    public void close() {
      executor.shutdownNow();
      registry.close();
    }
  }
}
