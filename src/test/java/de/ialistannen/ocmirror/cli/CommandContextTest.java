package de.ialistannen.ocmirror.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import de.ialistannen.ocmirror.image.Platform;
import de.ialistannen.ocmirror.logging.LoggingConfigurator;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandContextTest {

  @TempDir
  Path tempDir;

  private GlobalOptions options;

  @BeforeEach
  void setUp() {
    options = mock(GlobalOptions.class);
  }

  @Test
  void defaultsWithoutOptions() throws IOException {
    CommandContext context = CommandContext.create(options, Map.of());

    assertThat(context.checkSignatures()).isTrue();
    assertThat(context.dryRun()).isFalse();
    assertThat(context.signatureStores()).isEqualTo(CommandContext.OPENSHIFT_SIGNATURE_STORES);
    assertThat(context.signingKeys()).isEmpty();
    assertThat(context.dockerConfigPath()).isNull();
    assertThat(context.concurrency()).isEqualTo(CommandContext.DEFAULT_CONCURRENCY);
    assertThat(context.platform()).isEqualTo(Platform.LINUX_AMD64);
    assertThat(context.verbosity()).isEqualTo(LoggingConfigurator.DEFAULT_VERBOSITY);
    assertThat(context.verificationConfig().verify()).isTrue();
  }

  @Test
  void environmentFillsInMissingStoresAndKeys() throws IOException {
    Path first = Files.writeString(tempDir.resolve("first.asc"), "first key");
    Path second = Files.writeString(tempDir.resolve("second.asc"), "second key");

    CommandContext context = CommandContext.create(options, Map.of(
      CommandContext.SIGNATURE_STORE_ENV, " https://a.example  https://b.example\n",
      CommandContext.SIGNING_KEY_ENV, first + " " + second
    ));

    assertThat(context.signatureStores())
      .containsExactly(URI.create("https://a.example"), URI.create("https://b.example"));
    assertThat(context.signingKeys()).containsExactly("first key", "second key");
  }

  @Test
  void optionsWinOverEnvironment() throws IOException {
    Path key = Files.writeString(tempDir.resolve("key.asc"), "option key");
    when(options.signatureStores()).thenReturn(List.of("file:///stores/local"));
    when(options.signingKeys()).thenReturn(List.of(key.toString()));
    when(options.noCheckSignatures()).thenReturn(true);
    when(options.dryRun()).thenReturn(true);
    when(options.concurrency()).thenReturn(Optional.of(2));
    when(options.verbosity()).thenReturn(Optional.of(4));
    when(options.dockerConfigPath()).thenReturn(Optional.of("/tmp/config.json"));

    CommandContext context = CommandContext.create(options, Map.of(
      CommandContext.SIGNATURE_STORE_ENV, "https://ignored.example",
      CommandContext.SIGNING_KEY_ENV, "/does/not/exist"
    ));

    assertThat(context.signatureStores()).containsExactly(URI.create("file:///stores/local"));
    assertThat(context.signingKeys()).containsExactly("option key");
    assertThat(context.checkSignatures()).isFalse();
    assertThat(context.verificationConfig().verify()).isFalse();
    assertThat(context.dryRun()).isTrue();
    assertThat(context.concurrency()).isEqualTo(2);
    assertThat(context.verbosity()).isEqualTo(4);
    assertThat(context.dockerConfigPath()).isEqualTo(Path.of("/tmp/config.json"));
  }
}
