package de.ialistannen.ocmirror.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  private final Level original = root.getLevel();

  @AfterEach
  void restore() {
    root.setLevel(original);
  }

  @Test
  void mapsVerbosityToLevels() {
    assertThat(LoggingConfigurator.levelFor(-1)).isEqualTo(Level.ERROR);
    assertThat(LoggingConfigurator.levelFor(0)).isEqualTo(Level.ERROR);
    assertThat(LoggingConfigurator.levelFor(1)).isEqualTo(Level.WARN);
    assertThat(LoggingConfigurator.levelFor(LoggingConfigurator.DEFAULT_VERBOSITY)).isEqualTo(Level.INFO);
    assertThat(LoggingConfigurator.levelFor(3)).isEqualTo(Level.DEBUG);
    assertThat(LoggingConfigurator.levelFor(9)).isEqualTo(Level.TRACE);
  }

  @Test
  void appliesRootLevel() {
    LoggingConfigurator.applyVerbosity(3);

    assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
  }
}
