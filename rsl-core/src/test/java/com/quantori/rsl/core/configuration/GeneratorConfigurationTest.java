package com.quantori.rsl.core.configuration;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.rsl.core.GenerationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class GeneratorConfigurationTest {

  @Test
  void defaultsComeFromApplicationConfiguration() {
    GeneratorConfiguration configuration = GeneratorConfiguration.fromConfig(ConfigFactory.load());

    assertAll(
        () -> assertEquals(Path.of("smarts_hierarchical_library.csv"), configuration.getOutputFile()),
        () -> assertEquals("rsl-akka-system", configuration.getSystemName()),
        () -> assertEquals(',', configuration.getColumnSeparator())
    );
  }

  @Test
  void valuesCanBeOverridden() {
    Config config = ConfigFactory.load()
        .withValue("ring-smarts.generator.output-file", ConfigValueFactory.fromAnyRef("out/library.tsv"))
        .withValue("ring-smarts.generator.column-separator", ConfigValueFactory.fromAnyRef("\t"));

    GeneratorConfiguration configuration = GeneratorConfiguration.fromConfig(config);

    assertEquals(Path.of("out/library.tsv"), configuration.getOutputFile());
    assertEquals('\t', configuration.getColumnSeparator());
  }

  @Test
  void blankSystemNameFallsBackToDefault() {
    Config config = ConfigFactory.load()
        .withValue("ring-smarts.generator.system-name", ConfigValueFactory.fromAnyRef(" "));

    assertEquals(GeneratorConfiguration.DEFAULT_SYSTEM_NAME, GeneratorConfiguration.fromConfig(config).getSystemName());
  }

  @Test
  void invalidSeparatorIsRejected() {
    Config config = ConfigFactory.load()
        .withValue("ring-smarts.generator.column-separator", ConfigValueFactory.fromAnyRef(",,"));

    assertThrows(GenerationException.class, () -> GeneratorConfiguration.fromConfig(config));
  }

  @Test
  void missingSectionIsRejected() {
    Config config = ConfigFactory.load().withoutPath("ring-smarts.generator");

    assertThrows(GenerationException.class, () -> GeneratorConfiguration.fromConfig(config));
  }
}
