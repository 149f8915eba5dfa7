package com.quantori.rsl.core.configuration;

import com.quantori.rsl.core.GenerationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.nio.file.Path;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Settings of a generation run, read from the {@code ring-smarts.generator} configuration section.
 */
@Getter
@Builder
public class GeneratorConfiguration {
  public static final String CONFIG_PATH = "ring-smarts.generator";
  public static final String DEFAULT_SYSTEM_NAME = "rsl-akka-system";

  private final Path outputFile;
  private final String systemName;
  private final char columnSeparator;

  public static GeneratorConfiguration fromConfig(Config config) {
    try {
      Config section = config.getConfig(CONFIG_PATH);
      String separator = section.getString("column-separator");
      if (separator.length() != 1) {
        throw new GenerationException("Column separator must be a single character: '" + separator + "'");
      }
      return GeneratorConfiguration.builder()
          .outputFile(Path.of(section.getString("output-file")))
          .systemName(StringUtils.defaultIfBlank(section.getString("system-name"), DEFAULT_SYSTEM_NAME))
          .columnSeparator(separator.charAt(0))
          .build();
    } catch (ConfigException e) {
      throw new GenerationException("Unable to read generator configuration: " + e.getMessage(), e);
    }
  }
}
