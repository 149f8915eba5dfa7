package com.quantori.rsl.core;

import akka.actor.typed.ActorSystem;
import com.quantori.rsl.api.VocabularyException;
import com.quantori.rsl.api.vocabulary.Vocabulary;
import com.quantori.rsl.core.configuration.GeneratorConfiguration;
import com.quantori.rsl.core.configuration.GeneratorSystemProvider;
import com.quantori.rsl.core.model.GenerationResult;
import com.quantori.rsl.core.output.CsvTableWriter;
import com.quantori.rsl.core.source.HierarchyPipeline;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates the hierarchical ring SMARTS library and saves it as a CSV file. Takes no arguments, settings come from
 * {@code application.conf}.
 */
@Slf4j
public final class RingSmartsLibraryApplication {
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private RingSmartsLibraryApplication() {
  }

  public static void main(String[] args) {
    int status = run(ConfigFactory.load());
    if (status != 0) {
      System.exit(status);
    }
  }

  static int run(Config config) {
    GeneratorConfiguration configuration;
    Vocabulary vocabulary;
    try {
      configuration = GeneratorConfiguration.fromConfig(config);
      vocabulary = Vocabulary.fromConfig(config);
    } catch (GenerationException | VocabularyException e) {
      log.error(e.getMessage(), e);
      return 1;
    }

    ActorSystem<Void> system = new GeneratorSystemProvider().actorSystem(configuration, config);
    try {
      GenerationResult result = generate(system, vocabulary);
      log.info("Generated {} unique substructures", result.getTable().size());
      new CsvTableWriter(configuration.getColumnSeparator()).write(result.getTable(), configuration.getOutputFile());
      return 0;
    } catch (GenerationException | VocabularyException e) {
      log.error(e.getMessage(), e);
      return 1;
    } finally {
      terminate(system);
    }
  }

  static GenerationResult generate(ActorSystem<?> system, Vocabulary vocabulary) {
    try {
      return new HierarchyPipeline(system, vocabulary).run().toCompletableFuture().join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof VocabularyException vocabularyException) {
        throw vocabularyException;
      }
      throw new GenerationException("Generation pipeline failed", e.getCause());
    }
  }

  private static void terminate(ActorSystem<?> system) {
    system.terminate();
    try {
      system.getWhenTerminated().toCompletableFuture().get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for actor system termination");
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Actor system did not terminate cleanly within {}", SHUTDOWN_TIMEOUT, e);
    }
  }
}
