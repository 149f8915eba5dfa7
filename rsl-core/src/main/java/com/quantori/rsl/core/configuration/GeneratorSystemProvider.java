package com.quantori.rsl.core.configuration;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.Behaviors;
import com.typesafe.config.Config;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the actor system the generation stream is materialized on.
 */
@Slf4j
public class GeneratorSystemProvider {

  public ActorSystem<Void> actorSystem(GeneratorConfiguration configuration, Config config) {
    ActorSystem<Void> system = ActorSystem.create(Behaviors.empty(), configuration.getSystemName(), config);
    system.classicSystem().registerOnTermination(
        () -> log.info("shutting down {} actor system", configuration.getSystemName()));
    return system;
  }
}
