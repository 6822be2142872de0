package com.arenabox.core.model;

/**
 * Version details reported by the orchestration engine.
 *
 * @param version    engine version, e.g. {@code 24.0.7}
 * @param apiVersion API version the engine speaks
 * @param swarm      true when the engine is a swarm manager and accepts service calls
 */
public record EngineInfo(String version, String apiVersion, boolean swarm) {}
