package com.arenabox.transport;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TransportConfig {

    @Bean
    public DockerClientFactory dockerClientFactory(TransportProperties properties) {
        return new ZerodepDockerClientFactory(properties);
    }
}
