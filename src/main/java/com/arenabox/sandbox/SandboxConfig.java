package com.arenabox.sandbox;

import com.arenabox.transport.OrchestratorClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class SandboxConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortAllocator portAllocator(SandboxProperties properties) {
        return new PortAllocator(properties.getPortRangeMin(), properties.getPortRangeMax(),
                properties.getPortAllocationAttempts(), new SecureRandom());
    }

    @Bean
    public SandboxProvider containerSandboxProvider(OrchestratorClient client) {
        return new ContainerSandboxProvider(client);
    }

    @Bean
    public SandboxProvider serviceSandboxProvider(OrchestratorClient client) {
        return new ServiceSandboxProvider(client);
    }
}
