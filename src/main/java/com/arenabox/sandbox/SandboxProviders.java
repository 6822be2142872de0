package com.arenabox.sandbox;

import com.arenabox.core.model.SandboxKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the {@link SandboxProvider} registered for a sandbox kind.
 */
@Component
public class SandboxProviders {

    private final Map<SandboxKind, SandboxProvider> byKind = new EnumMap<>(SandboxKind.class);

    public SandboxProviders(List<SandboxProvider> providers) {
        for (SandboxProvider provider : providers) {
            if (byKind.putIfAbsent(provider.kind(), provider) != null) {
                throw new IllegalStateException("Duplicate sandbox provider for kind " + provider.kind());
            }
        }
    }

    public SandboxProvider forKind(SandboxKind kind) {
        SandboxProvider provider = byKind.get(kind);
        if (provider == null) {
            throw new IllegalStateException("No sandbox provider registered for kind " + kind);
        }
        return provider;
    }
}
