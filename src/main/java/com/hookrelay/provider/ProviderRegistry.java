package com.hookrelay.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service id → provider, fixed when the application context starts.
 *
 * The map is copied into an immutable one in the constructor; request threads
 * only ever read it. Two providers claiming the same service id fail startup.
 */
@Component
@Slf4j
public class ProviderRegistry {

    private final Map<String, HookProvider> providers;

    public ProviderRegistry(List<HookProvider> providers) {
        Map<String, HookProvider> byId = new HashMap<>();
        for (HookProvider provider : providers) {
            HookProvider previous = byId.putIfAbsent(provider.serviceId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider for service id '" + provider.serviceId()
                        + "': " + previous.getClass().getSimpleName()
                        + " and " + provider.getClass().getSimpleName());
            }
        }
        this.providers = Map.copyOf(byId);
        log.info("Registered webhook providers: {}", this.providers.keySet());
    }

    public static ProviderRegistry of(HookProvider... providers) {
        return new ProviderRegistry(Arrays.asList(providers));
    }

    public Optional<HookProvider> lookup(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(serviceId));
    }

    public Set<String> serviceIds() {
        return providers.keySet();
    }
}
