package com.fedivotes.adapter.out.federation;

import com.fedivotes.application.port.out.InstanceAllowlistPort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Allowlist held in memory and swapped atomically on refresh.
 */
@Component
public class InMemoryInstanceAllowlist implements InstanceAllowlistPort {

    private final AtomicReference<Set<String>> hosts = new AtomicReference<>(Set.of());

    @Override
    public boolean isKnownInstance(String host) {
        return host != null && hosts.get().contains(host.toLowerCase(Locale.ROOT));
    }

    @Override
    public void replaceAll(Set<String> newHosts) {
        hosts.set(Set.copyOf(newHosts));
    }

    @Override
    public int size() {
        return hosts.get().size();
    }
}
