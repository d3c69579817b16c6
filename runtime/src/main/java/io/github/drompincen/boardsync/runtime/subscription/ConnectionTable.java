package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ConnectionTable {

    private final Map<PushConnection, ConnectionSubscriptionState> states = new ConcurrentHashMap<>();

    public ConnectionSubscriptionState register(PushConnection connection) {
        return states.computeIfAbsent(connection, c -> new ConnectionSubscriptionState());
    }

    public Optional<ConnectionSubscriptionState> remove(PushConnection connection) {
        return Optional.ofNullable(states.remove(connection));
    }

    public Optional<ConnectionSubscriptionState> state(PushConnection connection) {
        return Optional.ofNullable(states.get(connection));
    }

    public Set<PushConnection> connections() {
        return states.keySet();
    }

    /**
     * One spec per distinct key referenced by any open connection.
     */
    public Map<String, SubscriptionSpec> activeSpecs() {
        Map<String, SubscriptionSpec> specs = new LinkedHashMap<>();
        states.forEach((connection, state) -> {
            if (!connection.isOpen()) return;
            state.bindings().values().forEach(b -> specs.putIfAbsent(b.key(), b.spec()));
        });
        return specs;
    }
}
