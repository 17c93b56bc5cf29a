package com.my.relay.adapter.out.outcome;

import com.my.relay.domain.model.RelayOutcome;
import com.my.relay.domain.port.out.OutcomeLogPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@IfBuildProperty(name = "relay.store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryOutcomeLog implements OutcomeLogPort {

    private final List<RelayOutcome> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public void append(RelayOutcome outcome) {
        outcomes.add(outcome);
    }

    @Override
    public List<RelayOutcome> query(Instant since) {
        return outcomes.stream()
                .filter(outcome -> !outcome.timestamp().isBefore(since))
                .toList();
    }
}
