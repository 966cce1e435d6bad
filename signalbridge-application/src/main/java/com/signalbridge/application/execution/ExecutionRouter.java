package com.signalbridge.application.execution;

import com.signalbridge.domain.intent.TransactionIntent;
import com.signalbridge.domain.intent.Venue;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches a gated intent to the executor registered for its venue.
 */
public final class ExecutionRouter {

    private final Map<Venue, VenueExecutor> executors = new EnumMap<>(Venue.class);

    public ExecutionRouter register(VenueExecutor executor) {
        Objects.requireNonNull(executor, "executor");
        executors.put(executor.venue(), executor);
        return this;
    }

    public ExecutionReport route(TransactionIntent intent) throws Exception {
        VenueExecutor executor = executors.get(intent.venue());
        if (executor == null) {
            throw new RoutingException("No executor registered for venue: " + intent.venue());
        }
        return executor.execute(intent);
    }
}
