package io.x402.autopay.store;

import io.x402.autopay.model.AgentState;

import java.util.function.Consumer;

/**
 * Holds the single persisted {@link AgentState} document.
 * Every call works on a private copy, so callers never observe partial writes.
 */
public interface StateStore {

    /** Snapshot of the current document. */
    AgentState read();

    /**
     * Reads the document, applies the mutation and writes the result back as one unit.
     *
     * @return the state as written
     */
    AgentState update(Consumer<AgentState> mutation);
}
