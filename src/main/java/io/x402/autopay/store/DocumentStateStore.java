package io.x402.autopay.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.x402.autopay.internal.Json;
import io.x402.autopay.model.AgentState;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Read-modify-write over a serialized JSON document. Subclasses decide where the bytes live.
 */
abstract class DocumentStateStore implements StateStore {

    private final ObjectMapper mapper = Json.mapper();
    private final Object lock = new Object();

    /** Raw document, or null when nothing has been written yet. */
    protected abstract byte[] load() throws IOException;

    protected abstract void store(byte[] document) throws IOException;

    @Override
    public AgentState read() {
        synchronized (lock) {
            return readUnlocked();
        }
    }

    @Override
    public AgentState update(Consumer<AgentState> mutation) {
        synchronized (lock) {
            AgentState state = readUnlocked();
            mutation.accept(state);
            state.normalize();
            try {
                store(mapper.writeValueAsBytes(state));
            } catch (IOException e) {
                throw new StateStoreException("Failed to write agent state", e);
            }
            return state;
        }
    }

    private AgentState readUnlocked() {
        try {
            byte[] document = load();
            if (document == null || document.length == 0) {
                AgentState initial = AgentState.initial();
                store(mapper.writeValueAsBytes(initial));
                return initial;
            }
            return mapper.readValue(document, AgentState.class).normalize();
        } catch (IOException e) {
            throw new StateStoreException("Failed to read agent state", e);
        }
    }
}
