package io.x402.autopay.store;

/** Keeps the serialized document in memory; state is lost when the process exits. */
public class InMemoryStateStore extends DocumentStateStore {

    private byte[] document;

    @Override
    protected byte[] load() {
        return document;
    }

    @Override
    protected void store(byte[] document) {
        this.document = document.clone();
    }
}
