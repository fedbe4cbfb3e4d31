package io.x402.autopay.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Persists the state document as a JSON file, replaced atomically on every write. */
public class JsonFileStateStore extends DocumentStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path file;

    public JsonFileStateStore(Path file) throws IOException {
        this.file = file.toAbsolutePath();
        Path parent = this.file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    protected byte[] load() throws IOException {
        if (!Files.exists(file)) {
            LOG.info("No state file at {}, starting from initial state", file);
            return null;
        }
        return Files.readAllBytes(file);
    }

    @Override
    protected void store(byte[] document) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(temp, document);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path getFile() {
        return file;
    }
}
