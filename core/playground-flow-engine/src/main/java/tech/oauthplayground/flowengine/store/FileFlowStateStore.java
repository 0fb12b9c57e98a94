package tech.oauthplayground.flowengine.store;

import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.oauthplayground.flowengine.config.FlowEngineConfig;
import tech.oauthplayground.flowengine.exception.FlowEngineException;
import tech.oauthplayground.flowengine.exception.FlowStateCorruptionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;

/**
 * Flow state store whose durable tier is one file per key in a directory.
 * Survives process restarts between the authorization redirect and the callback.
 */
@Singleton
@Typed(FileFlowStateStore.class)
public class FileFlowStateStore extends TieredFlowStateStore {

    private static final Logger LOG = Logger.getLogger(FileFlowStateStore.class);

    private final Path directory;

    @Inject
    public FileFlowStateStore(FlowEngineConfig config) {
        this(Path.of(config.store().directory()), config.store().fastTierTtl(), config.store().fastTierMaxSize());
    }

    public FileFlowStateStore(Path directory, Duration fastTierTtl, long fastTierMaxSize) {
        super(fastTierTtl, fastTierMaxSize);
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new FlowEngineException("Cannot create flow state directory " + directory, e);
        }
    }

    @Override
    protected Optional<String> readDurable(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FlowStateCorruptionException("Cannot read stored flow state " + file.getFileName(), e);
        }
    }

    @Override
    protected void writeDurable(String key, String value) {
        Path file = fileFor(key);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new FlowEngineException("Cannot write flow state " + file.getFileName(), e);
        }
    }

    @Override
    protected void deleteDurable(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            LOG.warnf("Failed to delete stored flow state [%s]: %s", key, e.getMessage());
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(key.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }
}
