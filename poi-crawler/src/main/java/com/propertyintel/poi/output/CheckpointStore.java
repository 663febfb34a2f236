package com.propertyintel.poi.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.propertyintel.poi.exception.PersistenceException;
import com.propertyintel.poi.model.CrawlProgress;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Durable save/restore of crawl progress as a JSON document.
 *
 * Saves go to a sibling temp file, forced to disk, which is then renamed over the
 * checkpoint, so a crash mid-write leaves the previous checkpoint intact. One store per checkpoint
 * file; two crawls must not share a file.
 */
@Slf4j
public class CheckpointStore {

    public static final int SCHEMA_VERSION = 1;

    private final Path checkpointPath;
    private final ObjectMapper mapper;
    private final Clock clock;

    public CheckpointStore(Path checkpointPath, ObjectMapper objectMapper, Clock clock) {
        this.checkpointPath = checkpointPath;
        this.mapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path getCheckpointPath() {
        return checkpointPath;
    }

    public boolean exists() {
        return Files.exists(checkpointPath);
    }

    /**
     * @throws PersistenceException if the checkpoint cannot be written
     */
    public void save(CrawlProgress progress) {
        CheckpointDocument doc = new CheckpointDocument();
        doc.setSchemaVersion(SCHEMA_VERSION);
        doc.setSavedAt(LocalDateTime.now(clock).toString());
        doc.setCompletedZones(progress.getCompletedZones());
        doc.setRecords(progress.getRecords());
        doc.setStats(progress.getStats());
        doc.setApiCalls(progress.getApiCalls());

        Path tmp = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
        try {
            Path parent = checkpointPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            writeDurably(tmp, mapper.writeValueAsBytes(doc));
            moveIntoPlace(tmp);

            log.debug("Checkpoint saved: {} zones, {} records -> {}",
                    doc.getCompletedZones().size(), doc.getRecords().size(), checkpointPath);

        } catch (IOException e) {
            log.error("Failed to save checkpoint {}: {}", checkpointPath, e.getMessage(), e);
            throw new PersistenceException("Checkpoint write failed: " + checkpointPath, e);
        }
    }

    private static void writeDurably(Path target, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(target,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            // on disk before the rename makes it visible
            channel.force(true);
        }
    }

    /**
     * @return the last successfully saved progress, empty if there is no checkpoint
     * @throws PersistenceException if a checkpoint exists but cannot be read
     */
    public Optional<CrawlProgress> load() {
        if (!Files.exists(checkpointPath)) {
            return Optional.empty();
        }
        try {
            CheckpointDocument doc = mapper.readValue(checkpointPath.toFile(), CheckpointDocument.class);
            if (doc.getSchemaVersion() > SCHEMA_VERSION) {
                throw new PersistenceException(String.format(
                        "Checkpoint %s has schema version %d, this build reads up to %d",
                        checkpointPath, doc.getSchemaVersion(), SCHEMA_VERSION));
            }

            log.info("Restored checkpoint from {} (saved {}): {} zones completed, {} records",
                    checkpointPath, doc.getSavedAt(), doc.getCompletedZones().size(), doc.getRecords().size());

            return Optional.of(CrawlProgress.restore(
                    doc.getCompletedZones(), doc.getRecords().values(), doc.getStats(), doc.getApiCalls()));

        } catch (IOException e) {
            throw new PersistenceException("Checkpoint read failed: " + checkpointPath, e);
        }
    }

    /**
     * Delete the checkpoint. Only called after the crawl completed and its dataset was written.
     */
    public void clear() {
        try {
            if (Files.deleteIfExists(checkpointPath)) {
                log.info("Cleaned up checkpoint file {}", checkpointPath);
            }
        } catch (IOException e) {
            throw new PersistenceException("Could not delete checkpoint " + checkpointPath, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, checkpointPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", checkpointPath);
            Files.move(tmp, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
