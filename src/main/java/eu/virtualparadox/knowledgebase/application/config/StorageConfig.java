package eu.virtualparadox.knowledgebase.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout under {@code knowledge.storage.root}: the Lucene index, the H2 catalog
 * and the ONNX model folders. Locations left unset are placed inside the root.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "knowledge.storage")
@Getter @Setter
public class StorageConfig {

    private Path root;
    private Path index;
    /** H2 file name without extension. */
    private Path db;
    private Path models;

    @PostConstruct
    public void prepare() throws IOException {
        if (root == null) {
            throw new IllegalStateException("knowledge.storage.root must be set");
        }
        index = index == null ? root.resolve("index") : index;
        db = db == null ? root.resolve("db").resolve("catalog") : db;
        models = models == null ? root.resolve("models") : models;

        Files.createDirectories(index);
        Files.createDirectories(models);
        if (db.getParent() != null) {
            Files.createDirectories(db.getParent());
        }
        log.info("Storage root {}: index={}, catalog={}, models={}", root, index, db, models);
    }

    /**
     * Folder holding {@code model.onnx} and {@code tokenizer.json} of one model.
     */
    public Path model(final String name) {
        return models.resolve(name);
    }
}
