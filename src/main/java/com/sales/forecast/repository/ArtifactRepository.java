package com.sales.forecast.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sales.forecast.engine.features.TrainingArtifacts;
import com.sales.forecast.exception.ArtifactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores the training artifacts (settings, schema, historical means, encoders, trailing
 * history) as one JSON document, independently of the model.
 */
@Repository
public class ArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRepository.class);

    private final ObjectMapper objectMapper;

    public ArtifactRepository() {
        this.objectMapper = JsonMappers.create();
    }

    public void save(Path path, TrainingArtifacts artifacts) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writeValue(path.toFile(), artifacts);
            log.info("Saved training artifacts to {}: {} feature columns, {} history rows",
                    path, artifacts.learned().featureColumns().size(), artifacts.history().records().size());
        } catch (IOException e) {
            log.error("Failed to save training artifacts to {}", path, e);
            throw new ArtifactStoreException("Failed to save training artifacts to " + path, e);
        }
    }

    public TrainingArtifacts load(Path path) {
        try {
            TrainingArtifacts artifacts = objectMapper.readValue(path.toFile(), TrainingArtifacts.class);
            log.info("Loaded training artifacts from {}", path);
            return artifacts;
        } catch (IOException e) {
            log.error("Failed to load training artifacts from {}", path, e);
            throw new ArtifactStoreException("Failed to load training artifacts from " + path, e);
        }
    }
}
