package com.sales.forecast.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sales.forecast.engine.gbt.ForecastModel;
import com.sales.forecast.engine.gbt.GradientBoostedModel;
import com.sales.forecast.exception.ArtifactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON persistence of the trained model. The model is read back as a {@link GradientBoostedModel}.
 */
@Repository
public class ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelRepository.class);

    private final ObjectMapper objectMapper;

    public ModelRepository() {
        this.objectMapper = JsonMappers.create();
    }

    public void save(Path path, ForecastModel model) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writeValue(path.toFile(), model);
            log.info("Saved model to {}: {} features", path, model.featureNames().size());
        } catch (IOException e) {
            log.error("Failed to save model to {}", path, e);
            throw new ArtifactStoreException("Failed to save model to " + path, e);
        }
    }

    public ForecastModel load(Path path) {
        try {
            GradientBoostedModel model = objectMapper.readValue(path.toFile(), GradientBoostedModel.class);
            log.info("Loaded model from {}: {} trees", path, model.getTrees().size());
            return model;
        } catch (IOException e) {
            log.error("Failed to load model from {}", path, e);
            throw new ArtifactStoreException("Failed to load model from " + path, e);
        }
    }
}
