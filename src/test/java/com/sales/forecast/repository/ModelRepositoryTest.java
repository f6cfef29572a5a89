package com.sales.forecast.repository;

import com.sales.forecast.config.ForecastProperties;
import com.sales.forecast.engine.gbt.ForecastModel;
import com.sales.forecast.engine.gbt.GradientBoostingTrainer;
import com.sales.forecast.exception.ArtifactStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRepositoryTest {

    @TempDir
    Path tempDir;

    private final ModelRepository repository = new ModelRepository();

    @Test
    void saveThenLoad_samePredictionsAndImportances() {
        ForecastProperties properties = new ForecastProperties();
        properties.getModel().setNumTrees(10);
        properties.getModel().setMinSamplesLeaf(2);
        double[][] features = new double[40][];
        double[] targets = new double[40];
        for (int i = 0; i < 40; i++) {
            features[i] = new double[]{i % 7, i};
            targets[i] = (i % 7) * 10.0 + i;
        }
        ForecastModel model = new GradientBoostingTrainer(properties).fit(List.of("a", "b"), features, targets);
        Path path = tempDir.resolve("model.json");

        repository.save(path, model);
        ForecastModel loaded = repository.load(path);

        assertThat(loaded.predict(features)).containsExactly(model.predict(features));
        assertThat(loaded.featureNames()).containsExactly("a", "b");
        assertThat(loaded.featureImportances()).isEqualTo(model.featureImportances());
    }

    @Test
    void load_corruptFile_throwsArtifactStoreError() throws Exception {
        Path path = tempDir.resolve("model.json");
        Files.writeString(path, "{not json");

        assertThatThrownBy(() -> repository.load(path)).isInstanceOf(ArtifactStoreException.class);
    }
}
