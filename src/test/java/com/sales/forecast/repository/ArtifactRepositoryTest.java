package com.sales.forecast.repository;

import com.sales.forecast.engine.features.FeaturePipeline;
import com.sales.forecast.engine.features.LearnedStatistics;
import com.sales.forecast.engine.features.TrailingHistory;
import com.sales.forecast.engine.features.TrainingArtifacts;
import com.sales.forecast.exception.ArtifactStoreException;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import com.sales.forecast.model.PanelSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static com.sales.forecast.testutil.TestDataFactory.JAN_2017;
import static com.sales.forecast.testutil.TestDataFactory.settings;
import static com.sales.forecast.testutil.TestDataFactory.syntheticPanel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactRepositoryTest {

    @TempDir
    Path tempDir;

    private final ArtifactRepository repository = new ArtifactRepository();
    private final FeaturePipeline pipeline = new FeaturePipeline();

    @Test
    void saveThenLoad_reproducesIdenticalFeatures() {
        Panel panel = Panel.of(syntheticPanel(List.of("A", "B"), List.of("S1", "S2"), JAN_2017, 6));
        LearnedStatistics learned = pipeline.fitTransform(panel, settings(List.of(1, 2), List.of(2)),
                new PanelSchema(List.of("price"), List.of("holiday"))).learned();
        TrainingArtifacts artifacts = new TrainingArtifacts(learned, TrailingHistory.capture(panel, 2));
        Path path = tempDir.resolve("models/artifacts.json");

        repository.save(path, artifacts);
        TrainingArtifacts loaded = repository.load(path);

        assertThat(loaded.learned().settings()).isEqualTo(learned.settings());
        assertThat(loaded.learned().schema()).isEqualTo(learned.schema());
        assertThat(loaded.learned().statistics()).isEqualTo(learned.statistics());
        assertThat(loaded.learned().featureColumns()).isEqualTo(learned.featureColumns());
        assertThat(loaded.learned().encoders().agency().getCategories()).containsExactly("A", "B");
        assertThat(loaded.history().records()).isEqualTo(artifacts.history().records());

        Panel next = Panel.of(syntheticPanel(List.of("A", "B"), List.of("S1", "S2"), JAN_2017.plusMonths(6), 1));
        FeatureMatrix before = pipeline.transform(next, learned, artifacts.history().toPanel());
        FeatureMatrix after = pipeline.transform(next, loaded.learned(), loaded.history().toPanel());
        assertThat(Arrays.deepEquals(before.toArray(), after.toArray())).isTrue();
    }

    @Test
    void load_historyRecordsCannotBeRewritten() {
        Panel panel = Panel.of(syntheticPanel(List.of("A"), List.of("S1"), JAN_2017, 3));
        LearnedStatistics learned = pipeline.fitTransform(panel, settings(List.of(1), List.of(2)),
                new PanelSchema(List.of("price"), List.of())).learned();
        Path path = tempDir.resolve("artifacts.json");
        repository.save(path, new TrainingArtifacts(learned, TrailingHistory.capture(panel, 2)));
        TrainingArtifacts loaded = repository.load(path);
        PanelRecord first = loaded.history().records().get(0);

        PanelRecord changed = first.withTarget(999.0);

        assertThat(loaded.history().records().get(0).getTarget()).isEqualTo(first.getTarget()).isNotEqualTo(999.0);
        assertThat(changed.getTarget()).isEqualTo(999.0);
        assertThatThrownBy(() -> first.getExogenous().put("price", 0.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> loaded.history().records().remove(0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(loaded.history().toPanel().records().get(0).getExogenous().get("price")).isEqualTo(1001.0);
    }

    @Test
    void load_missingFile_throwsArtifactStoreError() {
        assertThatThrownBy(() -> repository.load(tempDir.resolve("absent.json")))
                .isInstanceOf(ArtifactStoreException.class)
                .extracting("errorCode").isEqualTo("ARTIFACT_STORE_ERROR");
    }
}
