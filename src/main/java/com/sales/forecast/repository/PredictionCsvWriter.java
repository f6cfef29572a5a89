package com.sales.forecast.repository;

import com.sales.forecast.exception.ArtifactStoreException;
import com.sales.forecast.model.Prediction;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Repository
public class PredictionCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(PredictionCsvWriter.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader("date", "agency", "sku", "prediction")
            .build();

    public void write(Path path, List<Prediction> predictions) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
                for (Prediction prediction : predictions) {
                    printer.printRecord(prediction.date(), prediction.agency(), prediction.sku(),
                            prediction.prediction());
                }
            }
            log.info("Wrote {} predictions to {}", predictions.size(), path);
        } catch (IOException e) {
            log.error("Failed to write predictions to {}", path, e);
            throw new ArtifactStoreException("Failed to write predictions to " + path, e);
        }
    }
}
