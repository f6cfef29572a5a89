package com.sales.forecast.repository;

import com.sales.forecast.exception.ArtifactStoreException;
import com.sales.forecast.model.RawTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV file into a {@link RawTable}. Values stay untyped; parsing is the
 * panel loader's job. An unnamed leading index column is kept under the empty header.
 */
@Repository
public class PanelCsvReader {

    private static final Logger log = LoggerFactory.getLogger(PanelCsvReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_EMPTY)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    public RawTable read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < headers.size() && i < record.size(); i++) {
                    row.put(headers.get(i), record.get(i));
                }
                rows.add(row);
            }
            log.info("Read {} rows with columns {} from {}", rows.size(), headers, path);
            return new RawTable(headers, rows);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("Failed to read CSV {}", path, e);
            throw new ArtifactStoreException("Failed to read CSV " + path, e);
        }
    }
}
