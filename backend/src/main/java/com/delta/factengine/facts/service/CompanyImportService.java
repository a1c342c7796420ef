package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.model.ImportSummary;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the tracked company list from a CSV with {@code TICKER}, {@code NAME} and optional
 * {@code NAMEALT} columns.
 */
@Service
public class CompanyImportService {
    private static final Logger log = LoggerFactory.getLogger(CompanyImportService.class);
    private static final int MAX_SAMPLE_ERRORS = 10;

    private final FinancialsJdbcRepository repository;
    private final EngineProperties properties;

    public CompanyImportService(FinancialsJdbcRepository repository, EngineProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public ImportSummary importDefault() {
        return importCsv(resolvePath(properties.getData().getCompaniesCsv()));
    }

    public ImportSummary importCsv(Path csvPath) {
        int upserted = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String ticker = normalizeTicker(getColumn(record, "ticker"));
                String name = getColumn(record, "name");
                String nameAlt = getColumn(record, "namealt", "name_alt");
                if (ticker == null || name == null) {
                    skipped++;
                    addError(errors, "csv row " + record.getRecordNumber() + " missing TICKER or NAME");
                    continue;
                }
                try {
                    repository.upsertCompany(ticker, name, nameAlt);
                    upserted++;
                } catch (DataAccessException e) {
                    skipped++;
                    addError(errors, "failed to upsert " + ticker + ": " + e.getMostSpecificCause().getMessage());
                }
            }
        } catch (IOException e) {
            throw new EngineSetupException("Failed to read companies CSV at " + csvPath, e);
        }
        log.info("Imported {} companies from {} ({} rows skipped)", upserted, csvPath, skipped);
        return new ImportSummary(upserted, skipped, List.copyOf(errors));
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.getParser().getHeaderNames()) {
                if (header == null) {
                    continue;
                }
                String normalized = header.replace("\uFEFF", "").trim();
                if (normalized.equalsIgnoreCase(name) && record.isSet(header)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private String normalizeTicker(String ticker) {
        return ticker == null ? null : ticker.trim().toUpperCase(Locale.ROOT);
    }

    private void addError(List<String> errors, String message) {
        log.warn(message);
        if (errors.size() < MAX_SAMPLE_ERRORS) {
            errors.add(message);
        }
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
