package com.example.mediacache;

import com.example.mediacache.precache.PrecacheReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class StatisticsReportWriter {
    private final ObjectMapper mapper;
    private final Path reportPath;

    /**
     * Persists the outcome of the startup precache sweep to a single JSON file.
     */
    public StatisticsReportWriter(Path reportPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.reportPath = reportPath;
    }

    /**
     * Returns the last written report if the file exists.
     */
    public Optional<PrecacheReport> load() throws IOException {
        if (!Files.exists(reportPath)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(reportPath)) {
            return Optional.of(mapper.readValue(reader, PrecacheReport.class));
        }
    }

    public void save(PrecacheReport report) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    public Path path() {
        return reportPath;
    }
}
