/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repoq.trs.api.model.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes verification reports as an indented JSON array with ISO-8601 timestamps.
 */
public final class VerificationReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(VerificationReportWriter.class);

    private final ObjectMapper objectMapper;

    public VerificationReportWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(List<VerificationReport> reports, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(reports, writer);
        }
        logger.info("Wrote {} report(s) to {}", reports.size(), file);
    }

    public void write(List<VerificationReport> reports, Writer writer) throws IOException {
        objectMapper.writeValue(writer, reports);
    }

    public String toJson(VerificationReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize report for " + report.ruleSetName(), e);
        }
    }

    /**
     * Reader side of the same format, for tooling that compares runs.
     */
    public List<VerificationReport> read(Path file) throws IOException {
        return List.of(objectMapper.readValue(file.toFile(), VerificationReport[].class));
    }
}
