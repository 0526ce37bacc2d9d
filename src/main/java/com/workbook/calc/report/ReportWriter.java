package com.workbook.calc.report;

import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes reports to indented JSON.
 */
public final class ReportWriter {
    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String toJson(Object report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + report.getClass().getSimpleName(), e);
        }
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
