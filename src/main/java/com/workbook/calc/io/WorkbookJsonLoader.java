package com.workbook.calc.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workbook.calc.engine.AnalysisOptions;

/**
 * Reads workbook trees and analysis options from JSON.
 *
 * <p>
 * This is the boundary where upstream failures surface: unreadable files
 * propagate as {@link IOException}, malformed documents as
 * {@link IllegalArgumentException}. Nothing past this point throws on content.
 */
public final class WorkbookJsonLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private static final char BOM = '\uFEFF';

    private WorkbookJsonLoader() {
        // Utility class
    }

    /** Parses a JSON file into a WorkbookDefinition. */
    public static WorkbookDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON string into a WorkbookDefinition. */
    public static WorkbookDefinition parse(String json) {
        if (json == null || json.isBlank())
            throw new IllegalArgumentException("Empty workbook document");
        String cleaned = json.charAt(0) == BOM ? json.substring(1) : json;
        WorkbookDefinition def;
        try {
            def = MAPPER.readValue(cleaned, WorkbookDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workbook JSON: " + e.getOriginalMessage()
                    + locationOf(e), e);
        }
        if (def == null || def.getWorkbook() == null)
            throw new IllegalArgumentException("Missing 'workbook' key");
        return def;
    }

    /** Loads analysis options; keys not present keep their defaults. */
    public static AnalysisOptions loadOptions(Path path) throws IOException {
        try {
            AnalysisOptions options = MAPPER.readValue(Files.readString(path), AnalysisOptions.class);
            return options != null ? options : new AnalysisOptions();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid options JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String locationOf(JsonProcessingException e) {
        var loc = e.getLocation();
        return loc == null ? "" : " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
    }
}
