package com.flowgraph.executiontree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.executiontree.structure.PipelineStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialization and deserialization of the pipeline structure document.
 * Unknown properties are ignored on read so older or richer documents still load.
 */
public final class PipelineStructureJson {

    private static final Logger log = LoggerFactory.getLogger(PipelineStructureJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PipelineStructureJson() {
    }

    /**
     * Deserializes a pipeline structure from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static PipelineStructure fromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelineStructure.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a pipeline structure to a compact JSON string.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(PipelineStructure structure) {
        try {
            return MAPPER.writeValueAsString(structure);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes a pipeline structure to a pretty-printed JSON string. */
    public static String toJsonPretty(PipelineStructure structure) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(structure);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Writes the pretty-printed document to {@code file}, creating parent directories. */
    public static void write(PipelineStructure structure, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, toJsonPretty(structure), StandardCharsets.UTF_8);
            log.info("Pipeline structure saved | pipeline={} | file={}", structure.getPipelineName(), file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Reads a structure document from {@code file}. */
    public static PipelineStructure read(Path file) {
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
