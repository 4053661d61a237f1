package com.paretorank.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link RankingDocument} as JSON. {@code NaN} objectives are
 * written as the string {@code "NaN"}.
 */
public class RankingWriter {

    private final ObjectMapper mapper;

    /**
     * @param prettyPrint indent the output
     */
    public RankingWriter(boolean prettyPrint) {
        this.mapper = JsonMapper.builder()
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .build();
    }

    /**
     * Write to a file, replacing it if present. Parent directories are
     * created.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(Population population, RankingResult result, Path path) {
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream os = Files.newOutputStream(path)) {
                write(population, result, os);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write ranking to " + path, e);
        }
    }

    /**
     * Write to a stream. The stream is flushed but not closed.
     *
     * @throws IOException if writing fails
     */
    public void write(Population population, RankingResult result, OutputStream os) throws IOException {
        Objects.requireNonNull(population, "Population must not be null");
        Objects.requireNonNull(result, "RankingResult must not be null");
        mapper.writeValue(os, RankingDocument.of(population, result));
        os.flush();
    }
}
