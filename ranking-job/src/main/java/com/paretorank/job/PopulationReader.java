package com.paretorank.job;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link PopulationDocument} from JSON and converts it into a
 * {@link Population}.
 *
 * <p>
 * Bare {@code NaN} tokens are accepted alongside {@code null} and
 * {@code "NaN"} as undefined objective values. Unknown properties are
 * ignored.
 * </p>
 */
public class PopulationReader {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationReader.class);

    private final ObjectMapper mapper;

    public PopulationReader() {
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Read a population file.
     *
     * @param path JSON file; must not be {@code null}
     * @return the population
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     * @throws InvalidInputException    if an entry is missing its objectives
     */
    public Population read(Path path) {
        Objects.requireNonNull(path, "Population path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Population file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read population file: " + path, e);
        }
    }

    /**
     * Read a population from a stream. The stream is not closed.
     *
     * @param is     JSON source
     * @param source description used in messages
     * @return the population
     * @throws IllegalStateException if the JSON is malformed
     */
    public Population read(InputStream is, String source) {
        Objects.requireNonNull(is, "Input stream must not be null");
        PopulationDocument document;
        try {
            document = mapper.readValue(is, PopulationDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("Malformed population document " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            LOG.warn("Population document {} is empty", source);
            return Population.empty();
        }
        Population population = document.toPopulation();
        LOG.info("Read {} solution(s) with {} objective(s) from {}",
                population.size(), population.dimension(), source);
        return population;
    }
}
