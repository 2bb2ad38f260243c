package com.risk.fta.io;

import com.risk.fta.engine.Approximation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import lombok.Data;

/**
 * Analysis configuration.
 *
 * Fields absent from a settings file keep the defaults below, which match the
 * bundled {@code fta-defaults.json}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalysisSettings {
    public static final String DEFAULTS_RESOURCE = "fta-defaults.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    /** Cut sets above this order are discarded during expansion. */
    private int limitOrder = 20;
    /** Term budget of the inclusion-exclusion expansion. */
    private long numSums = 1_000_000;
    private Approximation approximation = Approximation.NONE;

    private boolean probabilityAnalysis = true;
    private boolean importanceAnalysis = true;
    private boolean uncertaintyAnalysis = false;

    private int numTrials = 1000;
    private int numThreads = 1;
    /** 0 for a nondeterministic simulation. */
    private long seed = 0;

    /** Loads the bundled defaults. */
    public static AnalysisSettings defaults() {
        return fromResource(DEFAULTS_RESOURCE);
    }

    /** Loads settings from a JSON file. */
    public static AnalysisSettings load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), AnalysisSettings.class).validate();
    }

    /**
     * Loads settings from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     * @throws UncheckedIOException     if the resource cannot be read.
     */
    public static AnalysisSettings fromResource(String resource) {
        try (InputStream in = AnalysisSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Settings resource not found: " + resource);
            return MAPPER.readValue(in, AnalysisSettings.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load settings from " + resource, e);
        }
    }

    /** Parses settings from a JSON string. */
    public static AnalysisSettings parse(String json) {
        try {
            return MAPPER.readValue(json, AnalysisSettings.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed settings", e);
        }
    }

    /**
     * Checks the budgets.
     *
     * @return this, for chaining.
     * @throws IllegalArgumentException on a non-positive budget or a missing
     *                                  approximation.
     */
    public AnalysisSettings validate() {
        if (limitOrder < 1)
            throw new IllegalArgumentException("limitOrder must be positive: " + limitOrder);
        if (numSums < 1)
            throw new IllegalArgumentException("numSums must be positive: " + numSums);
        if (numTrials < 1)
            throw new IllegalArgumentException("numTrials must be positive: " + numTrials);
        if (numThreads < 1)
            throw new IllegalArgumentException("numThreads must be positive: " + numThreads);
        if (approximation == null)
            throw new IllegalArgumentException("approximation must be set");
        return this;
    }
}
