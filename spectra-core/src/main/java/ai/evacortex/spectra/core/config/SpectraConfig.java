/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.config;

import ai.evacortex.spectra.core.engine.IterativeKernel;
import ai.evacortex.spectra.core.engine.KernelType;
import ai.evacortex.spectra.core.image.ImageCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Runtime settings, read from JSON.
 *
 * @param kernel                 transform implementation
 * @param defaultCompressionRate rate used by {@code ImageCodec.encode(image)}, 0..100
 * @param parallelChannels       encode/decode the three channels concurrently
 * @param twiddleCacheSize       number of transform lengths whose twiddles are kept
 * @param trace                  print per-transform timings to stderr
 */
public record SpectraConfig(KernelType kernel,
                            int defaultCompressionRate,
                            boolean parallelChannels,
                            int twiddleCacheSize,
                            boolean trace) {

    public static final String DEFAULT_RESOURCE = "spectra.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    public SpectraConfig {
        if (kernel == null) {
            throw new IllegalArgumentException("kernel must be set");
        }
        if (defaultCompressionRate < 0 || defaultCompressionRate > 100) {
            throw new IllegalArgumentException("defaultCompressionRate must be in [0, 100]: " + defaultCompressionRate);
        }
        if (twiddleCacheSize < 1) {
            throw new IllegalArgumentException("twiddleCacheSize must be >= 1: " + twiddleCacheSize);
        }
    }

    public static SpectraConfig defaults() {
        return new SpectraConfig(KernelType.RECURSIVE, ImageCodec.DEFAULT_COMPRESSION_RATE,
                false, IterativeKernel.DEFAULT_CACHE_SIZE, false);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns {@link #defaults()} if the
     * resource is absent.
     */
    public static SpectraConfig loadDefault() {
        try (InputStream in = SpectraConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULT_RESOURCE, e);
        }
    }

    public static SpectraConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config " + path, e);
        }
    }

    public static SpectraConfig parse(String json) {
        try {
            return MAPPER.readValue(json, SpectraConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed config: " + e.getOriginalMessage(), e);
        }
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, this);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save config " + path, e);
        }
    }

    public SpectraConfig withKernel(KernelType type) {
        return new SpectraConfig(type, defaultCompressionRate, parallelChannels, twiddleCacheSize, trace);
    }

    private static SpectraConfig read(InputStream in) throws IOException {
        try {
            return MAPPER.readValue(in, SpectraConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed config: " + e.getOriginalMessage(), e);
        }
    }
}
