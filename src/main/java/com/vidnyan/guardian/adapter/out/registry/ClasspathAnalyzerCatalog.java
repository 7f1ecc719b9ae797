package com.vidnyan.guardian.adapter.out.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.application.port.out.AnalyzerCatalog;
import com.vidnyan.guardian.config.GuardianProperties;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Analyzer catalog backed by JSON files on the classpath, one file per ecosystem.
 * Files are read in name order; a file that fails to load is logged and skipped.
 */
@Slf4j
@Component
public class ClasspathAnalyzerCatalog implements AnalyzerCatalog {

    private static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private final ObjectMapper objectMapper;
    private final String location;
    private List<AnalyzerSpec> specs;

    @Autowired
    public ClasspathAnalyzerCatalog(ObjectMapper objectMapper, GuardianProperties properties) {
        this(objectMapper, properties.getRegistry().getCatalogLocation());
    }

    public ClasspathAnalyzerCatalog(ObjectMapper objectMapper, String location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    public synchronized List<AnalyzerSpec> loadAll() {
        if (specs == null) {
            specs = List.copyOf(load());
        }
        return specs;
    }

    private List<AnalyzerSpec> load() {
        List<AnalyzerSpec> loaded = new ArrayList<>();
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            log.error("Failed to list analyzer catalog at {}", location, e);
            return loaded;
        }

        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                CatalogDto dto = objectMapper.readValue(in, CatalogDto.class);
                List<AnalyzerSpec> fromFile = mapCatalog(dto);
                loaded.addAll(fromFile);
                log.info("Loaded {} analyzers for '{}' from {}", fromFile.size(), dto.ecosystem, resource.getFilename());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to load analyzer catalog {}: {}", resource.getFilename(), e.getMessage());
            }
        }
        log.info("Analyzer catalog: {} analyzers from {}", loaded.size(), location);
        return loaded;
    }

    private List<AnalyzerSpec> mapCatalog(CatalogDto dto) {
        if (dto.ecosystem == null || dto.ecosystem.isBlank()) {
            throw new IllegalArgumentException("catalog file has no ecosystem");
        }
        List<AnalyzerSpec> result = new ArrayList<>();
        if (dto.analyzers != null) {
            for (AnalyzerDto analyzer : dto.analyzers) {
                result.add(mapAnalyzer(dto.ecosystem.trim(), analyzer));
            }
        }
        return result;
    }

    private AnalyzerSpec mapAnalyzer(String ecosystem, AnalyzerDto dto) {
        return new AnalyzerSpec(
                dto.id,
                dto.name,
                ecosystem,
                dto.command,
                Duration.ofSeconds(dto.timeoutSeconds != null ? dto.timeoutSeconds : DEFAULT_TIMEOUT_SECONDS),
                mapFormat(dto.format),
                mapSeverities(dto.severities),
                dto.extensions,
                dto.requiresPath);
    }

    private OutputFormat mapFormat(String format) {
        if (format == null) {
            return OutputFormat.LINE;
        }
        return OutputFormat.valueOf(format.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    private Map<String, Severity> mapSeverities(Map<String, String> severities) {
        Map<String, Severity> mapped = new LinkedHashMap<>();
        if (severities != null) {
            severities.forEach((nativeLevel, severity) -> mapped.put(nativeLevel,
                    Severity.parse(severity).orElseThrow(() ->
                            new IllegalArgumentException("unknown severity '" + severity + "' for " + nativeLevel))));
        }
        return mapped;
    }

    // DTO classes for JSON deserialization
    static class CatalogDto {
        public String ecosystem;
        public List<AnalyzerDto> analyzers;
    }

    static class AnalyzerDto {
        public String id;
        public String name;
        public List<String> command;
        public Integer timeoutSeconds;
        public String format;
        public Map<String, String> severities;
        public List<String> extensions;
        public String requiresPath;
    }
}
