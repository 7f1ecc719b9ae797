package com.vidnyan.guardian.adapter.out.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.model.Severity;
import com.vidnyan.guardian.domain.registry.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathAnalyzerCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void loadAll_ShouldReadBundledCatalog() {
        ClasspathAnalyzerCatalog catalog = new ClasspathAnalyzerCatalog(objectMapper, "classpath*:analyzers/*.json");

        List<AnalyzerSpec> specs = catalog.loadAll();
        Map<String, AnalyzerSpec> byId = specs.stream()
                .collect(Collectors.toMap(AnalyzerSpec::id, Function.identity()));

        assertEquals(17, specs.size());
        assertEquals("trivy", specs.get(0).id());
        assertTrue(byId.get("semgrep").isUniversal());
        assertEquals(OutputFormat.PIP_AUDIT_JSON, byId.get("pip-audit").format());
        assertEquals("requirements.txt", byId.get("pip-audit").requiresPath());
        assertEquals(Severity.HIGH, byId.get("pip-audit").severityFor("vulnerability"));
        assertEquals(Duration.ofSeconds(300), byId.get("ruff").timeout());
        assertTrue(byId.get("ruff").targetsFiles());
        assertSame(specs, catalog.loadAll());
    }

    @Test
    void loadAll_ShouldProduceRegistryWithoutDuplicates() {
        List<AnalyzerSpec> specs = new ClasspathAnalyzerCatalog(objectMapper, "classpath*:analyzers/*.json").loadAll();

        ToolRegistry.Builder builder = ToolRegistry.builder();
        specs.forEach(builder::register);
        ToolRegistry registry = builder.build();

        assertEquals(17, registry.size());
        assertEquals(List.of("ruff", "bandit", "pip-audit"),
                registry.analyzersFor("python").stream().map(AnalyzerSpec::id).toList());
    }

    @Test
    void loadAll_ShouldSkipInvalidFilesAndApplyDefaults() {
        ClasspathAnalyzerCatalog catalog =
                new ClasspathAnalyzerCatalog(objectMapper, "classpath*:catalog-fixtures/*.json");

        List<AnalyzerSpec> specs = catalog.loadAll();

        assertEquals(1, specs.size());
        AnalyzerSpec credo = specs.get(0);
        assertEquals("credo", credo.id());
        assertEquals("credo", credo.name());
        assertEquals("elixir", credo.ecosystem());
        assertEquals(OutputFormat.GENERIC_JSON, credo.format());
        assertEquals(Duration.ofSeconds(300), credo.timeout());
        assertEquals(Severity.MEDIUM, credo.severityFor("warning"));
        assertTrue(credo.appliesTo("lib/app.EX"));
    }

    @Test
    void loadAll_ShouldReturnEmptyCatalogWhenNothingMatches() {
        ClasspathAnalyzerCatalog catalog = new ClasspathAnalyzerCatalog(objectMapper, "classpath*:nowhere/*.json");

        assertTrue(catalog.loadAll().isEmpty());
    }
}
