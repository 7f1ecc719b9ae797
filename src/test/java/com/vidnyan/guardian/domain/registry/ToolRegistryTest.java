package com.vidnyan.guardian.domain.registry;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.analyzer.OutputFormat;
import com.vidnyan.guardian.domain.model.Ecosystem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.vidnyan.guardian.TestSpecs.spec;
import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final AnalyzerSpec RUFF = spec("ruff", "python", OutputFormat.SARIF, "ruff");
    private static final AnalyzerSpec BANDIT = spec("bandit", "python", OutputFormat.BANDIT_JSON, "bandit");
    private static final AnalyzerSpec ESLINT = spec("eslint", "javascript", OutputFormat.ESLINT_JSON, "eslint");
    private static final AnalyzerSpec SEMGREP = spec("semgrep", AnalyzerSpec.UNIVERSAL, OutputFormat.SEMGREP_JSON, "semgrep");

    private ToolRegistry.Builder registry() {
        return ToolRegistry.builder().register(RUFF).register(BANDIT).register(ESLINT).register(SEMGREP);
    }

    private static Ecosystem eco(String tag) {
        return new Ecosystem(tag, List.of());
    }

    @Test
    void select_ShouldKeepEcosystemOrderThenAppendUniversal() {
        List<AnalyzerSpec> selected = registry().build().select(List.of(eco("javascript"), eco("python")));

        assertEquals(List.of("eslint", "ruff", "bandit", "semgrep"), selected.stream().map(AnalyzerSpec::id).toList());
    }

    @Test
    void select_ShouldSelectNothingWithoutEcosystems() {
        assertTrue(registry().build().select(List.of()).isEmpty());
    }

    @Test
    void select_ShouldSkipDisabledToolsAndUniversalWhenTurnedOff() {
        ToolRegistry registry = registry().disabledTools(Set.of("bandit")).universalEnabled(false).build();

        List<AnalyzerSpec> selected = registry.select(List.of(eco("python")));

        assertEquals(List.of("ruff"), selected.stream().map(AnalyzerSpec::id).toList());
    }

    @Test
    void analyzersFor_ShouldReturnEmptyForUnknownTag() {
        assertTrue(registry().build().analyzersFor("cobol").isEmpty());
        assertEquals(4, registry().build().size());
    }

    @Test
    void register_ShouldRejectDuplicateIdsWithinAnEcosystem() {
        ToolRegistry.Builder builder = ToolRegistry.builder().register(RUFF);

        assertThrows(IllegalArgumentException.class, () -> builder.register(RUFF));
    }
}
