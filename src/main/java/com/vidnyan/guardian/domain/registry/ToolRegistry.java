package com.vidnyan.guardian.domain.registry;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;
import com.vidnyan.guardian.domain.model.Ecosystem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed mapping from ecosystem tag to the ordered analyzers that apply to it.
 */
public final class ToolRegistry {

    private final Map<String, List<AnalyzerSpec>> byEcosystem;
    private final Set<String> disabledTools;
    private final boolean universalEnabled;

    private ToolRegistry(Map<String, List<AnalyzerSpec>> byEcosystem, Set<String> disabledTools,
                         boolean universalEnabled) {
        this.byEcosystem = byEcosystem;
        this.disabledTools = Set.copyOf(disabledTools);
        this.universalEnabled = universalEnabled;
    }

    /**
     * Analyzers registered for a tag, in registration order. Disabled tools included.
     */
    public List<AnalyzerSpec> analyzersFor(String tag) {
        return byEcosystem.getOrDefault(tag, List.of());
    }

    /**
     * Analyzers to schedule for the detected ecosystems: ecosystem order first, then
     * registration order, then universal analyzers. Nothing is selected when no
     * ecosystem was detected.
     */
    public List<AnalyzerSpec> select(Collection<Ecosystem> ecosystems) {
        List<AnalyzerSpec> selected = new ArrayList<>();
        if (ecosystems.isEmpty()) {
            return selected;
        }
        for (Ecosystem ecosystem : ecosystems) {
            addEnabled(selected, analyzersFor(ecosystem.tag()));
        }
        if (universalEnabled) {
            addEnabled(selected, analyzersFor(AnalyzerSpec.UNIVERSAL));
        }
        return selected;
    }

    private void addEnabled(List<AnalyzerSpec> target, List<AnalyzerSpec> specs) {
        for (AnalyzerSpec spec : specs) {
            boolean seen = target.stream().anyMatch(s -> s.id().equals(spec.id()));
            if (!seen && !disabledTools.contains(spec.id())) {
                target.add(spec);
            }
        }
    }

    public Set<String> ecosystems() {
        return byEcosystem.keySet();
    }

    public int size() {
        return byEcosystem.values().stream().mapToInt(List::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<AnalyzerSpec>> byEcosystem = new LinkedHashMap<>();
        private Set<String> disabledTools = Set.of();
        private boolean universalEnabled = true;

        public Builder register(AnalyzerSpec spec) {
            List<AnalyzerSpec> specs = byEcosystem.computeIfAbsent(spec.ecosystem(), k -> new ArrayList<>());
            if (specs.stream().anyMatch(s -> s.id().equals(spec.id()))) {
                throw new IllegalArgumentException("Duplicate analyzer '" + spec.id() + "' for " + spec.ecosystem());
            }
            specs.add(spec);
            return this;
        }

        public Builder disabledTools(Set<String> tools) {
            this.disabledTools = tools;
            return this;
        }

        public Builder universalEnabled(boolean enabled) {
            this.universalEnabled = enabled;
            return this;
        }

        public ToolRegistry build() {
            Map<String, List<AnalyzerSpec>> frozen = new LinkedHashMap<>();
            byEcosystem.forEach((tag, specs) -> frozen.put(tag, List.copyOf(specs)));
            return new ToolRegistry(Collections.unmodifiableMap(frozen), disabledTools, universalEnabled);
        }
    }
}
