package com.vidnyan.guardian.application.port.out;

import com.vidnyan.guardian.domain.analyzer.AnalyzerSpec;

import java.util.List;

/**
 * Port for loading the static analyzer definitions.
 */
public interface AnalyzerCatalog {

    /**
     * All analyzer specs, grouped by ecosystem in catalog order.
     */
    List<AnalyzerSpec> loadAll();
}
