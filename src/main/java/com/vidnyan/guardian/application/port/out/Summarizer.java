package com.vidnyan.guardian.application.port.out;

import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GuardianReport;
import com.vidnyan.guardian.domain.report.Narrative;

/**
 * Port for turning a report into prose.
 * Implemented by language-model adapters; failures must not break the run.
 */
public interface Summarizer {

    Narrative summarize(GuardianReport report, RunMode mode);
}
