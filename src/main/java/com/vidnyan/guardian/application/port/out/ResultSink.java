package com.vidnyan.guardian.application.port.out;

import com.vidnyan.guardian.domain.error.SinkException;
import com.vidnyan.guardian.domain.model.RunMode;
import com.vidnyan.guardian.domain.report.GuardianReport;

/**
 * Port for delivering the final report somewhere: files, PR comments.
 */
public interface ResultSink {

    String name();

    boolean supports(RunMode mode);

    /**
     * @throws SinkException when the report could not be delivered
     */
    void publish(GuardianReport report, RunMode mode);
}
