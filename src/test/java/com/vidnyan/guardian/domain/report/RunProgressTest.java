package com.vidnyan.guardian.domain.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunProgressTest {

    @Test
    void advanceTo_ShouldWalkTheNormalPath() {
        RunProgress progress = new RunProgress();

        progress.advanceTo(RunStage.SCHEDULING);
        progress.advanceTo(RunStage.RUNNING);
        progress.advanceTo(RunStage.NORMALIZING);
        progress.advanceTo(RunStage.AGGREGATING);
        progress.advanceTo(RunStage.REPORTING);
        progress.advanceTo(RunStage.DONE);

        assertTrue(progress.current().isTerminal());
        assertEquals(List.of(RunStage.DETECTING, RunStage.SCHEDULING, RunStage.RUNNING, RunStage.NORMALIZING,
                RunStage.AGGREGATING, RunStage.REPORTING, RunStage.DONE), progress.history());
    }

    @Test
    void advanceTo_ShouldRejectSkippedStages() {
        RunProgress progress = new RunProgress();

        assertThrows(IllegalStateException.class, () -> progress.advanceTo(RunStage.RUNNING));
        assertEquals(RunStage.DETECTING, progress.current());
    }

    @Test
    void abort_ShouldOnlyBeAllowedDuringDetection() {
        RunProgress detecting = new RunProgress();
        detecting.abort("unreadable root");
        assertEquals(List.of(RunStage.DETECTING, RunStage.ABORTED), detecting.history());
        assertThrows(IllegalStateException.class, () -> detecting.advanceTo(RunStage.SCHEDULING));

        RunProgress running = new RunProgress();
        running.advanceTo(RunStage.SCHEDULING);
        running.advanceTo(RunStage.RUNNING);
        assertThrows(IllegalStateException.class, () -> running.abort("too late"));
    }
}
