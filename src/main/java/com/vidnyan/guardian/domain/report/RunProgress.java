package com.vidnyan.guardian.domain.report;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks the stage of a single run and rejects illegal transitions.
 * Only detection may abort; every later stage runs to completion.
 */
@Slf4j
public class RunProgress {

    private final List<RunStage> history = new ArrayList<>();
    private RunStage current;

    public RunProgress() {
        this.current = RunStage.DETECTING;
        history.add(current);
    }

    public RunStage current() {
        return current;
    }

    public List<RunStage> history() {
        return List.copyOf(history);
    }

    public void advanceTo(RunStage stage) {
        if (current.next() != stage) {
            throw new IllegalStateException("Illegal stage transition " + current + " -> " + stage);
        }
        move(stage);
    }

    public void abort(String reason) {
        if (current != RunStage.DETECTING) {
            throw new IllegalStateException("Cannot abort from " + current);
        }
        log.error("Run aborted during detection: {}", reason);
        move(RunStage.ABORTED);
    }

    private void move(RunStage stage) {
        log.debug("Stage {} -> {}", current, stage);
        current = stage;
        history.add(stage);
    }
}
