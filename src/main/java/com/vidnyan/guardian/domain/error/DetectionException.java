package com.vidnyan.guardian.domain.error;

import java.nio.file.Path;

/**
 * The repository could not be read. The only error that aborts a run.
 */
public class DetectionException extends GuardianException {

    private final Path repository;

    public DetectionException(Path repository, String message) {
        super(message);
        this.repository = repository;
    }

    public DetectionException(Path repository, String message, Throwable cause) {
        super(message, cause);
        this.repository = repository;
    }

    public Path getRepository() {
        return repository;
    }
}
