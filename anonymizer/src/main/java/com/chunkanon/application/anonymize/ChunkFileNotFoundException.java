package com.chunkanon.application.anonymize;

import org.springframework.boot.ExitCodeGenerator;

/**
 * No chunks file could be resolved, neither from an explicit path nor by auto-detection.
 * Fatal: the run stops before any output is written.
 */
public class ChunkFileNotFoundException extends AnonymizationException implements ExitCodeGenerator {

    public ChunkFileNotFoundException(String message) {
        super(message);
    }

    public ChunkFileNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
