package com.dcruver.litsync.app;

import org.springframework.boot.ExitCodeGenerator;

/**
 * A command finished but at least one item or plan operation failed.
 * The message carries the full report.
 */
public class SyncFailedException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 1;

    public SyncFailedException(String report) {
        super(report);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
