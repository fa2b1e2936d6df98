package com.dcruver.litsync.app;

import com.dcruver.litsync.library.LibraryClientException;
import com.dcruver.litsync.state.IntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Maps command failures to shell output and a process exit code.
 * Anything else falls through to Spring Shell's default handling.
 */
@Component
@Slf4j
public class SyncExitCodeResolver implements CommandExceptionResolver {

    static final int INTEGRITY_EXIT_CODE = 2;

    @Override
    public CommandHandlingResult resolve(Exception e) {
        if (e instanceof SyncFailedException) {
            return CommandHandlingResult.of(withNewline(e.getMessage()), SyncFailedException.EXIT_CODE);
        }
        if (e instanceof IntegrityException) {
            log.error("Aborted: {}", e.getMessage(), e);
            return CommandHandlingResult.of("Aborted: " + withNewline(e.getMessage()), INTEGRITY_EXIT_CODE);
        }
        if (e instanceof LibraryClientException) {
            log.error("Library unavailable: {}", e.getMessage(), e);
            return CommandHandlingResult.of("Library unavailable: " + withNewline(e.getMessage()),
                SyncFailedException.EXIT_CODE);
        }
        return null;
    }

    private static String withNewline(String message) {
        String text = message != null ? message : "";
        return text.endsWith("\n") ? text : text + "\n";
    }
}
