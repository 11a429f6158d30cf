package de.bsommerfeld.gamesync.launcher;

import java.util.List;

/**
 * Exit code and captured output of a finished game process.
 *
 * @param timedOut true if the process was killed after the deadline
 */
public record ProcessResult(int exitCode, List<String> stdout, List<String> stderr, boolean timedOut) {

    public ProcessResult {
        stdout = List.copyOf(stdout);
        stderr = List.copyOf(stderr);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
