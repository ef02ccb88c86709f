package com.github.acprelay.bridge;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;

/**
 * Starts the agent executable. Tests swap in a launcher that returns an in-process fake.
 */
@FunctionalInterface
public interface ProcessLauncher {

    @NotNull
    Process launch(@NotNull List<String> command) throws IOException;

    /** Launches with {@link ProcessBuilder} in the current working directory, stderr kept separate. */
    static ProcessLauncher system() {
        return command -> {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(false);
            return pb.start();
        };
    }
}
