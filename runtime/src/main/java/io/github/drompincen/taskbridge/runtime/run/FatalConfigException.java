package io.github.drompincen.taskbridge.runtime.run;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Configuration or connectivity problem found before any project was processed.
 * The only failure that aborts a run. Carries its own exit code so that a failure raised
 * while the context is still starting ends the process the same way as one raised by the command.
 */
public class FatalConfigException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public FatalConfigException(String message) {
        super(message);
    }

    public FatalConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
