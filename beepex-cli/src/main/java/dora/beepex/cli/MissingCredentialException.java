package dora.beepex.cli;

import org.springframework.boot.ExitCodeGenerator;

/**
 * No access token for the Desktop API. Raised while the application starts,
 * before any request is made, so it carries its own exit code.
 */
public class MissingCredentialException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public MissingCredentialException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
