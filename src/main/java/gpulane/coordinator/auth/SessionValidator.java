package gpulane.coordinator.auth;

/**
 * Validates a browser session token. Session issuance lives outside this service.
 */
@FunctionalInterface
public interface SessionValidator {

    boolean isValid(String token);

    /** Validator used when no session store is wired: every token is refused */
    static SessionValidator rejectAll() {
        return token -> false;
    }
}
