package ch.uzh.ifi.grading.exception;

/**
 * Operator-side setup is incomplete, for example a challenge without fixtures. Not the candidate's fault.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
