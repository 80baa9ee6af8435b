package com.edsim.triage.llm;

/**
 * The external triage system could not be reached or answered with something unusable.
 */
public class ExternalTriageException extends Exception {

    public ExternalTriageException(String message) {
        super(message);
    }

    public ExternalTriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
