package org.fielddispatch.engine.exception;

/**
 * Raised by collaborator clients when an external call fails or returns an
 * unusable response. Only the resilience layer catches it.
 */
public class DependencyUnavailableException extends RuntimeException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
