package com.trendsentinel.core.exception;

/**
 * Thrown when an operation needs an optional collaborator, such as a
 * periodogram provider, that was not configured.
 *
 * <p>
 * Callers that can accept a weaker method catch this exception and fall back
 * explicitly, recording the substitution; nothing in this library degrades
 * silently.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingCapabilityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String capability;

    public MissingCapabilityException(String capability, String message) {
        super(message);
        this.capability = capability;
    }

    /** @return short name of the missing capability, e.g. {@code "periodogram"} */
    public String getCapability() {
        return capability;
    }
}
