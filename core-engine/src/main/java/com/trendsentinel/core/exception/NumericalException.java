package com.trendsentinel.core.exception;

/**
 * Thrown when a numerical routine cannot produce a meaningful result, e.g.
 * a periodogram without any finite positive power.
 *
 * @since 1.0.0
 */
public class NumericalException extends ArithmeticException {

    private static final long serialVersionUID = 1L;

    public NumericalException(String message) {
        super(message);
    }
}
