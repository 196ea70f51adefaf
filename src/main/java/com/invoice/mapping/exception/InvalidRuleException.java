package com.invoice.mapping.exception;

/**
 * A mapping rule that cannot be applied as written: a regex that does not
 * compile, a malformed position selector, a missing keyword.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
