package com.recall.policy;

/**
 * PolicyException - The clinical policy table is missing a key, has a wrong type,
 * or references a vital the range table does not know.
 */
public class PolicyException extends RuntimeException {

    public PolicyException(String message) {
        super(message);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
