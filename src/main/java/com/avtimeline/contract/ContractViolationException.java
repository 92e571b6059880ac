package com.avtimeline.contract;

/**
 * Thrown when a service event breaks the event contract: missing identity
 * fields, an unparseable date or a payload that does not carry what its
 * event kind requires.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
