package com.eventix.common.exception;

/**
 * A ledger counter was found in a state that correct bookkeeping can never produce,
 * e.g. releasing more tickets than are reserved. Not retryable; needs an operator.
 */
public class LedgerInvariantException extends RuntimeException {

    public LedgerInvariantException(String message) {
        super(message);
    }
}
