package com.distributedsystems.bhr.exception;

/**
 * The referenced network (or block id) has no live block. Agents should drop the stale
 * work item rather than retry.
 */
public class NoSuchActiveBlockException extends BhrException {

    public NoSuchActiveBlockException(String reference) {
        super("no_such_active_block", "No active block for " + reference);
    }
}
