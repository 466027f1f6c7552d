package com.distributedsystems.bhr.exception;

import lombok.Getter;

/**
 * Raised when a block request falls inside a protected network and the caller did not
 * ask to skip the whitelist. Re-issuing the request with the override succeeds.
 */
@Getter
public class WhitelistConflictException extends BhrException {

    private final String requested;
    private final String protectedBy;

    public WhitelistConflictException(String requested, String protectedBy, String why) {
        super("whitelist_conflict", requested + " is whitelisted by " + protectedBy
                + (why == null || why.isBlank() ? "" : " (" + why + ")"));
        this.requested = requested;
        this.protectedBy = protectedBy;
    }
}
