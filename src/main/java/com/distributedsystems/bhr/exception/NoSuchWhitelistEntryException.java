package com.distributedsystems.bhr.exception;

public class NoSuchWhitelistEntryException extends BhrException {

    public NoSuchWhitelistEntryException(long entryId) {
        super("no_such_whitelist_entry", "No whitelist entry with id " + entryId);
    }
}
