package com.distributedsystems.bhr.exception;

public class NoSuchBlockException extends BhrException {

    public NoSuchBlockException(long blockId) {
        super("no_such_block", "No block with id " + blockId);
    }

    public NoSuchBlockException(String cidr) {
        super("no_such_block", "No block has ever been created for " + cidr);
    }
}
