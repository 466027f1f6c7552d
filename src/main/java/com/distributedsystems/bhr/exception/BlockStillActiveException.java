package com.distributedsystems.bhr.exception;

public class BlockStillActiveException extends BhrException {

    public BlockStillActiveException(long blockId, String cidr) {
        super("block_still_active", "Block " + blockId + " for " + cidr + " is still active");
    }
}
