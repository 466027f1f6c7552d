package com.distributedsystems.bhr.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class BlockRequestDTO {
    private String cidr;
    private String source;
    @JsonAlias("reason")
    private String why;
    /** Seconds; absent means the block never expires. */
    private Long duration;
    @JsonAlias("skip_whitelist")
    private boolean skipWhitelist;
}
