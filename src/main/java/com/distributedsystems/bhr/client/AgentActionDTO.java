package com.distributedsystems.bhr.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class AgentActionDTO {
    @JsonAlias({"agent", "agentId"})
    private String ident;
    /** Only read by the network-addressed endpoints. */
    private String cidr;
}
