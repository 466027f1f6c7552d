package com.distributedsystems.bhr.client;

import lombok.Data;

@Data
public class WhitelistRequestDTO {
    private String cidr;
    private String why;
}
