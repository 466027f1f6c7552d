package com.distributedsystems.bhr.client;

import lombok.Data;

@Data
public class WithdrawRequestDTO {
    private String why;
}
