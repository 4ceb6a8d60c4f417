package com.radar.lendcommon.dto;

import lombok.Data;

/**
 * 存入/提取抵押品
 */
@Data
public class AmountRequest {

    private Long amount;
}
