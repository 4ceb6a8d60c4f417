package com.radar.lendcommon.dto;

import lombok.Data;

@Data
public class OriginateRequest {

    /** 借款数量（借出资产最小单位） */
    private Long debtAmount;

    /** LTV档位：20/25/33/50 */
    private Integer ltv;

    /** 同时存入的抵押品数量，可为空 */
    private Long depositAmount;
}
