package com.radar.lendcommon.dto;

import lombok.Data;

@Data
public class LiquidateRequest {

    /** 被清算账户的所有者 */
    private Long ownerId;

    private Long loanId;
}
