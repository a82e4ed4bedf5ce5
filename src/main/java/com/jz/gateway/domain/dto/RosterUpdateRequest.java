package com.jz.gateway.domain.dto;

import lombok.Data;

@Data
public class RosterUpdateRequest {
    private String participantId;
    private String chatId;
    /** 仅 admin 接口使用 */
    private boolean admin;
}
