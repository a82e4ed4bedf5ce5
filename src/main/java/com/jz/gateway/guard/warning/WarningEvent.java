package com.jz.gateway.guard.warning;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WarningEvent {
    private String reason;
    private long ts;          // epoch millis
    private String issuerId;  // 发出警告的 agent
}
