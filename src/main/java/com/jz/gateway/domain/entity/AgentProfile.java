package com.jz.gateway.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("agent_profile")
public class AgentProfile {
    @TableId(type = IdType.AUTO)
    private Long id;

    private String code;
    private String name;
    private String role;
    private String description;
    /** 附加行为要求，拼进 system prompt */
    private String instructions;

    @TableField("system_prompt")
    private String systemPrompt;

    /** 为空时用 chat.generation.default-model */
    private String model;

    /** 群聊里是否对该 agent 收到的消息做审核 */
    private Integer moderationEnabled;
    private Integer isDefault;

    private Long promptServed;
    /** 毫秒，滑动平均 */
    private Long averageResponseTime;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean moderates() {
        return Integer.valueOf(1).equals(moderationEnabled);
    }

    public String agentKey() {
        return String.valueOf(id);
    }
}
