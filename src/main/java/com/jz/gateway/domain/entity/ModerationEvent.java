package com.jz.gateway.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/** 每次处罚尝试一行（含失败），只做留痕 */
@Data
@TableName("moderation_event")
public class ModerationEvent {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String participantId;
    private String chatId;

    /** warning_recorded / muted / kicked / banned / *_failed ... */
    private String action;

    private Integer warningCount;
    private String reason;
    private String issuerId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
