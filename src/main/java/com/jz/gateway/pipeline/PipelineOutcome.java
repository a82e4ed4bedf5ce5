package com.jz.gateway.pipeline;

public enum PipelineOutcome {
    /** 重复投递，直接丢弃，不回复 */
    SUPPRESSED_DUPLICATE,
    /** 审核命中，发出了处罚通知 */
    SANCTIONED,
    REPLIED,
    /** 超时 / 出错，回了一条致歉 */
    APOLOGIZED,
    /** 群里没叫到 agent 的普通消息，审核通过后不回复 */
    OBSERVED
}
