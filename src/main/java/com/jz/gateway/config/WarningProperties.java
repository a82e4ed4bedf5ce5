package com.jz.gateway.config;


import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "chat.warning")
public class WarningProperties {

    private String keyPrefix = "gw:warn:";

    /** 达到该警告数：临时禁言 */
    private int tempMuteThreshold = 3;

    /** 达到该警告数：踢出（封禁后延时解封） */
    private int kickThreshold = 4;

    /** 达到该警告数：封禁 */
    private int banThreshold = 5;

    /** 警告保留天数，过期的不计数 */
    private int expirationDays = 30;

    private Duration muteDuration = Duration.ofHours(1);

    /** 踢出时封禁到解封的间隔 */
    private long kickUnbanDelayMs = 5_000;

    public Duration retention() {
        return Duration.ofDays(expirationDays);
    }
}
