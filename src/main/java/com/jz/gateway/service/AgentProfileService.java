package com.jz.gateway.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.jz.gateway.domain.entity.AgentProfile;

public interface AgentProfileService extends IService<AgentProfile> {
    AgentProfile getDefaultAgent();
    AgentProfile getByIdCached(Long id);

    AgentProfile updateAgent(AgentProfile incoming);

    /** 成功生成一次回复后：promptServed + 1，并更新平均响应时间 */
    void recordServed(Long id, long elapsedMs);
}
