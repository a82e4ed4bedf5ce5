package com.jz.gateway.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.gateway.domain.entity.AgentProfile;
import com.jz.gateway.mapper.AgentProfileMapper;
import com.jz.gateway.service.AgentProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AgentProfileServiceImpl
        extends ServiceImpl<AgentProfileMapper, AgentProfile>
        implements AgentProfileService {

    private final CacheManager cacheManager;

    private static final String AGENTS = "agents";

    private Cache agentsCache() {
        return cacheManager.getCache(AGENTS);
    }

    /** 默认 agent（缓存 key='default'），sync=true 防击穿 */
    @Override
    @Cacheable(cacheNames = AGENTS, key = "'default'", sync = true)
    public AgentProfile getDefaultAgent() {
        AgentProfile a = this.lambdaQuery()
                .eq(AgentProfile::getIsDefault, 1)
                .last("limit 1")
                .one();
        if (a == null) {
            throw new IllegalStateException("no default agent, agent_profile is not initialized");
        }
        return a;
    }

    @Override
    @Cacheable(cacheNames = AGENTS, key = "'id:' + #id", sync = true, unless = "#result == null")
    public AgentProfile getByIdCached(Long id) {
        return getById(id);
    }

    @Override
    @Transactional
    @CachePut(cacheNames = AGENTS, key = "'id:' + #result.id", unless = "#result == null")
    public AgentProfile updateAgent(AgentProfile incoming) {
        updateById(incoming);
        AgentProfile fresh = getById(incoming.getId());
        if (fresh != null && Integer.valueOf(1).equals(fresh.getIsDefault())) {
            agentsCache().evict("default");
        }
        return fresh;
    }

    @Override
    public void recordServed(Long id, long elapsedMs) {
        if (id == null) return;
        long ms = Math.max(0, elapsedMs);
        // 同一条 UPDATE 内完成，MySQL 按书写顺序求值：先算平均再自增
        boolean ok = this.lambdaUpdate()
                .eq(AgentProfile::getId, id)
                .setSql("average_response_time = (average_response_time * prompt_served + " + ms + ") / (prompt_served + 1)")
                .setSql("prompt_served = prompt_served + 1")
                .update();
        if (!ok) {
            log.warn("[Agent] recordServed matched no row for agent {}", id);
        }
    }
}
