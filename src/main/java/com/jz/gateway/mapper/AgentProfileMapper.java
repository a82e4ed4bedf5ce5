package com.jz.gateway.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.gateway.domain.entity.AgentProfile;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AgentProfileMapper extends BaseMapper<AgentProfile> {}
