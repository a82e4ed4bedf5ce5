package com.jz.gateway.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.gateway.domain.entity.ModerationEvent;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ModerationEventMapper extends BaseMapper<ModerationEvent> {}
