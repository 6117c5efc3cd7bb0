package com.scoutim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.scoutim.domain.entity.ThreadEntity;

public interface ThreadMapper extends BaseMapper<ThreadEntity> {
}
