package com.scoutim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.scoutim.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
