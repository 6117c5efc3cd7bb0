package com.scoutim.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.scoutim.**.mapper")
public class MybatisPlusConfig {
}
