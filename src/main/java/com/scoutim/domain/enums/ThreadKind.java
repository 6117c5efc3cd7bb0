package com.scoutim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 会话类型（对应表字段：t_thread.kind）。
 *
 * <ul>
 *   <li>1 = 私信（DIRECT）：两个用户之间，无主题，subject_id = 0</li>
 *   <li>2 = 主题会话（SUBJECT）：围绕某个主题对象（如一名球员）由 owner 与对方发起</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ThreadKind {

    DIRECT(1, "direct"),

    SUBJECT(2, "subject");

    @EnumValue
    private final Integer code;

    private final String desc;
}
