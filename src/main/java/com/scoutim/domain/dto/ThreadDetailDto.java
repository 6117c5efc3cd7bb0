package com.scoutim.domain.dto;

import com.scoutim.domain.enums.ThreadKind;
import lombok.Data;

import java.util.List;

@Data
public class ThreadDetailDto {

    private Long threadId;

    private ThreadKind kind;

    private Long subjectId;

    private Long ownerId;

    private Long counterpartId;

    private String counterpartName;

    private Boolean active;

    /** 本次打开时标记为已读的条数 */
    private Integer markedRead;

    /** 按创建时间升序 */
    private List<MessageDto> messages;
}
