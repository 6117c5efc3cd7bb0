package com.scoutim.domain.controller;

import com.scoutim.auth.web.AuthContext;
import com.scoutim.common.api.ApiCodes;
import com.scoutim.common.api.Result;
import com.scoutim.domain.dto.MessageDto;
import com.scoutim.domain.dto.OpenDmRequest;
import com.scoutim.domain.dto.SendMessageRequest;
import com.scoutim.domain.dto.ThreadDetailDto;
import com.scoutim.domain.dto.ThreadSummaryDto;
import com.scoutim.domain.enums.ThreadKind;
import com.scoutim.domain.service.ChatMessageAppService;
import com.scoutim.domain.service.ConversationStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 私信：用户之间的一对一会话。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/dm")
public class DmController {

    private final ConversationStore conversationStore;
    private final ChatMessageAppService chatMessageAppService;

    @GetMapping
    public Result<List<ThreadSummaryDto>> list() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(conversationStore.listThreadsFor(userId, ThreadKind.DIRECT));
    }

    @PostMapping
    public Result<ThreadDetailDto> open(@Valid @RequestBody OpenDmRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.openDirectThread(userId, req.getRecipientUsername()));
    }

    @GetMapping("/{threadId}")
    public Result<ThreadDetailDto> detail(@PathVariable("threadId") Long threadId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.threadDetail(threadId, userId, ThreadKind.DIRECT));
    }

    @PostMapping("/{threadId}/messages")
    public Result<MessageDto> send(@PathVariable("threadId") Long threadId,
                                   @Valid @RequestBody SendMessageRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.send(threadId, userId, req.getBody(), ThreadKind.DIRECT));
    }
}
