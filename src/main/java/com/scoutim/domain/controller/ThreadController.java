package com.scoutim.domain.controller;

import com.scoutim.auth.web.AuthContext;
import com.scoutim.common.api.ApiCodes;
import com.scoutim.common.api.Result;
import com.scoutim.domain.dto.MessageDto;
import com.scoutim.domain.dto.OpenSubjectThreadRequest;
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
import java.util.Locale;

@RequiredArgsConstructor
@RestController
@RequestMapping("/threads")
public class ThreadController {

    private final ConversationStore conversationStore;
    private final ChatMessageAppService chatMessageAppService;

    public record UnreadTotalDto(long unreadCount) {
    }

    public record ReadResultDto(int markedRead) {
    }

    /**
     * @param kind 可选：direct / subject；不传返回全部
     */
    @GetMapping
    public Result<List<ThreadSummaryDto>> list(@RequestParam(required = false) String kind) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        ThreadKind k = null;
        if (kind != null && !kind.isBlank()) {
            try {
                k = ThreadKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return Result.fail(ApiCodes.BAD_REQUEST, "invalid_kind");
            }
        }
        return Result.ok(conversationStore.listThreadsFor(userId, k));
    }

    @GetMapping("/unread")
    public Result<UnreadTotalDto> unread() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(new UnreadTotalDto(conversationStore.totalUnread(userId)));
    }

    @PostMapping("/subject/{subjectId}")
    public Result<ThreadDetailDto> openSubject(@PathVariable("subjectId") Long subjectId,
                                               @Valid @RequestBody OpenSubjectThreadRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.openSubjectThread(subjectId, req.getOwnerId(), userId));
    }

    @GetMapping("/{threadId}")
    public Result<ThreadDetailDto> detail(@PathVariable("threadId") Long threadId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.threadDetail(threadId, userId));
    }

    @PostMapping("/{threadId}/messages")
    public Result<MessageDto> send(@PathVariable("threadId") Long threadId,
                                   @Valid @RequestBody SendMessageRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(chatMessageAppService.send(threadId, userId, req.getBody()));
    }

    @PostMapping("/{threadId}/read")
    public Result<ReadResultDto> read(@PathVariable("threadId") Long threadId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(new ReadResultDto(conversationStore.markRead(threadId, userId)));
    }

    @PostMapping("/{threadId}/deactivate")
    public Result<Void> deactivate(@PathVariable("threadId") Long threadId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        conversationStore.deactivateThread(threadId, userId);
        return Result.okVoid();
    }
}
