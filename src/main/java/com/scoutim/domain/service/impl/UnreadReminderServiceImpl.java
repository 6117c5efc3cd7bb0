package com.scoutim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.scoutim.common.mail.MailNotifier;
import com.scoutim.domain.config.ReminderProperties;
import com.scoutim.domain.dto.ReminderRunStats;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.mapper.UserMapper;
import com.scoutim.domain.service.ConversationStore;
import com.scoutim.domain.service.UnreadReminderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Service
public class UnreadReminderServiceImpl implements UnreadReminderService {

    private final UserMapper userMapper;
    private final ConversationStore conversationStore;
    private final MailNotifier mailNotifier;
    private final ReminderProperties props;
    private final Executor reminderExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public UnreadReminderServiceImpl(UserMapper userMapper,
                                     ConversationStore conversationStore,
                                     MailNotifier mailNotifier,
                                     ReminderProperties props,
                                     @Qualifier("imReminderExecutor") Executor reminderExecutor,
                                     Clock clock) {
        this.userMapper = userMapper;
        this.conversationStore = conversationStore;
        this.mailNotifier = mailNotifier;
        this.props = props;
        this.reminderExecutor = reminderExecutor;
        this.clock = clock;
    }

    @Override
    public ReminderRunStats runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.info("unread reminder run skipped: previous run still in progress");
            return new ReminderRunStats(true, 0, 0, 0, 0, 0);
        }
        try {
            return doRun();
        } finally {
            running.set(false);
        }
    }

    private ReminderRunStats doRun() {
        if (!mailNotifier.isConfigured()) {
            log.warn("unread reminder run skipped: mail notifier not configured");
            return ReminderRunStats.notConfigured();
        }

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        List<UserEntity> users = userMapper.selectList(new LambdaQueryWrapper<UserEntity>()
                .eq(UserEntity::getUnreadReminderEnabled, true)
                .eq(UserEntity::getEmailVerified, true)
                .isNotNull(UserEntity::getEmail)
                .ne(UserEntity::getEmail, ""));

        int sent = 0;
        int skippedCooldown = 0;
        int skippedNoUnread = 0;
        int failed = 0;
        for (UserEntity user : users) {
            if (inCooldown(user, now)) {
                skippedCooldown++;
                continue;
            }
            LocalDateTime cutoff = now.minusMinutes(user.reminderDelayMinEffective());
            long unread = conversationStore.countUnreadOlderThan(user.getId(), cutoff);
            if (unread <= 0) {
                skippedNoUnread++;
                continue;
            }
            SendOutcome outcome = sendWithTimeout(user, unread);
            if (outcome == SendOutcome.FAILED) {
                failed++;
                continue;
            }
            // 超时的发送可能仍会送达，同样记录冷却时间
            UserEntity patch = new UserEntity();
            patch.setId(user.getId());
            patch.setLastUnreadReminderSentAt(now);
            userMapper.updateById(patch);
            if (outcome == SendOutcome.SENT) {
                sent++;
            } else {
                failed++;
            }
        }

        ReminderRunStats stats = new ReminderRunStats(true, users.size(), sent, skippedCooldown, skippedNoUnread, failed);
        log.info("unread reminder run finished: candidates={}, sent={}, cooldown={}, noUnread={}, failed={}",
                stats.candidates(), stats.sent(), stats.skippedCooldown(), stats.skippedNoUnread(), stats.failed());
        return stats;
    }

    private boolean inCooldown(UserEntity user, LocalDateTime now) {
        LocalDateTime last = user.getLastUnreadReminderSentAt();
        if (last == null) {
            return false;
        }
        return last.isAfter(now.minusHours(props.cooldownHoursEffective()));
    }

    private SendOutcome sendWithTimeout(UserEntity user, long unread) {
        String subject = subject(unread);
        String text = textBody(user, unread);
        String html = htmlBody(user, unread);

        FutureTask<Void> task = new FutureTask<>(() -> {
            mailNotifier.send(user.getEmail(), subject, text, html);
            return null;
        });
        try {
            reminderExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("unread reminder rejected: userId={}, err={}", user.getId(), e.toString());
            return SendOutcome.FAILED;
        }

        long timeoutMs = props.sendTimeoutMsEffective();
        try {
            task.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("unread reminder sent: userId={}, unread={}", user.getId(), unread);
            return SendOutcome.SENT;
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("unread reminder timed out, cooldown recorded: userId={}, timeoutMs={}", user.getId(), timeoutMs);
            return SendOutcome.TIMED_OUT;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("unread reminder failed: userId={}, err={}", user.getId(), cause.toString());
            return SendOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            log.warn("unread reminder interrupted: userId={}", user.getId());
            return SendOutcome.TIMED_OUT;
        }
    }

    /**
     * TIMED_OUT：等待超时或被中断，邮件是否已被服务商接收未知。
     */
    enum SendOutcome {
        SENT,
        TIMED_OUT,
        FAILED
    }

    static String subject(long unread) {
        return unread == 1
                ? "You have 1 unread message on BB Scout"
                : "You have " + unread + " unread messages on BB Scout";
    }

    private String textBody(UserEntity user, long unread) {
        String name = user.displayName() == null ? "" : " " + user.displayName();
        return "Hi" + name + ",\n\n"
                + "You have " + unread + " unread message" + (unread == 1 ? "" : "s") + " waiting for you.\n"
                + "Open BB Scout to read them: " + props.webAppUrlEffective() + "\n\n"
                + "You can turn these reminders off in your settings.";
    }

    private String htmlBody(UserEntity user, long unread) {
        String name = user.displayName() == null ? "" : " " + escapeHtml(user.displayName());
        return "<div style=\"font-family: Arial, sans-serif; padding:16px; color:#111827;\">"
                + "<p style=\"margin:0 0 12px;\">Hi" + name + ",</p>"
                + "<p style=\"margin:0 0 16px;\">You have <b>" + unread + "</b> unread message"
                + (unread == 1 ? "" : "s") + " waiting for you.</p>"
                + "<p style=\"margin:0 0 16px;\">"
                + "<a href=\"" + escapeHtml(props.webAppUrlEffective()) + "\" style=\"background:#2563eb;color:#ffffff;"
                + "text-decoration:none;padding:10px 16px;border-radius:6px;display:inline-block;\">Open BB Scout</a>"
                + "</p>"
                + "<p style=\"margin:0;color:#6b7280;font-size:12px;\">You can turn these reminders off in your settings.</p>"
                + "</div>";
    }

    private static String escapeHtml(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
