package com.scoutim.common.cron;

import com.scoutim.domain.config.ReminderProperties;
import com.scoutim.domain.service.UnreadReminderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定时触发未读提醒扫描（fixed delay：上一轮结束后才开始计时，不会重叠）。
 *
 * <p>默认开启；im.reminder.enabled=false 时不创建。</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "im.reminder.enabled", havingValue = "true", matchIfMissing = true)
public class UnreadReminderCron implements SmartLifecycle {

    private final UnreadReminderService reminderService;
    private final ReminderProperties props;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public UnreadReminderCron(UnreadReminderService reminderService, ReminderProperties props) {
        this.reminderService = reminderService;
        this.props = props;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "unread-reminder-cron");
            t.setDaemon(true);
            return t;
        });
        long initialDelaySec = props.initialDelaySecondsEffective();
        long intervalSec = TimeUnit.MINUTES.toSeconds(props.intervalMinutesEffective());
        scheduler.scheduleWithFixedDelay(this::tick, initialDelaySec, intervalSec, TimeUnit.SECONDS);
        running = true;
        log.info("unread reminder cron started: initialDelaySec={}, intervalMin={}",
                initialDelaySec, props.intervalMinutesEffective());
    }

    void tick() {
        try {
            reminderService.runOnce();
        } catch (Exception e) {
            // 抛出会让 ScheduledExecutorService 取消后续执行
            log.error("unread reminder run failed", e);
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        log.info("unread reminder cron stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
