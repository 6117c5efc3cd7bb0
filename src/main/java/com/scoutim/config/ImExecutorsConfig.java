package com.scoutim.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({
        ImFanoutExecutorProperties.class,
        ImReminderExecutorProperties.class
})
public class ImExecutorsConfig {

    /**
     * 实时投递的发布线程：请求线程只负责入队，不等待 Redis。
     *
     * <p>单线程：同一进程内先提交的事件先发布，同一会话内的消息顺序因此与落库顺序一致。</p>
     */
    @Bean("imFanoutExecutor")
    public Executor imFanoutExecutor(ImFanoutExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("im-fanout-");
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props == null ? 10_000 : props.queueCapacityEffective());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(5);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * 未读提醒发送邮件用：每个用户一次调用，调用方带超时等待。
     */
    @Bean("imReminderExecutor")
    public Executor imReminderExecutor(ImReminderExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("im-reminder-");
        int core = props == null ? 2 : props.corePoolSizeEffective();
        int max = props == null ? 4 : props.maxPoolSizeEffective();
        if (max < core) {
            max = core;
        }
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(props == null ? 1_000 : props.queueCapacityEffective());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
