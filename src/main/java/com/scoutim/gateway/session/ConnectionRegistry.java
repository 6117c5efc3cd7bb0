package com.scoutim.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 本进程的 userId -> 连接集合。
 *
 * <p>一个用户可以同时有多条连接（多个标签页/设备）。连接断开时同步移除，集合为空则删除该用户的条目。</p>
 *
 * <p>锁只在修改与取快照时持有，网络写出在锁外进行。进程重启后表为空，由客户端重连重建。</p>
 */
@Slf4j
@Component
public class ConnectionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Set<Channel>> connections = new HashMap<>();

    public void register(long userId, Channel ch) {
        Objects.requireNonNull(ch, "channel");
        ch.attr(ATTR_USER_ID).set(userId);
        int size;
        lock.lock();
        try {
            Set<Channel> set = connections.computeIfAbsent(userId, k -> new LinkedHashSet<>());
            set.add(ch);
            size = set.size();
        } finally {
            lock.unlock();
        }
        log.debug("connection registered: userId={}, channel={}, userConnections={}", userId, ch.id().asShortText(), size);
    }

    /**
     * @return 是否确实移除了该连接
     */
    public boolean unregister(long userId, Channel ch) {
        if (ch == null) {
            return false;
        }
        boolean removed;
        lock.lock();
        try {
            Set<Channel> set = connections.get(userId);
            if (set == null) {
                return false;
            }
            removed = set.remove(ch);
            if (set.isEmpty()) {
                connections.remove(userId);
            }
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.debug("connection unregistered: userId={}, channel={}", userId, ch.id().asShortText());
        }
        return removed;
    }

    /**
     * 按 channel 上绑定的 userId 移除；未绑定用户的连接直接返回 false。
     */
    public boolean unregister(Channel ch) {
        if (ch == null) {
            return false;
        }
        Long userId = ch.attr(ATTR_USER_ID).get();
        if (userId == null) {
            return false;
        }
        return unregister(userId, ch);
    }

    public Long userIdOf(Channel ch) {
        return ch == null ? null : ch.attr(ATTR_USER_ID).get();
    }

    /**
     * 当前连接的快照；调用方遍历时不持锁。
     */
    public List<Channel> handlesFor(long userId) {
        lock.lock();
        try {
            Set<Channel> set = connections.get(userId);
            if (set == null || set.isEmpty()) {
                return List.of();
            }
            return new ArrayList<>(set);
        } finally {
            lock.unlock();
        }
    }

    public boolean isOnline(long userId) {
        lock.lock();
        try {
            Set<Channel> set = connections.get(userId);
            return set != null && !set.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public Set<Long> onlineUserIds() {
        lock.lock();
        try {
            return new HashSet<>(connections.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            int n = 0;
            for (Set<Channel> set : connections.values()) {
                n += set.size();
            }
            return n;
        } finally {
            lock.unlock();
        }
    }
}
