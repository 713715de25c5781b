package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owner-keyed registry of memory engines.
 *
 * <p>
 * Contexts are created lazily on first access and live for the lifetime of the
 * application. A background thread periodically writes buffered state whose
 * threshold or interval has been reached (batched long-term writes, knowledge
 * usage counters, usage statistics); on shutdown everything still buffered is
 * written.
 *
 * @see OwnerContextFactory
 */
@Service
@Slf4j
public class MemoryEngineRegistry {

    private final OwnerContextFactory factory;
    private final MemoryProperties properties;
    private final Map<String, OwnerMemoryContext> contexts = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> flushTask;

    public MemoryEngineRegistry(OwnerContextFactory factory, MemoryProperties properties) {
        this.factory = factory;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        int tickSeconds = Math.max(1, properties.getTasks().getFlushTickSeconds());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-flush");
            t.setDaemon(true);
            return t;
        });
        flushTask = scheduler.scheduleAtFixedRate(this::flushDue, tickSeconds, tickSeconds, TimeUnit.SECONDS);
        log.info("[MemoryEngine] Flush scheduler started (every {}s)", tickSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (flushTask != null) {
            flushTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        contexts.values().forEach(OwnerMemoryContext::flushAll);
        log.info("[MemoryEngine] Flushed {} owner(s) on shutdown", contexts.size());
    }

    /**
     * Context of an owner, created on first use.
     *
     * @throws IllegalArgumentException
     *             if the owner id is null or blank
     */
    public OwnerMemoryContext get(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
        return contexts.computeIfAbsent(ownerId, factory::create);
    }

    public boolean isOpen(String ownerId) {
        return ownerId != null && contexts.containsKey(ownerId);
    }

    public List<String> ownerIds() {
        return List.copyOf(contexts.keySet());
    }

    void flushDue() {
        for (OwnerMemoryContext context : contexts.values()) {
            try {
                context.flushDue();
            } catch (RuntimeException e) {
                log.warn("[MemoryEngine] Periodic flush for {} failed: {}", context.getOwnerId(), e.getMessage());
            }
        }
    }
}
