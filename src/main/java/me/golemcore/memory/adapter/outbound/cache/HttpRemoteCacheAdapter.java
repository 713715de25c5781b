package me.golemcore.memory.adapter.outbound.cache;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.RemoteCachePort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Remote cache adapter speaking the Webdis HTTP protocol (Redis commands as
 * URL path segments, JSON replies).
 *
 * <p>
 * Commands used:
 * <ul>
 * <li>GET /GET/{key} - read a value ({@code {"GET": value|null}})
 * <li>PUT /SETEX/{key}/{ttl} - write a value with expiry, value in the body
 * <li>GET /DEL/{key} - delete a key
 * <li>GET /KEYS/{pattern} - list keys for prefix invalidation
 * </ul>
 *
 * <p>
 * The cache is a soft dependency. Any HTTP error, timeout or malformed reply
 * is logged at debug level and reported as a miss; callers keep working with
 * the in-process tier only.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.cache.remote.enabled} - enable the remote tier
 * <li>{@code memory.cache.remote.url} - Webdis base URL
 * <li>{@code memory.cache.remote.key-prefix} - prefix for every key
 * <li>{@code memory.cache.remote.timeout-millis} - per-call timeout
 * </ul>
 */
@Component
@Slf4j
public class HttpRemoteCacheAdapter implements RemoteCachePort {

    private static final MediaType TEXT = MediaType.get("text/plain; charset=utf-8");

    private final MemoryProperties.RemoteCacheProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRemoteCacheAdapter(MemoryProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.config = properties.getCache().getRemote();
        this.objectMapper = objectMapper;
        long timeout = config.getTimeoutMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeout, TimeUnit.MILLISECONDS)
                .readTimeout(timeout, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode reply = execute(new Request.Builder().url(commandUrl("GET", prefixed(key))).get().build());
                JsonNode value = reply != null ? reply.get("GET") : null;
                if (value == null || value.isNull()) {
                    return Optional.empty();
                }
                return Optional.of(value.asText());
            } catch (IOException e) {
                log.debug("[RemoteCache] GET failed for {}: {}", key, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public CompletableFuture<Void> set(String key, String value, Duration ttl) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            long seconds = Math.max(1, ttl.toSeconds());
            try {
                execute(new Request.Builder()
                        .url(commandUrl("SETEX", prefixed(key), String.valueOf(seconds)))
                        .put(RequestBody.create(value, TEXT))
                        .build());
            } catch (IOException e) {
                log.debug("[RemoteCache] SETEX failed for {}: {}", key, e.getMessage());
            }
        });
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> deleteQuietly(prefixed(key)));
    }

    @Override
    public CompletableFuture<Void> deleteByPrefix(String prefix) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            List<String> keys = new ArrayList<>();
            try {
                JsonNode reply = execute(new Request.Builder()
                        .url(commandUrl("KEYS", prefixed(prefix) + "*"))
                        .get()
                        .build());
                JsonNode listed = reply != null ? reply.get("KEYS") : null;
                if (listed != null && listed.isArray()) {
                    listed.forEach(node -> keys.add(node.asText()));
                }
            } catch (IOException e) {
                log.debug("[RemoteCache] KEYS failed for {}: {}", prefix, e.getMessage());
                return;
            }
            keys.forEach(this::deleteQuietly);
        });
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled();
    }

    private void deleteQuietly(String fullKey) {
        try {
            execute(new Request.Builder().url(commandUrl("DEL", fullKey)).get().build());
        } catch (IOException e) {
            log.debug("[RemoteCache] DEL failed for {}: {}", fullKey, e.getMessage());
        }
    }

    private JsonNode execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code());
            }
            String text = body.string();
            return text.isBlank() ? null : objectMapper.readTree(text);
        }
    }

    private HttpUrl commandUrl(String command, String... args) {
        HttpUrl base = HttpUrl.parse(config.getUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid remote cache URL: " + config.getUrl());
        }
        HttpUrl.Builder builder = base.newBuilder().addPathSegment(command);
        for (String arg : args) {
            builder.addPathSegment(arg);
        }
        return builder.build();
    }

    private String prefixed(String key) {
        String prefix = config.getKeyPrefix();
        return prefix == null || prefix.isBlank() ? key : prefix + ":" + key;
    }
}
