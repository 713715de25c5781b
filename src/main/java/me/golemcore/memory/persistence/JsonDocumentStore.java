package me.golemcore.memory.persistence;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.port.outbound.StoragePort;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * One durable JSON document of an owner ({@code diary.json},
 * {@code lore_books.json}, {@code knowledge_graph.json}, ...).
 *
 * <p>
 * Writes go through {@link StoragePort#putTextAtomic} so a crash never leaves
 * a half-written file. A document that fails to parse is renamed to
 * {@code <name>.corrupt-<yyyyMMdd-HHmmss>} and loading continues with the
 * empty value; a broken file never blocks startup.
 *
 * @param <T>
 *            document type
 */
@Slf4j
public class JsonDocumentStore<T> {

    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String fileName;
    private final TypeReference<T> type;
    private final Supplier<T> emptyValue;
    private final boolean backupOnWrite;
    private final Clock clock;

    public JsonDocumentStore(StoragePort storagePort, ObjectMapper objectMapper, String directory,
            String fileName, TypeReference<T> type, Supplier<T> emptyValue, boolean backupOnWrite, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.fileName = fileName;
        this.type = type;
        this.emptyValue = emptyValue;
        this.backupOnWrite = backupOnWrite;
        this.clock = clock;
    }

    /**
     * Read the document. Missing, blank and corrupt files yield the empty
     * value.
     */
    public T load() {
        String json;
        try {
            json = storagePort.getText(directory, fileName).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read " + directory + "/" + fileName, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return emptyValue.get();
        }
        try {
            T value = objectMapper.readValue(json, type);
            return value != null ? value : emptyValue.get();
        } catch (JsonProcessingException e) {
            quarantine(e);
            return emptyValue.get();
        }
    }

    /**
     * Replace the document atomically.
     */
    public void save(T value) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + fileName, e);
        }
        try {
            storagePort.putTextAtomic(directory, fileName, json, backupOnWrite).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to write " + directory + "/" + fileName, e.getCause());
        }
    }

    public String getFileName() {
        return fileName;
    }

    private void quarantine(JsonProcessingException cause) {
        String backupName = fileName + ".corrupt-" + BACKUP_SUFFIX.format(clock.instant());
        log.warn("[Persistence] {}/{} is corrupt ({}), moving it to {} and starting empty",
                directory, fileName, cause.getOriginalMessage(), backupName);
        try {
            storagePort.moveObject(directory, fileName, backupName).join();
        } catch (CompletionException e) {
            log.warn("[Persistence] Failed to back up corrupt file {}: {}", fileName, e.getMessage());
        }
    }
}
