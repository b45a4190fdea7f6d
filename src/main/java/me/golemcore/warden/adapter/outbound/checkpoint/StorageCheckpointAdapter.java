package me.golemcore.warden.adapter.outbound.checkpoint;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.port.outbound.CheckpointPort;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint persistence on top of the workspace storage. Each session has a
 * single {@code checkpoints/<id>.json} file replaced by an atomic rename, so a
 * crash mid-write leaves the previous checkpoint intact.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageCheckpointAdapter implements CheckpointPort {

    private static final String CHECKPOINTS_DIR = "checkpoints";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;

    @Override
    public void save(String sessionId, int turnIndex, String blob) {
        storagePort.putTextAtomic(CHECKPOINTS_DIR, fileName(sessionId), blob, false).join();
        log.debug("[Checkpoint] Stored checkpoint for session {} at turn {}", sessionId, turnIndex);
    }

    @Override
    public Optional<String> loadLatest(String sessionId) {
        return Optional.ofNullable(storagePort.getText(CHECKPOINTS_DIR, fileName(sessionId)).join());
    }

    @Override
    public void delete(String sessionId) {
        storagePort.deleteObject(CHECKPOINTS_DIR, fileName(sessionId)).join();
    }

    @Override
    public List<String> listSessionIds() {
        return storagePort.listObjects(CHECKPOINTS_DIR, "").join().stream()
                .filter(name -> name.endsWith(EXTENSION))
                .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                .toList();
    }

    private String fileName(String sessionId) {
        return sessionId + EXTENSION;
    }
}
