package me.golemcore.conductor.domain.service;


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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.RuntimeEvent;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.TurnContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emits and stores runtime events for the current turn.
 */
@Service
@Slf4j
public class RuntimeEventService {

    private final Clock clock;

    public RuntimeEventService(Clock clock) {
        this.clock = clock;
    }

    public RuntimeEvent emit(TurnContext context, RuntimeEventType type, Map<String, Object> payload) {
        TurnContext safeContext = Objects.requireNonNull(context, "context must not be null");
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : Map.of();

        RuntimeEvent event = RuntimeEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .conversationId(safeContext.getConversationId())
                .payload(safePayload)
                .build();

        safeContext.getRuntimeEvents().add(event);
        log.debug("[Runtime] {} {}", type, safePayload);
        return event;
    }
}
