package me.golemcore.warden.domain.model;

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

/**
 * Caller context for a gate decision.
 *
 * @param sessionId
 *            session the call belongs to, used for the decision log
 * @param subAgent
 *            whether the session was spawned by another agent
 */
public record GateContext(String sessionId, boolean subAgent) {

    public static GateContext topLevel(String sessionId) {
        return new GateContext(sessionId, false);
    }

    public static GateContext subAgent(String sessionId) {
        return new GateContext(sessionId, true);
    }
}
