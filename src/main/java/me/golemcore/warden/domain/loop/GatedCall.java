package me.golemcore.warden.domain.loop;

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

import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.ToolCall;

/**
 * A proposed call paired with the gate's decision on it.
 */
public record GatedCall(ToolCall call, SecurityDecision decision) {

    public String id() {
        return call.getId();
    }
}
