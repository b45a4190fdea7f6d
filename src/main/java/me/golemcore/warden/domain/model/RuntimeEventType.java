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
 * Runtime events published on the event stream.
 */
public enum RuntimeEventType {
    RUN_STARTED, RUN_RESUMED,
    TURN_STARTED, TURN_COMPLETED, TURN_FAILED,
    USAGE_UPDATED,
    TOOL_CALL_DECIDED, TOOL_STARTED, TOOL_FINISHED,
    APPROVAL_REQUESTED, APPROVAL_RESOLVED,
    WATCHDOG_HINT,
    VERDICT,
    CHECKPOINT_SAVED,
    RUN_COMPLETED, RUN_FAILED, RUN_CANCELLED
}
