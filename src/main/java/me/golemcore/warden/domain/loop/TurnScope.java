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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Tracks the model stream and tool executions in flight for one turn so a
 * limit or an explicit cancel can stop all of them at once.
 */
public class TurnScope {

    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public <F extends Future<?>> F track(F future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
        return future;
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }

    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
