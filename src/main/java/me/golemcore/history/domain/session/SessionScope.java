package me.golemcore.history.domain.session;

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
 * Handle returned by {@link SessionContext#scope(String)}. Closing it restores
 * whatever session was current when the scope was opened. Closing twice is a
 * no-op.
 */
public final class SessionScope implements AutoCloseable {

    private final String sessionId;
    private boolean closed;

    SessionScope(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        SessionContext.clearCurrent();
    }
}
