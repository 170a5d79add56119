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

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * ThreadLocal stack of session ids giving telemetry call sites an ambient
 * session without explicit parameter passing.
 *
 * <p>
 * The stack, not a single slot, is the source of truth: {@link #scope(String)}
 * pushes on entry and pops on close, so the session that was current before a
 * nested scope becomes current again after it. Each thread sees its own stack.
 * Like any ThreadLocal, the value does not follow work handed to executors;
 * callers that hop threads must capture {@link #getCurrent()} and pass it on
 * explicitly.
 *
 * <p>
 * The current session is mirrored into the SLF4J MDC under
 * {@value #MDC_KEY}.
 */
public final class SessionContext {

    public static final String MDC_KEY = "sessionId";

    private static final ThreadLocal<Deque<String>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private SessionContext() {
    }

    public static void setCurrent(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        STACK.get().push(sessionId);
        MDC.put(MDC_KEY, sessionId);
    }

    public static Optional<String> getCurrent() {
        return Optional.ofNullable(STACK.get().peek());
    }

    /**
     * Pops the current session. The previous entry, if any, becomes current.
     */
    public static void clearCurrent() {
        Deque<String> stack = STACK.get();
        stack.poll();
        String previous = stack.peek();
        if (previous != null) {
            MDC.put(MDC_KEY, previous);
        } else {
            MDC.remove(MDC_KEY);
            STACK.remove();
        }
    }

    /**
     * Opens a scope with {@code sessionId} as current. Use with
     * try-with-resources so the scope is closed on error as well.
     */
    public static SessionScope scope(String sessionId) {
        setCurrent(sessionId);
        return new SessionScope(sessionId);
    }

    static int depth() {
        return STACK.get().size();
    }
}
