package me.golemcore.history.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

/**
 * Filter and pagination parameters for {@code HistoryManager#query}. All
 * filters combine with logical AND; time bounds are inclusive. A null
 * {@code limit}/{@code offset} disables that side of pagination.
 */
@Data
@Builder
public class HistoryQuery {

    private String sessionId;
    private Instant startTime;
    private Instant endTime;
    private Set<RecordType> recordTypes;
    private Integer limit;
    private Integer offset;

    public static HistoryQuery forSession(String sessionId) {
        return HistoryQuery.builder().sessionId(sessionId).build();
    }
}
