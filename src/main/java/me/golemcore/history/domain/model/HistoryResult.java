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

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of query results. {@code total} is the filtered count before
 * pagination was applied.
 */
@Data
@AllArgsConstructor
public class HistoryResult {

    private List<HistoryRecord> records;
    private int total;

    public static HistoryResult empty() {
        return new HistoryResult(List.of(), 0);
    }
}
