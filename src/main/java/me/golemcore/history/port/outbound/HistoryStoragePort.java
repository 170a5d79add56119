package me.golemcore.history.port.outbound;

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

import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.StorageInfo;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Port for durable, append-only persistence of history records. The adapter
 * exclusively owns the on-disk representation; every other component reads and
 * writes through this port.
 *
 * <p>
 * None of the operations throw on I/O or data errors: writes report failure
 * through their return value and reads skip what they cannot parse.
 */
public interface HistoryStoragePort {

    /**
     * Append one record to its session's log.
     *
     * @return {@code false} if the record was invalid or could not be written
     */
    boolean store(HistoryRecord record);

    /**
     * Read every parseable line of a session across all partitions, in file
     * order. A missing session yields an empty list.
     */
    List<Map<String, Object>> readAll(String sessionId);

    /**
     * Remove every record older than {@code cutoff} from all session logs. Lines
     * whose timestamp cannot be parsed are kept; files left empty are deleted.
     *
     * @return total number of removed lines
     */
    int cleanup(Instant cutoff);

    /**
     * Count records older than {@code cutoff} without modifying anything.
     */
    int countOlderThan(Instant cutoff);

    /**
     * Distinct ids of all sessions that have at least one log file, sorted.
     */
    List<String> listSessions();

    StorageInfo getStorageInfo();
}
