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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a retention cleanup run. In dry-run mode
 * {@code cleanedRecords} is the number of records that would have been
 * removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResult {

    @JsonProperty("cleaned_records")
    private int cleanedRecords;

    @JsonProperty("cutoff_date")
    private Instant cutoffDate;

    @JsonProperty("dry_run")
    private boolean dryRun;
}
