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
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation with its input arguments and, once finished, its output.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class ToolCallRecord extends HistoryRecord {

    @JsonProperty("tool_name")
    private String toolName;

    @JsonProperty("tool_input")
    @Builder.Default
    private Map<String, Object> toolInput = new LinkedHashMap<>();

    @JsonProperty("tool_output")
    private Map<String, Object> toolOutput; // null while the tool has not returned

    @Override
    public RecordType getRecordType() {
        return RecordType.TOOL_CALL;
    }

    @Override
    public void validate() {
        super.validate();
        requireNonBlank(toolName, "tool_name");
    }

    @Override
    public void applyDefaults() {
        super.applyDefaults();
        if (toolName == null) {
            toolName = "";
        }
        if (toolInput == null) {
            toolInput = new LinkedHashMap<>();
        }
    }
}
