/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.jsonindex.history;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Computes a patch that turns one value into another.
 */
@FunctionalInterface
public interface StructuralDiff {

    /**
     * @param from the previous value
     * @param to   the new value
     * @return a patch that, applied to {@code from}, reproduces {@code to}
     * @throws DiffException if the diff cannot be computed
     */
    JsonNode diff(JsonNode from, JsonNode to);
}
