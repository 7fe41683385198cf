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

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an incoming item differs from what is already recorded for its key.
 * <p>
 * Supplied per entity type by the ingestion driver. A detector may also supply a
 * canonical ordering of same-key records; when present the records are sorted with
 * it before {@link #changed} is asked, and the last one after sorting is the value
 * a change is diffed against.
 */
@FunctionalInterface
public interface ChangeDetector {

    /**
     * @param existing records already known for the key, oldest first, never empty
     * @param item     the incoming item
     * @return true if {@code item} must be recorded as a change
     */
    boolean changed(List<JsonNode> existing, JsonNode item);

    /**
     * Canonical ordering of same-key records, if the entity has one.
     */
    default Optional<Comparator<JsonNode>> ordering() {
        return Optional.empty();
    }

    /**
     * Returns a detector with the same decision and the given ordering.
     */
    default ChangeDetector withOrdering(Comparator<JsonNode> ordering) {
        Objects.requireNonNull(ordering, "ordering");
        ChangeDetector self = this;
        return new ChangeDetector() {
            @Override
            public boolean changed(List<JsonNode> existing, JsonNode item) {
                return self.changed(existing, item);
            }

            @Override
            public Optional<Comparator<JsonNode>> ordering() {
                return Optional.of(ordering);
            }
        };
    }

    /**
     * Changed when the latest record is not structurally equal to the item.
     */
    static ChangeDetector byContent() {
        return (existing, item) -> !latest(existing).equals(item);
    }

    /**
     * Changed when the latest record and the item disagree on one field,
     * e.g. a modification timestamp. A field missing on both sides is equal.
     */
    static ChangeDetector byField(String field) {
        Objects.requireNonNull(field, "field");
        return (existing, item) -> !latest(existing).path(field).equals(item.path(field));
    }

    /**
     * Orders records by the text of one field, e.g. an ISO-8601 creation time.
     */
    static Comparator<JsonNode> orderingByField(String field) {
        Objects.requireNonNull(field, "field");
        return Comparator.comparing(node -> node.path(field).asText());
    }

    private static JsonNode latest(List<JsonNode> existing) {
        return existing.get(existing.size() - 1);
    }
}
