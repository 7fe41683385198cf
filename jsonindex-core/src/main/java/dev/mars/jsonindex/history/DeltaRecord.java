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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One entry of the changelog, emitted once per classified incoming item.
 * <p>
 * Rendered by {@link #toJson} as
 * <pre>
 * { "id": &lt;key&gt;, "type": "add",    "item": &lt;object&gt; }
 * { "id": &lt;key&gt;, "type": "change", "item": &lt;old object&gt;, "delta": &lt;patch&gt; }
 * </pre>
 */
public interface DeltaRecord {

    /** Key of the entity this record describes. */
    String id();

    /** The item carried by the record: the new item for an add, the previous one for a change. */
    JsonNode item();

    /** Record type as written to the changelog. */
    String type();

    /**
     * Renders this record as a JSON object.
     */
    default ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id());
        node.put("type", type());
        node.set("item", item());
        if (this instanceof Change) {
            node.set("delta", ((Change) this).delta());
        }
        return node;
    }

    /**
     * A key that was not in the index.
     *
     * @param id   the key
     * @param item the new item
     */
    record Add(String id, JsonNode item) implements DeltaRecord {
        public Add {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(item, "item");
        }

        @Override
        public String type() {
            return "add";
        }
    }

    /**
     * A known key whose item changed. Applying {@code delta} to {@code item}
     * yields the new value, so history can be replayed forward.
     *
     * @param id    the key
     * @param item  the previous latest value
     * @param delta patch turning {@code item} into the new value
     */
    record Change(String id, JsonNode item, JsonNode delta) implements DeltaRecord {
        public Change {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(item, "item");
            Objects.requireNonNull(delta, "delta");
        }

        @Override
        public String type() {
            return "change";
        }
    }
}
