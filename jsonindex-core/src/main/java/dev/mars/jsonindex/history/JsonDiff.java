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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Structural diff between two JSON values, expressed as an RFC 6902 JSON Patch.
 * <p>
 * The patch is an array of {@code add}, {@code remove} and {@code replace}
 * operations addressed by JSON Pointer:
 * <ul>
 *   <li>Objects are compared field by field; missing fields are removed, new ones added</li>
 *   <li>Arrays are compared index by index; extra target elements are added at the end,
 *       surplus source elements are removed from the highest index down</li>
 *   <li>Any other difference (scalars, type changes) is a {@code replace}</li>
 * </ul>
 * Equal values produce an empty patch. {@link #apply} replays a patch.
 */
public final class JsonDiff implements StructuralDiff {

    /** Shared stateless instance. */
    public static final JsonDiff INSTANCE = new JsonDiff();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final String OP_ADD = "add";
    private static final String OP_REMOVE = "remove";
    private static final String OP_REPLACE = "replace";
    private static final String OP_TEST = "test";

    @Override
    public ArrayNode diff(JsonNode from, JsonNode to) {
        return between(from, to);
    }

    /**
     * @return the patch turning {@code from} into {@code to}
     * @throws DiffException if either value is missing
     */
    public static ArrayNode between(JsonNode from, JsonNode to) {
        if (from == null || to == null) {
            throw new DiffException("Cannot diff a missing value");
        }
        ArrayNode ops = NODES.arrayNode();
        diff("", from, to, ops);
        return ops;
    }

    /**
     * Applies {@code patch} to a deep copy of {@code source}.
     *
     * @return the patched value; {@code source} is not modified
     * @throws DiffException if the patch is malformed or does not fit {@code source}
     */
    public static JsonNode apply(JsonNode source, JsonNode patch) {
        if (source == null) {
            throw new DiffException("Cannot patch a missing value");
        }
        if (patch == null || !patch.isArray()) {
            throw new DiffException("Patch must be an array of operations");
        }
        JsonNode result = source.deepCopy();
        for (JsonNode operation : patch) {
            String op = requiredText(operation, "op");
            List<String> path = parsePointer(requiredText(operation, "path"));
            switch (op) {
                case OP_ADD:
                    result = add(result, path, requiredValue(operation));
                    break;
                case OP_REMOVE:
                    remove(result, path);
                    break;
                case OP_REPLACE:
                    result = replace(result, path, requiredValue(operation));
                    break;
                case OP_TEST:
                    if (!resolve(result, path).equals(requiredValue(operation))) {
                        throw new DiffException("Test failed at " + operation.get("path").asText());
                    }
                    break;
                default:
                    throw new DiffException("Unsupported patch operation: " + op);
            }
        }
        return result;
    }

    // ========================================================================
    // Diff
    // ========================================================================

    private static void diff(String path, JsonNode from, JsonNode to, ArrayNode ops) {
        if (from.equals(to)) {
            return;
        }
        if (from.isObject() && to.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = from.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String child = path + "/" + escape(field.getKey());
                JsonNode target = to.get(field.getKey());
                if (target == null) {
                    ops.add(operation(OP_REMOVE, child, null));
                } else {
                    diff(child, field.getValue(), target, ops);
                }
            }
            Iterator<Map.Entry<String, JsonNode>> added = to.fields();
            while (added.hasNext()) {
                Map.Entry<String, JsonNode> field = added.next();
                if (!from.has(field.getKey())) {
                    ops.add(operation(OP_ADD, path + "/" + escape(field.getKey()), field.getValue()));
                }
            }
        } else if (from.isArray() && to.isArray()) {
            int common = Math.min(from.size(), to.size());
            for (int i = 0; i < common; i++) {
                diff(path + "/" + i, from.get(i), to.get(i), ops);
            }
            for (int i = common; i < to.size(); i++) {
                ops.add(operation(OP_ADD, path + "/" + i, to.get(i)));
            }
            for (int i = from.size() - 1; i >= common; i--) {
                ops.add(operation(OP_REMOVE, path + "/" + i, null));
            }
        } else {
            ops.add(operation(OP_REPLACE, path, to));
        }
    }

    private static ObjectNode operation(String op, String path, JsonNode value) {
        ObjectNode node = NODES.objectNode();
        node.put("op", op);
        node.put("path", path);
        if (value != null) {
            node.set("value", value.deepCopy());
        }
        return node;
    }

    static String escape(String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }

    // ========================================================================
    // Apply
    // ========================================================================

    private static JsonNode add(JsonNode root, List<String> path, JsonNode value) {
        if (path.isEmpty()) {
            return value.deepCopy();
        }
        JsonNode parent = resolve(root, path.subList(0, path.size() - 1));
        String last = path.get(path.size() - 1);
        if (parent.isObject()) {
            ((ObjectNode) parent).set(last, value.deepCopy());
        } else if (parent.isArray()) {
            ArrayNode array = (ArrayNode) parent;
            if ("-".equals(last)) {
                array.add(value.deepCopy());
            } else {
                int index = index(last, array.size());
                array.insert(index, value.deepCopy());
            }
        } else {
            throw new DiffException("Cannot add below a scalar at /" + String.join("/", path));
        }
        return root;
    }

    private static void remove(JsonNode root, List<String> path) {
        if (path.isEmpty()) {
            throw new DiffException("Cannot remove the root value");
        }
        JsonNode parent = resolve(root, path.subList(0, path.size() - 1));
        String last = path.get(path.size() - 1);
        if (parent.isObject()) {
            if (((ObjectNode) parent).remove(last) == null) {
                throw new DiffException("No field to remove at /" + String.join("/", path));
            }
        } else if (parent.isArray()) {
            ArrayNode array = (ArrayNode) parent;
            array.remove(index(last, array.size() - 1));
        } else {
            throw new DiffException("Cannot remove below a scalar at /" + String.join("/", path));
        }
    }

    private static JsonNode replace(JsonNode root, List<String> path, JsonNode value) {
        if (path.isEmpty()) {
            return value.deepCopy();
        }
        JsonNode parent = resolve(root, path.subList(0, path.size() - 1));
        String last = path.get(path.size() - 1);
        if (parent.isObject()) {
            if (!parent.has(last)) {
                throw new DiffException("No field to replace at /" + String.join("/", path));
            }
            ((ObjectNode) parent).set(last, value.deepCopy());
        } else if (parent.isArray()) {
            ArrayNode array = (ArrayNode) parent;
            array.set(index(last, array.size() - 1), value.deepCopy());
        } else {
            throw new DiffException("Cannot replace below a scalar at /" + String.join("/", path));
        }
        return root;
    }

    private static JsonNode resolve(JsonNode root, List<String> path) {
        JsonNode node = root;
        for (String token : path) {
            JsonNode next = null;
            if (node.isObject()) {
                next = node.get(token);
            } else if (node.isArray()) {
                next = node.get(index(token, node.size() - 1));
            }
            if (next == null) {
                throw new DiffException("Path not found: /" + String.join("/", path));
            }
            node = next;
        }
        return node;
    }

    private static int index(String token, int max) {
        int index;
        try {
            index = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new DiffException("Not an array index: " + token, e);
        }
        if (index < 0 || index > max) {
            throw new DiffException("Array index out of range: " + index);
        }
        return index;
    }

    static List<String> parsePointer(String pointer) {
        if (pointer.isEmpty()) {
            return Collections.emptyList();
        }
        if (pointer.charAt(0) != '/') {
            throw new DiffException("Invalid JSON pointer: " + pointer);
        }
        String[] raw = pointer.substring(1).split("/", -1);
        List<String> tokens = new ArrayList<>(raw.length);
        for (String token : raw) {
            tokens.add(token.replace("~1", "/").replace("~0", "~"));
        }
        return tokens;
    }

    private static String requiredText(JsonNode operation, String field) {
        JsonNode value = operation.get(field);
        if (value == null || !value.isTextual()) {
            throw new DiffException("Patch operation without '" + field + "': " + operation);
        }
        return value.asText();
    }

    private static JsonNode requiredValue(JsonNode operation) {
        JsonNode value = operation.get("value");
        if (value == null) {
            throw new DiffException("Patch operation without 'value': " + operation);
        }
        return value;
    }
}
