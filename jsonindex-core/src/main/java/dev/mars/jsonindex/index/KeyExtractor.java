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
package dev.mars.jsonindex.index;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pulls the key literal out of a candidate object's raw text with one pattern match.
 * <p>
 * The text is never parsed, so the cost of indexing does not depend on how the
 * object is structured. The key is the last capturing group of the first match,
 * taken as it appears in the file (JSON escapes are not decoded).
 */
public final class KeyExtractor {

    private final String keyField;
    private final Pattern pattern;

    /**
     * @param keyField   name of the key attribute
     * @param keyMatcher regular expression with at least one capturing group
     * @throws IllegalArgumentException if the expression does not compile or has no group
     */
    public KeyExtractor(String keyField, String keyMatcher) {
        this.keyField = Objects.requireNonNull(keyField, "keyField");
        Objects.requireNonNull(keyMatcher, "keyMatcher");
        try {
            this.pattern = Pattern.compile(keyMatcher);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid key matcher: " + keyMatcher, e);
        }
        if (pattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("Key matcher needs a capturing group: " + keyMatcher);
        }
    }

    /**
     * Builds the default matcher for a key field: {@code "field"} followed by a
     * colon and a quoted value. The value runs to the first unescaped quote, so
     * {@code \"} stays part of the key.
     */
    public static String defaultMatcher(String keyField) {
        return "\"" + Pattern.quote(keyField) + "\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"";
    }

    /**
     * @return the key literal, or empty if the pattern does not match or the key is empty
     */
    public Optional<String> extract(CharSequence text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        String key = m.group(m.groupCount());
        return key == null || key.isEmpty() ? Optional.empty() : Optional.of(key);
    }

    /**
     * Whether the raw text names the key field at all. A span that does but
     * yields no key is a scan anomaly.
     */
    public boolean mentionsKeyField(CharSequence text) {
        return text.toString().contains(keyField);
    }

    public String keyField() {
        return keyField;
    }

    public String keyMatcher() {
        return pattern.pattern();
    }
}
