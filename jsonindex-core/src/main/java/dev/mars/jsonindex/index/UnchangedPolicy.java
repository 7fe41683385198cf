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

/**
 * What happens to an incoming item whose key is known and whose content is
 * classified as unchanged.
 * <p>
 * Neither policy emits a delta record. They differ in whether the key's latest
 * value advances to the incoming item.
 */
public enum UnchangedPolicy {

    /** Drop the item. The key's latest value stays the previously recorded one. */
    SKIP,

    /** Append the item to the index so it becomes the key's latest value. */
    RECORD
}
