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

/**
 * Classification counters of a changelog run.
 *
 * @param added     items whose key was unknown
 * @param changed   items recorded as changes
 * @param unchanged items classified as unchanged
 * @param failed    items whose diff or storage failed
 */
public record ChangelogStats(long added, long changed, long unchanged, long failed) {

    /** Items classified, failures included. */
    public long total() {
        return added + changed + unchanged + failed;
    }
}
