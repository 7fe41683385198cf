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
 * A read request is wider than the range buffer's window.
 * <p>
 * Raised before the buffer is touched, so the current window stays valid.
 */
public class BudgetExceededException extends IndexException {

    private final long start;
    private final long end;
    private final int budget;

    public BudgetExceededException(long start, long end, int budget) {
        super("Range [" + start + ", " + end + ") is " + (end - start) +
                " bytes, exceeds the buffer size of " + budget + " bytes");
        this.start = start;
        this.end = end;
        this.budget = budget;
    }

    public long start() {
        return start;
    }

    public long end() {
        return end;
    }

    public int budget() {
        return budget;
    }
}
