/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.woozie.graph;

/**
 * Sequential index source for fork/join pair names within one compilation.
 * Shared between component-level and top-level synthesis so that generated
 * names never collide. One instance per run; never shared across runs.
 */
public class ForkJoinCounter {

    private int next;

    public int next() {
        return next++;
    }

    /**
     * Number of fork/join pairs issued so far.
     */
    public int issued() {
        return next;
    }
}
