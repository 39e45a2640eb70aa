/*
 * Copyright (c) 2026 MakiBytes.
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
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.mintcheck.model;

public record SortState(SortMode mode, SortColumn column, SortDirection direction) {

    public static final SortState INITIAL = weighted();

    public static SortState weighted() {
        return new SortState(SortMode.WEIGHTED, null, SortDirection.DESC);
    }

    public boolean isWeighted() {
        return mode == SortMode.WEIGHTED;
    }

    /**
     * Header click: the active column toggles its direction, any other column
     * becomes active with its default direction.
     */
    public SortState activate(SortColumn target) {
        if (mode == SortMode.COLUMN && column == target) {
            return new SortState(SortMode.COLUMN, target, direction.toggle());
        }
        return new SortState(SortMode.COLUMN, target, target.getDefaultDirection());
    }

    /**
     * Weight edits always switch back to weighted ordering.
     */
    public SortState toWeighted() {
        if (mode == SortMode.WEIGHTED) {
            return this;
        }
        return new SortState(SortMode.WEIGHTED, column, direction);
    }
}
