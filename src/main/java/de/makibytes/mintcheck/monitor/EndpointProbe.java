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
package de.makibytes.mintcheck.monitor;

import java.util.concurrent.CompletableFuture;

/**
 * One kind of outbound check against a mint.
 *
 * @param <T> result type; {@code null} means the mint gave no usable answer
 */
public interface EndpointProbe<T> {

    String name();

    /**
     * Starts the probe. The future may complete exceptionally on transport errors and timeouts.
     */
    CompletableFuture<T> execute(String baseUrl);
}
