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

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.config.MintCheckProperties;

/**
 * Round trip to the mint's info endpoint. Only successful responses yield a latency.
 */
@Component
public class LatencyProbe extends HttpEndpointProbe<Long> {

    @Autowired
    public LatencyProbe(HttpClient probeHttpClient, MintCheckProperties properties) {
        this(probeHttpClient,
                properties.getProbe().getInfoPath(),
                Duration.ofMillis(properties.getProbe().getRequestTimeoutMs()));
    }

    public LatencyProbe(HttpClient httpClient, String infoPath, Duration timeout) {
        super(httpClient, infoPath, timeout);
    }

    @Override
    public String name() {
        return "latency";
    }

    @Override
    protected Long interpret(HttpResponse<String> response, long elapsedMs) {
        return isSuccess(response) ? elapsedMs : null;
    }
}
