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
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.mintcheck.config.MintCheckProperties;

/**
 * Reads the mint's keysets and reports the units of all active keysets.
 */
@Component
public class CapabilityProbe extends HttpEndpointProbe<Set<String>> {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityProbe.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public CapabilityProbe(HttpClient probeHttpClient, MintCheckProperties properties) {
        this(probeHttpClient,
                properties.getProbe().getKeysetsPath(),
                Duration.ofMillis(properties.getProbe().getRequestTimeoutMs()));
    }

    public CapabilityProbe(HttpClient httpClient, String keysetsPath, Duration timeout) {
        super(httpClient, keysetsPath, timeout);
    }

    @Override
    public String name() {
        return "keysets";
    }

    @Override
    protected Set<String> interpret(HttpResponse<String> response, long elapsedMs) {
        if (!isSuccess(response)) {
            return null;
        }
        try {
            return activeUnits(mapper.readTree(response.body()));
        } catch (JsonProcessingException ex) {
            logger.debug("Unparsable keysets from {}: {}", response.uri(), ex.getOriginalMessage());
            return null;
        }
    }

    Set<String> activeUnits(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode keysets = root.get("keysets");
        if (keysets == null || !keysets.isArray()) {
            return null;
        }
        Set<String> units = new LinkedHashSet<>();
        for (JsonNode keyset : keysets) {
            JsonNode active = keyset.get("active");
            JsonNode unit = keyset.get("unit");
            if (active == null || !active.isBoolean() || !active.booleanValue()) {
                continue;
            }
            if (unit == null || !unit.isTextual() || unit.asText().isBlank()) {
                continue;
            }
            units.add(unit.asText());
        }
        return units;
    }
}
