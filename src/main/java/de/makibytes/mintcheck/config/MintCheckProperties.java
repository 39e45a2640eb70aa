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
package de.makibytes.mintcheck.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import de.makibytes.mintcheck.model.Weights;

@ConfigurationProperties(prefix = "mints")
public class MintCheckProperties {

    /**
     * Which cached probe results the periodic refresh throws away.
     */
    public enum ClearScope {
        ALL,
        VISIBLE
    }

    private String datasetId = "dashboard";
    private Probe probe = new Probe();
    private Ranking ranking = new Ranking();
    private List<EndpointProperties> endpoints = new ArrayList<>();

    public String getDatasetId() {
        return datasetId;
    }

    public void setDatasetId(String datasetId) {
        this.datasetId = datasetId;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public List<EndpointProperties> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<EndpointProperties> endpoints) {
        this.endpoints = endpoints;
    }

    public static class Probe {
        private long cacheTtlMs = 10000;
        private long requestTimeoutMs = 5000;
        private long connectTimeoutMs = 2000;
        private long refreshIntervalMs = 15000;
        private long staggerDelayMs = 100;
        private String infoPath = "/v1/info";
        private String keysetsPath = "/v1/keysets";
        private ClearScope clearScope = ClearScope.ALL;

        public long getCacheTtlMs() {
            return cacheTtlMs;
        }

        public void setCacheTtlMs(long cacheTtlMs) {
            this.cacheTtlMs = cacheTtlMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public long getStaggerDelayMs() {
            return staggerDelayMs;
        }

        public void setStaggerDelayMs(long staggerDelayMs) {
            this.staggerDelayMs = staggerDelayMs;
        }

        public String getInfoPath() {
            return infoPath;
        }

        public void setInfoPath(String infoPath) {
            this.infoPath = infoPath;
        }

        public String getKeysetsPath() {
            return keysetsPath;
        }

        public void setKeysetsPath(String keysetsPath) {
            this.keysetsPath = keysetsPath;
        }

        public ClearScope getClearScope() {
            return clearScope;
        }

        public void setClearScope(ClearScope clearScope) {
            this.clearScope = clearScope;
        }
    }

    public static class Ranking {
        private boolean status = Weights.DEFAULTS.status();
        private double currency = Weights.DEFAULTS.currency();
        private double capacity = Weights.DEFAULTS.capacity();
        private double channels = Weights.DEFAULTS.channels();
        private double latency = Weights.DEFAULTS.latency();
        private double mints = Weights.DEFAULTS.mints();
        private double melts = Weights.DEFAULTS.melts();
        private double errors = Weights.DEFAULTS.errors();

        public Weights toWeights() {
            return new Weights(status, currency, capacity, channels, latency, mints, melts, errors);
        }

        public boolean isStatus() {
            return status;
        }

        public void setStatus(boolean status) {
            this.status = status;
        }

        public double getCurrency() {
            return currency;
        }

        public void setCurrency(double currency) {
            this.currency = currency;
        }

        public double getCapacity() {
            return capacity;
        }

        public void setCapacity(double capacity) {
            this.capacity = capacity;
        }

        public double getChannels() {
            return channels;
        }

        public void setChannels(double channels) {
            this.channels = channels;
        }

        public double getLatency() {
            return latency;
        }

        public void setLatency(double latency) {
            this.latency = latency;
        }

        public double getMints() {
            return mints;
        }

        public void setMints(double mints) {
            this.mints = mints;
        }

        public double getMelts() {
            return melts;
        }

        public void setMelts(double melts) {
            this.melts = melts;
        }

        public double getErrors() {
            return errors;
        }

        public void setErrors(double errors) {
            this.errors = errors;
        }
    }

    /**
     * Seed entry for the mint dataset. Field names follow the dataset attribute keys.
     */
    public static class EndpointProperties {

        private String url;
        private String name;
        private boolean up = true;
        private double uptime;
        private long capacity;
        private int channels;
        private int currencies;
        private int mints;
        private int melts;
        private int errors;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isUp() {
            return up;
        }

        public void setUp(boolean up) {
            this.up = up;
        }

        public double getUptime() {
            return uptime;
        }

        public void setUptime(double uptime) {
            this.uptime = uptime;
        }

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public int getChannels() {
            return channels;
        }

        public void setChannels(int channels) {
            this.channels = channels;
        }

        public int getCurrencies() {
            return currencies;
        }

        public void setCurrencies(int currencies) {
            this.currencies = currencies;
        }

        public int getMints() {
            return mints;
        }

        public void setMints(int mints) {
            this.mints = mints;
        }

        public int getMelts() {
            return melts;
        }

        public void setMelts(int melts) {
            this.melts = melts;
        }

        public int getErrors() {
            return errors;
        }

        public void setErrors(int errors) {
            this.errors = errors;
        }
    }
}
