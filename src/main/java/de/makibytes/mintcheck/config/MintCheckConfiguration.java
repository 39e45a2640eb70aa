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

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MintCheckConfiguration {

    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public HttpClient probeHttpClient(MintCheckProperties properties,
                                      @Qualifier("probeExecutor") ExecutorService probeExecutor) {
        long connectTimeoutMs = Math.max(1, properties.getProbe().getConnectTimeoutMs());
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(probeExecutor)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
