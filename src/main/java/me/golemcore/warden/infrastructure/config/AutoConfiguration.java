package me.golemcore.warden.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Shared infrastructure beans and startup logging.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final WardenProperties properties;
    private final LlmPort llmPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Top-level security policy built from {@code warden.security.*}.
     */
    @Bean
    public SecurityPolicy securityPolicy() {
        WardenProperties.SecurityProperties security = properties.getSecurity();
        return SecurityPolicy.builder()
                .autoApproveUpTo(security.getAutoApproveUpTo())
                .denyAbove(security.getDenyAbove())
                .approvalTimeoutSeconds(security.getApprovalTimeoutSeconds())
                .toolOverrides(new LinkedHashMap<>(security.getToolOverrides()))
                .dangerousPatterns(new ArrayList<>(security.getDangerousPatterns()))
                .overridesMayLowerTier(true)
                .build();
    }

    @PostConstruct
    public void init() {
        WardenProperties.SecurityProperties security = properties.getSecurity();
        log.info("GolemCore Warden starting...");
        log.info("LLM Provider: {} (available: {})", llmPort.getProviderId(), llmPort.isAvailable());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Security: auto-approve up to {}, deny above {}, {} dangerous patterns",
                security.getAutoApproveUpTo(), security.getDenyAbove(), security.getDangerousPatterns().size());
        log.info("Loop: max {} turns, max {}s, parallel tools: {}", properties.getLoop().getMaxTurns(),
                properties.getLoop().getMaxDurationSeconds(), properties.getLoop().isParallelTools());
    }
}
