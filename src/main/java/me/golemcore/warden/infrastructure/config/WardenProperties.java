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

import lombok.Data;
import me.golemcore.warden.domain.model.DangerousPattern;
import me.golemcore.warden.domain.model.SecurityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code warden.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link SecurityProperties} - gate thresholds, overrides, patterns</li>
 * <li>{@link GuardianProperties} - watchdog detectors</li>
 * <li>{@link LoopProperties} - turn limits and timeouts</li>
 * <li>{@link RetryProperties} - backoff for transient failures</li>
 * <li>{@link JudgeProperties} - goal acceptance defaults</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "warden")
@Data
public class WardenProperties {

    private StorageProperties storage = new StorageProperties();
    private SecurityProperties security = new SecurityProperties();
    private GuardianProperties guardian = new GuardianProperties();
    private LoopProperties loop = new LoopProperties();
    private RetryProperties retry = new RetryProperties();
    private JudgeProperties judge = new JudgeProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/warden";
    }

    @Data
    public static class SecurityProperties {
        private SecurityTier autoApproveUpTo = SecurityTier.T1;
        private SecurityTier denyAbove = SecurityTier.T4;
        private long approvalTimeoutSeconds = 60;
        private Map<String, SecurityTier> toolOverrides = new LinkedHashMap<>();
        private List<DangerousPattern> dangerousPatterns = new ArrayList<>(defaultDangerousPatterns());
        private SubAgentProperties subAgent = new SubAgentProperties();
    }

    @Data
    public static class SubAgentProperties {
        private SecurityTier autoApproveUpTo = SecurityTier.T0;
        private SecurityTier denyAbove = SecurityTier.T2;
        private long approvalTimeoutSeconds = 30;
        private List<DangerousPattern> extraPatterns = new ArrayList<>();
    }

    @Data
    public static class GuardianProperties {
        private boolean enabled = true;
        private long stallTimeoutSeconds = 120;
        private int doomLoopThreshold = 3;
        private int doomLoopWindow = 0;
        private long budgetTokens = 0;
        private int budgetWarnPercent = 80;

        public int effectiveDoomLoopWindow() {
            return doomLoopWindow > 0 ? doomLoopWindow : doomLoopThreshold * 2;
        }
    }

    @Data
    public static class LoopProperties {
        private int maxTurns = 25;
        private long maxDurationSeconds = 900;
        private long toolTimeoutSeconds = 60;
        private long modelTimeoutSeconds = 120;
        private boolean parallelTools = true;
        private int maxParallelTools = 8;
        private boolean completeOnLimit = false;
        private int maxConsecutiveTurnFailures = 2;
        private boolean resumeOnStartup = false;
        private String reasoningEffort;
        private Integer maxOutputTokens;
        private int maxToolOutputChars = 16000;
        private int runThreads = 4;
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 8000;
        private double jitter = 0.2;
    }

    @Data
    public static class JudgeProperties {
        private double confidenceFloor = 0.6;
        private double defaultThreshold = 0.9;
        private long timeoutSeconds = 60;
    }

    public static List<DangerousPattern> defaultDangerousPatterns() {
        return List.of(
                DangerousPattern.of("rm\\s+(-\\w*)?r", "recursive delete"),
                DangerousPattern.of("git\\s+push\\s+.*--force", "force push"),
                DangerousPattern.of("git\\s+reset\\s+--hard", "hard reset"),
                DangerousPattern.of("(?i)DROP\\s+(TABLE|DATABASE)", "SQL drop"),
                DangerousPattern.of("(?i)TRUNCATE\\s+TABLE", "SQL truncate"),
                DangerousPattern.of("(?i)DELETE\\s+FROM\\s+\\w+\\s*(;|$|\"|')", "SQL delete without WHERE"),
                DangerousPattern.of("chmod\\s+(-R\\s+)?777", "wide-open permissions"),
                DangerousPattern.of("mkfs\\.", "format filesystem"),
                DangerousPattern.of("dd\\s+if=", "raw disk write"),
                DangerousPattern.of(">\\s*/dev/(sd|nvme|hd|disk)", "write to device"),
                DangerousPattern.of("(curl|wget)[^|]*\\|\\s*(ba|z)?sh", "pipe download to shell"),
                DangerousPattern.of("(^|[\\s;&|\"'])sudo\\s", "privilege escalation"),
                DangerousPattern.of("(^|[\\s;&|\"'])su\\s+-", "privilege escalation"));
    }
}
