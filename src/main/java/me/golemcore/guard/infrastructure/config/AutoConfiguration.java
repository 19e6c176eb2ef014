package me.golemcore.guard.infrastructure.config;

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
import me.golemcore.guard.domain.service.CapabilityManager;
import me.golemcore.guard.port.outbound.ApprovalPort;
import me.golemcore.guard.security.BuiltinToolPermissions;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Spring configuration that prepares the guard on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Registers the built-in tool permissions when
 * {@code guard.tools.register-builtins} is true</li>
 * <li>Installs the first available {@link ApprovalPort} as approval
 * handler</li>
 * <li>Loads the persisted audit log</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GuardProperties properties;
    private final CapabilityManager capabilityManager;
    private final List<ApprovalPort> approvalPorts;

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

    @PostConstruct
    public void init() {
        log.info("GolemCore Guard starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        if (properties.getTools().isRegisterBuiltins()) {
            BuiltinToolPermissions.all().forEach(capabilityManager::registerTool);
            log.info("Registered {} built-in tool permissions", BuiltinToolPermissions.all().size());
        }

        Optional<ApprovalPort> handler = approvalPorts.stream()
                .filter(ApprovalPort::isAvailable)
                .findFirst();
        if (handler.isPresent()) {
            capabilityManager.setApprovalHandler(handler.get());
        } else {
            log.warn("No approval handler available, calls requiring approval will be denied");
        }

        capabilityManager.initialize().join();
        log.info("GolemCore Guard started successfully");
    }
}
