package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.ConnectionRegistration;
import me.golemcore.relay.domain.model.RegisterConnectionCommand;
import me.golemcore.relay.domain.model.UrlValidationResult;
import me.golemcore.relay.port.outbound.ConnectionRegistryPort;
import me.golemcore.relay.security.CallbackUrlValidator;
import me.golemcore.relay.security.SecretGenerator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Registers agent webhooks. The callback URL is checked for SSRF here, once;
 * the send path trusts stored URLs.
 */
@Service
@Slf4j
public class AgentConnectionService {

    private static final Set<String> PUBLIC_KEY_ALGORITHMS = Set.of("ed25519", "x25519");
    private static final int MIN_PRIORITY = 0;
    private static final int MAX_PRIORITY = 100;

    private final ConnectionRegistryPort connectionRegistry;
    private final CallbackUrlValidator urlValidator;
    private final Clock clock;

    public AgentConnectionService(ConnectionRegistryPort connectionRegistry, CallbackUrlValidator urlValidator,
            Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.urlValidator = urlValidator;
        this.clock = clock;
    }

    /**
     * Creates a connection or updates the one with the same framework and
     * label. A secret is returned only when one was issued.
     */
    public ConnectionRegistration register(String userId, RegisterConnectionCommand command) {
        requireText(command.getFramework(), "framework");
        requireText(command.getLabel(), "label");
        if (command.getRoutingPriority() < MIN_PRIORITY || command.getRoutingPriority() > MAX_PRIORITY) {
            throw new RelayException(ErrorCode.INVALID_REQUEST,
                    "routing_priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        String publicKeyAlg = normalizeAlgorithm(command.getPublicKeyAlg());

        UrlValidationResult url = urlValidator.validate(command.getCallbackUrl());
        if (!url.valid()) {
            log.warn("[Agents] Rejected callback URL for user {}: {}", userId, url.error());
            throw new RelayException(ErrorCode.INVALID_CALLBACK_URL, url.error());
        }

        Optional<AgentConnection> existing = connectionRegistry.findByUserFrameworkLabel(userId,
                command.getFramework(), command.getLabel());
        if (existing.isPresent()) {
            return update(existing.get(), command, publicKeyAlg);
        }

        String secret = hasText(command.getCallbackSecret())
                ? command.getCallbackSecret()
                : SecretGenerator.callbackSecret();
        AgentConnection connection = AgentConnection.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .framework(command.getFramework())
                .label(command.getLabel())
                .description(command.getDescription())
                .capabilities(command.getCapabilities() != null ? List.copyOf(command.getCapabilities()) : List.of())
                .publicKey(command.getPublicKey())
                .publicKeyAlg(publicKeyAlg)
                .routingPriority(command.getRoutingPriority())
                .callbackUrl(command.getCallbackUrl())
                .callbackSecret(secret)
                .status(AgentConnection.STATUS_ACTIVE)
                .createdAt(clock.instant())
                .build();
        connectionRegistry.insert(connection);
        log.info("[Agents] Registered connection {} ({}/{}) for user {}", connection.getId(),
                connection.getFramework(), connection.getLabel(), userId);
        return new ConnectionRegistration(connection.getId(), secret, false);
    }

    public List<AgentConnection> list(String userId) {
        return connectionRegistry.findByUser(userId);
    }

    private ConnectionRegistration update(AgentConnection existing, RegisterConnectionCommand command,
            String publicKeyAlg) {
        String issuedSecret = null;
        if (hasText(command.getCallbackSecret())) {
            issuedSecret = command.getCallbackSecret();
        } else if (command.isRotateSecret()) {
            issuedSecret = SecretGenerator.callbackSecret();
        }

        AgentConnection updated = existing.toBuilder()
                .description(command.getDescription() != null ? command.getDescription() : existing.getDescription())
                .capabilities(command.getCapabilities() != null
                        ? List.copyOf(command.getCapabilities())
                        : existing.getCapabilities())
                .publicKey(command.getPublicKey() != null ? command.getPublicKey() : existing.getPublicKey())
                .publicKeyAlg(publicKeyAlg != null ? publicKeyAlg : existing.getPublicKeyAlg())
                .routingPriority(command.getRoutingPriority())
                .callbackUrl(command.getCallbackUrl())
                .callbackSecret(issuedSecret != null ? issuedSecret : existing.getCallbackSecret())
                .status(AgentConnection.STATUS_ACTIVE)
                .build();
        connectionRegistry.update(updated);
        log.info("[Agents] Updated connection {} for user {} (secret rotated: {})", existing.getId(),
                existing.getUserId(), issuedSecret != null);
        return new ConnectionRegistration(existing.getId(), issuedSecret, true);
    }

    private String normalizeAlgorithm(String algorithm) {
        if (!hasText(algorithm)) {
            return null;
        }
        String normalized = algorithm.trim().toLowerCase(Locale.ROOT);
        if (!PUBLIC_KEY_ALGORITHMS.contains(normalized)) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "public_key_alg must be ed25519 or x25519");
        }
        return normalized;
    }

    private static void requireText(String value, String field) {
        if (!hasText(value)) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, field + " is required");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
