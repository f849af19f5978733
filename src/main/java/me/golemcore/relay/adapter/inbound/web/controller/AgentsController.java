package me.golemcore.relay.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.adapter.inbound.web.dto.AgentConnectionDto;
import me.golemcore.relay.adapter.inbound.web.dto.AgentRegistrationResponse;
import me.golemcore.relay.adapter.inbound.web.dto.RegisterAgentRequest;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.ConnectionRegistration;
import me.golemcore.relay.domain.model.RegisterConnectionCommand;
import me.golemcore.relay.domain.service.AgentConnectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
public class AgentsController {

    private final AgentConnectionService connectionService;

    @PostMapping
    public Mono<ResponseEntity<AgentRegistrationResponse>> register(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @RequestBody RegisterAgentRequest request) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            ConnectionRegistration registration = connectionService.register(caller, toCommand(request));
            AgentRegistrationResponse body = new AgentRegistrationResponse(registration.connectionId(),
                    registration.callbackSecret(), registration.updated() ? Boolean.TRUE : null);
            HttpStatus status = registration.updated() ? HttpStatus.OK : HttpStatus.CREATED;
            return ResponseEntity.status(status).body(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<List<AgentConnectionDto>>> list(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            List<AgentConnectionDto> connections = connectionService.list(caller).stream()
                    .map(AgentsController::toDto)
                    .toList();
            return ResponseEntity.ok(connections);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static RegisterConnectionCommand toCommand(RegisterAgentRequest request) {
        return RegisterConnectionCommand.builder()
                .framework(request.getFramework())
                .label(request.getLabel())
                .description(request.getDescription())
                .capabilities(request.getCapabilities())
                .routingPriority(request.getRoutingPriority())
                .callbackUrl(request.getCallbackUrl())
                .callbackSecret(request.getCallbackSecret())
                .publicKey(request.getPublicKey())
                .publicKeyAlg(request.getPublicKeyAlg())
                .rotateSecret(request.isRotateSecret())
                .build();
    }

    private static AgentConnectionDto toDto(AgentConnection connection) {
        return new AgentConnectionDto(connection.getId(), connection.getFramework(), connection.getLabel(),
                connection.getDescription(), connection.getCapabilities(), connection.getRoutingPriority(),
                connection.getCallbackUrl(), connection.getPublicKey(), connection.getPublicKeyAlg(),
                connection.getStatus(), connection.getLastSeen(), connection.getCreatedAt());
    }
}
