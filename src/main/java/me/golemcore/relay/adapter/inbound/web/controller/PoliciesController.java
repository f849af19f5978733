package me.golemcore.relay.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.adapter.inbound.web.dto.CreatePolicyRequest;
import me.golemcore.relay.adapter.inbound.web.dto.PolicyDto;
import me.golemcore.relay.domain.model.CreatePolicyCommand;
import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.service.PolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/policies")
@RequiredArgsConstructor
public class PoliciesController {

    private final PolicyService policyService;

    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> create(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @RequestBody CreatePolicyRequest request) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            CreatePolicyCommand command = CreatePolicyCommand.builder()
                    .scope(request.getScope())
                    .targetId(request.getTargetId())
                    .policyType(request.getPolicyType())
                    .policyContent(request.getPolicyContent())
                    .priority(request.getPriority())
                    .enabled(request.getEnabled() == null || request.getEnabled())
                    .build();
            Policy policy = policyService.create(caller, command);
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("policy_id", policy.getId()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<List<PolicyDto>>> list(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            List<PolicyDto> policies = policyService.list(caller).stream()
                    .map(PoliciesController::toDto)
                    .toList();
            return ResponseEntity.ok(policies);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Map<String, Boolean>>> delete(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @PathVariable String id) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            policyService.delete(caller, id);
            return ResponseEntity.ok(Map.of("success", true));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static PolicyDto toDto(Policy policy) {
        return new PolicyDto(policy.getId(), policy.getScope().value(), policy.getTargetId(),
                policy.getPolicyType().value(), policy.getPolicyContent(), policy.getPriority(),
                policy.isEnabled(), policy.getCreatedAt());
    }
}
