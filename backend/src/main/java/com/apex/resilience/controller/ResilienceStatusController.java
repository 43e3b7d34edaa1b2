package com.apex.resilience.controller;

import com.apex.resilience.dto.CircuitStatusResponse;
import com.apex.resilience.dto.LeaderStatusResponse;
import com.apex.resilience.exception.NotFoundException;
import com.apex.resilience.failover.FailoverCoordinator;
import com.apex.resilience.failover.FailoverRole;
import com.apex.resilience.lease.LeaseLock;
import com.apex.resilience.service.CircuitGateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/resilience")
@RequiredArgsConstructor
@Tag(name = "Resilience")
public class ResilienceStatusController {

    private final CircuitGateService circuitGateService;
    private final FailoverCoordinator failoverCoordinator;

    @GetMapping("/circuits")
    @Operation(summary = "List circuit breaker snapshots")
    public ResponseEntity<List<CircuitStatusResponse>> getCircuits() {
        List<CircuitStatusResponse> circuits = circuitGateService.snapshots().entrySet().stream()
                .map(entry -> CircuitStatusResponse.of(entry.getKey(), entry.getValue()))
                .toList();
        return ResponseEntity.ok(circuits);
    }

    @GetMapping("/circuits/{resource}")
    @Operation(summary = "Get one circuit breaker snapshot")
    public ResponseEntity<CircuitStatusResponse> getCircuit(@PathVariable String resource) {
        return circuitGateService.find(resource)
                .map(breaker -> ResponseEntity.ok(CircuitStatusResponse.of(resource, breaker.snapshot())))
                .orElseThrow(() -> new NotFoundException("Unknown circuit: " + resource));
    }

    @GetMapping("/leader")
    @Operation(summary = "Get lease leadership status")
    public ResponseEntity<LeaderStatusResponse> getLeader() {
        // read-only: the lock itself is only driven from the failover tick
        LeaseLock lock = failoverCoordinator.lock();
        String currentHolder = lock.holder().orElse(null);
        boolean leader = lock.getHolderId().equals(currentHolder);
        return ResponseEntity.ok(LeaderStatusResponse.builder()
                .key(lock.getKey())
                .holderId(lock.getHolderId())
                .leader(leader)
                .currentHolder(currentHolder)
                .role(FailoverRole.of(leader).label())
                .lastTickMs(failoverCoordinator.lastTickMs())
                .build());
    }
}
