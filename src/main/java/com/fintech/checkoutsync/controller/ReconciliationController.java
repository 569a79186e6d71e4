package com.fintech.checkoutsync.controller;

import com.fintech.checkoutsync.dto.ReconciliationResult;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.repository.CheckoutRepository;
import com.fintech.checkoutsync.service.ReconciliationService;
import com.fintech.checkoutsync.service.ReconciliationService.ReconciliationStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for checkout reconciliation: manual runs, statistics and read-only
 * checkout views for operators.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Checkout reconciliation operations API")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final CheckoutRepository checkoutRepository;

    @Operation(
            summary = "Trigger manual reconciliation",
            description = "Refreshes every open checkout against the gateway, then recovers recent failed PayPal orders the gateway settled."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "409", description = "Reconciliation already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationResult> triggerReconciliation() {
        log.info("Manual reconciliation triggered via API");
        return ResponseEntity.ok(reconciliationService.updateStates());
    }

    @Operation(summary = "Get reconciliation statistics")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconciliationStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconciliationStats> getStats() {
        return ResponseEntity.ok(reconciliationService.getStats());
    }

    @Operation(
            summary = "Get open checkouts",
            description = "Returns a paginated list of checkouts not yet in a final state."
    )
    @GetMapping("/checkouts/open")
    public ResponseEntity<Page<Checkout>> getOpenCheckouts(
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        Page<Checkout> checkouts = checkoutRepository.findByStateNotIn(
                CheckoutState.finalStates(),
                PageRequest.of(page, size)
        );
        return ResponseEntity.ok(checkouts);
    }

    @Operation(summary = "Get checkout by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Checkout found",
                    content = @Content(schema = @Schema(implementation = Checkout.class))),
            @ApiResponse(responseCode = "404", description = "Checkout not found")
    })
    @GetMapping("/checkouts/{id}")
    public ResponseEntity<Checkout> getCheckout(
            @Parameter(description = "Checkout ID") @PathVariable Long id) {
        return checkoutRepository.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Get operator actions for a checkout",
            description = "Lists the gateway actions (void, settle, credit) and which of them the checkout's current state allows."
    )
    @GetMapping("/checkouts/{id}/actions")
    public ResponseEntity<Map<String, Object>> getCheckoutActions(
            @Parameter(description = "Checkout ID") @PathVariable Long id) {
        return checkoutRepository.findById(id)
                .map(checkout -> ResponseEntity.ok(Map.<String, Object>of(
                        "checkoutId", checkout.getId(),
                        "state", checkout.getState() == null ? "" : checkout.getState().getCode(),
                        "actions", checkout.actions(),
                        "eligible", checkout.eligibleActions())))
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Health check")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        ReconciliationStats stats = reconciliationService.getStats();

        Map<String, Object> health = Map.of(
                "status", "UP",
                "reconciliation", Map.of(
                        "isRunning", stats.isReconciliationRunning(),
                        "openCheckouts", stats.getOpenCheckoutCount(),
                        "settledCheckouts", stats.getSettledCheckoutCount(),
                        "failedPayments", stats.getFailedPaymentCount()
                )
        );

        return ResponseEntity.ok(health);
    }
}
