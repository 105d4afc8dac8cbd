package com.marketplace.conversation.controller;

import com.marketplace.conversation.model.PendingAction;
import com.marketplace.conversation.model.PendingActionDecision;
import com.marketplace.conversation.service.ActionGateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/actions")
@Tag(name = "Pending Actions", description = "Human review of replies held back by the action gate")
public class PendingActionController {

    private final ActionGateService actionGate;

    public PendingActionController(ActionGateService actionGate) {
        this.actionGate = actionGate;
    }

    @GetMapping("/pending")
    @Operation(summary = "List pending actions",
               description = "Active actions awaiting a human decision, oldest first")
    public ResponseEntity<List<PendingAction>> listPending() {
        return ResponseEntity.ok(actionGate.listPending());
    }

    @GetMapping("/pending/{actionId}")
    @Operation(summary = "Get a pending action")
    public ResponseEntity<PendingAction> getPending(@PathVariable String actionId) {
        Optional<PendingAction> action = actionGate.findPending(actionId);
        if (action.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(action.get());
    }

    @PostMapping("/pending/{actionId}/decision")
    @Operation(summary = "Approve or reject a pending action",
               description = "Approval queues the reply (or responseOverride) for delivery. " +
                       "Rejection and late decisions never send anything.")
    public ResponseEntity<PendingAction> decide(@PathVariable String actionId,
                                                @RequestBody PendingActionDecision decision) {
        if (decision.getApproved() == null) {
            throw new IllegalArgumentException("approved is required");
        }

        Optional<PendingAction> resolved = actionGate.decide(actionId, decision.getApproved(),
                decision.getDecidedBy(), decision.getResponseOverride());
        if (resolved.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(resolved.get());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
