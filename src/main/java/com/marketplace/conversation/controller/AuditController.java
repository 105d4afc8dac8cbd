package com.marketplace.conversation.controller;

import com.marketplace.conversation.model.AuditEntry;
import com.marketplace.conversation.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit Trail", description = "Append-only record of gated decisions")
public class AuditController {

    private final AuditTrailService auditTrail;

    public AuditController(AuditTrailService auditTrail) {
        this.auditTrail = auditTrail;
    }

    @GetMapping
    @Operation(summary = "List recent audit entries",
               description = "Newest first. Optionally filter by buyer.")
    public ResponseEntity<List<AuditEntry>> recent(
            @RequestParam(required = false) String buyerId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditTrail.recent(buyerId, Math.max(0, limit)));
    }
}
