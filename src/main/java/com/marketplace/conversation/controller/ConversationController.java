package com.marketplace.conversation.controller;

import com.marketplace.conversation.model.ConversationSummary;
import com.marketplace.conversation.model.InboundMessage;
import com.marketplace.conversation.model.MessageOutcome;
import com.marketplace.conversation.service.ConversationAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/conversations")
@Tag(name = "Conversations", description = "Analyse buyer messages and inspect conversation state")
public class ConversationController {

    private final ConversationAnalysisService analysisService;

    public ConversationController(ConversationAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/messages")
    @Operation(summary = "Analyse an inbound buyer message",
               description = "Classifies intent, scores fraud risk, advances the conversation state and " +
                       "either authorizes a reply or holds it for human review. " +
                       "persisted=false means the result is valid but was not saved.")
    @ApiResponse(responseCode = "200", description = "Analysis outcome",
                 content = @Content(schema = @Schema(implementation = MessageOutcome.class)))
    public CompletableFuture<ResponseEntity<MessageOutcome>> analyzeMessage(@RequestBody InboundMessage message) {
        return analysisService.processAsync(message).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/{buyerId}")
    @Operation(summary = "Get conversation summary",
               description = "Returns exists=false when the engine has never seen this buyer")
    public ResponseEntity<ConversationSummary> getSummary(@PathVariable String buyerId) {
        return ResponseEntity.ok(analysisService.getSummary(buyerId));
    }

    @PostMapping("/{buyerId}/fraud-score/reset")
    @Operation(summary = "Reset accumulated fraud score",
               description = "Clears the conversation's fraud score after a human has cleared the buyer")
    public ResponseEntity<ConversationSummary> resetFraudScore(@PathVariable String buyerId,
                                             @RequestBody(required = false) Map<String, String> body) {
        String resetBy = body != null ? body.getOrDefault("resetBy", "ops") : "ops";
        Optional<ConversationSummary> summary = analysisService.resetFraudScore(buyerId, resetBy);
        if (summary.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(summary.get());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
