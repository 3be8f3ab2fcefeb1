package com.openforge.taskmate.agent;

import com.openforge.taskmate.agent.dto.ChatTurnRequest;
import com.openforge.taskmate.agent.dto.ConfirmationRequest;
import com.openforge.taskmate.agent.dto.TurnResponse;
import com.openforge.taskmate.auth.CurrentOwner;
import com.openforge.taskmate.tool.ToolDescriptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Conversational entry point.
 *
 * Endpoints:
 *   POST /api/chat                - one chat turn
 *   POST /api/chat/confirmations  - confirm or cancel a proposed tool call
 *   GET  /api/chat/tools          - published tool schemas
 *
 * The owner is always taken from the bearer token, never from the body.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<TurnResponse> chat(@Valid @RequestBody ChatTurnRequest request) {
        return ResponseEntity.ok(orchestrator.handleTurn(CurrentOwner.require(), request));
    }

    @PostMapping("/confirmations")
    public ResponseEntity<TurnResponse> confirm(@Valid @RequestBody ConfirmationRequest request) {
        return ResponseEntity.ok(orchestrator.resolveConfirmation(CurrentOwner.require(), request));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<ToolDescriptor>> tools() {
        CurrentOwner.require();
        return ResponseEntity.ok(orchestrator.tools());
    }
}
