package com.myla.gateway.http;

import com.myla.agent.AgentOrchestrator;
import com.myla.shared.model.AgentRequest;
import com.myla.shared.model.ThreadMessage;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
public class ChatController {

    private final AgentOrchestrator orchestrator;

    public ChatController(AgentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public record ChatBody(String message, List<ThreadMessage> context) {}

    @PostMapping("/v1/chat")
    public ResponseEntity<Map<String, String>> chat(@RequestBody ChatBody body) {
        if (body == null || body.message() == null || body.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "'message' is required"));
        }
        var request = new AgentRequest(UUID.randomUUID().toString(), body.message(),
            body.context() != null ? body.context() : List.of());
        return ResponseEntity.ok(Map.of("reply", orchestrator.run(request)));
    }
}
