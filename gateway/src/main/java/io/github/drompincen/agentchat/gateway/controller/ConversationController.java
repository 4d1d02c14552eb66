package io.github.drompincen.agentchat.gateway.controller;

import io.github.drompincen.agentchat.persistence.store.ConversationStore;
import io.github.drompincen.agentchat.persistence.store.StoredConversation;
import io.github.drompincen.agentchat.protocol.api.ConversationSummary;
import io.github.drompincen.agentchat.runtime.session.TabScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationStore conversationStore;
    private final TabScheduler scheduler;

    public ConversationController(ConversationStore conversationStore, TabScheduler scheduler) {
        this.conversationStore = conversationStore;
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<ConversationSummary> list() {
        return conversationStore.list();
    }

    @GetMapping("/search")
    public List<ConversationSummary> search(@RequestParam(name = "q", required = false) String query) {
        return conversationStore.search(query);
    }

    @GetMapping("/latest")
    public ResponseEntity<ConversationSummary> latest() {
        return conversationStore.latest()
                .map(StoredConversation::summary)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    /** Loads a stored conversation into a tab; clients then subscribe to it over the socket. */
    @PostMapping("/{id}/open")
    public ResponseEntity<Map<String, Object>> open(@PathVariable String id) {
        return scheduler.openStored(id).map(session -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("conversationId", session.id());
            body.put("title", session.title());
            body.put("transcript", session.transcript());
            body.put("state", session.state().snapshot(session.id()));
            return ResponseEntity.ok(body);
        }).orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (scheduler.owner().filter(id::equals).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        scheduler.close(id);
        return conversationStore.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
