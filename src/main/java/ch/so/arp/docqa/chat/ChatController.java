package ch.so.arp.docqa.chat;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.docqa.answer.Answer;
import jakarta.validation.Valid;

/**
 * REST endpoints for asking questions and managing chat sessions.
 */
@RestController
@RequestMapping(path = "/api/chat", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Answer chat(@Valid @RequestBody ChatRequest request) {
        return chatService.answer(request.question(), request.topK(), request.similarityThreshold());
    }

    @PostMapping(path = "/sessions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatSession> createSession(@Valid @RequestBody SessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(chatService.createSession(request.name()));
    }

    @GetMapping("/sessions")
    public List<ChatSession> listSessions() {
        return chatService.listSessions();
    }

    @GetMapping("/sessions/{id}")
    public ChatSessionDetails getSession(@PathVariable long id) {
        return chatService.getSession(id);
    }

    @PatchMapping(path = "/sessions/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ChatSession renameSession(@PathVariable long id, @Valid @RequestBody SessionRequest request) {
        return chatService.renameSession(id, request.name());
    }

    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Void> deleteSession(@PathVariable long id) {
        chatService.deleteSession(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/sessions/{id}/questions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Answer askInSession(@PathVariable long id, @Valid @RequestBody ChatRequest request) {
        return chatService.answerInSession(id, request.question(), request.topK(), request.similarityThreshold());
    }
}
