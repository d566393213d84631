package ch.so.arp.docqa.chat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import ch.so.arp.docqa.answer.Answer;
import ch.so.arp.docqa.answer.AnswerSynthesizer;
import ch.so.arp.docqa.answer.RetrievalResult;
import ch.so.arp.docqa.answer.Retriever;
import ch.so.arp.docqa.exception.SessionNotFoundException;
import ch.so.arp.docqa.exception.ValidationException;

/**
 * Coordinates the retrieval of context from the vector store and delegates the
 * answer generation to the answer synthesizer. Questions asked within a session
 * are recorded in the chat history.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final Retriever retriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final ChatHistoryRepository chatHistory;

    public ChatService(Retriever retriever, AnswerSynthesizer answerSynthesizer,
            ChatHistoryRepository chatHistory) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.answerSynthesizer = Objects.requireNonNull(answerSynthesizer, "answerSynthesizer");
        this.chatHistory = Objects.requireNonNull(chatHistory, "chatHistory");
    }

    public Answer answer(String question, Integer topK, Double similarityThreshold) {
        RetrievalResult retrieval = retriever.retrieve(question, topK, similarityThreshold);
        if (!retrieval.hasContext()) {
            LOGGER.debug("No relevant context for question '{}'", question);
        }
        return answerSynthesizer.synthesize(question, retrieval);
    }

    /**
     * Answer the question and store both the question and the answer in the
     * session.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public Answer answerInSession(long sessionId, String question, Integer topK, Double similarityThreshold) {
        requireSession(sessionId);
        if (!StringUtils.hasText(question)) {
            throw new ValidationException("Question must not be blank");
        }
        chatHistory.addMessage(sessionId, MessageRole.USER, question, Map.of());
        Answer answer = answer(question, topK, similarityThreshold);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sources", answer.sources());
        metadata.put("confidence", answer.confidence());
        if (answer.error() != null) {
            metadata.put("error", answer.error());
        }
        chatHistory.addMessage(sessionId, MessageRole.ASSISTANT, answer.answer(), metadata);
        return answer;
    }

    public ChatSession createSession(String name) {
        ChatSession session = chatHistory.createSession(name.strip());
        LOGGER.info("Created chat session {} '{}'", session.id(), session.name());
        return session;
    }

    public List<ChatSession> listSessions() {
        return chatHistory.findAllSessions();
    }

    public ChatSessionDetails getSession(long sessionId) {
        ChatSession session = requireSession(sessionId);
        return new ChatSessionDetails(session, chatHistory.findMessages(sessionId));
    }

    public ChatSession renameSession(long sessionId, String name) {
        if (!chatHistory.renameSession(sessionId, name.strip())) {
            throw new SessionNotFoundException(sessionId);
        }
        return requireSession(sessionId);
    }

    public void deleteSession(long sessionId) {
        if (!chatHistory.deleteSession(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        LOGGER.info("Deleted chat session {}", sessionId);
    }

    private ChatSession requireSession(long sessionId) {
        return chatHistory.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
