package com.example.tenantstore.repo;

import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.ChatMessage;
import com.example.tenantstore.model.ChatSession;
import com.example.tenantstore.model.TokenUsage;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.query.SortOrder;
import com.example.tenantstore.retry.OperationContext;
import com.example.tenantstore.store.QueryPage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Repository
public class ChatSessionRepository extends HpkRepository<ChatSession> {

    private final int maxHistory;

    public ChatSessionRepository(RepositorySupport support, @Value("${app.chat.max-history:100}") int maxHistory) {
        super(EntityFamily.CHAT_SESSION, ChatSession.class, support);
        if (maxHistory < 1) {
            throw new IllegalArgumentException("app.chat.max-history must be positive");
        }
        this.maxHistory = maxHistory;
    }

    @Override
    protected String[] keyFieldsOf(ChatSession session) {
        return new String[] {session.getTenantId(), session.getUserId(), session.getSessionId()};
    }

    @Override
    protected void validate(ChatSession session) {
        if (session.getMessages() == null) {
            session.setMessages(new ArrayList<>());
        }
        for (ChatMessage message : session.getMessages()) {
            require("ChatMessage", "role", message.getRole());
            require("ChatMessage", "content", message.getContent());
        }
        if (session.getMessageCount() == null) {
            session.setMessageCount(session.getMessages().size());
        }
        if (session.getTokenUsage() == null) {
            session.setTokenUsage(TokenUsage.builder().build());
        }
        if (session.getLastActivityAt() == null) {
            session.setLastActivityAt(support.getClock().instant());
        }
    }

    /**
     * Read-modify-write append. Only the most recent messages are retained; {@code messageCount}
     * and token usage keep counting trimmed ones.
     */
    public ChatSession appendMessage(String tenantId, String userId, String sessionId, ChatMessage message) {
        return appendMessage(tenantId, userId, sessionId, message, OperationContext.none());
    }

    public ChatSession appendMessage(String tenantId, String userId, String sessionId, ChatMessage message,
                                     OperationContext context) {
        require("ChatMessage", "role", message.getRole());
        require("ChatMessage", "content", message.getContent());
        ChatSession session = requireExisting(context, false, tenantId, userId, sessionId);
        Instant now = support.getClock().instant();

        ChatMessage appended = message.toBuilder()
                .messageId(message.getMessageId() == null ? UUID.randomUUID().toString() : message.getMessageId())
                .timestamp(message.getTimestamp() == null ? now : message.getTimestamp())
                .build();
        List<ChatMessage> messages = new ArrayList<>(session.getMessages());
        messages.add(appended);
        if (messages.size() > maxHistory) {
            messages = new ArrayList<>(messages.subList(messages.size() - maxHistory, messages.size()));
        }
        session.setMessages(messages);
        session.setMessageCount(session.getMessageCount() + 1);
        if (appended.getTokenCount() != null) {
            session.getTokenUsage().add(appended.getRole(), appended.getTokenCount());
        }
        session.setLastActivityAt(now);
        return update(session, session.getVersion(), context);
    }

    /** A user's sessions, most recently active first. */
    public QueryPage<ChatSession> listSessions(String tenantId, String userId, Integer pageSize, String continuationToken) {
        QueryRequest request = QueryRequest.builder()
                .tenantId(tenantId)
                .scopeValue(userId)
                .sort(SortOrder.desc("lastActivityAt"))
                .pageSize(pageSize)
                .continuationToken(continuationToken)
                .build();
        return query(request);
    }
}
