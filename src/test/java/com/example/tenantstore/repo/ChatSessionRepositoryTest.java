package com.example.tenantstore.repo;

import com.example.tenantstore.exception.AlreadyExistsException;
import com.example.tenantstore.exception.EntityNotFoundException;
import com.example.tenantstore.exception.ErrorKind;
import com.example.tenantstore.exception.PartitionMismatchException;
import com.example.tenantstore.exception.VersionConflictException;
import com.example.tenantstore.model.ChatMessage;
import com.example.tenantstore.model.ChatSession;
import com.example.tenantstore.model.MessageRole;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.store.DocumentStore;
import com.example.tenantstore.store.InMemoryDocumentStore;
import com.example.tenantstore.store.QueryPage;
import com.example.tenantstore.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ChatSessionRepositoryTest {

    private InMemoryDocumentStore store;
    private RepositoryFixture fixture;
    private ChatSessionRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        fixture = new RepositoryFixture(store);
        repository = new ChatSessionRepository(fixture.support, 100);
    }

    @Test
    void testCreateGetUpdate_StaleVersionConflicts() {
        // Given
        repository.create(session("t1", "u1", "s1"));

        // When
        ChatSession loaded = repository.get("t1", "u1", "s1").orElseThrow();

        // Then
        assertEquals(1L, loaded.getVersion());
        assertEquals("s1", loaded.getId());
        assertEquals("chat/t1/u1/s1", loaded.getPartitionKey());

        // When
        ChatSession stale = repository.get("t1", "u1", "s1").orElseThrow();
        loaded.getMessages().add(message(MessageRole.USER, "hello"));
        fixture.clock.advance(Duration.ofSeconds(1));
        ChatSession updated = repository.update(loaded, 1);

        // Then
        assertEquals(2L, updated.getVersion());
        assertEquals(1, updated.getMessages().size());

        // When
        stale.setTitle("overwritten");
        VersionConflictException conflict = assertThrows(VersionConflictException.class, () -> repository.update(stale, 1));

        // Then
        assertEquals(ErrorKind.VERSION_CONFLICT, conflict.getKind());
        ChatSession stored = repository.get("t1", "u1", "s1").orElseThrow();
        assertEquals(2L, stored.getVersion());
        assertNotEquals("overwritten", stored.getTitle());
    }

    @Test
    void testUpdate_VersionIsOnePlusNumberOfUpdates() {
        ChatSession current = repository.create(session("t1", "u1", "s1"));

        for (int i = 0; i < 5; i++) {
            current.setTitle("title " + i);
            current = repository.update(current, current.getVersion());
        }

        assertEquals(6L, current.getVersion());
        assertEquals(6L, repository.get("t1", "u1", "s1").orElseThrow().getVersion());
    }

    @Test
    void testUpdate_StampsMonotonicTimestamps() {
        // Given
        ChatSession created = repository.create(session("t1", "u1", "s1"));

        // When
        ChatSession updated = repository.update(created, 1);

        // Then
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertTrue(updated.getUpdatedAt().isAfter(created.getUpdatedAt()));
    }

    @Test
    void testUpdate_KeepsServerOwnedFieldsFromStoredRecord() {
        // Given
        ChatSession created = repository.create(session("t1", "u1", "s1"));
        fixture.clock.advance(Duration.ofSeconds(5));
        ChatSession rebuilt = ChatSession.builder()
                .tenantId("t1")
                .userId("u1")
                .sessionId("s1")
                .title("renamed")
                .createdBy("someone-else")
                .build();

        // When
        ChatSession updated = repository.update(rebuilt, 1);

        // Then
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertEquals("u1", updated.getCreatedBy());
        assertEquals("renamed", updated.getTitle());
        Map<String, Object> raw = store.documents("chats").iterator().next();
        assertEquals(created.getCreatedAt().toEpochMilli(), ((Number) raw.get("createdAt")).longValue());
        assertEquals("u1", raw.get("createdBy"));
    }

    @Test
    void testUpdate_CannotClearSoftDeleteFlag() {
        repository.create(session("t1", "u1", "s1"));
        ChatSession deleted = repository.softDelete("t1", "u1", "s1");

        deleted.setIsDeleted(false);
        deleted.setDeletedAt(null);
        ChatSession updated = repository.update(deleted, deleted.getVersion());

        assertTrue(updated.isSoftDeleted());
        assertTrue(deleted.getUpdatedAt().isBefore(updated.getUpdatedAt()));
        assertNotNull(updated.getDeletedAt());
        assertTrue(repository.get("t1", "u1", "s1").isEmpty());
    }

    @Test
    void testCount_ScopedToTenantAndUserAndExcludesDeleted() {
        // Given
        repository.create(session("t1", "u1", "s1"));
        repository.create(session("t1", "u1", "s2"));
        repository.create(session("t1", "u2", "s3"));
        repository.create(session("t2", "u1", "s4"));
        repository.softDelete("t1", "u1", "s2");

        // When
        long forUser = repository.count(QueryRequest.builder().tenantId("t1").scopeValue("u1").build());
        long forTenant = repository.count(QueryRequest.forTenant("t1"));
        long withDeleted = repository.count(QueryRequest.builder().tenantId("t1").includeDeleted(true).build());

        // Then
        assertEquals(1, forUser);
        assertEquals(2, forTenant);
        assertEquals(3, withDeleted);
        assertEquals("tenantId", store.getQueries().get(0).getPredicates().get(0).getField());
    }

    @Test
    void testCreate_DoesNotMutateCallerEntity() {
        ChatSession input = session("t1", "u1", "s1");

        ChatSession created = repository.create(input);

        assertNull(input.getVersion());
        assertNull(input.getCreatedAt());
        assertEquals(1L, created.getVersion());
        assertEquals(fixture.clock.instant(), created.getCreatedAt());
    }

    @Test
    void testCreate_TwiceStoresOneAndSurfacesAlreadyExists() {
        repository.create(session("t1", "u1", "s1"));

        assertThrows(AlreadyExistsException.class, () -> repository.create(session("t1", "u1", "s1")));
        assertEquals(1, store.size("chats"));
    }

    @Test
    void testCreate_RetryAfterDroppedResponseSurfacesAlreadyExists() {
        // Given a store that persists the first create but loses the response
        InMemoryDocumentStore flaky = new InMemoryDocumentStore() {
            private boolean dropped;

            @Override
            public synchronized Map<String, Object> create(String container, Map<String, Object> document, String partitionKey) {
                Map<String, Object> stored = super.create(container, document, partitionKey);
                if (!dropped) {
                    dropped = true;
                    throw new StoreException(StoreException.SERVICE_UNAVAILABLE, "connection reset after write");
                }
                return stored;
            }
        };
        ChatSessionRepository flakyRepository = new ChatSessionRepository(new RepositoryFixture(flaky).support, 100);

        // When
        AlreadyExistsException e = assertThrows(AlreadyExistsException.class,
                () -> flakyRepository.create(session("t1", "u1", "s1")));

        // Then
        StoreException cause = assertInstanceOf(StoreException.class, e.getCause());
        assertEquals(StoreException.CONFLICT, cause.getStatusCode());
        assertEquals(2, cause.getAttempts());
        assertEquals(1, flaky.size("chats"));
    }

    @Test
    void testGet_AbsentIsEmptyNotError() {
        assertTrue(repository.get("t1", "u1", "missing").isEmpty());
        assertFalse(repository.exists("t1", "u1", "missing"));
    }

    @Test
    void testGet_WrongArityFailsBeforeReachingStore() {
        DocumentStore mocked = mock(DocumentStore.class);
        ChatSessionRepository guarded = new ChatSessionRepository(new RepositoryFixture(mocked).support, 100);

        assertThrows(PartitionMismatchException.class, () -> guarded.get("t1", "u1"));
        assertThrows(PartitionMismatchException.class, () -> guarded.get("t1", "u1", "s1", "extra"));

        verifyNoInteractions(mocked);
    }

    @Test
    void testUpdate_ChangingTenantIsRejected() {
        ChatSession created = repository.create(session("t1", "u1", "s1"));

        created.setTenantId("t2");

        assertThrows(PartitionMismatchException.class, () -> repository.update(created, 1));
        assertTrue(repository.get("t2", "u1", "s1").isEmpty());
    }

    @Test
    void testUpdate_MissingEntityIsNotFound() {
        assertThrows(EntityNotFoundException.class, () -> repository.update(session("t1", "u1", "ghost"), 1));
    }

    @Test
    void testSoftDelete_ExcludedFromDefaultReadsAndQueries() {
        // Given
        repository.create(session("t1", "u1", "s1"));
        repository.create(session("t1", "u1", "s2"));

        // When
        ChatSession deleted = repository.softDelete("t1", "u1", "s1");

        // Then
        assertTrue(deleted.getIsDeleted());
        assertNotNull(deleted.getDeletedAt());
        assertEquals(2L, deleted.getVersion());
        assertTrue(repository.get("t1", "u1", "s1").isEmpty());
        assertTrue(repository.getIncludingDeleted("t1", "u1", "s1").isPresent());
        assertEquals(List.of("s2"), sessionIds(repository.listSessions("t1", "u1", null, null)));

        QueryRequest withDeleted = QueryRequest.builder().tenantId("t1").scopeValue("u1").includeDeleted(true).build();
        assertEquals(2, repository.query(withDeleted).getItems().size());
        assertEquals(2, store.size("chats"));
    }

    @Test
    void testHardDelete_RemovesRecord() {
        repository.create(session("t1", "u1", "s1"));

        repository.hardDelete("t1", "u1", "s1");

        assertEquals(0, store.size("chats"));
        assertThrows(EntityNotFoundException.class, () -> repository.hardDelete("t1", "u1", "s1"));
    }

    @Test
    void testAppendMessage_TrimsHistoryButKeepsCounting() {
        // Given
        ChatSessionRepository shortHistory = new ChatSessionRepository(fixture.support, 3);
        shortHistory.create(session("t1", "u1", "s1"));

        // When
        ChatSession result = null;
        for (int i = 1; i <= 5; i++) {
            fixture.clock.advance(Duration.ofSeconds(1));
            ChatMessage m = message(i % 2 == 0 ? MessageRole.ASSISTANT : MessageRole.USER, "m" + i);
            m.setTokenCount(10);
            result = shortHistory.appendMessage("t1", "u1", "s1", m);
        }

        // Then
        assertEquals(3, result.getMessages().size());
        assertEquals("m3", result.getMessages().get(0).getContent());
        assertEquals("m5", result.getMessages().get(2).getContent());
        assertEquals(5, result.getMessageCount());
        assertEquals(50, result.getTokenUsage().getTotalTokens());
        assertEquals(20, result.getTokenUsage().getCompletionTokens());
        assertEquals(6L, result.getVersion());
        assertEquals(fixture.clock.instant(), result.getLastActivityAt());
        assertNotNull(result.getMessages().get(2).getMessageId());
    }

    @Test
    void testListSessions_PagesWithinTenantAndUser() {
        // Given
        for (int i = 0; i < 5; i++) {
            fixture.clock.advance(Duration.ofMinutes(1));
            repository.create(session("t1", "u1", "s" + i));
        }
        repository.create(session("t2", "u1", "other-tenant"));
        repository.create(session("t1", "u2", "other-user"));

        // When
        List<String> seen = new ArrayList<>();
        String token = null;
        int pages = 0;
        do {
            QueryPage<ChatSession> page = repository.listSessions("t1", "u1", 2, token);
            assertTrue(page.getItems().size() <= 2);
            seen.addAll(sessionIds(page));
            token = page.getContinuationToken();
            pages++;
        } while (token != null);

        // Then
        assertEquals(3, pages);
        assertEquals(List.of("s4", "s3", "s2", "s1", "s0"), seen);
    }

    private static List<String> sessionIds(QueryPage<ChatSession> page) {
        return page.getItems().stream().map(ChatSession::getSessionId).collect(Collectors.toList());
    }

    private static ChatSession session(String tenantId, String userId, String sessionId) {
        return ChatSession.builder()
                .tenantId(tenantId)
                .userId(userId)
                .sessionId(sessionId)
                .title("Benefits question")
                .createdBy(userId)
                .build();
    }

    private static ChatMessage message(MessageRole role, String content) {
        return ChatMessage.builder().role(role).content(content).build();
    }
}
