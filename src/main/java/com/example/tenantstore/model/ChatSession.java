package com.example.tenantstore.model;

import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ChatSession extends BaseEntity {
    private String userId;
    private String sessionId;
    private String projectId;
    private String title;

    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    /** Counts every message ever appended, including ones trimmed from {@link #messages}. */
    private Integer messageCount;
    private TokenUsage tokenUsage;
    private Instant lastActivityAt;
}
