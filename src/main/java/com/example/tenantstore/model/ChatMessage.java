package com.example.tenantstore.model;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ChatMessage {
    private String messageId;
    private MessageRole role;
    private String content;
    private Instant timestamp;
    private Integer tokenCount;
    private List<MessageSource> sources;
}
