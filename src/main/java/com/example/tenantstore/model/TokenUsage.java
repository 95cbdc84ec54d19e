package com.example.tenantstore.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenUsage {
    @Builder.Default
    private long promptTokens = 0;
    @Builder.Default
    private long completionTokens = 0;
    @Builder.Default
    private long totalTokens = 0;

    public void add(MessageRole role, int tokens) {
        if (role == MessageRole.ASSISTANT) {
            completionTokens += tokens;
        } else {
            promptTokens += tokens;
        }
        totalTokens += tokens;
    }
}
