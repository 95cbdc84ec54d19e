package com.example.tenantstore.retry;

import lombok.Value;

import java.time.Duration;

@Value
public class RetryEvent {
    String operation;
    int attempt;
    Duration delay;
    ErrorClass errorClass;
    Throwable error;
}
