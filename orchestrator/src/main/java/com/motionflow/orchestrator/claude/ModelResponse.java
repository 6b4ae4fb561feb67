package com.motionflow.orchestrator.claude;

/** Assistant text plus the token usage the call is billed for. */
public record ModelResponse(String text, long inputTokens, long outputTokens) {}
