package com.flamingo.ai.recall.service.extraction;

/** One completed dialogue turn as handed to the write path. */
public record TurnContext(
    String userId,
    String conversationId,
    int turnNumber,
    String userMessage,
    String assistantMessage) {}
