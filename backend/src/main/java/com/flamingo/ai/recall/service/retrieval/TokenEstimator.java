package com.flamingo.ai.recall.service.retrieval;

import com.flamingo.ai.recall.domain.entity.Memory;

/** Rough token count of a memory as rendered into a prompt. */
public final class TokenEstimator {

  private static final int CHARS_PER_TOKEN = 4;

  // Bullet, type label and separators around each rendered line
  private static final int LINE_OVERHEAD_TOKENS = 6;

  private TokenEstimator() {}

  public static int estimate(Memory memory) {
    int chars = memory.getContent() == null ? 0 : memory.getContent().length();
    return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN + LINE_OVERHEAD_TOKENS;
  }
}
