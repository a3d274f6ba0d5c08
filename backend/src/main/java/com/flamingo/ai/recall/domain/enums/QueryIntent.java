package com.flamingo.ai.recall.domain.enums;

/** How a retrieval query should be served. */
public enum QueryIntent {
  /** Conversation opener: serve the user's profile without similarity search. */
  GREETING,

  /** Short, generic message: inject no memory context. */
  BROAD,

  /** Anything else: full hybrid search. */
  SPECIFIC
}
