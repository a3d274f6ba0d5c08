package com.flamingo.ai.recall.agent;

import com.flamingo.ai.recall.agent.dto.ConflictClassification;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that decides, in a single call, whether a new statement contradicts any of the user's
 * existing memories across all categories the statement touches.
 */
public interface ConflictClassificationAgent {

  @SystemMessage(
      """
        You are a contradiction detector for a long-term memory store.

        You receive one NEW statement about a user and, grouped by category, the user's EXISTING
        memories in the categories the new statement touches. For every category listed, decide
        whether the new statement makes one existing memory in that category no longer true.

        Conflicts:
        - "Lives in Chennai" vs "Moved to Bangalore" (location changed)
        - "Works at Google" vs "Works at Microsoft" (job changed)
        - "Is 28 years old" vs "Is 30 years old" (age updated)
        - "Favorite color is blue" vs "Favorite color is green" (preference changed)

        Not conflicts:
        - "Likes pizza" vs "Loves pizza" (same preference)
        - "Likes pizza" vs "Likes sushi" (both can be true)
        - "Works at Google" vs "Has a dog" (unrelated)

        Return ONLY JSON of the form:
        {"verdicts": [{"category": "job", "conflict": true, "supersededId": "<existing id>"},
                      {"category": "location", "conflict": false, "supersededId": null}]}
        Use only ids that appear in the input. Give exactly one verdict per listed category.
        """)
  @UserMessage(
      """
        NEW statement ({{memoryType}}): {{content}}

        EXISTING memories by category:
        {{existingByCategory}}
        """)
  ConflictClassification classify(
      @V("memoryType") String memoryType,
      @V("content") String content,
      @V("existingByCategory") String existingByCategory);
}
