package com.flamingo.ai.recall.service.retrieval;

import com.flamingo.ai.recall.domain.enums.QueryIntent;

/**
 * Optional caller context for a retrieval.
 *
 * @param turnNumber turn the query belongs to, null when unknown
 * @param forcedIntent intent to use instead of classifying, null to classify
 */
public record RetrievalHint(Integer turnNumber, QueryIntent forcedIntent) {

  public static RetrievalHint none() {
    return new RetrievalHint(null, null);
  }

  public static RetrievalHint atTurn(int turnNumber) {
    return new RetrievalHint(turnNumber, null);
  }
}
