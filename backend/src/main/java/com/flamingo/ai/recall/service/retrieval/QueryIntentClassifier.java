package com.flamingo.ai.recall.service.retrieval;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.enums.QueryIntent;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Rule-based classification of a query into GREETING, BROAD or SPECIFIC. */
@Component
@RequiredArgsConstructor
public class QueryIntentClassifier {

  private static final int GREETING_MAX_WORDS = 5;

  private static final List<String> GREETING_PHRASES =
      List.of(
          "hi", "hello", "hey", "hiya", "howdy", "greetings", "good morning", "good afternoon",
          "good evening", "good day", "what's up", "whats up", "sup", "yo");

  // Words that carry no topic on their own
  private static final Set<String> FILLER_WORDS =
      Set.of(
          "hi", "hello", "hey", "hiya", "yo", "sup", "there", "ok", "okay", "k", "yes", "yeah",
          "yep", "no", "nope", "sure", "thanks", "thank", "thx", "you", "cool", "nice", "great",
          "good", "fine", "alright", "right", "lol", "haha", "hmm", "um", "uh", "well", "so",
          "and", "or", "but", "then", "the", "a", "an", "it", "that", "this", "is", "are", "was",
          "what", "how", "why", "who", "tell", "me", "something", "anything", "more", "else",
          "please", "go", "on", "continue", "again", "huh", "really", "wow", "bye", "morning",
          "afternoon", "evening", "day", "up", "what's", "whats", "i", "see", "got", "do", "to");

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}'\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final MemoryConfig memoryConfig;

  public QueryIntent classify(String query, RetrievalHint hint) {
    if (hint != null && hint.forcedIntent() != null) {
      return hint.forcedIntent();
    }

    String normalized = normalize(query);
    if (normalized.isEmpty()) {
      return QueryIntent.BROAD;
    }
    String[] words = WHITESPACE.split(normalized);

    if (words.length <= GREETING_MAX_WORDS && startsWithGreeting(normalized) && isEarly(hint)) {
      return QueryIntent.GREETING;
    }
    if (words.length <= memoryConfig.getRetrieval().getBroadMaxWords()
        && Arrays.stream(words).allMatch(FILLER_WORDS::contains)) {
      return QueryIntent.BROAD;
    }
    return QueryIntent.SPECIFIC;
  }

  private boolean isEarly(RetrievalHint hint) {
    if (hint == null || hint.turnNumber() == null) {
      return true;
    }
    return hint.turnNumber() <= memoryConfig.getRetrieval().getGreetingTurnWindow();
  }

  private static boolean startsWithGreeting(String normalized) {
    for (String phrase : GREETING_PHRASES) {
      if (normalized.equals(phrase) || normalized.startsWith(phrase + " ")) {
        return true;
      }
    }
    return false;
  }

  static String normalize(String query) {
    if (query == null) {
      return "";
    }
    String stripped = NON_WORD.matcher(query.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }
}
