package com.flamingo.ai.recall.service.extraction;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/** Normalizes memory content and hashes it for exact-duplicate detection. */
public final class ContentHasher {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private ContentHasher() {}

  /** Lower-cased, trimmed, internal whitespace collapsed to single spaces. */
  public static String normalize(String content) {
    return WHITESPACE.matcher(content.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
  }

  /** Hex SHA-256 of the normalized content. */
  public static String hash(String content) {
    return Hashing.sha256().hashString(normalize(content), StandardCharsets.UTF_8).toString();
  }
}
