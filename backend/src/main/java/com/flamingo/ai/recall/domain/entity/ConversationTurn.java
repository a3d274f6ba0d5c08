package com.flamingo.ai.recall.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One completed user/assistant exchange, kept for extraction grounding. */
@Entity
@Table(
    name = "conversation_turns",
    indexes =
        @Index(
            name = "uk_turns_conversation_number",
            columnList = "conversation_id, turn_number",
            unique = true))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String userId;

  @Column(name = "conversation_id", nullable = false)
  private String conversationId;

  @Column(name = "turn_number", nullable = false)
  private int turnNumber;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String userMessage;

  @Column(columnDefinition = "TEXT")
  private String assistantMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
