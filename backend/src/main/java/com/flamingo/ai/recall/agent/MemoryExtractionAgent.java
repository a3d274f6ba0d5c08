package com.flamingo.ai.recall.agent;

import com.flamingo.ai.recall.agent.dto.ExtractedMemory;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import java.util.List;

/**
 * AI agent for extracting long-term memories from one dialogue turn. Uses LangChain4j AI Services
 * for structured LLM interaction.
 */
public interface MemoryExtractionAgent {

  @SystemMessage(
      """
        You are a memory extraction system for a personal assistant with long-term memory.
        Analyze the latest conversation turn and extract information about the user that is
        worth remembering for future conversations.

        Memory types:
        - entity: names, identities, people, places and organizations in the user's life
        - fact: verifiable statements about the user (job, location, age, education)
        - preference: likes, dislikes, favorites, habits
        - commitment: promises, meetings, tasks, deadlines
        - episodic: notable events the user describes

        Importance levels:
        - critical: identity, close relationships, life goals
        - high: standing preferences, commitments, job and location
        - medium: ordinary facts and interests
        - low: small talk, temporary information

        Confidence: 1.0 for explicit statements, 0.8 for strong inferences, 0.6 or lower for weak
        signals.

        Rules:
        - Use the prior turns only to resolve references; extract from the latest turn only
        - Never extract the assistant's own statements, questions without information, or filler
        - Keep each memory to one concise sentence written in the third person
        - Return an empty array when nothing is worth remembering
        - Return ONLY a valid JSON array of objects
        """)
  @UserMessage(
      """
        Prior turns:
        {{priorTurns}}

        Latest turn #{{turnNumber}}:
        User: {{userMessage}}
        Assistant: {{assistantMessage}}

        Extract memories as JSON array:
        [{"type": "fact|preference|commitment|episodic|entity", "content": "...",
          "confidence": 0.0-1.0, "importanceLevel": "critical|high|medium|low",
          "tags": ["..."], "entities": ["..."]}]
        """)
  List<ExtractedMemory> extract(
      @V("priorTurns") String priorTurns,
      @V("turnNumber") int turnNumber,
      @V("userMessage") String userMessage,
      @V("assistantMessage") String assistantMessage);
}
