/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.agentform.integration.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.exceptions.ValidationException;

import java.util.Map;

/**
 * {@link LlmWorkflow} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>
 * Each workflow is a single prompt that embeds the inputs as JSON and asks for a JSON object back. Markdown code
 * fences around the reply are stripped before parsing.
 *
 * <p>
 * <b>Workflows:</b>
 * <ul>
 * <li>{@value LlmWorkflow#RESPONSE_ANALYSIS}: sentiment, quality, insights and flags for one answer</li>
 * <li>{@value LlmWorkflow#DYNAMIC_QUESTION}: one follow-up question derived from a source answer</li>
 * </ul>
 */
@ApplicationScoped
public class ChatModelLlmWorkflow implements LlmWorkflow {

    private static final Logger LOG = Logger.getLogger(ChatModelLlmWorkflow.class);

    private static final TypeReference<Map<String, Object>> OUTPUT_TYPE = new TypeReference<>() {
    };

    private static final String RESPONSE_ANALYSIS_PROMPT = """
            You analyze answers submitted to an online form.

            INSTRUCTIONS:
            1. Judge the sentiment of the answer (label positive, negative, neutral or mixed; confidence 0.0-1.0;
               score -1.0 to 1.0; one sentence of reasoning)
            2. Score answer quality (completeness, relevance, clarity, overall_score, each 0.0-1.0) and list issues
               and strengths
            3. Extract up to 3 insights as objects with text, confidence and category
            4. Set flags: needs_review, potential_spam, incomplete_answer, unusual_pattern, high_quality

            INPUT:
            %s

            Respond with ONLY valid JSON in this exact format (no markdown, no explanation):
            {
              "sentiment": {"label": "positive", "confidence": 0.8, "score": 0.6, "reasoning": "..."},
              "quality": {"completeness": 0.7, "relevance": 0.9, "clarity": 0.8, "overall_score": 0.8,
                          "issues": [], "strengths": ["specific"]},
              "insights": [{"text": "...", "confidence": 0.7, "category": "general"}],
              "flags": {"needs_review": false, "potential_spam": false, "incomplete_answer": false,
                        "unusual_pattern": false, "high_quality": true}
            }
            """;

    private static final String DYNAMIC_QUESTION_PROMPT = """
            You write one follow-up question for a respondent filling in an online form.

            INSTRUCTIONS:
            1. Read the source question and the respondent's answer
            2. Ask for a clarification or a deeper detail; never repeat the source question
            3. Pick a strategy type: clarify, expand, example or quantify
            4. Keep the question under 25 words

            INPUT:
            %s

            Respond with ONLY valid JSON in this exact format (no markdown, no explanation):
            {
              "title": "What made that experience stand out?",
              "question_type": "text_short",
              "strategy": {"type": "expand", "reasoning": "..."}
            }
            """;

    @Inject
    ChatModel chatModel;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public WorkflowExecution execute(String workflowName, Map<String, Object> inputs) {
        String prompt = buildPrompt(workflowName, inputs);
        LOG.debugf("Sending %s workflow request (%d prompt chars)", workflowName, prompt.length());

        String response = chatModel.chat(prompt);

        try {
            Map<String, Object> output = objectMapper.readValue(stripCodeFences(response), OUTPUT_TYPE);
            if (output == null) {
                LOG.warnf("Workflow %s returned a null JSON document", workflowName);
                return WorkflowExecution.failed("LLM output is not a JSON object", "invalid_output");
            }
            LOG.debugf("Workflow %s returned keys %s", workflowName, output.keySet());
            return WorkflowExecution.succeeded(output);
        } catch (JsonProcessingException e) {
            LOG.warnf("Workflow %s returned unparseable output: %s", workflowName, response);
            return WorkflowExecution.failed("LLM output is not valid JSON: " + e.getOriginalMessage(),
                    "invalid_output");
        }
    }

    private String buildPrompt(String workflowName, Map<String, Object> inputs) {
        String template = switch (workflowName) {
            case RESPONSE_ANALYSIS -> RESPONSE_ANALYSIS_PROMPT;
            case DYNAMIC_QUESTION -> DYNAMIC_QUESTION_PROMPT;
            default -> throw new ValidationException("Unknown LLM workflow: " + workflowName);
        };
        try {
            return String.format(template, objectMapper.writeValueAsString(inputs));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Workflow inputs are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    static String stripCodeFences(String response) {
        String json = response == null ? "" : response.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.trim();
    }
}
