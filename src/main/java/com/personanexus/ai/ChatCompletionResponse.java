/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of an OpenAI-compatible {@code /chat/completions} endpoint.
 * Only the fields the engine reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionResponse {

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<Choice> choices;

    public String getModel() {
        return model;
    }

    public List<Choice> getChoices() {
        return choices;
    }

    /**
     * Content of the first choice, or null if the response carries none.
     */
    public String firstContent() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        Choice first = choices.get(0);
        return first.getMessage() != null ? first.getMessage().getContent() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        @JsonProperty("index")
        private Integer index;

        @JsonProperty("message")
        private ChatCompletionRequest.Message message;

        @JsonProperty("finish_reason")
        private String finishReason;

        public Integer getIndex() {
            return index;
        }

        public ChatCompletionRequest.Message getMessage() {
            return message;
        }

        public String getFinishReason() {
            return finishReason;
        }
    }
}
