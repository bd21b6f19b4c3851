package com.purchasingpower.bookflow.configuration;

import lombok.Data;

/**
 * OpenAI-compatible chat completions endpoint.
 */
@Data
public class OpenAiProperties {

    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "gpt-4o-mini";

    private int timeoutSeconds = 60;
}
