package com.purchasingpower.bookflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "llama3.2";

    @NotBlank
    private String embeddingModel = "all-minilm";

    private int timeoutSeconds = 60;

    private int maxRetries = 2;
}
