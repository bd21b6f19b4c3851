package com.purchasingpower.bookflow.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LlmProperties {

    /** Active generative provider: ollama or openai. */
    @NotBlank
    private String provider = "ollama";

    private double classificationTemperature = 0.0;

    private int classificationMaxTokens = 50;

    private double responseTemperature = 0.3;

    private int responseMaxTokens = 300;
}
