package com.purchasingpower.bookflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "bookflow")
public class BookFlowProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ResolverProperties resolver = new ResolverProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OpenAiProperties openai = new OpenAiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PaymentProperties payment = new PaymentProperties();
}
