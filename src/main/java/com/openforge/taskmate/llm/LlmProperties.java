package com.openforge.taskmate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OpenAI-compatible chat providers, read from "taskmate.llm":
 *
 * taskmate:
 *   llm:
 *     primary:
 *       name: openrouter
 *       base-url: https://openrouter.ai/api/v1
 *       api-key: ${OPENROUTER_API_KEY}
 *       model: openai/gpt-4o-mini
 *       timeout-seconds: 60
 *     fallback:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY}
 *       model: gpt-4o-mini
 */
@ConfigurationProperties(prefix = "taskmate.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("60") int timeoutSeconds
    ) {

        /** Last four characters only; used in startup logs. */
        public String maskedKey() {
            if (apiKey == null || apiKey.length() < 8) return "****";
            return "****" + apiKey.substring(apiKey.length() - 4);
        }
    }
}
