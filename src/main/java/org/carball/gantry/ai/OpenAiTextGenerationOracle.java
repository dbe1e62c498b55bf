package org.carball.gantry.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.ChatCompletion;
import com.openai.models.ChatCompletionCreateParams;
import com.openai.models.ResponseFormatJsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Oracle backed by the OpenAI chat completions API in JSON mode.
 *
 * <p>Calls are not bounded here; the decomposer enforces the per-call timeout.
 */
@Slf4j
public class OpenAiTextGenerationOracle implements TextGenerationOracle {

    private static final String SYSTEM_PROMPT = """
        You generate fields of highway toll-gantry transaction records for the
        Yunnan expressway network. Each request names a group of fields, the
        constraints they must satisfy and the values already generated for the
        same record. Stay consistent with those values.
        
        Respond ONLY with a single JSON object holding exactly the requested
        fields. Do not include any text before or after the JSON object.
        """;

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final OpenAIClient openAiClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiTextGenerationOracle(String apiKey, String model, double temperature, int maxTokens) {
        this(OpenAIOkHttpClient.builder()
                        .apiKey(apiKey)
                        .build(),
                model, temperature, maxTokens);
    }

    OpenAiTextGenerationOracle(OpenAIClient openAiClient, String model, double temperature, int maxTokens) {
        this.openAiClient = openAiClient;
        this.objectMapper = new ObjectMapper();
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    /**
     * Creates the OpenAI-backed oracle, or returns null when AI is disabled with
     * {@code -Dskip.ai=true} or no API key is available.
     */
    public static OpenAiTextGenerationOracle createIfEnabled(String apiKey, String model, double temperature,
                                                             int maxTokens) {
        if ("true".equals(System.getProperty("skip.ai"))) {
            log.info("Skipping AI generation (skip.ai=true), all field groups use rule-based generation");
            return null;
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No OpenAI API key configured, all field groups use rule-based generation");
            return null;
        }
        return new OpenAiTextGenerationOracle(apiKey, model, temperature, maxTokens);
    }

    @Override
    public Map<String, Object> generate(String prompt) throws OracleException {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(prompt)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        log.trace("User prompt:\n{}", prompt);

        String response;
        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params);
            if (completion.choices().isEmpty()) {
                throw new InvalidOracleResponseException("No choices in response from " + model);
            }
            response = completion.choices().get(0).message().content().orElse("");
        } catch (RuntimeException e) {
            throw new OracleException("OpenAI request failed: " + e.getMessage(), e);
        }
        if (response == null || response.isBlank()) {
            throw new InvalidOracleResponseException("Empty response from " + model);
        }

        log.trace("OpenAI response:\n{}", response);
        return parse(response);
    }

    Map<String, Object> parse(String response) throws InvalidOracleResponseException {
        String json = cleanJsonResponse(response);
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, OBJECT_TYPE);
            if (parsed == null) {
                throw new InvalidOracleResponseException("Response is JSON null");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new InvalidOracleResponseException("Response is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    static String cleanJsonResponse(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        }
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    @Override
    public String name() {
        return "openai:" + model;
    }
}
