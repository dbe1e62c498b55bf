package org.carball.gantry.ai;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test oracle answering per field group, identified from the prompt header.
 */
public class ScriptedOracle implements TextGenerationOracle {

    private static final String GROUP_HEADER = "## Field group: ";

    private final Map<String, Map<String, Object>> responses = new HashMap<>();
    private final Map<String, OracleException> failures = new HashMap<>();
    private final List<String> prompts = new ArrayList<>();

    public ScriptedOracle respond(String group, Map<String, Object> response) {
        responses.put(group, response);
        return this;
    }

    public ScriptedOracle fail(String group, OracleException failure) {
        failures.put(group, failure);
        return this;
    }

    @Override
    public synchronized Map<String, Object> generate(String prompt) throws OracleException {
        prompts.add(prompt);
        String group = groupOf(prompt);
        if (failures.containsKey(group)) {
            throw failures.get(group);
        }
        Map<String, Object> response = responses.get(group);
        if (response == null) {
            throw new OracleException("No scripted response for group " + group);
        }
        return new HashMap<>(response);
    }

    @Override
    public String name() {
        return "scripted";
    }

    public synchronized List<String> getPrompts() {
        return List.copyOf(prompts);
    }

    static String groupOf(String prompt) {
        int start = prompt.indexOf(GROUP_HEADER);
        if (start < 0) {
            return "";
        }
        int end = prompt.indexOf('\n', start);
        return prompt.substring(start + GROUP_HEADER.length(), end < 0 ? prompt.length() : end).trim();
    }
}
