package com.discernus.pipeline;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.discernus.gasket.MarkerProtocol;
import com.discernus.gasket.PayloadSchema;

/**
 * Fills {@code {{inputId}}} placeholders with input artifact text and appends the
 * output-format instructions. Inputs that no placeholder mentions are appended as
 * labelled sections.
 */
public class PromptRenderer {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    public String render(String template, Map<String, String> inputs, PayloadSchema schema, MarkerProtocol protocol) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        Set<String> used = new HashSet<>();
        while (matcher.find()) {
            String id = matcher.group(1);
            String value = inputs.get(id);
            if (value == null) {
                throw new IllegalArgumentException("Prompt references {{" + id + "}} which is not a stage input");
            }
            used.add(id);
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);
        for (Map.Entry<String, String> input : inputs.entrySet()) {
            if (!used.contains(input.getKey())) {
                rendered.append("\n\n### Input: ").append(input.getKey()).append('\n').append(input.getValue());
            }
        }
        rendered.append("\n\n").append(protocol.instructions(schema));
        return rendered.toString();
    }
}
