package com.automate.ScanOps.command;

import com.automate.ScanOps.Models.ParameterType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a manifest command template into an argument vector.
 * <p>
 * Pure and total: parameters are expected to be validated already, anything that does not
 * resolve is dropped rather than rejected. The output is an argv list, never a shell string.
 */
@Component
public class CommandBuilder {

    public static final String TARGET_PLACEHOLDER = "{{target}}";
    public static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");
    private static final Pattern BARE_PLACEHOLDER = Pattern.compile("^\\{\\{(\\w+)\\}\\}$");

    public enum TokenKind {
        LITERAL,
        TARGET,
        BARE_PLACEHOLDER,
        EMBEDDED_PLACEHOLDER
    }

    public static TokenKind classify(String token) {
        if (TARGET_PLACEHOLDER.equals(token)) {
            return TokenKind.TARGET;
        }
        if (BARE_PLACEHOLDER.matcher(token).matches()) {
            return TokenKind.BARE_PLACEHOLDER;
        }
        if (PLACEHOLDER.matcher(token).find()) {
            return TokenKind.EMBEDDED_PLACEHOLDER;
        }
        return TokenKind.LITERAL;
    }

    public List<String> build(List<String> template, Map<String, Object> params, String target) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        Map<String, Object> values = params == null ? Map.of() : params;
        List<String> argv = new ArrayList<>(template.size());

        for (String token : template) {
            if (token == null) {
                continue;
            }
            switch (classify(token)) {
                case TARGET -> argv.add(target);
                case BARE_PLACEHOLDER -> expandBare(token, values, argv);
                case EMBEDDED_PLACEHOLDER -> expandEmbedded(token, values, target, argv);
                case LITERAL -> argv.add(token);
            }
        }
        return Collections.unmodifiableList(argv);
    }

    private void expandBare(String token, Map<String, Object> values, List<String> argv) {
        Matcher m = BARE_PLACEHOLDER.matcher(token);
        if (!m.matches()) {
            return;
        }
        Object value = values.get(m.group(1));
        // a bare boolean has no literal text around it, so it never reaches argv;
        // flags are written as "-O{{osDetection}}" and handled as embedded tokens
        if (value == null || value instanceof Boolean) {
            return;
        }
        String text = ParameterType.stringify(value);
        if (!text.isEmpty()) {
            argv.add(text);
        }
    }

    private void expandEmbedded(String token, Map<String, Object> values, String target, List<String> argv) {
        Matcher m = PLACEHOLDER.matcher(token);
        StringBuilder out = new StringBuilder();
        boolean resolved = false;
        while (m.find()) {
            String name = m.group(1);
            Object value = "target".equals(name) ? target : values.get(name);
            String replacement;
            if (value instanceof Boolean flag) {
                // true keeps the surrounding literal as the flag; false counts as absent
                replacement = "";
                resolved |= flag;
            } else if (value == null || (value instanceof String s && s.isEmpty())) {
                replacement = "";
            } else {
                replacement = ParameterType.stringify(value);
                resolved = true;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);

        String composite = out.toString();
        if (resolved && !composite.isBlank()) {
            argv.add(composite);
        }
    }
}
