package io.github.drompincen.clawguard.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * POSIX shell-word splitting: whitespace separates words, single quotes are literal,
 * double quotes allow backslash escapes. Nothing is expanded.
 */
final class ShellTokenizer {

    private static final String DOUBLE_QUOTE_ESCAPABLE = "\"\\$`\n";

    private ShellTokenizer() {}

    static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote == '\'') {
                if (c == '\'') quote = 0;
                else current.append(c);
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < command.length()
                        && DOUBLE_QUOTE_ESCAPABLE.indexOf(command.charAt(i + 1)) >= 0) {
                    current.append(command.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= command.length()) {
                    throw new IllegalArgumentException("No escaped character");
                }
                current.append(command.charAt(++i));
                inToken = true;
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("No closing quotation");
        }
        if (inToken) tokens.add(current.toString());
        return tokens;
    }
}
