package com.clawcron.app.commands;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shell-style argument splitting and option parsing shared by command
 * handlers.
 */
public final class CommandArgs {

    private static final Pattern PLAIN_TOKEN = Pattern.compile("[A-Za-z0-9_./:@%+=,*-]+");

    private CommandArgs() {
    }

    /**
     * Split a command line into tokens. Supports single quotes (literal),
     * double quotes (with {@code \"} and {@code \\} escapes) and backslash
     * escapes outside quotes.
     *
     * @throws IllegalArgumentException on an unterminated quote
     */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int end = line.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("unterminated single quote");
                }
                current.append(line, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i++;
                boolean closed = false;
                while (i < line.length()) {
                    char d = line.charAt(i);
                    if (d == '\\' && i + 1 < line.length()
                            && (line.charAt(i + 1) == '"' || line.charAt(i + 1) == '\\')) {
                        current.append(line.charAt(i + 1));
                        i += 2;
                    } else if (d == '"') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        current.append(d);
                        i++;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException("unterminated double quote");
                }
                inToken = true;
            } else if (c == '\\' && i + 1 < line.length()) {
                current.append(line.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Join tokens into a line that {@link #tokenize(String)} splits back into
     * the same tokens.
     */
    public static String join(List<String> tokens) {
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            if (PLAIN_TOKEN.matcher(token).matches()) {
                sb.append(token);
            } else {
                sb.append('\'').append(token.replace("'", "'\\''")).append('\'');
            }
        }
        return sb.toString();
    }

    /**
     * Options and positionals of a tokenized command.
     *
     * @param options    option name (without dashes, aliases resolved) to value;
     *                   flags map to {@code "true"}
     * @param positional remaining arguments in order
     */
    public record Parsed(Map<String, String> options, List<String> positional) {

        public String option(String name) {
            return options.get(name);
        }

        public boolean flag(String name) {
            return "true".equals(options.get(name));
        }
    }

    /**
     * Parse {@code --name value}, {@code --name=value} and boolean flags.
     *
     * @param flags   option names that take no value
     * @param aliases alternative spellings (e.g. {@code n -> name})
     * @throws IllegalArgumentException when an option is missing its value
     */
    public static Parsed parse(List<String> tokens, Set<String> flags, Map<String, String> aliases) {
        Map<String, String> options = new HashMap<>();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (!token.startsWith("-") || token.equals("-") || isNumber(token)) {
                positional.add(token);
                continue;
            }
            String name = token.startsWith("--") ? token.substring(2) : token.substring(1);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            name = aliases.getOrDefault(name, name);

            if (flags.contains(name)) {
                options.put(name, inlineValue != null ? inlineValue : "true");
            } else if (inlineValue != null) {
                options.put(name, inlineValue);
            } else if (i + 1 < tokens.size()) {
                options.put(name, tokens.get(++i));
            } else {
                throw new IllegalArgumentException("option --" + name + " requires a value");
            }
        }
        return new Parsed(options, positional);
    }

    private static boolean isNumber(String token) {
        return token.length() > 1 && token.substring(1).chars().allMatch(Character::isDigit);
    }
}
