package com.ivamare.topicbus.backend;

import java.util.regex.Pattern;

/**
 * Glob-style topic matcher using the same rules as Redis pattern subscriptions:
 * {@code *} matches any run of characters, {@code ?} matches one character.
 */
public final class TopicPattern {

    private final String pattern;
    private final Pattern regex;

    private TopicPattern(String pattern) {
        this.pattern = pattern;
        this.regex = Pattern.compile(toRegex(pattern));
    }

    public static TopicPattern compile(String pattern) {
        return new TopicPattern(pattern);
    }

    public boolean matches(String topic) {
        return regex.matcher(topic).matches();
    }

    public boolean isWildcard() {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
    }

    public String pattern() {
        return pattern;
    }

    private static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
