package com.example.statstore.engine.store.memory;

import java.util.regex.Pattern;

/**
 * Redis-style glob ({@code * ? [abc] [^a] [a-z] \x}) compiled to a regex.
 */
final class GlobPattern {

    private GlobPattern() {
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i++;
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        regex.append(Pattern.quote("\\"));
                    }
                    break;
                case '[':
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        regex.append(Pattern.quote("["));
                        break;
                    }
                    regex.append(characterClass(glob.substring(i + 1, close)));
                    i = close;
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String characterClass(String body) {
        StringBuilder sb = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("^")) {
            sb.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                sb.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.append(']').toString();
    }
}
