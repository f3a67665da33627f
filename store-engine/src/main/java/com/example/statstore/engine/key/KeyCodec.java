package com.example.statstore.engine.key;

import com.example.statstore.engine.error.UnrecognizedKeyException;

import java.util.Optional;

// Keys are NS::FIELD::label. Field names never contain the separator, labels may.
public final class KeyCodec {

    public static final String SEPARATOR = "::";

    private final String namespace;
    private final String keyPrefix;

    public KeyCodec(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (namespace.contains(SEPARATOR)) {
            throw new IllegalArgumentException("namespace must not contain '" + SEPARATOR + "': " + namespace);
        }
        this.namespace = namespace;
        this.keyPrefix = namespace + SEPARATOR;
    }

    public String getNamespace() {
        return namespace;
    }

    public String encode(String label, StatField field) {
        return keyPrefix + field.name() + SEPARATOR + label;
    }

    public String contextKey(String contextId) {
        return encode(contextId, StatField.CONTEXTS);
    }

    public DecodedKey decode(String key) {
        return tryDecode(key).orElseThrow(() -> new UnrecognizedKeyException(key));
    }

    public Optional<DecodedKey> tryDecode(String key) {
        if (key == null || !key.startsWith(keyPrefix)) {
            return Optional.empty();
        }
        String rest = key.substring(keyPrefix.length());
        int end = rest.indexOf(SEPARATOR);
        if (end < 0) {
            return Optional.empty();
        }
        String label = rest.substring(end + SEPARATOR.length());
        return StatField.fromSegment(rest.substring(0, end))
                .map(field -> new DecodedKey(label, field));
    }

    /**
     * Store-side glob over the COUNT keys of every label matching {@code labelGlob}. The namespace
     * is escaped so that glob characters in it only ever match themselves.
     */
    public String labelPattern(String labelGlob) {
        String glob = labelGlob == null || labelGlob.isEmpty() ? "*" : labelGlob;
        return escapeGlob(keyPrefix) + StatField.COUNT.name() + SEPARATOR + glob;
    }

    static String escapeGlob(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
