package ch.so.arp.docqa.store;

import ch.so.arp.docqa.exception.StoreException;

/**
 * Conversion between {@code float[]} and the pgvector text representation
 * {@code [1.0,2.0,3.0]}.
 */
final class PgVectors {

    private PgVectors() {
    }

    static String toLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder(embedding.length * 10);
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parse(String literal) {
        if (literal == null) {
            return new float[0];
        }
        String trimmed = literal.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '[' || trimmed.charAt(trimmed.length() - 1) != ']') {
            throw new StoreException("Malformed vector literal: " + abbreviate(trimmed));
        }
        String body = trimmed.substring(1, trimmed.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                vector[i] = Float.parseFloat(parts[i].trim());
            }
        } catch (NumberFormatException ex) {
            throw new StoreException("Malformed vector literal: " + abbreviate(trimmed), ex);
        }
        return vector;
    }

    private static String abbreviate(String value) {
        return value.length() > 40 ? value.substring(0, 40) + "..." : value;
    }
}
