package org.twistmodal.logic.model;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.common.InvalidValueException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The value of a proposition as it is stored in a world: either the text of a pair, e.g. {@code (1, 0)}
 * or {@code ('a', 'b')}, which is only parsed when the value is needed, or a bare label {@code v},
 * standing for {@code (v, v)}. Pairs supplied as objects are kept as they are.
 */
public interface RawValue {

    String text();

    TruthPair resolve();

    static RawValue of(String text) {
        Objects.requireNonNull(text);
        if (text.isBlank()) throw new InvalidValueException("''", "empty value");
        if (text.strip().startsWith("(")) return new PairLiteral(text);
        return new Label(text.strip());
    }

    static RawValue of(TruthPair pair) {
        return new Resolved(pair);
    }

    record Resolved(TruthPair pair) implements RawValue {
        public Resolved {
            Objects.requireNonNull(pair);
        }

        @Override
        public String text() {
            return pair.toString();
        }

        @Override
        public TruthPair resolve() {
            return pair;
        }
    }

    record Label(String text) implements RawValue {
        public Label {
            assert !text.isBlank();
        }

        @Override
        public TruthPair resolve() {
            return TruthPair.diagonal(text);
        }
    }

    record PairLiteral(String text) implements RawValue {

        @Override
        public TruthPair resolve() {
            String s = text.strip();
            if (!s.startsWith("(") || !s.endsWith(")")) {
                throw new InvalidValueException(text, "expected a pair (t, f)");
            }
            List<String> parts = split(s.substring(1, s.length() - 1));
            if (parts.size() != 2) {
                throw new InvalidValueException(text, "expected exactly two components, got " + parts.size());
            }
            return new TruthPair(label(parts.get(0)), label(parts.get(1)));
        }

        /*
        commas inside a quoted label do not separate components
         */
        private List<String> split(String inner) {
            List<String> parts = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            char quote = 0;
            for (char c : inner.toCharArray()) {
                if (quote != 0) {
                    if (c == quote) quote = 0;
                    current.append(c);
                } else if (c == '\'' || c == '"') {
                    quote = c;
                    current.append(c);
                } else if (c == ',') {
                    parts.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            if (quote != 0) {
                throw new InvalidValueException(text, "unterminated quote");
            }
            parts.add(current.toString());
            return parts;
        }

        private String label(String part) {
            String s = part.strip();
            if (s.length() >= 2 && (s.charAt(0) == '\'' || s.charAt(0) == '"')
                && s.charAt(s.length() - 1) == s.charAt(0)) {
                s = s.substring(1, s.length() - 1);
            }
            if (s.isEmpty()) {
                throw new InvalidValueException(text, "empty component");
            }
            return s;
        }
    }
}
