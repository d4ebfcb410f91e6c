package org.parallang;

import java.text.MessageFormat;
import java.util.Comparator;

// Ordered pair, used as the key of the scanner's transition table
record Pair<K extends Comparable<K>, V extends Comparable<V>>(K first, V second) implements Comparable<Pair<K, V>> {
    static <K extends Comparable<K>, V extends Comparable<V>> Pair<K, V> of(K first, V second) {
        return new Pair<>(first, second);
    }

    @Override
    public String toString() {
        return MessageFormat.format("({0}, {1})", first, second);
    }

    @Override
    public int compareTo(Pair<K, V> other) {
        return Comparator.comparing((Pair<K, V> p) -> p.first())
            .thenComparing((Pair<K, V> p) -> p.second())
            .compare(this, other);
    }
}
