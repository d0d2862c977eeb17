package com.health.misinfo.model;

/**
 * Unordered pair of account ids. The canonical form keeps {@code a} lexicographically
 * smaller than {@code b}, so (A,B) and (B,A) are equal.
 */
public record NodePair(String a, String b) implements Comparable<NodePair> {

    public NodePair {
        if (a.compareTo(b) > 0) {
            String temp = a;
            a = b;
            b = temp;
        }
    }

    public static NodePair of(String first, String second) {
        return new NodePair(first, second);
    }

    @Override
    public int compareTo(NodePair o) {
        int cmp = a.compareTo(o.a);
        return cmp != 0 ? cmp : b.compareTo(o.b);
    }

    @Override
    public String toString() {
        return a + "--" + b;
    }
}
