package dev.blanke.fieldidentifier.model;

/**
 * A singly linked node for building member chains of arbitrary depth.
 */
public final class Node {

    public final String label;

    public Node next;

    public Node(final String label) {
        this.label = label;
    }

    public static Node chain(final String... labels) {
        final var head = new Node(labels[0]);
        var current = head;
        for (int i = 1; i < labels.length; ++i)
            current = current.next = new Node(labels[i]);
        return head;
    }
}
