package com.jsonstreams.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * The open containers of one document, root first.
 * <p>
 * A container's depth is its index here, and its parent is the slot below it.
 * Only open containers are held, so the last slot is always the one that accepts
 * writes. Containers refer to each other through this arena rather than by direct
 * references.
 */
final class ContainerStack {
    private final StreamContext context;
    private final List<Container> slots = new ArrayList<>();

    ContainerStack(StreamContext context) {
        this.context = context;
    }

    /**
     * Creates a container one level above the current top. The caller emits its opening bracket.
     */
    Container push(Kind kind) {
        Container container = new Container(this, context, kind, slots.size());
        slots.add(container);
        return container;
    }

    /**
     * Removes a container that just closed and hands control back to its parent.
     *
     * @return the parent, or {@code null} when the root was popped
     */
    Container pop(Container container) {
        int last = slots.size() - 1;
        if (last < 0 || slots.get(last) != container) {
            throw new IllegalStateException("Container at depth " + container.depth() + " is not on top of the stack");
        }
        slots.remove(last);
        if (last == 0) {
            return null;
        }
        Container parent = slots.get(last - 1);
        parent.childClosed();
        return parent;
    }

    /**
     * The container currently allowed to accept writes, or {@code null} once the root has closed.
     */
    Container top() {
        return slots.isEmpty() ? null : slots.get(slots.size() - 1);
    }

    int size() {
        return slots.size();
    }

    boolean isEmpty() {
        return slots.isEmpty();
    }
}
