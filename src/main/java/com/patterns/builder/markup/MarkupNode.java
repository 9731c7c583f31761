package com.patterns.builder.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single element of a markup tree.
 *
 * Rendering layout:
 * - "&lt;name&gt;" at the node's own indent
 * - the text, one level deeper, only if it is not blank
 * - every child, rendered recursively one level deeper
 * - "&lt;/name&gt;" at the node's own indent
 *
 * Indentation is {@link #INDENT_SIZE} spaces per depth level.
 */
public final class MarkupNode {
    public static final int INDENT_SIZE = 2;

    private final String name;
    private final String text;
    private final List<MarkupNode> children = new ArrayList<>();

    /**
     * Creates a leaf element.
     *
     * @param name Tag name, must not be null.
     * @param text Body text, must not be null (may be empty).
     */
    public MarkupNode(String name, String text) {
        this.name = requireArg(name, "name");
        this.text = requireArg(text, "text");
    }

    // Root form used by MarkupBuilder, carries no text
    MarkupNode(String name) {
        this(name, "");
    }

    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    /** Read-only view of the children, in insertion order. */
    public List<MarkupNode> children() {
        return Collections.unmodifiableList(children);
    }

    void append(MarkupNode child) {
        children.add(child);
    }

    /**
     * Renders this node and its subtree starting at the given depth.
     */
    public String render(int depth) {
        var sb = new StringBuilder(64);
        renderInto(sb, depth);
        return sb.toString();
    }

    private void renderInto(StringBuilder sb, int depth) {
        String indent = " ".repeat(INDENT_SIZE * depth);
        sb.append(indent).append('<').append(name).append(">\n");

        if (!text.isBlank()) {
            sb.append(" ".repeat(INDENT_SIZE * (depth + 1))).append(text).append('\n');
        }

        for (MarkupNode child : children)
            child.renderInto(sb, depth + 1);

        sb.append(indent).append("</").append(name).append(">\n");
    }

    @Override
    public String toString() {
        return render(0);
    }

    static String requireArg(String value, String paramName) {
        if (value == null)
            throw new IllegalArgumentException(paramName + " must not be null");
        return value;
    }
}
