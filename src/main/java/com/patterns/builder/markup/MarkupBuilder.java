package com.patterns.builder.markup;

import lombok.extern.log4j.Log4j2;

/**
 * Markup Builder -- fluent construction of a two-level markup tree.
 *
 * Usage Pattern:
 * 1. Create a builder: MarkupBuilder b = MarkupBuilder.create("ul");
 * 2. Add children: b.addChild("li", "hello").addChild("li", "world");
 * 3. Render: String html = b.render();
 */
@Log4j2
public final class MarkupBuilder {
    private final String rootName;
    private MarkupNode root;

    private MarkupBuilder(String rootName) {
        this.rootName = MarkupNode.requireArg(rootName, "rootName");
        this.root = new MarkupNode(rootName);
    }

    /**
     * Creates a new builder owning an empty root element.
     *
     * @param rootName Tag name of the root element.
     * @return A new MarkupBuilder instance.
     */
    public static MarkupBuilder create(String rootName) {
        return new MarkupBuilder(rootName);
    }

    /**
     * Appends a leaf element to the root.
     *
     * @param childName Tag name of the child.
     * @param childText Body text of the child.
     * @return This builder, for chaining.
     */
    public MarkupBuilder addChild(String childName, String childText) {
        root.append(new MarkupNode(childName, childText));
        return this;
    }

    /**
     * Discards every child added so far. The root keeps its original name.
     */
    public MarkupBuilder reset() {
        log.debug("Resetting <{}> with {} children", rootName, root.children().size());
        root = new MarkupNode(rootName);
        return this;
    }

    /** The root element as built so far. */
    public MarkupNode root() {
        return root;
    }

    public String render() {
        return root.render(0);
    }

    @Override
    public String toString() {
        return render();
    }
}
