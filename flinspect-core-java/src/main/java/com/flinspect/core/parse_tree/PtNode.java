package com.flinspect.core.parse_tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One labeled node of a parse-tree dump.
 *
 * Nodes carry no Fortran semantics: a label, an optional leaf value (the text after {@code =}),
 * the dump line they came from and their children in dump order.
 */
public final class PtNode {

    private final String label;
    private final String value;
    private final int line;
    private final ConstructTag tag;
    private final List<PtNode> children = new ArrayList<>();

    public PtNode(String label, String value, int line) {
        this.label = label;
        this.value = value;
        this.line = line;
        this.tag = ConstructTag.of(label);
    }

    public String label()    { return label; }
    public String value()    { return value; }
    public int line()        { return line; }
    public ConstructTag tag() { return tag; }

    public List<PtNode> children() { return Collections.unmodifiableList(children); }

    void addChild(PtNode child) {
        children.add(child);
    }

    public boolean is(ConstructTag t) {
        return tag == t;
    }

    /** First direct child with the given tag, or null. */
    public PtNode child(ConstructTag t) {
        for (PtNode c : children) {
            if (c.tag == t) return c;
        }
        return null;
    }

    /** All direct children with the given tag, in order. */
    public List<PtNode> children(ConstructTag t) {
        List<PtNode> result = new ArrayList<>();
        for (PtNode c : children) {
            if (c.tag == t) result.add(c);
        }
        return result;
    }

    /** First node with the given tag in a pre-order walk below this node, or null. */
    public PtNode firstDescendant(ConstructTag t) {
        for (PtNode c : children) {
            if (c.tag == t) return c;
            PtNode found = c.firstDescendant(t);
            if (found != null) return found;
        }
        return null;
    }

    /** All nodes with the given tag below this node, pre-order. */
    public List<PtNode> descendants(ConstructTag t) {
        List<PtNode> result = new ArrayList<>();
        collect(t, result);
        return result;
    }

    private void collect(ConstructTag t, List<PtNode> into) {
        for (PtNode c : children) {
            if (c.tag == t) into.add(c);
            c.collect(t, into);
        }
    }

    /** Value of the first direct {@code Name} child, or null. */
    public String nameValue() {
        PtNode name = child(ConstructTag.NAME);
        return name != null ? name.value : null;
    }

    @Override
    public String toString() {
        return value == null ? label : label + " = '" + value + "'";
    }
}
