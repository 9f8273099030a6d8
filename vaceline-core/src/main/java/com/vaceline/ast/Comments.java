package com.vaceline.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Comments decorating a statement (or the program).
 *
 * <p>Leading comments are printed on their own lines before the node, trailing comments after it on
 * the same line. Inner comments sit inside a construct (between tokens of an expression, or before a
 * closing brace) and are kept on the tree but not rendered by the printer.</p>
 */
public final class Comments {

    private final List<Comment> leading;
    private final List<Comment> trailing;
    private final List<Comment> inner;

    public Comments() {
        this(null, null, null);
    }

    public Comments(List<Comment> leading, List<Comment> trailing, List<Comment> inner) {
        this.leading = leading == null ? new ArrayList<>() : new ArrayList<>(leading);
        this.trailing = trailing == null ? new ArrayList<>() : new ArrayList<>(trailing);
        this.inner = inner == null ? new ArrayList<>() : new ArrayList<>(inner);
    }

    static Comments orEmpty(Comments comments) {
        return comments == null ? new Comments() : comments;
    }

    public List<Comment> leading() {
        return leading;
    }

    public List<Comment> trailing() {
        return trailing;
    }

    public List<Comment> inner() {
        return inner;
    }

    public boolean isEmpty() {
        return leading.isEmpty() && trailing.isEmpty() && inner.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comments other)) return false;
        return leading.equals(other.leading) && trailing.equals(other.trailing) && inner.equals(other.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leading, trailing, inner);
    }

    @Override
    public String toString() {
        return "Comments[leading=" + leading + ", trailing=" + trailing + ", inner=" + inner + "]";
    }
}
