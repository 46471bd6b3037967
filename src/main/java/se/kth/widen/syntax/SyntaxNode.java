package se.kth.widen.syntax;

import java.util.List;

/**
 * A read-only node of a concrete syntax tree. A parent's byte range must contain the byte range of
 * each of its children.
 */
public interface SyntaxNode {

    /** @return The grammar-defined type tag of this node, e.g. {@code if_statement}. */
    String kind();

    /** @return The range of this node in the UTF-8 bytes of the text it was parsed from. */
    ByteRange byteRange();

    /** @return true if the parser inserted this node to recover from a syntax error. */
    boolean isErrorOrMissing();

    /** @return The children of this node, in source order. */
    List<SyntaxNode> children();
}
