package se.kth.widen.syntax.treesitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.treesitter.TSNode;
import org.treesitter.TSTree;
import se.kth.widen.syntax.ByteRange;
import se.kth.widen.syntax.SyntaxNode;

/**
 * Adapts a tree-sitter node. Children are wrapped on first access. Byte offsets are converted to
 * UTF-8 offsets of the parsed text.
 */
class TreeSitterNode implements SyntaxNode {
    static final String ERROR_KIND = "ERROR";

    // native memory of the nodes is owned by the tree, which must stay reachable
    private final TSTree tree;
    private final TSNode node;
    private final Utf8Offsets offsets;
    private List<SyntaxNode> children;

    TreeSitterNode(TSTree tree, TSNode node, Utf8Offsets offsets) {
        this.tree = tree;
        this.node = node;
        this.offsets = offsets;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public ByteRange byteRange() {
        return new ByteRange(
                offsets.toUtf8(node.getStartByte()), offsets.toUtf8(node.getEndByte()));
    }

    @Override
    public boolean isErrorOrMissing() {
        return ERROR_KIND.equals(node.getType()) || node.isMissing();
    }

    @Override
    public List<SyntaxNode> children() {
        if (children == null) {
            int count = node.getChildCount();
            List<SyntaxNode> wrapped = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    wrapped.add(new TreeSitterNode(tree, child, offsets));
                }
            }
            children = Collections.unmodifiableList(wrapped);
        }
        return children;
    }

    @Override
    public String toString() {
        return kind() + byteRange();
    }
}
