package se.kth.widen.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/** Searches concrete syntax trees. The walks are iterative, as trees may be arbitrarily deep. */
public class SyntaxNodeLocator {

    private SyntaxNodeLocator() {}

    /**
     * Find the deepest node that fully contains a byte range. Children are searched in order and
     * the first one containing the range is descended into.
     *
     * @param root The root of the tree to search.
     * @param range A byte range in the text the tree was parsed from.
     * @return The smallest containing node, or an empty optional if not even the root contains the
     *     range.
     */
    public static Optional<SyntaxNode> findSmallestContainingNode(
            SyntaxNode root, ByteRange range) {
        if (!root.byteRange().contains(range)) {
            return Optional.empty();
        }

        SyntaxNode current = root;
        Optional<SyntaxNode> next = firstContainingChild(current, range);
        while (next.isPresent()) {
            current = next.get();
            next = firstContainingChild(current, range);
        }
        return Optional.of(current);
    }

    /** @return true if the node or any of its descendants is an error or missing node. */
    public static boolean hasErrors(SyntaxNode node) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            SyntaxNode current = stack.pop();
            if (current.isErrorOrMissing()) {
                return true;
            }
            current.children().forEach(stack::push);
        }
        return false;
    }

    private static Optional<SyntaxNode> firstContainingChild(SyntaxNode node, ByteRange range) {
        for (SyntaxNode child : node.children()) {
            if (child.byteRange().contains(range)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }
}
