package se.kth.widen.expand;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import se.kth.widen.conflict.ConflictMarkers;
import se.kth.widen.conflict.ConflictRegion;
import se.kth.widen.conflict.ConflictRegionParser;
import se.kth.widen.conflict.Side;
import se.kth.widen.conflict.VersionResolver;
import se.kth.widen.exception.WidenException;
import se.kth.widen.syntax.ByteRange;
import se.kth.widen.syntax.LanguageId;
import se.kth.widen.syntax.NodeClassifier;
import se.kth.widen.syntax.SyntaxNode;
import se.kth.widen.syntax.SyntaxNodeLocator;
import se.kth.widen.syntax.SyntaxParser;
import se.kth.widen.syntax.treesitter.TreeSitterParser;
import se.kth.widen.util.LazyLogger;
import se.kth.widen.util.Pair;

/**
 * Widens conflict regions to syntactic boundaries.
 *
 * <p>Both sides of the text are parsed with all conflicts resolved to that side. If neither parse
 * has errors, the markers already sit on valid boundaries and the text is returned as is.
 * Otherwise, each conflict is widened to the smallest statement or declaration level node of the
 * "ours" tree that contains its "ours" content.
 *
 * <p>A fresh parser handle is requested for every call, so an instance may be shared between
 * threads.
 */
public class ConflictExpander {
    private static final LazyLogger LOGGER = new LazyLogger(ConflictExpander.class);

    private final Supplier<SyntaxParser> parsers;
    private final Function<LanguageId, NodeClassifier> classifiers;

    /** Create an expander that parses with tree-sitter and the bundled node kind tables. */
    public ConflictExpander() {
        this(TreeSitterParser::new, NodeClassifier::forLanguage);
    }

    public ConflictExpander(
            Supplier<SyntaxParser> parsers, Function<LanguageId, NodeClassifier> classifiers) {
        this.parsers = parsers;
        this.classifiers = classifiers;
    }

    /**
     * Expand the conflicts of a text to syntactic boundaries. This method never throws: on any
     * failure, the content is returned unchanged.
     *
     * @param content Text with conflict markers.
     * @param language The language of the text.
     * @return The text with widened conflict regions.
     */
    public String expandConflicts(String content, LanguageId language) {
        try {
            return expand(content, language);
        } catch (WidenException e) {
            LOGGER.warn(() -> "Leaving conflicts as they are: " + e.getMessage());
            return content;
        } catch (RuntimeException e) {
            LOGGER.warn(() -> "Unexpected error while expanding conflicts", e);
            return content;
        }
    }

    private String expand(String content, LanguageId language) {
        List<ConflictRegion> regions = ConflictRegionParser.parse(content);
        if (regions.isEmpty()) {
            return content;
        }
        LOGGER.debug(() -> "Found " + regions.size() + " conflict(s)");

        String ours = VersionResolver.resolve(content, regions, Side.OURS);
        String theirs = VersionResolver.resolve(content, regions, Side.THEIRS);

        SyntaxParser parser = parsers.get();
        parser.setLanguage(language);
        SyntaxNode oursTree = parser.parse(ours);
        SyntaxNode theirsTree = parser.parse(theirs);

        if (!needsExpansion(oursTree, theirsTree)) {
            LOGGER.info(() -> "Both sides parse without errors, conflicts are left as they are");
            return content;
        }

        NodeClassifier classifier = classifiers.apply(language);
        List<String> oursLines = Arrays.asList(ConflictMarkers.splitLines(ours));

        Pair<List<String>, Integer> document =
                Pair.of(Arrays.asList(ConflictMarkers.splitLines(content)), 0);
        for (ConflictRegion region : regions) {
            ExpansionDecision decision =
                    decide(region, regions, ours, oursLines, oursTree, classifier);
            if (!decision.isNone()) {
                document = rewrite(document, region, decision);
            }
        }

        return String.join("\n", document.first);
    }

    /**
     * @return true if at least one of the trees contains an error or missing node.
     */
    static boolean needsExpansion(SyntaxNode oursTree, SyntaxNode theirsTree) {
        return SyntaxNodeLocator.hasErrors(oursTree) || SyntaxNodeLocator.hasErrors(theirsTree);
    }

    private static ExpansionDecision decide(
            ConflictRegion region,
            List<ConflictRegion> regions,
            String ours,
            List<String> oursLines,
            SyntaxNode oursTree,
            NodeClassifier classifier) {
        int lineCount = region.lineCount(Side.OURS);
        if (lineCount == 0) {
            LOGGER.debug(() -> region + " has no lines on our side, skipping");
            return ExpansionDecision.NONE;
        }

        int resolvedStart = CoordinateMapper.originalLineToResolvedLine(region, regions, Side.OURS);
        Optional<ByteRange> byteRange =
                CoordinateMapper.lineSpanToByteRange(oursLines, resolvedStart, lineCount);
        if (!byteRange.isPresent()) {
            LOGGER.warn(() -> region + " maps outside of the resolved text, skipping");
            return ExpansionDecision.NONE;
        }

        Optional<SyntaxNode> node =
                SyntaxNodeLocator.findSmallestContainingNode(oursTree, byteRange.get());
        if (!node.isPresent()) {
            return ExpansionDecision.NONE;
        }

        String kind = node.get().kind();
        if (!classifier.isExpandable(kind)) {
            LOGGER.debug(
                    () ->
                            region
                                    + " is enclosed by "
                                    + kind
                                    + ", which is not expandable in "
                                    + classifier.getLanguage());
            return ExpansionDecision.NONE;
        }

        LineSpan nodeSpan = CoordinateMapper.byteRangeToLineSpan(node.get().byteRange(), ours);
        LineSpan conflictSpan = new LineSpan(resolvedStart, resolvedStart + lineCount - 1);
        ExpansionDecision decision = ExpansionDecision.between(conflictSpan, nodeSpan);
        LOGGER.debug(() -> region + " is enclosed by " + kind + ": " + decision);
        return decision;
    }

    private static Pair<List<String>, Integer> rewrite(
            Pair<List<String>, Integer> document,
            ConflictRegion region,
            ExpansionDecision decision) {
        Pair<List<String>, Integer> rewritten =
                RegionRewriter.expand(
                        document.first,
                        region,
                        decision.getExpandBefore(),
                        decision.getExpandAfter(),
                        document.second);
        return Pair.of(rewritten.first, document.second + rewritten.second);
    }
}
