package se.kth.widen.syntax.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import se.kth.widen.exception.GrammarException;
import se.kth.widen.exception.SyntaxParseException;
import se.kth.widen.syntax.LanguageId;
import se.kth.widen.syntax.SyntaxNode;
import se.kth.widen.syntax.SyntaxParser;
import se.kth.widen.util.LazyLogger;

/** A {@link SyntaxParser} backed by a tree-sitter parser handle. */
public class TreeSitterParser implements SyntaxParser {
    private static final LazyLogger LOGGER = new LazyLogger(TreeSitterParser.class);

    private final TSParser parser;
    private LanguageId language;

    public TreeSitterParser() {
        try {
            parser = new TSParser();
        } catch (LinkageError e) {
            throw new GrammarException("could not load the tree-sitter runtime", e);
        }
    }

    @Override
    public void setLanguage(LanguageId language) {
        try {
            TSLanguage grammar =
                    Grammars.forLanguage(language)
                            .orElseThrow(
                                    () ->
                                            new GrammarException(
                                                    "no grammar bundled for " + language));
            parser.setLanguage(grammar);
        } catch (LinkageError | IllegalArgumentException e) {
            throw new GrammarException("could not load the grammar for " + language, e);
        }
        this.language = language;
        LOGGER.debug(() -> "Parser configured for " + language);
    }

    @Override
    public SyntaxNode parse(String text) {
        if (language == null) {
            throw new SyntaxParseException("no language set before parsing");
        }
        TSTree tree = parser.parseString(null, text);
        if (tree == null) {
            throw new SyntaxParseException("tree-sitter produced no tree for " + language);
        }
        return new TreeSitterNode(tree, tree.getRootNode(), Utf8Offsets.of(text));
    }
}
