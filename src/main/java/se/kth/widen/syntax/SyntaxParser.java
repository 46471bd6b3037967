package se.kth.widen.syntax;

import se.kth.widen.exception.GrammarException;
import se.kth.widen.exception.SyntaxParseException;

/**
 * A stateful parser handle. The language must be set before parsing, and a handle must not be used
 * by two threads at once.
 */
public interface SyntaxParser {

    /**
     * Load the grammar of a language into this handle.
     *
     * @param language The language to parse.
     * @throws GrammarException If there is no grammar for the language or it cannot be loaded.
     */
    void setLanguage(LanguageId language);

    /**
     * Parse text with the grammar of the last language set.
     *
     * @param text The text to parse.
     * @return The root node of the tree.
     * @throws SyntaxParseException If no tree could be produced.
     */
    SyntaxNode parse(String text);
}
