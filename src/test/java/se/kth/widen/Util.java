package se.kth.widen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.kth.widen.exception.GrammarException;
import se.kth.widen.exception.SyntaxParseException;
import se.kth.widen.syntax.ByteRange;
import se.kth.widen.syntax.LanguageId;
import se.kth.widen.syntax.SyntaxNode;
import se.kth.widen.syntax.SyntaxParser;

/**
 * Utility methods for the test suite.
 *
 * @author Simon Larsén
 */
public class Util {

    /** Join lines with newlines. */
    public static String lines(String... lines) {
        return String.join("\n", lines);
    }

    public static FakeNode node(String kind, int start, int end, SyntaxNode... children) {
        return new FakeNode(kind, start, end, false, Arrays.asList(children));
    }

    public static FakeNode error(int start, int end, SyntaxNode... children) {
        return new FakeNode("ERROR", start, end, true, Arrays.asList(children));
    }

    /** Extract the contents of each side of every conflict, in document order. */
    public static List<Conflict> parseConflicts(String string) {
        Pattern conflictPattern =
                Pattern.compile(
                        "^<<<<<<<[^\\n]*\\n(.*?)^=======[^\\n]*\\n(.*?)^>>>>>>>[^\\n]*$",
                        Pattern.DOTALL | Pattern.MULTILINE);
        Matcher matcher = conflictPattern.matcher(string);

        List<Conflict> matches = new ArrayList<>();
        while (matcher.find()) {
            matches.add(new Conflict(matcher.group(1), matcher.group(2)));
        }
        return matches;
    }

    /** Side contents of a conflict, each including the newline ending its last line. */
    public static class Conflict {
        public final String ours;
        public final String theirs;

        Conflict(String ours, String theirs) {
            this.ours = ours;
            this.theirs = theirs;
        }

        @Override
        public String toString() {
            return "Conflict{ours='" + ours + "', theirs='" + theirs + "'}";
        }
    }

    /** A hand-built syntax tree node. */
    public static class FakeNode implements SyntaxNode {
        private final String kind;
        private final ByteRange range;
        private final boolean errorOrMissing;
        private final List<SyntaxNode> children;

        FakeNode(
                String kind,
                int start,
                int end,
                boolean errorOrMissing,
                List<SyntaxNode> children) {
            this.kind = kind;
            this.range = new ByteRange(start, end);
            this.errorOrMissing = errorOrMissing;
            this.children = Collections.unmodifiableList(children);
        }

        @Override
        public String kind() {
            return kind;
        }

        @Override
        public ByteRange byteRange() {
            return range;
        }

        @Override
        public boolean isErrorOrMissing() {
            return errorOrMissing;
        }

        @Override
        public List<SyntaxNode> children() {
            return children;
        }

        @Override
        public String toString() {
            return kind + range;
        }
    }

    /**
     * A parser returning prepared trees for exact input texts. Texts without a prepared tree fail
     * to parse.
     */
    public static class ScriptedParser implements SyntaxParser {
        private final Map<String, SyntaxNode> trees = new HashMap<>();
        private final List<String> parsed = new ArrayList<>();
        private final LanguageId supported;
        private LanguageId language;

        public ScriptedParser(LanguageId supported) {
            this.supported = supported;
        }

        public ScriptedParser withTree(String text, SyntaxNode root) {
            trees.put(text, root);
            return this;
        }

        /** @return The texts parsed so far, in order. */
        public List<String> getParsed() {
            return parsed;
        }

        @Override
        public void setLanguage(LanguageId language) {
            if (!supported.equals(language)) {
                throw new GrammarException("no grammar for " + language);
            }
            this.language = language;
        }

        @Override
        public SyntaxNode parse(String text) {
            if (language == null) {
                throw new SyntaxParseException("no language set");
            }
            parsed.add(text);
            SyntaxNode tree = trees.get(text);
            if (tree == null) {
                throw new SyntaxParseException("no tree prepared for text");
            }
            return tree;
        }
    }
}
