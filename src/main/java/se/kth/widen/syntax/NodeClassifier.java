package se.kth.widen.syntax;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import se.kth.widen.util.LazyLogger;

/**
 * Decides which node kinds a conflict may be widened to. Only statement and declaration level
 * kinds qualify. Expression level nodes such as call chains are left out, as the smallest
 * expression enclosing a one-argument change is often a whole chained call.
 *
 * <p>The kinds of each language are read from the classpath resource {@code
 * expandable-kinds/<language>.txt}, one kind per line. Blank lines and lines starting with {@code
 * #} are ignored.
 */
public class NodeClassifier {
    private static final LazyLogger LOGGER = new LazyLogger(NodeClassifier.class);
    static final String TABLE_DIRECTORY = "expandable-kinds";

    private final LanguageId language;
    private final Set<String> expandableKinds;

    public NodeClassifier(LanguageId language, Set<String> expandableKinds) {
        this.language = language;
        this.expandableKinds = Collections.unmodifiableSet(new HashSet<>(expandableKinds));
    }

    /**
     * Load the table shipped for a language. A language without a table gets a classifier that
     * rejects every kind.
     */
    public static NodeClassifier forLanguage(LanguageId language) {
        String resource = "/" + TABLE_DIRECTORY + "/" + language.getName() + ".txt";
        try (InputStream in = NodeClassifier.class.getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.warn(() -> "No expandable node kinds for " + language);
                return new NodeClassifier(language, Collections.emptySet());
            }
            return new NodeClassifier(language, readKinds(in));
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + resource, e);
        }
    }

    public boolean isExpandable(String kind) {
        return expandableKinds.contains(kind);
    }

    public Set<String> getExpandableKinds() {
        return expandableKinds;
    }

    public LanguageId getLanguage() {
        return language;
    }

    private static Set<String> readKinds(InputStream in) throws IOException {
        Set<String> kinds = new HashSet<>();
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String kind = line.trim();
                if (!kind.isEmpty() && !kind.startsWith("#")) {
                    kinds.add(kind);
                }
            }
        }
        return kinds;
    }
}
