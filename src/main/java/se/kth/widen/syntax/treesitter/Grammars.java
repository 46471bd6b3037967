package se.kth.widen.syntax.treesitter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJava;
import se.kth.widen.syntax.LanguageId;

/** The tree-sitter grammars bundled with the application. */
public class Grammars {
    private static final Map<LanguageId, Supplier<TSLanguage>> GRAMMARS = new HashMap<>();

    static {
        GRAMMARS.put(LanguageId.JAVA, TreeSitterJava::new);
    }

    private Grammars() {}

    /** @return A fresh instance of the grammar of the language, if one is bundled. */
    public static Optional<TSLanguage> forLanguage(LanguageId language) {
        return Optional.ofNullable(GRAMMARS.get(language)).map(Supplier::get);
    }

    public static Set<LanguageId> supportedLanguages() {
        return Collections.unmodifiableSet(GRAMMARS.keySet());
    }
}
