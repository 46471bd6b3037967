package se.kth.widen.syntax;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Identifies a language. The identifier selects both the grammar a parser loads and the table of
 * node kinds conflicts may be widened to.
 */
public class LanguageId {
    public static final LanguageId JAVA = new LanguageId("java");

    static final String EXTENSIONS_RESOURCE = "languages.properties";
    private static final Properties EXTENSIONS = loadExtensions();

    private final String name;

    private LanguageId(String name) {
        this.name = name;
    }

    public static LanguageId of(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("language name must not be empty");
        }
        return new LanguageId(normalized);
    }

    /**
     * Detect the language of a file from its extension.
     *
     * @param fileName A file name or path.
     * @return The language, or an empty optional if the extension is unknown.
     */
    public static Optional<LanguageId> fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        int sep = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dot <= sep + 1 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(EXTENSIONS.getProperty(extension)).map(LanguageId::of);
    }

    public String getName() {
        return name;
    }

    private static Properties loadExtensions() {
        Properties props = new Properties();
        try (InputStream in = LanguageId.class.getResourceAsStream("/" + EXTENSIONS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + EXTENSIONS_RESOURCE, e);
        }
        return props;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((LanguageId) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
