package se.kth.widen.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine.IVersionProvider;

/**
 * Provides the command line with the version of the packaged application.
 *
 * @author Simon Larsén
 */
public class WidenVersionProvider implements IVersionProvider {
    static final String POM_PROPERTIES = "META-INF/maven/se.kth/widen/pom.properties";

    @Override
    public String[] getVersion() {
        return new String[] {getVersionFromPomProperties()};
    }

    private String getVersionFromPomProperties() {
        Properties props = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(POM_PROPERTIES)) {
            if (in == null) {
                return "LOCAL";
            }
            props.load(in);
            return props.getProperty("version", "LOCAL");
        } catch (IOException e) {
            return "LOCAL";
        }
    }
}
