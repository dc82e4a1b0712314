package io.github.jsonvalidation.schema;

import org.junit.jupiter.api.BeforeAll;

import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Applies `java.util.logging.ConsoleHandler.level` to the root logger and its handlers,
/// and points `json.schema.test.resources` at this module's fixtures unless already set.
public class JsonSchemaLoggingConfig {

    static final String RESOURCES_PROPERTY = "json.schema.test.resources";

    @BeforeAll
    static void configureLoggingAndFixtures() {
        Level level = configuredLevel();
        Logger root = Logger.getLogger("");
        if (root.getLevel() == null || root.getLevel().intValue() > level.intValue()) {
            root.setLevel(level);
        }
        for (Handler handler : root.getHandlers()) {
            if (handler.getLevel() == null || handler.getLevel().intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }

        String resources = System.getProperty(RESOURCES_PROPERTY);
        if (resources == null || resources.isBlank()) {
            System.setProperty(RESOURCES_PROPERTY, Path.of("src", "test", "resources").toAbsolutePath().toString());
        }
    }

    private static Level configuredLevel() {
        String name = System.getProperty("java.util.logging.ConsoleHandler.level");
        if (name == null) {
            return Level.INFO;
        }
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }
}
