package org.transitlog.cli.config;

import java.net.URL;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

/**
 * Applies the {@code logging} config block to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"            # or "COLOR"
 *   default-level = "INFO"
 *   levels {
 *     "org.transitlog.datapipeline.resources.archive" = "DEBUG"
 *   }
 * }
 * </pre>
 * The appender is chosen by {@code logback.xml} from the {@code transitlog.logging.format}
 * system property, so Logback is re-read from the classpath before levels are applied.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Reloads {@code logback.xml} and applies configured levels.
     *
     * @param config the application configuration
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        reload(context);

        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO);
                context.getLogger(loggerName).setLevel(level);
            }
        }
    }

    private static void reload(LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
