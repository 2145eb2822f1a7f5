package im.arun.tlfextract.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level switch for the {@code --verbose} flag.
 */
public final class LoggingConfigurator {

    static final String APP_LOGGER = "im.arun.tlfextract";

    private LoggingConfigurator() {
    }

    public static void configure(boolean verbose) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger appLogger = context.getLogger(APP_LOGGER);
        appLogger.setLevel(verbose ? Level.INFO : Level.WARN);
    }
}
