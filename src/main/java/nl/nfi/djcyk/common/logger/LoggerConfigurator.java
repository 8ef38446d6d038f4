package nl.nfi.djcyk.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import static nl.nfi.djcyk.common.HostUtils.hostname;

public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    public static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{2000} -%kvp- %msg%n";
    private static final String CONSOLE_PATTERN = "%-5level %logger{0} - %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        final String logDirectoryPath = System.getProperty(LOG_DIRECTORY_PROPERTY);
        if (logDirectoryPath == null) {
            // keep stdout for parse results, only problems go to stderr
            final Logger root = setupLogger("ROOT", "WARN", null);
            root.addAppender(createConsoleAppender());
            return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
        }

        final Logger root = setupLogger("ROOT", "DEBUG", null);
        root.addAppender(createFileAppender(logDirectoryPath));

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setTarget("System.err");
        appender.setEncoder(createEncoder(appender, CONSOLE_PATTERN));
        appender.start();
        return appender;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final String logFilePath = logDirectoryPath + "/" + hostname() + ".log";
        final String logRollPathPattern = logDirectoryPath + "/" + hostname() + ".%d{yyyy-MM-dd}.%i.gz";

        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logFilePath);

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logRollPathPattern);
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setEncoder(createEncoder(appender, LOG_PATTERN));

        appender.start();
        return appender;
    }

    private PatternLayoutEncoder createEncoder(final OutputStreamAppender<ILoggingEvent> appender, final String pattern) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(pattern);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();
        return layoutEncoder;
    }
}
