package org.javai.cfgpp.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Log4j2 appender that records what one class logs, for assertions in tests.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender captor = LogCaptorAppender.create(CfgParser.class, Level.DEBUG)) {
 *     parser.parse(...);
 *     assertThat(captor.messages()).anyMatch(msg -&gt; msg.contains("Including"));
 * }
 * </pre>
 * A logger config is registered for the class for the lifetime of the captor and
 * removed again on {@link #close()}.
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean ownsLoggerConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, boolean ownsLoggerConfig,
			Level previousLevel) {
		super("LogCaptor-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.ownsLoggerConfig = ownsLoggerConfig;
		this.previousLevel = previousLevel;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		boolean owns = !loggerConfig.getName().equals(loggerName);
		if (owns) {
			loggerConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, loggerConfig);
		}
		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender(context, loggerConfig, owns, previousLevel);
		appender.start();
		loggerConfig.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	/**
	 * Messages logged at exactly {@code level}.
	 */
	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel().equals(level))
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (ownsLoggerConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
