package org.javai.nandu.testsupport;

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
 * Records the formatted messages one class logs while the capture is open.
 * <pre>
 * try (LogCapture log = LogCapture.capture(NanduCli.class, Level.WARN)) {
 *     cli.run(...);
 *     assertThat(log.messages()).anyMatch(msg -&gt; msg.contains("Refusing input"));
 * }
 * </pre>
 * A logger of the class's own name is added to the active configuration for the
 * duration of the capture and removed again on close.
 */
public final class LogCapture implements AutoCloseable {

	private final LoggerContext context;
	private final String loggerName;
	private final Recorder recorder;

	private LogCapture(LoggerContext context, String loggerName, Recorder recorder) {
		this.context = context;
		this.loggerName = loggerName;
		this.recorder = recorder;
	}

	public static LogCapture capture(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		if (configuration.getLoggers().containsKey(loggerName)) {
			throw new IllegalStateException("Logger '" + loggerName + "' is already configured or captured");
		}

		Recorder recorder = new Recorder("capture-" + loggerName);
		recorder.start();
		LoggerConfig captured = new LoggerConfig(loggerName, level, false);
		captured.addAppender(recorder, level, null);
		configuration.addLogger(loggerName, captured);
		context.updateLoggers();
		return new LogCapture(context, loggerName, recorder);
	}

	public List<String> messages() {
		return List.copyOf(recorder.messages);
	}

	@Override
	public void close() {
		context.getConfiguration().removeLogger(loggerName);
		context.updateLoggers();
		recorder.stop();
	}

	private static final class Recorder extends AbstractAppender {

		private final List<String> messages = new CopyOnWriteArrayList<>();

		private Recorder(String name) {
			super(name, null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			messages.add(event.getMessage().getFormattedMessage());
		}
	}
}
