package works.mongobridge.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.mongobridge.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.mongobridge.logging.MdcKeys.CONNECTION;

/**
 * A Logback {@link TurboFilter} that provides per-connection logging control.
 * Intended to suppress expected warnings and errors during testing.
 * <p>
 * Register a {@link LogController} for a connection name using {@link #withController};
 * the controller can then set log levels using {@link LogController#setLogging}
 * without affecting the logs of other connections.
 * <p>
 * This class infers that a log message is associated with a particular connection
 * by checking the MDC for the key {@link MdcKeys#CONNECTION},
 * which the connection's worker sets around every task it runs.
 * Messages logged on other threads, such as the caller's loop, are unaffected.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message is associated with a connection
 *         that has a registered controller,
 *         and that controller has an override for that specific logger, that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply, which means
 *         that the logger inherits the level from its ancestors.
 *     </li>
 * </ol>
 */
public class ConnectionLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByConnection = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// Logback Level, because OFF is a valid override
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}

		public void clear() {
			overrides.clear();
		}
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted on behalf of the
	 * connection named <code>connectionName</code>, until the returned registration is closed.
	 */
	public static Registration withController(String connectionName, LogController controller) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Registering controller {} for connection \"{}\"", System.identityHashCode(controller), connectionName);
		}
		LogController old = controllersByConnection.put(connectionName, controller);
		assert old == null: "Must not create two log controllers for the same connection: \"" + connectionName + "\"";
		return () -> controllersByConnection.remove(connectionName, controller);
	}

	@FunctionalInterface
	public interface Registration extends AutoCloseable {
		@Override void close();
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// An explicitly configured logger wins over any override
			return NEUTRAL;
		}
		String connectionName = MDC.get(CONNECTION);
		if (connectionName == null) {
			return NEUTRAL;
		}
		var controller = controllersByConnection.get(connectionName);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}

		// Messages below the override level are suppressed
		if (messageLevel.isGreaterOrEqual(overrideLevel)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(ConnectionLogFilter.class);
}
