package works.mongobridge.testing;

import ch.qos.logback.classic.Level;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.logback.ConnectionLogFilter;
import works.mongobridge.logback.ConnectionLogFilter.LogController;

/**
 * Base class for tests that drive connections from a {@link ManualLoop}.
 * <p>
 * Renames the test thread after the test, logs the start and end of each test,
 * and offers {@link #setLogging} to quieten loggers for connections
 * registered with {@link #controlLogsOf}.
 */
public abstract class AbstractBridgeTest {
	protected final ManualLoop loop = new ManualLoop();
	protected final LogController logController = new LogController();
	protected final List<Runnable> tearDownActions = new ArrayList<>();
	private volatile String oldThreadName;

	@BeforeEach
	void logStart(TestInfo testInfo) {
		oldThreadName = Thread.currentThread().getName();
		String newThreadName = "test: " + testInfo.getDisplayName();
		Thread.currentThread().setName(newThreadName);
		logTest("/=== Start", testInfo);
		LOGGER.debug("Old thread name was {}", oldThreadName);
	}

	@AfterEach
	void logDone(TestInfo testInfo) {
		// Reverse order, like nested try-with-resources
		for (int i = tearDownActions.size() - 1; i >= 0; i--) {
			tearDownActions.get(i).run();
		}
		tearDownActions.clear();
		logTest("\\=== Done", testInfo);
		Thread.currentThread().setName(oldThreadName);
	}

	private static void logTest(String verb, TestInfo testInfo) {
		String method =
			testInfo.getTestClass().map(Class::getSimpleName).orElse(null)
				+ "."
				+ testInfo.getTestMethod().map(Method::getName).orElse(null);
		LOGGER.info("{} {} {}", verb, method, testInfo.getDisplayName());
	}

	/**
	 * Causes {@link #setLogging} to apply to messages logged on behalf of the named connection.
	 */
	protected void controlLogsOf(String connectionName) {
		var registration = ConnectionLogFilter.withController(connectionName, logController);
		tearDownActions.add(registration::close);
	}

	protected void setLogging(Level level, Class<?>... loggers) {
		logController.setLogging(level, loggers);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractBridgeTest.class);
}
