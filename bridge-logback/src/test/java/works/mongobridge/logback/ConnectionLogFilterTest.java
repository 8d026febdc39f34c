package works.mongobridge.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.mongobridge.logback.ConnectionLogFilter.LogController;
import works.mongobridge.logback.ConnectionLogFilter.Registration;
import works.mongobridge.logging.MappedDiagnosticContext.MDCScope;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.mongobridge.logging.MappedDiagnosticContext.setupMDC;

class ConnectionLogFilterTest {
	final LoggerContext loggerContext = new LoggerContext();
	final Logger quietLogger = loggerContext.getLogger("works.mongobridge.Quiet");
	final Logger otherLogger = loggerContext.getLogger("works.mongobridge.Other");
	final ConnectionLogFilter filter = new ConnectionLogFilter();
	final LogController controller = new LogController();
	Registration registration;

	@BeforeEach
	void registerController() {
		registration = ConnectionLogFilter.withController("quiet-connection", controller);
		controller.setLogging(Level.ERROR, quietLogger.getName());
	}

	@AfterEach
	void unregisterController() {
		registration.close();
		MDC.clear();
	}

	@Test
	void overriddenLogger_belowOverride_denied() {
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(DENY, decide(quietLogger, Level.WARN));
		}
	}

	@Test
	void overriddenLogger_atOrAboveOverride_neutral() {
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(NEUTRAL, decide(quietLogger, Level.ERROR));
		}
	}

	@Test
	void otherLogger_neutral() {
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(NEUTRAL, decide(otherLogger, Level.DEBUG));
		}
	}

	@Test
	void otherConnection_neutral() {
		try (MDCScope __ = setupMDC("noisy-connection")) {
			assertEquals(NEUTRAL, decide(quietLogger, Level.WARN));
		}
	}

	@Test
	void noConnectionInMDC_neutral() {
		assertEquals(NEUTRAL, decide(quietLogger, Level.WARN));
	}

	@Test
	void explicitLoggerLevel_takesPrecedence() {
		quietLogger.setLevel(Level.DEBUG);
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(NEUTRAL, decide(quietLogger, Level.WARN));
		}
	}

	@Test
	void offOverride_deniesEvenErrors() {
		controller.setLogging(Level.OFF, quietLogger.getName());
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(DENY, decide(quietLogger, Level.ERROR));
		}
	}

	@Test
	void closedRegistration_neutral() {
		registration.close();
		try (MDCScope __ = setupMDC("quiet-connection")) {
			assertEquals(NEUTRAL, decide(quietLogger, Level.WARN));
		}
		registration = ConnectionLogFilter.withController("quiet-connection", controller);
	}

	private ch.qos.logback.core.spi.FilterReply decide(Logger logger, Level level) {
		return filter.decide(null, logger, level, "message", null, null);
	}
}
