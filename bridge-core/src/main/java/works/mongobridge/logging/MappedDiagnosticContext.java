package works.mongobridge.logging;

import org.slf4j.MDC;

import static works.mongobridge.logging.MdcKeys.CONNECTION;
import static works.mongobridge.logging.MdcKeys.OPERATION;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	/**
	 * Puts the connection name into the MDC for the duration of the returned scope,
	 * restoring whatever was there before when the scope is closed.
	 */
	public static MDCScope setupMDC(String connectionName) {
		MDCScope result = new MDCScope();
		MDC.put(CONNECTION, connectionName);
		return result;
	}

	public static MDCScope setupMDC(String connectionName, String operation) {
		MDCScope result = new MDCScope();
		MDC.put(CONNECTION, connectionName);
		MDC.put(OPERATION, operation);
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final String oldConnection = MDC.get(CONNECTION);
		private final String oldOperation = MDC.get(OPERATION);

		MDCScope() { }

		@Override
		public void close() {
			restore(CONNECTION, oldConnection);
			restore(OPERATION, oldOperation);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}
}
