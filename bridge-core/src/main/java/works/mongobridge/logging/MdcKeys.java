package works.mongobridge.logging;

/**
 * Keys used in the SLF4J {@link org.slf4j.MDC MDC}.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * The name of the connection on whose behalf the current thread is working.
	 */
	public static final String CONNECTION = "mongobridge.connection";

	/**
	 * The operation currently running on a worker thread.
	 */
	public static final String OPERATION = "mongobridge.operation";
}
