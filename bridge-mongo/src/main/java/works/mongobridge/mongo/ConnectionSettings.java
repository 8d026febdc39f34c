package works.mongobridge.mongo;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConnectionSettings {
	/**
	 * Appears in thread names and in the MDC of every log line
	 * emitted on behalf of this connection.
	 * If null, a name is generated from the host.
	 */
	String connectionName;

	/**
	 * Used when the host string has no <code>:port</code> suffix.
	 */
	@Default int defaultPort = HostAddress.DEFAULT_PORT;

	/**
	 * The database used for namespaces that have no <code>db.</code> prefix.
	 */
	@Default String defaultDatabase = "test";

	@Default ConversionPolicy conversionPolicy = ConversionPolicy.LENIENT;

	@Default int connectTimeoutMS = 10_000;
	@Default int serverSelectionTimeoutMS = 10_000;

	/**
	 * Zero means no timeout.
	 */
	@Default int socketTimeoutMS = 0;

	@Default String applicationName = "mongo-bridge";

	public void validate() {
		if (defaultPort < 1 || defaultPort > 65535) {
			throw new IllegalArgumentException("defaultPort out of range: " + defaultPort);
		}
		if (defaultDatabase == null || defaultDatabase.isEmpty() || defaultDatabase.contains(".")) {
			throw new IllegalArgumentException("Invalid defaultDatabase: \"" + defaultDatabase + "\"");
		}
		if (conversionPolicy == null) {
			throw new IllegalArgumentException("conversionPolicy is required");
		}
		if (connectTimeoutMS < 0 || serverSelectionTimeoutMS < 0 || socketTimeoutMS < 0) {
			throw new IllegalArgumentException("Timeouts must not be negative");
		}
	}
}
