package works.mongobridge.mongo;

import java.util.List;
import org.bson.BsonDocument;
import works.mongobridge.mongo.exceptions.DisconnectedException;
import works.mongobridge.mongo.exceptions.DriverException;

/**
 * Synchronous database access, one call at a time.
 * <p>
 * A {@link Connection} owns exactly one of these and calls it only from its
 * worker thread, so implementations need not be thread-safe.
 * <p>
 * Namespaces are of the form <code>database.collection</code>;
 * a bare collection name refers to {@link ConnectionSettings#defaultDatabase()}.
 * <p>
 * Write methods don't report server-side write errors by throwing.
 * Instead, the error is recorded and returned by the next call to {@link #getLastError()}.
 * They throw {@link DriverException} only if the call itself could not be carried out.
 */
public interface BlockingDriver {
	/**
	 * Establishes the connection, and verifies the server responds.
	 *
	 * @throws DriverException with a message describing why the connection failed
	 */
	void connect(HostAddress address) throws DriverException;

	/**
	 * @return true if the driver has not connected, or has since lost its connection.
	 */
	boolean isFailed();

	/**
	 * @return null if the driver has lost its connection.
	 * The cursor must be {@link Cursor#close() closed} by the caller.
	 */
	Cursor query(String namespace, BsonDocument filter) throws DriverException;

	void insert(String namespace, BsonDocument document) throws DriverException;

	void insert(String namespace, List<BsonDocument> documents) throws DriverException;

	/**
	 * If <code>document</code> starts with a <code>$</code> operator,
	 * it describes changes to make; otherwise it replaces the matched document.
	 */
	void update(String namespace, BsonDocument filter, BsonDocument document, boolean upsert, boolean multi) throws DriverException;

	void remove(String namespace, BsonDocument filter, boolean justOne) throws DriverException;

	/**
	 * @return the server's reply, even if it indicates the command failed.
	 */
	BsonDocument runCommand(String database, BsonDocument command) throws DriverException;

	/**
	 * @return the error from the most recent write, or the empty string if it succeeded.
	 * @throws DisconnectedException if the status can't be determined
	 */
	String getLastError() throws DriverException;

	/**
	 * Releases all resources. The driver is unusable afterward.
	 */
	void close();

	interface Cursor extends AutoCloseable {
		boolean more();

		BsonDocument next();

		@Override
		void close();
	}
}
