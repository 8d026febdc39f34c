package works.mongobridge.mongo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonNumber;
import org.bson.BsonValue;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.Callback;
import works.mongobridge.Deferred;
import works.mongobridge.Delivery;
import works.mongobridge.DynamicValue;
import works.mongobridge.Outcome;
import works.mongobridge.mongo.exceptions.DriverException;
import works.mongobridge.mongo.exceptions.MalformedAddressException;
import works.mongobridge.mongo.internal.Dispatcher;
import works.mongobridge.reactor.Loop;

import static java.util.Objects.requireNonNull;

/**
 * An asynchronous connection to one MongoDB server.
 * <p>
 * Every operation returns immediately. The blocking work happens on a thread
 * owned by this connection, and results are delivered on the {@link Loop}
 * given to {@link #connect}, so reactions never need to worry about concurrency.
 * <p>
 * Operations start in the order they were issued. To make one operation wait
 * for another to finish, issue it from the first one's
 * {@link Deferred#onComplete completion reaction}.
 * <p>
 * Reactions should be registered on the returned {@link Deferred} right away,
 * before returning control to the loop. An operation whose Deferred has no success
 * or failure reaction at that point skips the work of finding out whether it
 * succeeded, and only its completion reaction runs.
 * <p>
 * Collection names are namespaces of the form <code>database.collection</code>;
 * a bare collection name refers to {@link ConnectionSettings#defaultDatabase()}.
 */
public final class Connection implements AutoCloseable {
	private final String name;
	private final BsonConverter converter;
	private final Dispatcher dispatcher;

	public static final String CONNECTION_LOST = "Connection to MongoDB lost";

	private Connection(String name, Loop notifier, ConnectionSettings settings, BlockingDriver driver) {
		this.name = name;
		this.converter = new BsonConverter(settings.conversionPolicy());
		this.dispatcher = new Dispatcher(name, notifier, driver);
	}

	public static Connection connect(@NotNull Loop notifier, @NotNull String host, @NotNull ConnectCallback callback) {
		return connect(notifier, host, ConnectionSettings.builder().build(), callback);
	}

	public static Connection connect(@NotNull Loop notifier, @NotNull String host, @NotNull ConnectionSettings settings, @NotNull ConnectCallback callback) {
		return connect(notifier, host, settings, DriverFactory.syncDriver(), callback);
	}

	/**
	 * Creates a connection and begins connecting to <code>host</code>.
	 * <p>
	 * The outcome is reported to <code>callback</code> on <code>notifier</code>.
	 * A malformed <code>host</code> is reported the same way as a failure to connect;
	 * it does not throw.
	 * The returned connection can be used immediately: operations issued before
	 * the connection is established wait for it.
	 *
	 * @param host of the form <code>host[:port]</code>
	 */
	public static Connection connect(@NotNull Loop notifier, @NotNull String host, @NotNull ConnectionSettings settings, @NotNull DriverFactory driverFactory, @NotNull ConnectCallback callback) {
		requireNonNull(notifier);
		requireNonNull(callback);
		settings.validate();
		String name = (settings.connectionName() == null)
			? "mongo-" + CONNECTION_COUNTER.incrementAndGet()
			: settings.connectionName();
		Connection result = new Connection(name, notifier, settings, driverFactory.create(settings));

		try {
			result.beginConnecting(HostAddress.parse(host, settings.defaultPort()), callback);
		} catch (MalformedAddressException e) {
			LOGGER.debug("Connection {} not attempted", name, e);
			notifier.submit(() -> callback.onConnect(false, e.getMessage()));
		}
		return result;
	}

	private void beginConnecting(HostAddress address, ConnectCallback callback) {
		LOGGER.debug("Connection {} to {}", name, address);
		dispatcher.dispatch("connect " + address, new ConnectDelivery(callback), (driver, requiresStatus) -> {
			driver.connect(address);
			return Outcome.success(null);
		});
	}

	public String name() {
		return name;
	}

	/**
	 * Reports, on the loop, whether the driver believes it is connected.
	 * Runs after all previously issued operations.
	 */
	public void connected(@NotNull Consumer<Boolean> callback) {
		requireNonNull(callback);
		Callback<Boolean> adapter = (result, error) -> callback.accept(error == null && Boolean.TRUE.equals(result));
		dispatcher.dispatch("connected", Delivery.toCallback(adapter), (driver, requiresStatus) ->
			Outcome.success(!driver.isFailed()));
	}

	/**
	 * @return on success, a sequence of the matching documents
	 */
	public Deferred<DynamicValue> query(@NotNull String collection, @NotNull DynamicValue filter) {
		Deferred.Resolver<DynamicValue> resolver = Deferred.newResolver();
		query(collection, filter, resolver);
		return resolver.deferred();
	}

	public void query(@NotNull String collection, @NotNull DynamicValue filter, @NotNull Callback<DynamicValue> callback) {
		query(collection, filter, Delivery.toCallback(callback));
	}

	private void query(String collection, DynamicValue filter, Delivery<DynamicValue> delivery) {
		requireNonNull(filter);
		dispatcher.dispatch("query " + collection, delivery, (driver, requiresStatus) -> {
			BlockingDriver.Cursor cursor = driver.query(collection, converter.encode(filter));
			if (cursor == null) {
				return Outcome.failure(CONNECTION_LOST);
			}
			try (cursor) {
				if (!requiresStatus) {
					return Outcome.unobserved();
				}
				List<DynamicValue> results = new ArrayList<>();
				while (cursor.more()) {
					results.add(converter.decode(cursor.next()));
				}
				LOGGER.trace("Query on {} returned {} documents", collection, results.size());
				return Outcome.success(DynamicValue.sequence(results));
			}
		});
	}

	public Deferred<Void> insert(@NotNull String collection, @NotNull DynamicValue document) {
		Deferred.Resolver<Void> resolver = Deferred.newResolver();
		insert(collection, document, resolver);
		return resolver.deferred();
	}

	public void insert(@NotNull String collection, @NotNull DynamicValue document, @NotNull Callback<Void> callback) {
		insert(collection, document, Delivery.toCallback(callback));
	}

	public void insertAndForget(@NotNull String collection, @NotNull DynamicValue document) {
		insert(collection, document, Delivery.discard());
	}

	private void insert(String collection, DynamicValue document, Delivery<Void> delivery) {
		requireNonNull(document);
		dispatcher.dispatch("insert " + collection, delivery, (driver, requiresStatus) -> {
			driver.insert(collection, converter.encode(document));
			return acknowledgement(driver, requiresStatus);
		});
	}

	public Deferred<Void> insert(@NotNull String collection, @NotNull List<DynamicValue> documents) {
		Deferred.Resolver<Void> resolver = Deferred.newResolver();
		insertAll(collection, documents, resolver);
		return resolver.deferred();
	}

	public void insert(@NotNull String collection, @NotNull List<DynamicValue> documents, @NotNull Callback<Void> callback) {
		insertAll(collection, documents, Delivery.toCallback(callback));
	}

	public void insertAndForget(@NotNull String collection, @NotNull List<DynamicValue> documents) {
		insertAll(collection, documents, Delivery.discard());
	}

	private void insertAll(String collection, List<DynamicValue> documents, Delivery<Void> delivery) {
		List<DynamicValue> snapshot = List.copyOf(documents);
		dispatcher.dispatch("insert " + collection, delivery, (driver, requiresStatus) -> {
			driver.insert(collection, converter.encodeAll(snapshot));
			return acknowledgement(driver, requiresStatus);
		});
	}

	/**
	 * Same as {@link #update(String, DynamicValue, DynamicValue, boolean, boolean) update}
	 * with <code>upsert</code> and <code>multi</code> both false.
	 */
	public Deferred<Void> update(@NotNull String collection, @NotNull DynamicValue filter, @NotNull DynamicValue document) {
		return update(collection, filter, document, false, false);
	}

	/**
	 * @param document if it starts with a <code>$</code> operator, the changes to make;
	 *                 otherwise, a replacement for the matched document.
	 * @param upsert if true, inserts a document when none matches <code>filter</code>
	 * @param multi if true, updates all matching documents rather than just one.
	 *              Requires <code>document</code> to use <code>$</code> operators.
	 */
	public Deferred<Void> update(@NotNull String collection, @NotNull DynamicValue filter, @NotNull DynamicValue document, boolean upsert, boolean multi) {
		Deferred.Resolver<Void> resolver = Deferred.newResolver();
		update(collection, filter, document, upsert, multi, resolver);
		return resolver.deferred();
	}

	public void update(@NotNull String collection, @NotNull DynamicValue filter, @NotNull DynamicValue document, boolean upsert, boolean multi, @NotNull Callback<Void> callback) {
		update(collection, filter, document, upsert, multi, Delivery.toCallback(callback));
	}

	public void updateAndForget(@NotNull String collection, @NotNull DynamicValue filter, @NotNull DynamicValue document, boolean upsert, boolean multi) {
		update(collection, filter, document, upsert, multi, Delivery.discard());
	}

	private void update(String collection, DynamicValue filter, DynamicValue document, boolean upsert, boolean multi, Delivery<Void> delivery) {
		requireNonNull(filter);
		requireNonNull(document);
		dispatcher.dispatch("update " + collection, delivery, (driver, requiresStatus) -> {
			driver.update(collection, converter.encode(filter), converter.encode(document), upsert, multi);
			return acknowledgement(driver, requiresStatus);
		});
	}

	/**
	 * Removes all documents matching <code>filter</code>.
	 */
	public Deferred<Void> remove(@NotNull String collection, @NotNull DynamicValue filter) {
		return remove(collection, filter, false);
	}

	public Deferred<Void> remove(@NotNull String collection, @NotNull DynamicValue filter, boolean limitToOne) {
		Deferred.Resolver<Void> resolver = Deferred.newResolver();
		remove(collection, filter, limitToOne, resolver);
		return resolver.deferred();
	}

	public void remove(@NotNull String collection, @NotNull DynamicValue filter, boolean limitToOne, @NotNull Callback<Void> callback) {
		remove(collection, filter, limitToOne, Delivery.toCallback(callback));
	}

	public void removeAndForget(@NotNull String collection, @NotNull DynamicValue filter, boolean limitToOne) {
		remove(collection, filter, limitToOne, Delivery.discard());
	}

	private void remove(String collection, DynamicValue filter, boolean limitToOne, Delivery<Void> delivery) {
		requireNonNull(filter);
		dispatcher.dispatch("remove " + collection, delivery, (driver, requiresStatus) -> {
			driver.remove(collection, converter.encode(filter), limitToOne);
			return acknowledgement(driver, requiresStatus);
		});
	}

	/**
	 * @return on success, the server's reply. Fails if the reply's <code>ok</code> field is not truthy,
	 * with the reply's <code>errmsg</code> or <code>error</code> as the message.
	 */
	public Deferred<DynamicValue> runCommand(@NotNull String database, @NotNull DynamicValue command) {
		Deferred.Resolver<DynamicValue> resolver = Deferred.newResolver();
		runCommand(database, command, resolver);
		return resolver.deferred();
	}

	public void runCommand(@NotNull String database, @NotNull DynamicValue command, @NotNull Callback<DynamicValue> callback) {
		runCommand(database, command, Delivery.toCallback(callback));
	}

	private void runCommand(String database, DynamicValue command, Delivery<DynamicValue> delivery) {
		requireNonNull(command);
		dispatcher.dispatch("runCommand " + database, delivery, (driver, requiresStatus) -> {
			BsonDocument reply = driver.runCommand(database, converter.encode(command));
			if (!requiresStatus) {
				return Outcome.unobserved();
			}
			if (reply == null) {
				return Outcome.failure(CONNECTION_LOST);
			}
			if (isOk(reply)) {
				return Outcome.success(converter.decode(reply));
			} else {
				return Outcome.failure(commandError(reply));
			}
		});
	}

	/**
	 * Shuts down the driver once all previously issued operations have finished.
	 * Operations issued afterward fail with {@value Dispatcher#CLOSED_MESSAGE}.
	 */
	@Override
	public void close() {
		LOGGER.debug("Closing connection {}", name);
		dispatcher.close();
	}

	/**
	 * Closing starts when the loop runs the task queued by {@link #close()},
	 * so this must not be called from the loop's own thread.
	 *
	 * @return true if the connection finished closing within the given time.
	 */
	public boolean awaitClosed(Duration timeout) throws InterruptedException {
		return dispatcher.awaitTermination(timeout);
	}

	@Override
	public String toString() {
		return "Connection{" + name + '}';
	}

	private static Outcome<Void> acknowledgement(BlockingDriver driver, boolean requiresStatus) throws DriverException {
		if (!requiresStatus) {
			return Outcome.unobserved();
		}
		String error = driver.getLastError();
		if (error == null || error.isEmpty()) {
			return Outcome.success(null);
		} else {
			return Outcome.failure(error);
		}
	}

	static boolean isOk(BsonDocument reply) {
		BsonValue ok = reply.get("ok");
		if (ok instanceof BsonNumber n) {
			return n.doubleValue() != 0.0;
		} else if (ok instanceof BsonBoolean b) {
			return b.getValue();
		} else {
			return false;
		}
	}

	static String commandError(BsonDocument reply) {
		for (String field: List.of("errmsg", "error")) {
			BsonValue value = reply.get(field);
			if (value != null && value.isString() && !value.asString().getValue().isEmpty()) {
				return value.asString().getValue();
			}
		}
		return "Command failed";
	}

	private record ConnectDelivery(ConnectCallback callback) implements Delivery<Void> {
		@Override
		public boolean requiresStatus() {
			return true;
		}

		@Override
		public void deliver(Outcome<Void> outcome) {
			if (outcome instanceof Outcome.Failure<Void> f) {
				callback.onConnect(false, f.message());
			} else {
				callback.onConnect(true, "");
			}
		}
	}

	private static final AtomicLong CONNECTION_COUNTER = new AtomicLong(0);
	private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);
}
