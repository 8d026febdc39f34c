package works.mongobridge.mongo.internal;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteConcernException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.mongo.BlockingDriver;
import works.mongobridge.mongo.ConnectionSettings;
import works.mongobridge.mongo.HostAddress;
import works.mongobridge.mongo.exceptions.DisconnectedException;
import works.mongobridge.mongo.exceptions.DriverException;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * {@link BlockingDriver} over the official synchronous MongoDB client.
 * <p>
 * Write errors reported by the server are recorded for {@link #getLastError()}.
 * Network errors and timeouts mark the driver as failed and throw {@link DisconnectedException};
 * the driver stays failed until a subsequent call succeeds.
 */
public final class SyncMongoDriver implements BlockingDriver {
	private final ConnectionSettings settings;
	private MongoClient client;
	private boolean isFailed = true;
	private String lastError = "";

	public SyncMongoDriver(ConnectionSettings settings) {
		this.settings = settings;
	}

	@Override
	public void connect(HostAddress address) throws DriverException {
		MongoClientSettings clientSettings = MongoClientSettings.builder()
			.applicationName(settings.applicationName())
			.applyToClusterSettings(b -> b
				.hosts(List.of(new ServerAddress(address.host(), address.port())))
				.serverSelectionTimeout(settings.serverSelectionTimeoutMS(), MILLISECONDS))
			.applyToSocketSettings(b -> b
				.connectTimeout(settings.connectTimeoutMS(), MILLISECONDS)
				.readTimeout(settings.socketTimeoutMS(), MILLISECONDS))
			.build();
		LOGGER.debug("Connecting to {}", address);
		MongoClient newClient = MongoClients.create(clientSettings);
		try {
			newClient.getDatabase("admin").runCommand(new BsonDocument("ping", new BsonInt32(1)));
		} catch (MongoException e) {
			newClient.close();
			throw new DriverException(messageOf(e), e);
		}
		if (client != null) {
			client.close();
		}
		client = newClient;
		isFailed = false;
		lastError = "";
		LOGGER.debug("Connected to {}", address);
	}

	@Override
	public boolean isFailed() {
		return client == null || isFailed;
	}

	@Override
	public Cursor query(String namespace, BsonDocument filter) throws DriverException {
		if (client == null) {
			LOGGER.debug("Query on {} while not connected", namespace);
			return null;
		}
		MongoCollection<BsonDocument> collection = collection(namespace);
		try {
			MongoCursor<BsonDocument> cursor = collection.find(filter).iterator();
			isFailed = false;
			return new CursorAdapter(cursor);
		} catch (MongoSocketException | MongoTimeoutException e) {
			LOGGER.debug("Connection lost during query on {}", namespace, e);
			isFailed = true;
			return null;
		} catch (MongoException e) {
			throw new DriverException(messageOf(e), e);
		}
	}

	@Override
	public void insert(String namespace, BsonDocument document) throws DriverException {
		BsonDocument toInsert = mutableCopy(document);
		write(namespace, c -> c.insertOne(toInsert));
	}

	@Override
	public void insert(String namespace, List<BsonDocument> documents) throws DriverException {
		if (documents.isEmpty()) {
			lastError = "";
			return;
		}
		List<BsonDocument> toInsert = new ArrayList<>(documents.size());
		for (BsonDocument document: documents) {
			toInsert.add(mutableCopy(document));
		}
		write(namespace, c -> c.insertMany(toInsert));
	}

	@Override
	public void update(String namespace, BsonDocument filter, BsonDocument document, boolean upsert, boolean multi) throws DriverException {
		boolean isOperatorUpdate = !document.isEmpty() && document.getFirstKey().startsWith("$");
		if (isOperatorUpdate) {
			UpdateOptions options = new UpdateOptions().upsert(upsert);
			if (multi) {
				write(namespace, c -> c.updateMany(filter, document, options));
			} else {
				write(namespace, c -> c.updateOne(filter, document, options));
			}
		} else if (multi) {
			lastError = "multi update only works with $ operators";
		} else {
			write(namespace, c -> c.replaceOne(filter, document, new ReplaceOptions().upsert(upsert)));
		}
	}

	@Override
	public void remove(String namespace, BsonDocument filter, boolean justOne) throws DriverException {
		if (justOne) {
			write(namespace, c -> c.deleteOne(filter));
		} else {
			write(namespace, c -> c.deleteMany(filter));
		}
	}

	@Override
	public BsonDocument runCommand(String database, BsonDocument command) throws DriverException {
		MongoClient c = requireClient();
		try {
			BsonDocument reply = c.getDatabase(database).runCommand(command, BsonDocument.class);
			isFailed = false;
			return reply;
		} catch (MongoCommandException e) {
			// The server answered; the command just didn't work
			return e.getResponse();
		} catch (MongoException e) {
			throw translate(e);
		}
	}

	@Override
	public String getLastError() throws DriverException {
		requireClient();
		return lastError;
	}

	@Override
	public void close() {
		if (client != null) {
			LOGGER.debug("Closing client");
			client.close();
			client = null;
		}
	}

	private void write(String namespace, Consumer<MongoCollection<BsonDocument>> action) throws DriverException {
		MongoCollection<BsonDocument> collection = collection(namespace);
		lastError = "";
		try {
			action.accept(collection);
			isFailed = false;
		} catch (MongoWriteException e) {
			lastError = e.getError().getMessage();
		} catch (MongoWriteConcernException e) {
			lastError = e.getWriteConcernError().getMessage();
		} catch (MongoBulkWriteException e) {
			lastError = e.getWriteErrors().isEmpty()? messageOf(e) : e.getWriteErrors().get(0).getMessage();
		} catch (MongoException e) {
			throw translate(e);
		}
		if (!lastError.isEmpty()) {
			LOGGER.debug("Write to {} failed: {}", namespace, lastError);
		}
	}

	private MongoCollection<BsonDocument> collection(String namespace) throws DriverException {
		MongoClient c = requireClient();
		MongoNamespace ns;
		try {
			ns = (namespace.indexOf('.') >= 0)
				? new MongoNamespace(namespace)
				: new MongoNamespace(settings.defaultDatabase(), namespace);
		} catch (IllegalArgumentException e) {
			throw new DriverException("Invalid namespace \"" + namespace + "\"", e);
		}
		return c
			.getDatabase(ns.getDatabaseName())
			.getCollection(ns.getCollectionName(), BsonDocument.class);
	}

	private MongoClient requireClient() throws DisconnectedException {
		if (client == null) {
			throw new DisconnectedException("Not connected");
		}
		return client;
	}

	private DriverException translate(MongoException e) {
		if (e instanceof MongoSocketException || e instanceof MongoTimeoutException) {
			isFailed = true;
			return new DisconnectedException(messageOf(e), e);
		} else {
			return new DriverException(messageOf(e), e);
		}
	}

	/**
	 * The client adds an <code>_id</code> to inserted documents that lack one,
	 * which isn't possible on an immutable document.
	 */
	private static BsonDocument mutableCopy(BsonDocument document) {
		BsonDocument result = new BsonDocument();
		result.putAll(document);
		return result;
	}

	private static String messageOf(Exception e) {
		return (e.getMessage() == null)? e.getClass().getSimpleName() : e.getMessage();
	}

	/**
	 * Network errors while iterating mark the driver failed, as they do for any other call.
	 */
	private final class CursorAdapter implements Cursor {
		private final MongoCursor<BsonDocument> cursor;

		CursorAdapter(MongoCursor<BsonDocument> cursor) {
			this.cursor = cursor;
		}

		@Override
		public boolean more() {
			try {
				return cursor.hasNext();
			} catch (MongoSocketException | MongoTimeoutException e) {
				isFailed = true;
				throw e;
			}
		}

		@Override
		public BsonDocument next() {
			try {
				return cursor.next();
			} catch (MongoSocketException | MongoTimeoutException e) {
				isFailed = true;
				throw e;
			}
		}

		@Override
		public void close() {
			cursor.close();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SyncMongoDriver.class);
}
