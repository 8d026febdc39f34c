package works.mongobridge.mongo;

import works.mongobridge.mongo.internal.SyncMongoDriver;

@FunctionalInterface
public interface DriverFactory {
	BlockingDriver create(ConnectionSettings settings);

	static DriverFactory syncDriver() {
		return SyncMongoDriver::new;
	}
}
