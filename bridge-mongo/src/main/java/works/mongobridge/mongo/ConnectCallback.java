package works.mongobridge.mongo;

/**
 * Told whether {@link Connection#connect} succeeded.
 * When <code>connected</code> is true, <code>error</code> is empty.
 */
@FunctionalInterface
public interface ConnectCallback {
	void onConnect(boolean connected, String error);
}
