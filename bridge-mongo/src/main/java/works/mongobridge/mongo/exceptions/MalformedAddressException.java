package works.mongobridge.mongo.exceptions;

/**
 * Indicates a server address that isn't of the form {@code host[:port]}.
 */
public class MalformedAddressException extends IllegalArgumentException {
	private final String address;

	public MalformedAddressException(String address, String problem) {
		super("Malformed address \"" + address + "\": " + problem);
		this.address = address;
	}

	public String address() {
		return address;
	}
}
