package works.mongobridge.mongo;

import works.mongobridge.mongo.exceptions.MalformedAddressException;

/**
 * A server address of the form <code>host[:port]</code>.
 * IPv6 literals must be bracketed, as in <code>[::1]:27017</code>.
 */
public record HostAddress(String host, int port) {
	public static final int DEFAULT_PORT = 27017;

	public HostAddress {
		if (host == null || host.isBlank()) {
			throw new MalformedAddressException(String.valueOf(host), "host is empty");
		}
		if (port < 1 || port > 65535) {
			throw new MalformedAddressException(host + ":" + port, "port out of range");
		}
	}

	public static HostAddress parse(String address) {
		return parse(address, DEFAULT_PORT);
	}

	public static HostAddress parse(String address, int defaultPort) {
		if (address == null) {
			throw new MalformedAddressException("null", "address is missing");
		}
		String trimmed = address.trim();
		if (trimmed.isEmpty()) {
			throw new MalformedAddressException(address, "address is empty");
		}

		String host;
		String portText;
		if (trimmed.startsWith("[")) {
			int close = trimmed.indexOf(']');
			if (close < 0) {
				throw new MalformedAddressException(address, "unterminated IPv6 literal");
			}
			host = trimmed.substring(1, close);
			String rest = trimmed.substring(close + 1);
			if (rest.isEmpty()) {
				portText = null;
			} else if (rest.startsWith(":")) {
				portText = rest.substring(1);
			} else {
				throw new MalformedAddressException(address, "unexpected text after IPv6 literal");
			}
		} else {
			int colon = trimmed.indexOf(':');
			if (colon < 0) {
				host = trimmed;
				portText = null;
			} else if (trimmed.indexOf(':', colon + 1) >= 0) {
				throw new MalformedAddressException(address, "IPv6 literals must be enclosed in brackets");
			} else {
				host = trimmed.substring(0, colon);
				portText = trimmed.substring(colon + 1);
			}
		}

		if (host.isEmpty()) {
			throw new MalformedAddressException(address, "host is empty");
		}
		if (portText == null) {
			return new HostAddress(host, defaultPort);
		}
		int port;
		try {
			port = Integer.parseInt(portText);
		} catch (NumberFormatException e) {
			throw new MalformedAddressException(address, "port is not a number");
		}
		if (port < 1 || port > 65535) {
			throw new MalformedAddressException(address, "port out of range");
		}
		return new HostAddress(host, port);
	}

	@Override
	public String toString() {
		if (host.indexOf(':') >= 0) {
			return "[" + host + "]:" + port;
		} else {
			return host + ":" + port;
		}
	}
}
