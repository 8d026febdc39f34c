package works.mongobridge.exceptions;

import works.mongobridge.DynamicValue;

/**
 * Thrown when a {@link DynamicValue} accessor is called on a value of a different tag.
 */
public class WrongTagException extends IllegalStateException {
	private final DynamicValue.Tag actualTag;

	public WrongTagException(DynamicValue.Tag actualTag, String expectedVariant) {
		super("Expected " + expectedVariant + " but value is " + actualTag);
		this.actualTag = actualTag;
	}

	public DynamicValue.Tag actualTag() {
		return actualTag;
	}
}
