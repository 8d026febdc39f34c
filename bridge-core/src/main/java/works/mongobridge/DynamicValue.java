package works.mongobridge;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import works.mongobridge.exceptions.WrongTagException;

import static java.util.Objects.requireNonNull;

/**
 * A document, query, or result, independent of any wire format.
 * <p>
 * The {@link #tag() tag} of a value fully determines which variant it is,
 * and therefore which accessor may be called.
 * Values are immutable once built, so they can be handed from one thread
 * to another without copying.
 * <p>
 * {@link SequenceValue} preserves element order.
 * {@link MappingValue} preserves insertion order for iteration,
 * but its {@link Object#equals equality} ignores key order.
 */
public sealed interface DynamicValue
	permits DynamicValue.NullValue,
	DynamicValue.BoolValue,
	DynamicValue.IntValue,
	DynamicValue.DoubleValue,
	DynamicValue.StringValue,
	DynamicValue.SequenceValue,
	DynamicValue.MappingValue
{
	enum Tag {
		NULL,
		BOOL,
		INT,
		DOUBLE,
		STRING,
		SEQUENCE,
		MAPPING;

		public boolean isComposite() {
			return this == SEQUENCE || this == MAPPING;
		}
	}

	Tag tag();

	default boolean isNull() {
		return tag() == Tag.NULL;
	}

	default boolean asBoolean() {
		return as(BoolValue.class).value();
	}

	default long asLong() {
		return as(IntValue.class).value();
	}

	default double asDouble() {
		return as(DoubleValue.class).value();
	}

	default String asString() {
		return as(StringValue.class).value();
	}

	default List<DynamicValue> asSequence() {
		return as(SequenceValue.class).elements();
	}

	default Map<String, DynamicValue> asMapping() {
		return as(MappingValue.class).entries();
	}

	private <V extends DynamicValue> V as(Class<V> variant) {
		if (variant.isInstance(this)) {
			return variant.cast(this);
		} else {
			throw new WrongTagException(tag(), variant.getSimpleName());
		}
	}

	NullValue NULL = new NullValue();
	BoolValue TRUE = new BoolValue(true);
	BoolValue FALSE = new BoolValue(false);

	static DynamicValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	static DynamicValue of(long value) {
		return new IntValue(value);
	}

	static DynamicValue of(double value) {
		return new DoubleValue(value);
	}

	static DynamicValue of(String value) {
		return (value == null) ? NULL : new StringValue(value);
	}

	static SequenceValue sequence(DynamicValue... elements) {
		return new SequenceValue(List.of(elements));
	}

	static SequenceValue sequence(Collection<? extends DynamicValue> elements) {
		return new SequenceValue(List.copyOf(elements));
	}

	static MappingValue emptyMapping() {
		return MappingValue.EMPTY;
	}

	static MappingBuilder mapping() {
		return new MappingBuilder();
	}

	record NullValue() implements DynamicValue {
		@Override public Tag tag() { return Tag.NULL; }
		@Override public String toString() { return "null"; }
	}

	record BoolValue(boolean value) implements DynamicValue {
		@Override public Tag tag() { return Tag.BOOL; }
		@Override public String toString() { return Boolean.toString(value); }
	}

	record IntValue(long value) implements DynamicValue {
		@Override public Tag tag() { return Tag.INT; }
		@Override public String toString() { return Long.toString(value); }
	}

	record DoubleValue(double value) implements DynamicValue {
		@Override public Tag tag() { return Tag.DOUBLE; }
		@Override public String toString() { return Double.toString(value); }
	}

	record StringValue(@NotNull String value) implements DynamicValue {
		public StringValue {
			requireNonNull(value);
		}

		@Override public Tag tag() { return Tag.STRING; }
		@Override public String toString() { return '"' + value + '"'; }
	}

	record SequenceValue(@NotNull List<DynamicValue> elements) implements DynamicValue {
		public SequenceValue {
			elements = List.copyOf(elements);
		}

		@Override public Tag tag() { return Tag.SEQUENCE; }

		public int size() {
			return elements.size();
		}

		public DynamicValue get(int index) {
			return elements.get(index);
		}

		@Override public String toString() { return elements.toString(); }
	}

	record MappingValue(@NotNull Map<String, DynamicValue> entries) implements DynamicValue {
		static final MappingValue EMPTY = new MappingValue(Map.of());

		public MappingValue {
			LinkedHashMap<String, DynamicValue> copy = new LinkedHashMap<>(entries.size());
			entries.forEach((key, value) -> copy.put(requireNonNull(key, "key"), requireNonNull(value, "value")));
			entries = Collections.unmodifiableMap(copy);
		}

		@Override public Tag tag() { return Tag.MAPPING; }

		public int size() {
			return entries.size();
		}

		public boolean containsKey(String key) {
			return entries.containsKey(key);
		}

		/**
		 * @return the value for <code>key</code>, or {@link DynamicValue#NULL} if absent.
		 */
		public DynamicValue get(String key) {
			return entries.getOrDefault(key, NULL);
		}

		@Override public String toString() { return entries.toString(); }
	}

	/**
	 * Accumulates the entries of a {@link MappingValue} in order.
	 * A repeated key replaces the earlier value but keeps its original position.
	 */
	final class MappingBuilder {
		private final LinkedHashMap<String, DynamicValue> entries = new LinkedHashMap<>();

		MappingBuilder() { }

		public MappingBuilder put(String key, DynamicValue value) {
			entries.put(requireNonNull(key, "key"), Objects.requireNonNullElse(value, NULL));
			return this;
		}

		public MappingBuilder put(String key, String value) {
			return put(key, DynamicValue.of(value));
		}

		public MappingBuilder put(String key, long value) {
			return put(key, DynamicValue.of(value));
		}

		public MappingBuilder put(String key, double value) {
			return put(key, DynamicValue.of(value));
		}

		public MappingBuilder put(String key, boolean value) {
			return put(key, DynamicValue.of(value));
		}

		public MappingValue build() {
			return new MappingValue(entries);
		}
	}
}
