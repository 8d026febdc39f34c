package works.mongobridge.mongo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.RawBsonDocument;
import org.bson.io.BasicOutputBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.mongobridge.DynamicValue;
import works.mongobridge.DynamicValue.MappingValue;
import works.mongobridge.DynamicValue.SequenceValue;
import works.mongobridge.mongo.exceptions.BsonFormatException;

import static works.mongobridge.mongo.ConversionPolicy.STRICT;

/**
 * Converts between {@link DynamicValue} and BSON documents.
 * <p>
 * BSON has no distinct array type at the top level, so a root {@link SequenceValue}
 * is encoded as a document whose keys are <code>"0"</code>, <code>"1"</code>, and so on.
 * Conversely, a decoded document whose keys are exactly that sequence becomes a
 * {@link SequenceValue}. Nested sequences are encoded as BSON arrays.
 * <p>
 * Integers are written as int32 when they fit, and int64 otherwise.
 * Decoding accepts null, boolean, int32, int64, double, string, array, and document;
 * what happens to other types is determined by the {@link ConversionPolicy}.
 * <p>
 * An empty document always decodes as an empty mapping,
 * so an empty root sequence does not survive a round trip.
 */
public final class BsonConverter {
	private final ConversionPolicy policy;

	public BsonConverter(ConversionPolicy policy) {
		this.policy = policy;
	}

	public ConversionPolicy policy() {
		return policy;
	}

	/**
	 * @return an immutable document
	 * @throws BsonFormatException if <code>root</code> is not a mapping or sequence and the policy is {@link ConversionPolicy#STRICT STRICT}
	 */
	public RawBsonDocument encode(DynamicValue root) {
		BasicOutputBuffer buffer = new BasicOutputBuffer();
		try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
			writer.writeStartDocument();
			if (root instanceof MappingValue m) {
				writeMembers(writer, m);
			} else if (root instanceof SequenceValue s) {
				writeIndexedMembers(writer, s);
			} else if (policy == STRICT) {
				throw new BsonFormatException("Document root must be a mapping or sequence, not " + root.tag());
			} else {
				LOGGER.debug("Encoding {} root as an empty document", root.tag());
			}
			writer.writeEndDocument();
		}
		return new RawBsonDocument(buffer.toByteArray());
	}

	public List<BsonDocument> encodeAll(List<? extends DynamicValue> roots) {
		List<BsonDocument> result = new ArrayList<>(roots.size());
		for (DynamicValue root: roots) {
			result.add(encode(root));
		}
		return result;
	}

	/**
	 * @return a {@link SequenceValue} if the document's keys are <code>"0"</code> through <code>"n-1"</code> in order;
	 * otherwise a {@link MappingValue}
	 * @throws BsonFormatException if the document contains an unsupported type and the policy is {@link ConversionPolicy#STRICT STRICT}
	 */
	public DynamicValue decode(BsonDocument document) {
		return decodeDocument("", document);
	}

	/**
	 * @return true if the document is non-empty and its keys are
	 * <code>"0"</code>, <code>"1"</code>, ... in that order.
	 */
	public static boolean couldBeArray(BsonDocument document) {
		if (document.isEmpty()) {
			return false;
		}
		int expected = 0;
		for (String key: document.keySet()) {
			if (!key.equals(Integer.toString(expected))) {
				return false;
			}
			++expected;
		}
		return true;
	}

	private void writeMembers(BsonBinaryWriter writer, MappingValue mapping) {
		for (Map.Entry<String, DynamicValue> entry: mapping.entries().entrySet()) {
			writer.writeName(entry.getKey());
			writeValue(writer, entry.getValue());
		}
	}

	private void writeIndexedMembers(BsonBinaryWriter writer, SequenceValue sequence) {
		for (int i = 0; i < sequence.size(); i++) {
			writer.writeName(Integer.toString(i));
			writeValue(writer, sequence.get(i));
		}
	}

	private void writeValue(BsonBinaryWriter writer, DynamicValue value) {
		switch (value.tag()) {
			case NULL -> writer.writeNull();
			case BOOL -> writer.writeBoolean(value.asBoolean());
			case INT -> {
				long n = value.asLong();
				if (Integer.MIN_VALUE <= n && n <= Integer.MAX_VALUE) {
					writer.writeInt32((int) n);
				} else {
					writer.writeInt64(n);
				}
			}
			case DOUBLE -> writer.writeDouble(value.asDouble());
			case STRING -> writer.writeString(value.asString());
			case SEQUENCE -> {
				writer.writeStartArray();
				for (DynamicValue element: value.asSequence()) {
					writeValue(writer, element);
				}
				writer.writeEndArray();
			}
			case MAPPING -> {
				writer.writeStartDocument();
				writeMembers(writer, (MappingValue) value);
				writer.writeEndDocument();
			}
		}
	}

	private DynamicValue decodeDocument(String path, BsonDocument document) {
		if (couldBeArray(document)) {
			List<DynamicValue> elements = new ArrayList<>(document.size());
			for (Map.Entry<String, BsonValue> entry: document.entrySet()) {
				elements.add(decodeValue(path + "/" + entry.getKey(), entry.getValue()));
			}
			return DynamicValue.sequence(elements);
		}
		DynamicValue.MappingBuilder builder = DynamicValue.mapping();
		for (Map.Entry<String, BsonValue> entry: document.entrySet()) {
			builder.put(entry.getKey(), decodeValue(path + "/" + entry.getKey(), entry.getValue()));
		}
		return builder.build();
	}

	private DynamicValue decodeArray(String path, BsonArray array) {
		List<DynamicValue> elements = new ArrayList<>(array.size());
		for (int i = 0; i < array.size(); i++) {
			elements.add(decodeValue(path + "/" + i, array.get(i)));
		}
		return DynamicValue.sequence(elements);
	}

	private DynamicValue decodeValue(String path, BsonValue value) {
		return switch (value.getBsonType()) {
			case NULL -> DynamicValue.NULL;
			case BOOLEAN -> DynamicValue.of(value.asBoolean().getValue());
			case INT32 -> DynamicValue.of((long) value.asInt32().getValue());
			case INT64 -> DynamicValue.of(value.asInt64().getValue());
			case DOUBLE -> DynamicValue.of(value.asDouble().getValue());
			case STRING -> DynamicValue.of(value.asString().getValue());
			case ARRAY -> decodeArray(path, value.asArray());
			case DOCUMENT -> decodeDocument(path, value.asDocument());
			default -> unsupported(path, value);
		};
	}

	private DynamicValue unsupported(String path, BsonValue value) {
		if (policy == STRICT) {
			throw new BsonFormatException("Unsupported BSON type " + value.getBsonType() + " at \"" + path + "\"");
		}
		LOGGER.debug("Decoding unsupported BSON type {} at \"{}\" as null", value.getBsonType(), path);
		return DynamicValue.NULL;
	}

	@Override
	public String toString() {
		return "BsonConverter{" + policy + '}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BsonConverter.class);
}
