package works.mongobridge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.mongobridge.DynamicValue.MappingValue;
import works.mongobridge.DynamicValue.Tag;
import works.mongobridge.exceptions.WrongTagException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DynamicValueTest {

	@Test
	void tags_matchVariants() {
		assertEquals(Tag.NULL, DynamicValue.NULL.tag());
		assertEquals(Tag.BOOL, DynamicValue.of(true).tag());
		assertEquals(Tag.INT, DynamicValue.of(1).tag());
		assertEquals(Tag.DOUBLE, DynamicValue.of(1.5).tag());
		assertEquals(Tag.STRING, DynamicValue.of("x").tag());
		assertEquals(Tag.SEQUENCE, DynamicValue.sequence().tag());
		assertEquals(Tag.MAPPING, DynamicValue.emptyMapping().tag());
		assertTrue(Tag.SEQUENCE.isComposite());
		assertTrue(Tag.MAPPING.isComposite());
	}

	@Test
	void nullString_isNullValue() {
		assertSame(DynamicValue.NULL, DynamicValue.of((String) null));
	}

	@Test
	void accessors_wrongTag_throws() {
		DynamicValue value = DynamicValue.of("text");
		assertEquals("text", value.asString());
		WrongTagException e = assertThrows(WrongTagException.class, value::asLong);
		assertEquals(Tag.STRING, e.actualTag());
		assertThrows(WrongTagException.class, value::asMapping);
	}

	@Test
	void mapping_equalityIgnoresOrder_iterationKeepsIt() {
		MappingValue ab = DynamicValue.mapping().put("a", 1).put("b", 2).build();
		MappingValue ba = DynamicValue.mapping().put("b", 2).put("a", 1).build();
		assertEquals(ab, ba);
		assertEquals(List.of("a", "b"), new ArrayList<>(ab.entries().keySet()));
		assertEquals(List.of("b", "a"), new ArrayList<>(ba.entries().keySet()));
	}

	@Test
	void mapping_repeatedKey_keepsPositionReplacesValue() {
		MappingValue m = DynamicValue.mapping().put("a", 1).put("b", 2).put("a", 3).build();
		assertEquals(List.of("a", "b"), new ArrayList<>(m.entries().keySet()));
		assertEquals(3, m.get("a").asLong());
	}

	@Test
	void mapping_missingKey_getReturnsNull() {
		assertSame(DynamicValue.NULL, DynamicValue.emptyMapping().get("absent"));
	}

	@Test
	void sequence_orderMatters() {
		assertNotEquals(
			DynamicValue.sequence(DynamicValue.of(1), DynamicValue.of(2)),
			DynamicValue.sequence(DynamicValue.of(2), DynamicValue.of(1)));
	}

	@Test
	void composites_areImmutableCopies() {
		List<DynamicValue> elements = new ArrayList<>(List.of(DynamicValue.of(1)));
		var sequence = DynamicValue.sequence(elements);
		elements.add(DynamicValue.of(2));
		assertEquals(1, sequence.size());
		assertThrows(UnsupportedOperationException.class, () -> sequence.elements().add(DynamicValue.NULL));

		Map<String, DynamicValue> entries = new LinkedHashMap<>();
		entries.put("k", DynamicValue.of("v"));
		var mapping = new MappingValue(entries);
		entries.put("other", DynamicValue.NULL);
		assertEquals(1, mapping.size());
		assertThrows(UnsupportedOperationException.class, () -> mapping.entries().put("x", DynamicValue.NULL));
	}

	@Test
	void intAndDouble_areDistinct() {
		assertNotEquals(DynamicValue.of(1), DynamicValue.of(1.0));
	}
}
