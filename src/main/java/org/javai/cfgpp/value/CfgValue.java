package org.javai.cfgpp.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.cfgpp.CfgIndexOutOfBoundsException;
import org.javai.cfgpp.CfgKeyNotFoundException;
import org.javai.cfgpp.CfgTypeException;

/**
 * A node of a parsed CFG++ value tree. Sealed to ensure all value kinds are known.
 * <p>
 * Containers own their children exclusively: a tree never shares sub-trees and
 * never contains cycles. {@link ArrayValue} and {@link ObjectValue} are mutable
 * through {@link #push(CfgValue)} and {@link #set(String, CfgValue)}; every other
 * variant is immutable.
 * <p>
 * Lookups never throw. {@link #get(String)}, {@link #get(int)} and
 * {@link #getPath(String)} return an empty {@link Optional} both for a missing
 * entry and for a value of the wrong container kind. The {@code require*}
 * variants throw instead.
 */
public sealed interface CfgValue {

	ValueKind kind();

	/**
	 * Lower-case kind name, as used in type errors and validation messages.
	 */
	default String typeName() {
		return kind().typeName();
	}

	default boolean is(ValueKind expected) {
		return kind() == expected;
	}

	default boolean isNull() {
		return kind() == ValueKind.NULL;
	}

	// ---- lookups -------------------------------------------------------

	/**
	 * Entry of an object by key; empty for a missing key or a non-object.
	 */
	default Optional<CfgValue> get(String key) {
		if (this instanceof ObjectValue object) {
			return Optional.ofNullable(object.entries.get(key));
		}
		return Optional.empty();
	}

	/**
	 * Element of an array by position; empty when out of range or not an array.
	 */
	default Optional<CfgValue> get(int index) {
		if (this instanceof ArrayValue array && index >= 0 && index < array.elements.size()) {
			return Optional.of(array.elements.get(index));
		}
		return Optional.empty();
	}

	/**
	 * Navigates a dotted path such as {@code servers[0].host}. Each dot-separated
	 * segment is a key optionally followed by one or more {@code [index]} suffixes;
	 * a segment may also consist of suffixes alone, e.g. {@code [1].name} on an array.
	 *
	 * @return the addressed value, or empty on the first missing key or index
	 */
	default Optional<CfgValue> getPath(String path) {
		if (path == null) {
			return Optional.empty();
		}
		CfgValue current = this;
		for (String segment : path.split("\\.", -1)) {
			int bracket = segment.indexOf('[');
			String key = bracket < 0 ? segment : segment.substring(0, bracket);
			if (bracket != 0) {
				Optional<CfgValue> next = current.get(key);
				if (next.isEmpty()) {
					return Optional.empty();
				}
				current = next.get();
			}
			if (bracket < 0) {
				continue;
			}
			String suffixes = segment.substring(bracket);
			while (!suffixes.isEmpty()) {
				int close = suffixes.indexOf(']');
				if (!suffixes.startsWith("[") || close < 0) {
					return Optional.empty();
				}
				int index;
				try {
					index = Integer.parseInt(suffixes.substring(1, close));
				} catch (NumberFormatException e) {
					return Optional.empty();
				}
				Optional<CfgValue> next = current.get(index);
				if (next.isEmpty()) {
					return Optional.empty();
				}
				current = next.get();
				suffixes = suffixes.substring(close + 1);
			}
		}
		return Optional.of(current);
	}

	/**
	 * Like {@link #get(String)} but fails when there is no entry.
	 *
	 * @throws CfgKeyNotFoundException if the key is absent or this is not an object
	 */
	default CfgValue require(String key) {
		return get(key).orElseThrow(() -> new CfgKeyNotFoundException(key));
	}

	/**
	 * @throws CfgIndexOutOfBoundsException if the index is out of range or this is not an array
	 */
	default CfgValue require(int index) {
		return get(index).orElseThrow(() -> new CfgIndexOutOfBoundsException(index));
	}

	/**
	 * @throws CfgKeyNotFoundException naming the whole path when any segment is missing
	 */
	default CfgValue requirePath(String path) {
		return getPath(path).orElseThrow(() -> new CfgKeyNotFoundException(path));
	}

	// ---- mutation ------------------------------------------------------

	/**
	 * Assigns an object entry; an existing entry with the same key is replaced.
	 *
	 * @throws CfgTypeException if this is not an object
	 * @throws IllegalArgumentException if {@code value} is or contains this object
	 */
	default void set(String key, CfgValue value) {
		if (!(this instanceof ObjectValue object)) {
			throw new CfgTypeException(ValueKind.OBJECT.typeName(), typeName());
		}
		rejectCycle(value, this);
		object.entries.put(key, value != null ? value : NullValue.INSTANCE);
	}

	/**
	 * Appends an array element.
	 *
	 * @throws CfgTypeException if this is not an array
	 * @throws IllegalArgumentException if {@code value} is or contains this array
	 */
	default void push(CfgValue value) {
		if (!(this instanceof ArrayValue array)) {
			throw new CfgTypeException(ValueKind.ARRAY.typeName(), typeName());
		}
		rejectCycle(value, this);
		array.elements.add(value != null ? value : NullValue.INSTANCE);
	}

	private static void rejectCycle(CfgValue value, CfgValue container) {
		if (value != null && holds(value, container)) {
			throw new IllegalArgumentException("A " + container.typeName() + " cannot contain itself");
		}
	}

	// identity walk, not equals()
	private static boolean holds(CfgValue tree, CfgValue node) {
		if (tree == node) {
			return true;
		}
		if (tree instanceof ArrayValue array) {
			for (CfgValue element : array.elements) {
				if (holds(element, node)) {
					return true;
				}
			}
		} else if (tree instanceof ObjectValue object) {
			for (CfgValue entry : object.entries.values()) {
				if (holds(entry, node)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Number of elements or entries; {@code 0} for every scalar.
	 */
	default int size() {
		if (this instanceof ArrayValue array) {
			return array.elements.size();
		}
		if (this instanceof ObjectValue object) {
			return object.entries.size();
		}
		return 0;
	}

	/**
	 * Whether a container has no elements. Scalars are never empty: emptiness is
	 * not a meaningful question for them, so this returns {@code false}.
	 */
	default boolean isEmpty() {
		if (this instanceof ArrayValue array) {
			return array.elements.isEmpty();
		}
		if (this instanceof ObjectValue object) {
			return object.entries.isEmpty();
		}
		return false;
	}

	// ---- typed views ---------------------------------------------------

	default Optional<Boolean> asBoolean() {
		return this instanceof BooleanValue b ? Optional.of(b.value()) : Optional.empty();
	}

	default Optional<Long> asLong() {
		return this instanceof IntegerValue i ? Optional.of(i.value()) : Optional.empty();
	}

	default Optional<Double> asDouble() {
		return this instanceof DoubleValue d ? Optional.of(d.value()) : Optional.empty();
	}

	/**
	 * Text of a string or of an enum literal.
	 */
	default Optional<String> asString() {
		if (this instanceof StringValue s) {
			return Optional.of(s.value());
		}
		if (this instanceof EnumValue e) {
			return Optional.of(e.value());
		}
		return Optional.empty();
	}

	default Optional<List<CfgValue>> asList() {
		return this instanceof ArrayValue array ? Optional.of(array.elements()) : Optional.empty();
	}

	default Optional<Map<String, CfgValue>> asMap() {
		return this instanceof ObjectValue object ? Optional.of(object.entries()) : Optional.empty();
	}

	/**
	 * Deep copy. Scalars are immutable and returned as-is.
	 */
	default CfgValue copy() {
		if (this instanceof ArrayValue array) {
			ArrayValue result = new ArrayValue(List.of());
			array.elements.forEach(e -> result.elements.add(e.copy()));
			return result;
		}
		if (this instanceof ObjectValue object) {
			ObjectValue result = new ObjectValue(Map.of());
			object.entries.forEach((k, v) -> result.entries.put(k, v.copy()));
			return result;
		}
		return this;
	}

	// ---- factories -----------------------------------------------------

	static CfgValue nullValue() {
		return NullValue.INSTANCE;
	}

	static CfgValue of(boolean value) {
		return new BooleanValue(value);
	}

	static CfgValue of(long value) {
		return new IntegerValue(value);
	}

	static CfgValue of(double value) {
		return new DoubleValue(value);
	}

	static CfgValue of(String value) {
		return new StringValue(value);
	}

	static CfgValue enumValue(String value) {
		return new EnumValue(value);
	}

	static ArrayValue array(CfgValue... elements) {
		return new ArrayValue(Arrays.asList(elements));
	}

	static ArrayValue array(List<CfgValue> elements) {
		return new ArrayValue(elements);
	}

	static ObjectValue object() {
		return new ObjectValue(Map.of());
	}

	static ObjectValue object(Map<String, CfgValue> entries) {
		return new ObjectValue(entries);
	}

	// ---- variants ------------------------------------------------------

	record NullValue() implements CfgValue {
		static final NullValue INSTANCE = new NullValue();

		@Override
		public ValueKind kind() {
			return ValueKind.NULL;
		}

		@Override
		public String toString() {
			return "null";
		}
	}

	record BooleanValue(boolean value) implements CfgValue {
		@Override
		public ValueKind kind() {
			return ValueKind.BOOLEAN;
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}

	record IntegerValue(long value) implements CfgValue {
		@Override
		public ValueKind kind() {
			return ValueKind.INTEGER;
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	record DoubleValue(double value) implements CfgValue {
		@Override
		public ValueKind kind() {
			return ValueKind.DOUBLE;
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	record StringValue(String value) implements CfgValue {
		public StringValue {
			value = value != null ? value : "";
		}

		@Override
		public ValueKind kind() {
			return ValueKind.STRING;
		}

		@Override
		public String toString() {
			return "\"" + value + "\"";
		}
	}

	/**
	 * A bare identifier used as a value, e.g. {@code level = debug}.
	 */
	record EnumValue(String value) implements CfgValue {
		@Override
		public ValueKind kind() {
			return ValueKind.ENUM;
		}

		@Override
		public String toString() {
			return value;
		}
	}

	record ArrayValue(List<CfgValue> elements) implements CfgValue {
		public ArrayValue {
			elements = elements != null ? new ArrayList<>(elements) : new ArrayList<>();
		}

		@Override
		public List<CfgValue> elements() {
			return Collections.unmodifiableList(elements);
		}

		@Override
		public ValueKind kind() {
			return ValueKind.ARRAY;
		}

		@Override
		public String toString() {
			return elements.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
		}
	}

	/**
	 * String-keyed entries. Keys are unique; insertion order is kept for display
	 * only and takes no part in equality.
	 */
	record ObjectValue(Map<String, CfgValue> entries) implements CfgValue {
		public ObjectValue {
			entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
		}

		@Override
		public Map<String, CfgValue> entries() {
			return Collections.unmodifiableMap(entries);
		}

		/**
		 * Copies every entry of {@code other} into this object, replacing existing keys.
		 */
		public void putAll(ObjectValue other) {
			entries.putAll(other.entries);
		}

		@Override
		public ValueKind kind() {
			return ValueKind.OBJECT;
		}

		@Override
		public String toString() {
			return entries.entrySet().stream()
					.map(e -> e.getKey() + ": " + e.getValue())
					.collect(Collectors.joining(", ", "{", "}"));
		}
	}
}
