package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The types referred to by abstract types during frame computation for one
 * class, analogous to a constant pool.  Each distinct type gets a stable
 * index; abstract types of REFERENCE, UNINITIALIZED and FORWARD_UNINITIALIZED
 * kind hold these indices.
 *
 * A SymbolTable belongs to a single analysis (typically all the methods of one
 * class) and is not thread-safe.  Concurrent analyses must use separate
 * tables.
 * @since 9/29/2026
 */
public final class SymbolTable {
	private final String className;
	private final CommonSuperClassResolver resolver;
	/**
	 * All type symbols, indexed by type index.
	 */
	private final List<Symbol> types = new ArrayList<>();
	private final Map<String, Symbol> typesByName = new HashMap<>();
	private final Table<String, Integer, Symbol> uninitializedTypes = HashBasedTable.create();
	/**
	 * Keyed by label identity, then by type name.
	 */
	private final Map<Label, Map<String, Symbol>> forwardUninitializedTypes = new IdentityHashMap<>();
	/**
	 * Keyed by (smaller index, larger index).
	 */
	private final Table<Integer, Integer, Symbol> mergedTypes = HashBasedTable.create();

	public SymbolTable(String className) {
		this(className, CommonSuperClassResolver.ROOT_OBJECT);
	}

	/**
	 * Creates a new SymbolTable for analyzing methods of the given class.
	 * @param className the internal name of the class whose methods are
	 * analyzed (the type of {@code this} in instance methods)
	 * @param resolver used to merge unrelated reference types
	 */
	public SymbolTable(String className, CommonSuperClassResolver resolver) {
		this.className = checkNotNull(className);
		this.resolver = checkNotNull(resolver);
	}

	public String getClassName() {
		return className;
	}

	public CommonSuperClassResolver getResolver() {
		return resolver;
	}

	/**
	 * Returns the number of type symbols in this table.
	 * @return the number of types
	 */
	public int size() {
		return types.size();
	}

	public Symbol getType(int typeIndex) {
		return types.get(typeIndex);
	}

	public ImmutableList<Symbol> types() {
		return ImmutableList.copyOf(types);
	}

	/**
	 * Adds a class or array type to this table, returning its index.  Adding
	 * the same name twice returns the same index.
	 * @param internalName an internal class name or array descriptor
	 * @return the type's index
	 */
	public int addType(String internalName) {
		checkArgument(!internalName.isEmpty(), "empty type name");
		Symbol symbol = typesByName.get(internalName);
		if (symbol == null) {
			symbol = new Symbol(types.size(), Symbol.Tag.TYPE, internalName, 0, null, 0);
			types.add(symbol);
			typesByName.put(internalName, symbol);
		}
		return symbol.getIndex();
	}

	/**
	 * Adds the type of an object created by a NEW instruction at the given
	 * offset.  Two NEWs of the same class at different offsets get distinct
	 * indices.
	 * @param internalName the internal name of the class being instantiated
	 * @param bytecodeOffset the offset of the NEW instruction
	 * @return the type's index
	 */
	public int addUninitializedType(String internalName, int bytecodeOffset) {
		checkArgument(bytecodeOffset >= 0, "bad offset %s", bytecodeOffset);
		Symbol symbol = uninitializedTypes.get(internalName, bytecodeOffset);
		if (symbol == null) {
			symbol = new Symbol(types.size(), Symbol.Tag.UNINITIALIZED_TYPE, internalName, bytecodeOffset, null, 0);
			types.add(symbol);
			uninitializedTypes.put(internalName, bytecodeOffset, symbol);
		}
		return symbol.getIndex();
	}

	/**
	 * Adds the type of an object created by a NEW instruction whose offset is
	 * not known yet.  The label marks the NEW and must be bound before the
	 * type's offset is requested.
	 * @param internalName the internal name of the class being instantiated
	 * @param label the label of the NEW instruction
	 * @return the type's index
	 */
	public int addForwardUninitializedType(String internalName, Label label) {
		checkNotNull(internalName);
		Map<String, Symbol> byName = forwardUninitializedTypes.get(checkNotNull(label));
		if (byName == null) {
			byName = new HashMap<>(2);
			forwardUninitializedTypes.put(label, byName);
		}
		Symbol symbol = byName.get(internalName);
		if (symbol == null) {
			symbol = new Symbol(types.size(), Symbol.Tag.FORWARD_UNINITIALIZED_TYPE, internalName, 0, label, 0);
			types.add(symbol);
			byName.put(internalName, symbol);
		}
		return symbol.getIndex();
	}

	/**
	 * Returns the index of the common super type of the two given types, as
	 * computed by this table's {@link CommonSuperClassResolver}.  Results are
	 * cached, and the merge is symmetric.
	 * @param typeIndex1 the index of a TYPE symbol
	 * @param typeIndex2 the index of a TYPE symbol
	 * @return the index of the common super type
	 */
	public int addMergedType(int typeIndex1, int typeIndex2) {
		Integer low = Math.min(typeIndex1, typeIndex2), high = Math.max(typeIndex1, typeIndex2);
		Symbol symbol = mergedTypes.get(low, high);
		if (symbol == null) {
			String type1 = getType(low).getValue(), type2 = getType(high).getValue();
			int result = addType(resolver.getCommonSuperClass(type1, type2));
			long data = (low & 0xFFFFFFFFL) | ((long)high << 32);
			symbol = new Symbol(-1, Symbol.Tag.MERGED_TYPE, null, data, null, result);
			mergedTypes.put(low, high, symbol);
		}
		return symbol.getInfo();
	}

	/**
	 * Returns the bytecode offset of the NEW instruction that created the
	 * given uninitialized type.
	 * @param typeIndex the index of an UNINITIALIZED_TYPE or
	 * FORWARD_UNINITIALIZED_TYPE symbol
	 * @return the NEW instruction's offset
	 * @throws IllegalStateException if the type's label is not bound
	 */
	public int getUninitializedOffset(int typeIndex) {
		Symbol symbol = getType(typeIndex);
		switch (symbol.getTag()) {
			case UNINITIALIZED_TYPE:
				return (int)symbol.getData();
			case FORWARD_UNINITIALIZED_TYPE:
				return symbol.getLabel().getOffset();
			default:
				throw new IllegalArgumentException("not an uninitialized type: " + symbol);
		}
	}

	@Override
	public String toString() {
		return "SymbolTable(" + className + ", " + types.size() + " types)";
	}
}
