package edu.mit.stackmap.frame;

/**
 * An entry in a {@link SymbolTable}.  Symbols are immutable; merging two types
 * produces a new symbol rather than editing either one.
 * @since 9/29/2026
 */
public final class Symbol {
	public enum Tag {
		/**
		 * A class or array type, by internal name.
		 */
		TYPE,
		/**
		 * An object created by a NEW at a known bytecode offset.
		 */
		UNINITIALIZED_TYPE,
		/**
		 * An object created by a NEW whose offset is not yet known, identified
		 * by a {@link Label} placed at the NEW.
		 */
		FORWARD_UNINITIALIZED_TYPE,
		/**
		 * The common super type of two types.  Not a type itself; records the
		 * type index of the merge result.
		 */
		MERGED_TYPE
	}

	private final int index;
	private final Tag tag;
	private final String value;
	private final long data;
	private final Label label;
	private final int info;
	Symbol(int index, Tag tag, String value, long data, Label label, int info) {
		this.index = index;
		this.tag = tag;
		this.value = value;
		this.data = data;
		this.label = label;
		this.info = info;
	}

	/**
	 * Returns this symbol's index in its table's type list, or -1 for
	 * MERGED_TYPE symbols, which are not types.
	 * @return this symbol's index
	 */
	public int getIndex() {
		return index;
	}

	public Tag getTag() {
		return tag;
	}

	/**
	 * Returns the internal name of the type this symbol describes, or null for
	 * MERGED_TYPE symbols.
	 * @return the internal name
	 */
	public String getValue() {
		return value;
	}

	/**
	 * For UNINITIALIZED_TYPE, the offset of the NEW instruction.  For
	 * MERGED_TYPE, the two merged type indices packed as (low | high << 32).
	 * @return this symbol's auxiliary data
	 */
	public long getData() {
		return data;
	}

	public Label getLabel() {
		return label;
	}

	/**
	 * For MERGED_TYPE, the type index of the common super type.
	 * @return the merge result's type index
	 */
	public int getInfo() {
		return info;
	}

	@Override
	public String toString() {
		switch (tag) {
			case TYPE:
				return value;
			case UNINITIALIZED_TYPE:
				return value + "@" + data;
			case FORWARD_UNINITIALIZED_TYPE:
				return value + "@" + label;
			case MERGED_TYPE:
				return "merge(" + (int)data + ", " + (int)(data >>> 32) + ")=" + info;
			default:
				throw new AssertionError(tag);
		}
	}
}
