package edu.mit.stackmap.frame;

import com.google.common.base.Strings;
import org.objectweb.asm.Type;

/**
 * Encodes abstract types as packed ints.  An abstract type is a 32-bit int
 * laid out as follows:
 * <pre>
 *   DIM (6 bits, signed) | KIND (4 bits) | FLAGS (2 bits) | VALUE (20 bits)
 * </pre>
 * DIM is the number of array dimensions (negative dimensions appear only in
 * output frames, e.g. after an AALOAD on a stack-relative type).  KIND
 * selects the meaning of VALUE:
 * <ul>
 * <li>CONSTANT: VALUE is one of the ITEM_* codes;</li>
 * <li>REFERENCE: VALUE is a type index in a {@link SymbolTable};</li>
 * <li>UNINITIALIZED and FORWARD_UNINITIALIZED: VALUE is the index of an
 * uninitialized type symbol;</li>
 * <li>LOCAL: VALUE is a local variable index in the input frame of the same
 * block (output frames only);</li>
 * <li>STACK: VALUE is a position relative to the top of the input stack of
 * the same block (output frames only).</li>
 * </ul>
 * The zero int is never a valid type and marks a slot that has never been
 * assigned.  Because symbols are deduplicated and never mutated, two abstract
 * types denote the same type iff they are equal ints.
 * @since 9/28/2026
 */
final class AbstractTypes {
	private AbstractTypes() {}

	static final int ITEM_TOP = 0;
	static final int ITEM_INTEGER = 1;
	static final int ITEM_FLOAT = 2;
	static final int ITEM_DOUBLE = 3;
	static final int ITEM_LONG = 4;
	static final int ITEM_NULL = 5;
	static final int ITEM_UNINITIALIZED_THIS = 6;
	static final int ITEM_OBJECT = 7;
	static final int ITEM_UNINITIALIZED = 8;
	//Only used as array element types; at the JVM level these are all ints.
	static final int ITEM_BOOLEAN = 9;
	static final int ITEM_BYTE = 10;
	static final int ITEM_CHAR = 11;
	static final int ITEM_SHORT = 12;

	private static final int DIM_SIZE = 6;
	private static final int KIND_SIZE = 4;
	private static final int FLAGS_SIZE = 2;
	private static final int VALUE_SIZE = 32 - DIM_SIZE - KIND_SIZE - FLAGS_SIZE;

	static final int DIM_SHIFT = KIND_SIZE + FLAGS_SIZE + VALUE_SIZE;
	private static final int KIND_SHIFT = FLAGS_SIZE + VALUE_SIZE;
	private static final int FLAGS_SHIFT = VALUE_SIZE;

	static final int DIM_MASK = ((1 << DIM_SIZE) - 1) << DIM_SHIFT;
	static final int KIND_MASK = ((1 << KIND_SIZE) - 1) << KIND_SHIFT;
	static final int VALUE_MASK = (1 << VALUE_SIZE) - 1;

	/**
	 * Added to a type to make it an array of that type.
	 */
	static final int ARRAY_OF = +1 << DIM_SHIFT;
	/**
	 * Added to an array type to get its element type.
	 */
	static final int ELEMENT_OF = -1 << DIM_SHIFT;

	static final int CONSTANT_KIND = 1 << KIND_SHIFT;
	static final int REFERENCE_KIND = 2 << KIND_SHIFT;
	static final int UNINITIALIZED_KIND = 3 << KIND_SHIFT;
	static final int FORWARD_UNINITIALIZED_KIND = 4 << KIND_SHIFT;
	static final int LOCAL_KIND = 5 << KIND_SHIFT;
	static final int STACK_KIND = 6 << KIND_SHIFT;

	/**
	 * On a LOCAL or STACK type, means the type resolves to TOP if the slot it
	 * refers to turns out to hold a long or double.  Set on the local before
	 * one that gets overwritten, because that local might have held the first
	 * half of a wide value.
	 */
	static final int TOP_IF_LONG_OR_DOUBLE_FLAG = 1 << FLAGS_SHIFT;

	static final int TOP = CONSTANT_KIND | ITEM_TOP;
	static final int BOOLEAN = CONSTANT_KIND | ITEM_BOOLEAN;
	static final int BYTE = CONSTANT_KIND | ITEM_BYTE;
	static final int CHAR = CONSTANT_KIND | ITEM_CHAR;
	static final int SHORT = CONSTANT_KIND | ITEM_SHORT;
	static final int INTEGER = CONSTANT_KIND | ITEM_INTEGER;
	static final int FLOAT = CONSTANT_KIND | ITEM_FLOAT;
	static final int LONG = CONSTANT_KIND | ITEM_LONG;
	static final int DOUBLE = CONSTANT_KIND | ITEM_DOUBLE;
	static final int NULL = CONSTANT_KIND | ITEM_NULL;
	static final int UNINITIALIZED_THIS = CONSTANT_KIND | ITEM_UNINITIALIZED_THIS;

	static int kind(int abstractType) {
		return abstractType & KIND_MASK;
	}

	static int value(int abstractType) {
		return abstractType & VALUE_MASK;
	}

	/**
	 * Returns the (signed) number of array dimensions of the given type.
	 */
	static int dimensions(int abstractType) {
		return abstractType >> DIM_SHIFT;
	}

	static boolean isWide(int abstractType) {
		return abstractType == LONG || abstractType == DOUBLE;
	}

	/**
	 * Returns true if the type is a reference type of any array dimension, or
	 * an array of primitives.  NULL and the uninitialized types are not
	 * included.
	 */
	static boolean isReferenceOrArray(int abstractType) {
		return (abstractType & DIM_MASK) != 0 || kind(abstractType) == REFERENCE_KIND;
	}

	/**
	 * Returns true if the type may appear in an input frame (that is, it does
	 * not refer to another frame and has a non-negative dimension).
	 */
	static boolean isResolved(int abstractType) {
		int kind = kind(abstractType);
		return dimensions(abstractType) >= 0
				&& (kind == CONSTANT_KIND || kind == REFERENCE_KIND
				|| kind == UNINITIALIZED_KIND || kind == FORWARD_UNINITIALIZED_KIND);
	}

	static int fromInternalName(SymbolTable symbolTable, String internalName) {
		if (internalName.charAt(0) == '[')
			return fromDescriptor(symbolTable, internalName, 0);
		return REFERENCE_KIND | symbolTable.addType(internalName);
	}

	/**
	 * Returns the abstract type of the type descriptor starting at the given
	 * offset of the given string, or 0 if the descriptor is V.  The descriptor
	 * must extend to the end of the string.
	 * @param symbolTable the symbol table to add reference types to
	 * @param buffer a string ending with a type descriptor
	 * @param offset the offset of the descriptor in the string
	 * @return the abstract type, or 0 for void
	 */
	static int fromDescriptor(SymbolTable symbolTable, String buffer, int offset) {
		switch (buffer.charAt(offset)) {
			case 'V':
				return 0;
			case 'Z':
			case 'C':
			case 'B':
			case 'S':
			case 'I':
				return INTEGER;
			case 'F':
				return FLOAT;
			case 'J':
				return LONG;
			case 'D':
				return DOUBLE;
			case 'L':
				return REFERENCE_KIND | symbolTable.addType(buffer.substring(offset + 1, buffer.length() - 1));
			case '[':
				int elementOffset = offset + 1;
				while (buffer.charAt(elementOffset) == '[')
					++elementOffset;
				int elementType;
				switch (buffer.charAt(elementOffset)) {
					case 'Z':
						elementType = BOOLEAN;
						break;
					case 'C':
						elementType = CHAR;
						break;
					case 'B':
						elementType = BYTE;
						break;
					case 'S':
						elementType = SHORT;
						break;
					case 'I':
						elementType = INTEGER;
						break;
					case 'F':
						elementType = FLOAT;
						break;
					case 'J':
						elementType = LONG;
						break;
					case 'D':
						elementType = DOUBLE;
						break;
					case 'L':
						elementType = REFERENCE_KIND | symbolTable.addType(buffer.substring(elementOffset + 1, buffer.length() - 1));
						break;
					default:
						throw new IllegalArgumentException("invalid descriptor fragment: " + buffer.substring(elementOffset));
				}
				return ((elementOffset - offset) << DIM_SHIFT) | elementType;
			default:
				throw new IllegalArgumentException("invalid descriptor: " + buffer.substring(offset));
		}
	}

	/**
	 * Returns the descriptor of the element type of a primitive array type
	 * (the CONSTANT kind part of an array type).
	 */
	private static char primitiveDescriptor(int constantType) {
		switch (constantType) {
			case BOOLEAN:
				return 'Z';
			case BYTE:
				return 'B';
			case CHAR:
				return 'C';
			case SHORT:
				return 'S';
			case INTEGER:
				return 'I';
			case FLOAT:
				return 'F';
			case LONG:
				return 'J';
			case DOUBLE:
				return 'D';
			default:
				throw new AssertionError(Integer.toHexString(constantType));
		}
	}

	/**
	 * Converts a resolved abstract type to a verification type.
	 * @param symbolTable the symbol table the type's symbols come from
	 * @param abstractType a resolved abstract type
	 * @return the corresponding verification type
	 */
	static VerificationType toVerificationType(SymbolTable symbolTable, int abstractType) {
		int dimensions = dimensions(abstractType);
		if (dimensions < 0)
			throw new AssertionError("unresolved type in input frame: " + toString(symbolTable, abstractType));
		if (dimensions > 0) {
			StringBuilder descriptor = new StringBuilder(Strings.repeat("[", dimensions));
			if (kind(abstractType) == REFERENCE_KIND)
				descriptor.append('L').append(symbolTable.getType(value(abstractType)).getValue()).append(';');
			else
				descriptor.append(primitiveDescriptor(abstractType & ~DIM_MASK));
			return VerificationType.object(descriptor.toString());
		}

		switch (kind(abstractType)) {
			case CONSTANT_KIND:
				switch (value(abstractType)) {
					case ITEM_TOP:
						return VerificationType.TOP;
					case ITEM_INTEGER:
						return VerificationType.INTEGER;
					case ITEM_FLOAT:
						return VerificationType.FLOAT;
					case ITEM_LONG:
						return VerificationType.LONG;
					case ITEM_DOUBLE:
						return VerificationType.DOUBLE;
					case ITEM_NULL:
						return VerificationType.NULL;
					case ITEM_UNINITIALIZED_THIS:
						return VerificationType.UNINITIALIZED_THIS;
					default:
						throw new AssertionError("bare array element type: " + value(abstractType));
				}
			case REFERENCE_KIND:
				return VerificationType.object(symbolTable.getType(value(abstractType)).getValue());
			case UNINITIALIZED_KIND: {
				Symbol symbol = symbolTable.getType(value(abstractType));
				return VerificationType.uninitialized(symbol.getValue(), (int)symbol.getData());
			}
			case FORWARD_UNINITIALIZED_KIND: {
				Symbol symbol = symbolTable.getType(value(abstractType));
				return VerificationType.uninitialized(symbol.getValue(), symbol.getLabel());
			}
			default:
				throw new AssertionError("unresolved type in input frame: " + toString(symbolTable, abstractType));
		}
	}

	/**
	 * Converts a verification type back to an abstract type.
	 */
	static int fromVerificationType(SymbolTable symbolTable, VerificationType type) {
		switch (type.getTag()) {
			case TOP:
				return TOP;
			case INTEGER:
				return INTEGER;
			case FLOAT:
				return FLOAT;
			case LONG:
				return LONG;
			case DOUBLE:
				return DOUBLE;
			case NULL:
				return NULL;
			case UNINITIALIZED_THIS:
				return UNINITIALIZED_THIS;
			case OBJECT:
				return fromInternalName(symbolTable, type.getClassName());
			case UNINITIALIZED:
				if (type.getLabel() != null)
					return FORWARD_UNINITIALIZED_KIND | symbolTable.addForwardUninitializedType(type.getClassName(), type.getLabel());
				return UNINITIALIZED_KIND | symbolTable.addUninitializedType(type.getClassName(), type.getOffset());
			default:
				throw new AssertionError(type);
		}
	}

	/**
	 * Renders an abstract type for debugging.  Unlike
	 * {@link #toVerificationType(SymbolTable, int)}, this works on output frame
	 * types too.
	 */
	static String toString(SymbolTable symbolTable, int abstractType) {
		if (abstractType == 0)
			return "<unset>";
		StringBuilder sb = new StringBuilder();
		int dimensions = dimensions(abstractType);
		int value = value(abstractType);
		switch (kind(abstractType)) {
			case CONSTANT_KIND:
				switch (abstractType & ~DIM_MASK) {
					case TOP:
						sb.append("top");
						break;
					case NULL:
						sb.append("null");
						break;
					case UNINITIALIZED_THIS:
						sb.append("uninitializedThis");
						break;
					default:
						sb.append(Type.getType(String.valueOf(primitiveDescriptor(abstractType & ~DIM_MASK))).getClassName());
						break;
				}
				break;
			case REFERENCE_KIND:
				sb.append(symbolTable.getType(value).getValue());
				break;
			case UNINITIALIZED_KIND:
			case FORWARD_UNINITIALIZED_KIND:
				sb.append("uninitialized(").append(symbolTable.getType(value)).append(')');
				break;
			case LOCAL_KIND:
				sb.append("local").append(value);
				break;
			case STACK_KIND:
				sb.append("stack-").append(value);
				break;
			default:
				sb.append("?").append(Integer.toHexString(abstractType));
				break;
		}
		if (dimensions > 0)
			sb.append(Strings.repeat("[]", dimensions));
		else if (dimensions < 0)
			sb.append(Strings.repeat("<elem>", -dimensions));
		if ((abstractType & TOP_IF_LONG_OR_DOUBLE_FLAG) != 0)
			sb.append("?top");
		return sb.toString();
	}
}
