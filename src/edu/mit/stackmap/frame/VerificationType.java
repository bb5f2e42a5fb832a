package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import java.util.Objects;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.LabelNode;

/**
 * A verification type, as stored in a stack map frame: one of the primitive
 * items, an object type (with its internal name or array descriptor), or an
 * uninitialized type (identified by the offset or label of its NEW
 * instruction).
 *
 * Long and double are single verification types even though they occupy two
 * local variable or stack slots.
 * @since October 1, 2026
 */
public final class VerificationType {
	public enum Tag {
		TOP(AbstractTypes.ITEM_TOP),
		INTEGER(AbstractTypes.ITEM_INTEGER),
		FLOAT(AbstractTypes.ITEM_FLOAT),
		DOUBLE(AbstractTypes.ITEM_DOUBLE),
		LONG(AbstractTypes.ITEM_LONG),
		NULL(AbstractTypes.ITEM_NULL),
		UNINITIALIZED_THIS(AbstractTypes.ITEM_UNINITIALIZED_THIS),
		OBJECT(AbstractTypes.ITEM_OBJECT),
		UNINITIALIZED(AbstractTypes.ITEM_UNINITIALIZED);
		private final int item;
		private Tag(int item) {
			this.item = item;
		}

		/**
		 * Returns the verification_type_info tag byte for this tag.
		 * @return the tag byte
		 */
		public int item() {
			return item;
		}
	}

	public static final VerificationType TOP = new VerificationType(Tag.TOP, null, -1, null);
	public static final VerificationType INTEGER = new VerificationType(Tag.INTEGER, null, -1, null);
	public static final VerificationType FLOAT = new VerificationType(Tag.FLOAT, null, -1, null);
	public static final VerificationType DOUBLE = new VerificationType(Tag.DOUBLE, null, -1, null);
	public static final VerificationType LONG = new VerificationType(Tag.LONG, null, -1, null);
	public static final VerificationType NULL = new VerificationType(Tag.NULL, null, -1, null);
	public static final VerificationType UNINITIALIZED_THIS = new VerificationType(Tag.UNINITIALIZED_THIS, null, -1, null);

	private final Tag tag;
	/**
	 * For OBJECT, the internal name (or array descriptor).  For UNINITIALIZED,
	 * the internal name of the class being constructed.  Otherwise null.
	 */
	private final String className;
	/**
	 * For UNINITIALIZED types whose NEW offset was known during analysis, that
	 * offset; otherwise -1.
	 */
	private final int offset;
	/**
	 * For UNINITIALIZED types identified by the label of their NEW
	 * instruction, that label; otherwise null.
	 */
	private final Label label;
	private VerificationType(Tag tag, String className, int offset, Label label) {
		this.tag = tag;
		this.className = className;
		this.offset = offset;
		this.label = label;
	}

	public static VerificationType object(String internalName) {
		checkArgument(!internalName.isEmpty());
		return new VerificationType(Tag.OBJECT, internalName, -1, null);
	}

	public static VerificationType uninitialized(String internalName, int newOffset) {
		checkArgument(newOffset >= 0, "bad offset %s", newOffset);
		return new VerificationType(Tag.UNINITIALIZED, checkNotNull(internalName), newOffset, null);
	}

	public static VerificationType uninitialized(String internalName, Label newLabel) {
		return new VerificationType(Tag.UNINITIALIZED, checkNotNull(internalName), -1, checkNotNull(newLabel));
	}

	public Tag getTag() {
		return tag;
	}

	public String getClassName() {
		return className;
	}

	public Label getLabel() {
		return label;
	}

	/**
	 * Returns the bytecode offset of the NEW instruction creating this
	 * uninitialized type.
	 * @return the offset of the NEW instruction
	 * @throws IllegalStateException if this type is identified by a label that
	 * has not been bound
	 */
	public int getOffset() {
		checkState(tag == Tag.UNINITIALIZED, "not an uninitialized type: %s", this);
		return label != null ? label.getOffset() : offset;
	}

	/**
	 * Returns true if this type occupies two slots.
	 * @return true iff this type is long or double
	 */
	public boolean isWide() {
		return tag == Tag.LONG || tag == Tag.DOUBLE;
	}

	/**
	 * Returns this type in the form used by ASM's frame API ({@code Opcodes.TOP}
	 * and friends, internal names, or a LabelNode for uninitialized types).
	 * @return this type as a FrameNode element
	 */
	public Object toAsmFrameElement() {
		switch (tag) {
			case TOP:
				return Opcodes.TOP;
			case INTEGER:
				return Opcodes.INTEGER;
			case FLOAT:
				return Opcodes.FLOAT;
			case DOUBLE:
				return Opcodes.DOUBLE;
			case LONG:
				return Opcodes.LONG;
			case NULL:
				return Opcodes.NULL;
			case UNINITIALIZED_THIS:
				return Opcodes.UNINITIALIZED_THIS;
			case OBJECT:
				return className;
			case UNINITIALIZED:
				LabelNode node = label != null ? label.getLabelNode() : null;
				checkState(node != null, "uninitialized type %s has no label node", this);
				return node;
			default:
				throw new AssertionError(tag);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final VerificationType other = (VerificationType)obj;
		//labels compare by identity
		return this.tag == other.tag
				&& Objects.equals(this.className, other.className)
				&& this.offset == other.offset
				&& this.label == other.label;
	}

	@Override
	public int hashCode() {
		int hash = 7;
		hash = 41 * hash + tag.hashCode();
		hash = 41 * hash + Objects.hashCode(className);
		hash = 41 * hash + offset;
		hash = 41 * hash + System.identityHashCode(label);
		return hash;
	}

	@Override
	public String toString() {
		switch (tag) {
			case OBJECT:
				return className;
			case UNINITIALIZED:
				return "uninitialized " + className + "@" + (label != null ? label : offset);
			default:
				return tag.name().toLowerCase();
		}
	}
}
