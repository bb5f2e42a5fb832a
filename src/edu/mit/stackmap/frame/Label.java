package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import org.objectweb.asm.tree.LabelNode;

/**
 * A position in a method's code: the start of a basic block or the site of a
 * NEW instruction.  A Label may be bound to a bytecode offset once offsets
 * are known; until then, types that refer to it (forward uninitialized
 * types) cannot be written in offset form.
 *
 * Labels are compared by identity.
 * @since 9/30/2026
 */
public final class Label {
	private final LabelNode labelNode;
	private int offset = -1;
	public Label(LabelNode labelNode) {
		this.labelNode = checkNotNull(labelNode);
	}

	/**
	 * Returns the ASM label node marking this position in the instruction
	 * list.  The node may not be in the list yet if the position had no label
	 * before analysis; see {@link ControlFlowGraph#pendingLabels()}.
	 * @return the label node
	 */
	public LabelNode getLabelNode() {
		return labelNode;
	}

	public boolean isBound() {
		return offset >= 0;
	}

	public void bind(int offset) {
		checkArgument(offset >= 0, "negative offset %s", offset);
		checkState(!isBound() || this.offset == offset, "%s already bound to %s, not %s", this, this.offset, offset);
		this.offset = offset;
	}

	/**
	 * Returns the bytecode offset this label is bound to.
	 * @return the bytecode offset
	 * @throws IllegalStateException if this label is not bound
	 */
	public int getOffset() {
		if (!isBound())
			throw new IllegalStateException("label not bound: " + this);
		return offset;
	}

	@Override
	public String toString() {
		return "L" + Integer.toHexString(System.identityHashCode(this)) + (isBound() ? "@" + offset : "");
	}
}
