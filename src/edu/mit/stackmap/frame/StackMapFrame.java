package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.ImmutableList;
import org.objectweb.asm.tree.AbstractInsnNode;

/**
 * The resolved input frame of one basic block: the verification types of its
 * locals (trailing TOPs and the second slot of wide values elided) and of its
 * stack (bottom first).
 * @since 10/8/2026
 */
public final class StackMapFrame {
	private final int blockId;
	private final AbstractInsnNode start;
	private final Label label;
	private final ImmutableList<VerificationType> locals, stack;
	private final boolean jumpTarget, reachable;
	StackMapFrame(int blockId, AbstractInsnNode start, Label label, ImmutableList<VerificationType> locals, ImmutableList<VerificationType> stack, boolean jumpTarget, boolean reachable) {
		this.blockId = blockId;
		this.start = start;
		this.label = label;
		this.locals = checkNotNull(locals);
		this.stack = checkNotNull(stack);
		this.jumpTarget = jumpTarget;
		this.reachable = reachable;
	}

	public int getBlockId() {
		return blockId;
	}

	/**
	 * Returns the first real instruction of the block this frame describes.
	 * @return the block's first instruction
	 */
	public AbstractInsnNode getStart() {
		return start;
	}

	/**
	 * Returns the label at the start of the block, or null if the block does
	 * not begin with a label.
	 * @return the block's label, or null
	 */
	public Label getLabel() {
		return label;
	}

	public ImmutableList<VerificationType> getLocals() {
		return locals;
	}

	public ImmutableList<VerificationType> getStack() {
		return stack;
	}

	public boolean isJumpTarget() {
		return jumpTarget;
	}

	public boolean isReachable() {
		return reachable;
	}

	@Override
	public String toString() {
		return String.format("B%d%s%s locals %s stack %s", blockId,
				jumpTarget ? " (target)" : "", reachable ? "" : " (unreachable)",
				locals, stack);
	}
}
