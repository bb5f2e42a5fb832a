package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import java.util.List;
import org.objectweb.asm.Opcodes;

/**
 * The compressed forms of a stack map frame, each describing a frame relative
 * to the previous one.
 * @since October 12, 2026
 */
public enum FrameType {
	/**
	 * Same locals, empty stack, offset delta below 64.
	 */
	SAME(Opcodes.F_SAME),
	SAME_EXTENDED(Opcodes.F_SAME),
	/**
	 * Same locals, one stack element, offset delta below 64.
	 */
	SAME_LOCALS_1_STACK_ITEM(Opcodes.F_SAME1),
	SAME_LOCALS_1_STACK_ITEM_EXTENDED(Opcodes.F_SAME1),
	/**
	 * The previous locals minus the last 1-3, empty stack.
	 */
	CHOP(Opcodes.F_CHOP),
	/**
	 * The previous locals plus 1-3 more, empty stack.
	 */
	APPEND(Opcodes.F_APPEND),
	FULL(Opcodes.F_FULL);

	private static final int MAX_SHORT_DELTA = 63;
	private static final int MAX_EXTENDED_DELTA = 65535;
	private final int asmType;
	private FrameType(int asmType) {
		this.asmType = asmType;
	}

	/**
	 * Returns the ASM frame type ({@code Opcodes.F_SAME} etc.) for this frame
	 * type.  The short and extended forms map to the same ASM type, because
	 * the class writer picks between them itself.
	 * @return the ASM frame type
	 */
	public int asmType() {
		return asmType;
	}

	/**
	 * Chooses the smallest frame type describing the given frame relative to
	 * the previous frame.
	 * @param previousLocals the locals of the previous frame
	 * @param locals the locals of the current frame
	 * @param stack the stack of the current frame
	 * @param offsetDelta the offset delta as stored in the class file, or -1
	 * if unknown (in which case the short forms are chosen)
	 * @return the frame type
	 */
	public static FrameType compress(List<VerificationType> previousLocals, List<VerificationType> locals, List<VerificationType> stack, int offsetDelta) {
		checkArgument(offsetDelta >= -1 && offsetDelta <= MAX_EXTENDED_DELTA, "bad offset delta %s", offsetDelta);
		boolean extended = offsetDelta > MAX_SHORT_DELTA;
		int localsDelta = locals.size() - previousLocals.size();
		FrameType type;
		if (stack.isEmpty()) {
			if (localsDelta == 0)
				type = extended ? SAME_EXTENDED : SAME;
			else if (localsDelta >= -3 && localsDelta < 0)
				type = CHOP;
			else if (localsDelta > 0 && localsDelta <= 3)
				type = APPEND;
			else
				type = FULL;
		} else if (stack.size() == 1 && localsDelta == 0)
			type = extended ? SAME_LOCALS_1_STACK_ITEM_EXTENDED : SAME_LOCALS_1_STACK_ITEM;
		else
			type = FULL;

		if (type != FULL) {
			//all but FULL require the common prefix of the locals to be equal
			int common = Math.min(previousLocals.size(), locals.size());
			if (!previousLocals.subList(0, common).equals(locals.subList(0, common)))
				type = FULL;
		}
		return type;
	}
}
