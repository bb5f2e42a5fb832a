package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.tree.AbstractInsnNode;

/**
 * A maximal straight-line run of instructions in a {@link ControlFlowGraph}.
 * Blocks are identified by their index in the graph; edges refer to their
 * targets by that index.
 * @since 10/6/2026
 */
public final class BasicBlock {
	/**
	 * An edge to a successor block.
	 */
	public static final class Edge {
		private final int target;
		private final int catchType;
		Edge(int target, int catchType) {
			this.target = target;
			this.catchType = catchType;
		}

		public int getTarget() {
			return target;
		}

		/**
		 * Returns the abstract type of the exception caught along this edge, or
		 * 0 for a normal (jump or fall-through) edge.
		 * @return the caught type, or 0
		 */
		public int getCatchType() {
			return catchType;
		}

		public boolean isExceptional() {
			return catchType != 0;
		}

		@Override
		public String toString() {
			return (isExceptional() ? "catch->" : "->") + target;
		}
	}

	private final int id;
	/**
	 * The range of instruction indices [begin, end) in this block, including
	 * labels and other pseudo-instructions.
	 */
	private final int begin;
	private int end;
	/**
	 * The index of the first real instruction (opcode >= 0) in this block.
	 */
	private final int firstRealInsn;
	private final AbstractInsnNode firstRealNode;
	private final Label label;
	private final List<Edge> successors = new ArrayList<>(2);
	private boolean jumpTarget;
	private boolean fallsOffEnd;
	private Frame frame;
	private boolean reachable;
	private boolean inWorklist;

	BasicBlock(int id, int begin, int end, int firstRealInsn, AbstractInsnNode firstRealNode, Label label) {
		this.id = id;
		this.begin = begin;
		this.end = end;
		this.firstRealInsn = firstRealInsn;
		this.firstRealNode = firstRealNode;
		this.label = label;
	}

	public int getId() {
		return id;
	}

	public int getBegin() {
		return begin;
	}

	public int getEnd() {
		return end;
	}

	void setEnd(int end) {
		checkArgument(end >= this.end, "shrinking block %s to %s", this, end);
		this.end = end;
	}

	public int getFirstRealInsn() {
		return firstRealInsn;
	}

	/**
	 * Returns the first instruction in this block that has an opcode; frames
	 * for this block are placed immediately before it.
	 * @return the first real instruction
	 */
	public AbstractInsnNode getFirstRealNode() {
		return firstRealNode;
	}

	/**
	 * Returns the label of this block's first label node, or null if the block
	 * does not begin with a label.
	 * @return this block's label, or null
	 */
	public Label getLabel() {
		return label;
	}

	public ImmutableList<Edge> successors() {
		return ImmutableList.copyOf(successors);
	}

	void addSuccessor(int target, int catchType) {
		for (Edge e : successors)
			if (e.target == target && e.catchType == catchType)
				return;
		successors.add(new Edge(target, catchType));
	}

	/**
	 * Returns true if this block is the target of a jump, a switch or an
	 * exception handler, so it begins with an explicit frame.
	 * @return true iff this block is a jump target
	 */
	public boolean isJumpTarget() {
		return jumpTarget;
	}

	void markJumpTarget() {
		jumpTarget = true;
	}

	/**
	 * Returns true if execution can continue past this block's last
	 * instruction, but no instruction follows it.
	 * @return true iff this block falls off the end of the code
	 */
	public boolean fallsOffEnd() {
		return fallsOffEnd;
	}

	void markFallsOffEnd() {
		fallsOffEnd = true;
	}

	Frame getFrame() {
		return frame;
	}

	void setFrame(Frame frame) {
		checkArgument(frame.getOwner() == id, "frame %s for block %s", frame, id);
		this.frame = frame;
	}

	/**
	 * Returns true if the fixed-point iteration reached this block.  Only
	 * meaningful after frames have been computed.
	 * @return true iff this block is reachable
	 */
	public boolean isReachable() {
		return reachable;
	}

	void markReachable() {
		reachable = true;
	}

	boolean isInWorklist() {
		return inWorklist;
	}

	void setInWorklist(boolean inWorklist) {
		this.inWorklist = inWorklist;
	}

	@Override
	public String toString() {
		return "B" + id + "[" + begin + ", " + end + ")";
	}
}
