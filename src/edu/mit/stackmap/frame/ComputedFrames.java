package edu.mit.stackmap.frame;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.PrintWriter;

/**
 * The result of computing frames for one method: the resolved input frame of
 * every basic block, the method's implicit initial frame, and its maxStack and
 * maxLocals.
 * @since 10/8/2026
 */
public final class ComputedFrames {
	private final ControlFlowGraph cfg;
	private final ImmutableList<StackMapFrame> frames;
	private final ImmutableList<VerificationType> initialLocals, initialStack;
	private final int maxStack, maxLocals;
	ComputedFrames(ControlFlowGraph cfg, ImmutableList<StackMapFrame> frames, ImmutableList<VerificationType> initialLocals, ImmutableList<VerificationType> initialStack, int maxStack, int maxLocals) {
		this.cfg = cfg;
		this.frames = frames;
		this.initialLocals = initialLocals;
		this.initialStack = initialStack;
		this.maxStack = maxStack;
		this.maxLocals = maxLocals;
	}

	public ControlFlowGraph getControlFlowGraph() {
		return cfg;
	}

	/**
	 * Returns the frames of all blocks, indexed by block id.
	 * @return the frames
	 */
	public ImmutableList<StackMapFrame> frames() {
		return frames;
	}

	public StackMapFrame getFrame(int blockId) {
		return frames.get(blockId);
	}

	/**
	 * Returns the locals of the frame the method starts with, before any
	 * merges: the receiver and parameters for a method analyzed from its
	 * descriptor.
	 * @return the initial locals
	 */
	public ImmutableList<VerificationType> getInitialLocals() {
		return initialLocals;
	}

	public ImmutableList<VerificationType> getInitialStack() {
		return initialStack;
	}

	public int getMaxStack() {
		return maxStack;
	}

	public int getMaxLocals() {
		return maxLocals;
	}

	public ImmutableSortedSet<Integer> unreachableBlocks() {
		ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
		for (StackMapFrame f : frames)
			if (!f.isReachable())
				builder.add(f.getBlockId());
		return builder.build();
	}

	public void dump(PrintWriter writer) {
		writer.write(String.format("%s%s: maxStack %d, maxLocals %d",
				cfg.getMethodNode().name, cfg.getMethodNode().desc, maxStack, maxLocals));
		writer.println();
		writer.write("initial locals " + initialLocals + " stack " + initialStack);
		writer.println();
		for (StackMapFrame f : frames) {
			writer.write(f.toString());
			writer.println();
		}
		writer.flush();
	}
}
