package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FrameNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TryCatchBlockNode;

/**
 * Writes computed frames back into a MethodNode as compressed FrameNodes, so
 * the method can be written by a ClassWriter that does not compute frames.
 * @since October 12, 2026
 */
public final class FrameNodeEmitter {
	private static final Log LOG = LogFactory.getLog(FrameNodeEmitter.class);
	private FrameNodeEmitter() {}

	/**
	 * Replaces the given method's frames with the computed ones and sets its
	 * maxStack and maxLocals.  The ComputedFrames must have been computed for
	 * this method, and the method must not have been modified since.
	 * @param methodNode the method to modify
	 * @param computed the frames computed for the method
	 * @param options the emission options
	 */
	public static void emit(MethodNode methodNode, ComputedFrames computed, AnalysisOptions options) {
		ControlFlowGraph cfg = computed.getControlFlowGraph();
		checkArgument(cfg.getMethodNode() == methodNode, "frames for %s%s, not %s%s",
				cfg.getMethodNode().name, cfg.getMethodNode().desc, methodNode.name, methodNode.desc);
		InsnList insns = methodNode.instructions;
		for (AbstractInsnNode insn : cfg.instructions())
			if (insn instanceof FrameNode)
				insns.remove(insn);
		for (Map.Entry<LabelNode, AbstractInsnNode> e : cfg.pendingLabels().entrySet())
			insns.insertBefore(e.getValue(), e.getKey());

		ToIntFunction<AbstractInsnNode> offsets = options.getOffsets();
		List<VerificationType> previousLocals = computed.getInitialLocals();
		int previousOffset = -1, emitted = 0;
		for (StackMapFrame frame : computed.frames()) {
			if (!options.getFramePlacement().needsFrame(frame))
				continue;
			int offsetDelta = -1;
			if (offsets != null) {
				int offset = offsets.applyAsInt(frame.getStart());
				offsetDelta = previousOffset < 0 ? offset : offset - previousOffset - 1;
				previousOffset = offset;
			}
			insns.insertBefore(frame.getStart(), toFrameNode(previousLocals, frame, offsetDelta));
			previousLocals = frame.getLocals();
			++emitted;
		}

		int rewritten = 0;
		if (options.rewriteDeadCode() && !computed.unreachableBlocks().isEmpty()) {
			removeDeadCodeFromHandlers(methodNode, computed);
			for (int blockId : computed.unreachableBlocks()) {
				BasicBlock block = cfg.getBlock(blockId);
				insns.insertBefore(block.getFirstRealNode(), new InsnNode(Opcodes.ATHROW));
				for (int i = block.getBegin(); i < block.getEnd(); ++i)
					if (cfg.instruction(i).getOpcode() >= 0)
						insns.remove(cfg.instruction(i));
				++rewritten;
			}
		}

		methodNode.maxStack = computed.getMaxStack();
		methodNode.maxLocals = computed.getMaxLocals();
		if (LOG.isDebugEnabled())
			LOG.debug(methodNode.name + methodNode.desc + ": emitted " + emitted + " frames, rewrote " + rewritten + " dead blocks");
	}

	/**
	 * Returns a FrameNode for the given frame, compressed relative to the
	 * given previous locals.
	 */
	static FrameNode toFrameNode(List<VerificationType> previousLocals, StackMapFrame frame, int offsetDelta) {
		ImmutableList<VerificationType> locals = frame.getLocals(), stack = frame.getStack();
		FrameType type = FrameType.compress(previousLocals, locals, stack, offsetDelta);
		switch (type) {
			case SAME:
			case SAME_EXTENDED:
				return new FrameNode(Opcodes.F_SAME, 0, null, 0, null);
			case SAME_LOCALS_1_STACK_ITEM:
			case SAME_LOCALS_1_STACK_ITEM_EXTENDED:
				return new FrameNode(Opcodes.F_SAME1, 0, null, 1, toAsm(stack));
			case CHOP:
				return new FrameNode(Opcodes.F_CHOP, previousLocals.size() - locals.size(), null, 0, null);
			case APPEND:
				List<VerificationType> appended = locals.subList(previousLocals.size(), locals.size());
				return new FrameNode(Opcodes.F_APPEND, appended.size(), toAsm(appended), 0, null);
			case FULL:
				return new FrameNode(Opcodes.F_FULL, locals.size(), toAsm(locals), stack.size(), toAsm(stack));
			default:
				throw new AssertionError(type);
		}
	}

	private static Object[] toAsm(List<VerificationType> types) {
		Object[] elements = new Object[types.size()];
		for (int i = 0; i < elements.length; ++i)
			elements[i] = types.get(i).toAsmFrameElement();
		return elements;
	}

	/**
	 * Splits the handler ranges covering unreachable blocks so they cover only
	 * reachable ones, dropping handlers left with no code.
	 */
	private static void removeDeadCodeFromHandlers(MethodNode methodNode, ComputedFrames computed) {
		ControlFlowGraph cfg = computed.getControlFlowGraph();
		Map<Integer, LabelNode> blockLabels = new HashMap<>();
		List<TryCatchBlockNode> handlers = new ArrayList<>(methodNode.tryCatchBlocks.size());
		for (TryCatchBlockNode tcb : methodNode.tryCatchBlocks) {
			ImmutableList<BasicBlock> covered = cfg.coveredBlocks(tcb);
			boolean anyDead = false;
			for (BasicBlock b : covered)
				anyDead |= !b.isReachable();
			if (!anyDead) {
				handlers.add(tcb);
				continue;
			}

			for (int i = 0; i < covered.size(); ) {
				if (!covered.get(i).isReachable()) {
					++i;
					continue;
				}
				int runStart = i;
				while (i < covered.size() && covered.get(i).isReachable()
						&& (i == runStart || covered.get(i).getId() == covered.get(i - 1).getId() + 1))
					++i;
				LabelNode start = runStart == 0 ? tcb.start : labelAtBlock(methodNode, cfg, blockLabels, covered.get(runStart).getId());
				LabelNode end = i == covered.size() ? tcb.end : labelAtBlock(methodNode, cfg, blockLabels, covered.get(i - 1).getId() + 1);
				TryCatchBlockNode segment = new TryCatchBlockNode(start, end, tcb.handler, tcb.type);
				segment.visibleTypeAnnotations = tcb.visibleTypeAnnotations;
				segment.invisibleTypeAnnotations = tcb.invisibleTypeAnnotations;
				handlers.add(segment);
			}
		}
		if (LOG.isDebugEnabled() && handlers.size() != methodNode.tryCatchBlocks.size())
			LOG.debug(methodNode.name + methodNode.desc + ": " + methodNode.tryCatchBlocks.size() + " handler ranges became " + handlers.size());
		methodNode.tryCatchBlocks = handlers;
	}

	/**
	 * Returns a label node at the start of the given block (or at the end of
	 * the code, if the block id is one past the last block), inserting one if
	 * needed.
	 */
	private static LabelNode labelAtBlock(MethodNode methodNode, ControlFlowGraph cfg, Map<Integer, LabelNode> blockLabels, int blockId) {
		LabelNode label = blockLabels.get(blockId);
		if (label != null)
			return label;
		label = new LabelNode();
		if (blockId < cfg.blocks().size()) {
			//before the block's frame, if it has one
			AbstractInsnNode position = cfg.getBlock(blockId).getFirstRealNode();
			while (position.getPrevious() instanceof FrameNode)
				position = position.getPrevious();
			methodNode.instructions.insertBefore(position, label);
		} else
			methodNode.instructions.add(label);
		blockLabels.put(blockId, label);
		return label;
	}
}
