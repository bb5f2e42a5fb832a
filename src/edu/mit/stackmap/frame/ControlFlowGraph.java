package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import static edu.mit.stackmap.frame.AbstractTypes.*;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * The basic blocks of a method and the edges between them.  Blocks are stored
 * in instruction order; block 0 is the entry block.
 *
 * A block begins at the first instruction, at every label that is a jump,
 * switch or handler target or a handler range boundary, and after every jump,
 * switch, return or throw.  In methods with exception handlers, a block also
 * ends after every local variable store.  Labels with no real instruction
 * between them belong to the same block.
 * @since 10/6/2026
 */
public final class ControlFlowGraph {
	private final MethodNode methodNode;
	private final AbstractInsnNode[] insns;
	private final ImmutableList<BasicBlock> blocks;
	/**
	 * Maps instruction index to the id of its block.
	 */
	private final int[] blockOfInsn;
	private final Map<LabelNode, Integer> labelIndices;
	private final Map<LabelNode, Label> labels;
	/**
	 * Labels created for NEW instructions not preceded by a label, mapped to
	 * the NEW they must be inserted before.
	 */
	private final Map<LabelNode, AbstractInsnNode> pendingLabels;
	private final int maxLocals;
	private ControlFlowGraph(MethodNode methodNode, AbstractInsnNode[] insns, ImmutableList<BasicBlock> blocks, int[] blockOfInsn, Map<LabelNode, Integer> labelIndices, Map<LabelNode, Label> labels, int maxLocals) {
		this.methodNode = methodNode;
		this.insns = insns;
		this.blocks = blocks;
		this.blockOfInsn = blockOfInsn;
		this.labelIndices = labelIndices;
		this.labels = labels;
		this.pendingLabels = new LinkedHashMap<>();
		this.maxLocals = maxLocals;
	}

	/**
	 * Builds the control-flow graph of the given method.
	 * @param methodNode a method with code
	 * @param symbolTable the symbol table to add caught exception types to
	 * @return the method's control-flow graph
	 * @throws AnalysisException if the method uses JSR or RET
	 */
	public static ControlFlowGraph build(MethodNode methodNode, SymbolTable symbolTable) {
		checkArgument(methodNode.instructions.size() > 0, "%s%s has no code", methodNode.name, methodNode.desc);
		AbstractInsnNode[] insns = methodNode.instructions.toArray();
		Map<LabelNode, Integer> labelIndices = new IdentityHashMap<>();
		for (int i = 0; i < insns.length; ++i)
			if (insns[i] instanceof LabelNode)
				labelIndices.put((LabelNode)insns[i], i);

		boolean hasHandlers = !methodNode.tryCatchBlocks.isEmpty();
		boolean[] leader = new boolean[insns.length + 1];
		leader[0] = true;
		for (int i = 0; i < insns.length; ++i) {
			AbstractInsnNode insn = insns[i];
			int opcode = insn.getOpcode();
			if (opcode == Opcodes.JSR || opcode == Opcodes.RET)
				throw AnalysisException.atInstruction(i, "JSR/RET are not supported");
			if (insn instanceof JumpInsnNode) {
				leader[indexOf(labelIndices, ((JumpInsnNode)insn).label)] = true;
				leader[i + 1] = true;
			} else if (insn instanceof TableSwitchInsnNode || insn instanceof LookupSwitchInsnNode) {
				for (LabelNode target : switchTargets(insn))
					leader[indexOf(labelIndices, target)] = true;
				leader[i + 1] = true;
			} else if (endsControlFlow(opcode))
				leader[i + 1] = true;
			else if (hasHandlers && opcode >= Opcodes.ISTORE && opcode <= Opcodes.ASTORE)
				//handlers must see the locals after each store, not just at
				//block boundaries
				leader[i + 1] = true;
		}
		for (TryCatchBlockNode tcb : methodNode.tryCatchBlocks) {
			leader[indexOf(labelIndices, tcb.start)] = true;
			leader[indexOf(labelIndices, tcb.end)] = true;
			leader[indexOf(labelIndices, tcb.handler)] = true;
		}

		//Split into blocks.  A leader starts a new block only once the current
		//block contains a real instruction.
		Map<LabelNode, Label> labels = new IdentityHashMap<>();
		List<BasicBlock> blocks = new ArrayList<>();
		int[] blockOfInsn = new int[insns.length];
		int begin = 0;
		while (begin < insns.length) {
			int firstReal = -1;
			LabelNode firstLabel = null;
			int end = begin;
			for (; end < insns.length; ++end) {
				if (end > begin && leader[end] && firstReal >= 0)
					break;
				if (firstLabel == null && firstReal < 0 && insns[end] instanceof LabelNode)
					firstLabel = (LabelNode)insns[end];
				if (firstReal < 0 && insns[end].getOpcode() >= 0)
					firstReal = end;
			}
			if (firstReal < 0) {
				//trailing labels and line numbers; no block can start here
				checkState(!blocks.isEmpty(), "%s%s has no instructions", methodNode.name, methodNode.desc);
				blocks.get(blocks.size() - 1).setEnd(end);
			} else {
				Label label = firstLabel != null ? labelFor(labels, firstLabel) : null;
				blocks.add(new BasicBlock(blocks.size(), begin, end, firstReal, insns[firstReal], label));
			}
			for (int i = begin; i < end; ++i)
				blockOfInsn[i] = blocks.size() - 1;
			begin = end;
		}
		for (int i = 0; i < insns.length; ++i)
			if (insns[i] instanceof LabelNode)
				labelFor(labels, (LabelNode)insns[i]);

		int maxLocals = computeMaxLocals(methodNode, insns);
		ControlFlowGraph cfg = new ControlFlowGraph(methodNode, insns, ImmutableList.copyOf(blocks), blockOfInsn, labelIndices, labels, maxLocals);
		cfg.addEdges(symbolTable);
		return cfg;
	}

	private void addEdges(SymbolTable symbolTable) {
		for (BasicBlock block : blocks) {
			AbstractInsnNode last = lastRealInsn(block);
			int opcode = last.getOpcode();
			if (last instanceof JumpInsnNode) {
				BasicBlock target = blockOf(((JumpInsnNode)last).label);
				target.markJumpTarget();
				block.addSuccessor(target.getId(), 0);
				if (opcode != Opcodes.GOTO)
					addFallThrough(block);
			} else if (last instanceof TableSwitchInsnNode || last instanceof LookupSwitchInsnNode) {
				for (LabelNode label : switchTargets(last)) {
					BasicBlock target = blockOf(label);
					target.markJumpTarget();
					block.addSuccessor(target.getId(), 0);
				}
			} else if (!endsControlFlow(opcode))
				addFallThrough(block);
		}

		for (TryCatchBlockNode tcb : methodNode.tryCatchBlocks) {
			BasicBlock handler = blockOf(tcb.handler);
			handler.markJumpTarget();
			int catchType = REFERENCE_KIND | symbolTable.addType(tcb.type != null ? tcb.type : "java/lang/Throwable");
			for (BasicBlock block : coveredBlocks(tcb))
				block.addSuccessor(handler.getId(), catchType);
		}
	}

	private void addFallThrough(BasicBlock block) {
		if (block.getId() + 1 < blocks.size())
			block.addSuccessor(block.getId() + 1, 0);
		else
			block.markFallsOffEnd();
	}

	/**
	 * Returns the blocks whose code is covered by the given handler range, in
	 * order.
	 * @param tcb a try-catch block of this graph's method
	 * @return the covered blocks
	 */
	public ImmutableList<BasicBlock> coveredBlocks(TryCatchBlockNode tcb) {
		int start = indexOf(labelIndices, tcb.start), end = indexOf(labelIndices, tcb.end);
		ImmutableList.Builder<BasicBlock> builder = ImmutableList.builder();
		for (BasicBlock block : blocks)
			if (block.getFirstRealInsn() >= start && block.getFirstRealInsn() < end)
				builder.add(block);
		return builder.build();
	}

	private AbstractInsnNode lastRealInsn(BasicBlock block) {
		for (int i = block.getEnd() - 1; i >= block.getBegin(); --i)
			if (insns[i].getOpcode() >= 0)
				return insns[i];
		throw new AssertionError("block without code: " + block);
	}

	private BasicBlock blockOf(LabelNode label) {
		return blocks.get(blockOfInsn[indexOf(labelIndices, label)]);
	}

	private static int indexOf(Map<LabelNode, Integer> labelIndices, LabelNode label) {
		Integer index = labelIndices.get(label);
		checkArgument(index != null, "label %s not in instruction list", label);
		return index;
	}

	private static Label labelFor(Map<LabelNode, Label> labels, LabelNode labelNode) {
		Label label = labels.get(labelNode);
		if (label == null) {
			label = new Label(labelNode);
			labels.put(labelNode, label);
		}
		return label;
	}

	private static List<LabelNode> switchTargets(AbstractInsnNode insn) {
		List<LabelNode> targets = new ArrayList<>();
		if (insn instanceof TableSwitchInsnNode) {
			targets.add(((TableSwitchInsnNode)insn).dflt);
			targets.addAll(((TableSwitchInsnNode)insn).labels);
		} else {
			targets.add(((LookupSwitchInsnNode)insn).dflt);
			targets.addAll(((LookupSwitchInsnNode)insn).labels);
		}
		return targets;
	}

	/**
	 * Returns true if the given opcode never falls through to the next
	 * instruction.
	 */
	private static boolean endsControlFlow(int opcode) {
		return (opcode >= Opcodes.IRETURN && opcode <= Opcodes.RETURN)
				|| opcode == Opcodes.ATHROW || opcode == Opcodes.GOTO
				|| opcode == Opcodes.TABLESWITCH || opcode == Opcodes.LOOKUPSWITCH;
	}

	private static int computeMaxLocals(MethodNode methodNode, AbstractInsnNode[] insns) {
		int maxLocals = Type.getArgumentsAndReturnSizes(methodNode.desc) >> 2;
		//the sizes include the receiver slot
		if ((methodNode.access & Opcodes.ACC_STATIC) != 0)
			--maxLocals;
		maxLocals = Math.max(maxLocals, methodNode.maxLocals);
		for (AbstractInsnNode insn : insns) {
			if (insn instanceof VarInsnNode) {
				int opcode = insn.getOpcode();
				boolean wide = opcode == Opcodes.LLOAD || opcode == Opcodes.DLOAD
						|| opcode == Opcodes.LSTORE || opcode == Opcodes.DSTORE;
				maxLocals = Math.max(maxLocals, ((VarInsnNode)insn).var + (wide ? 2 : 1));
			} else if (insn instanceof IincInsnNode)
				maxLocals = Math.max(maxLocals, ((IincInsnNode)insn).var + 1);
		}
		return maxLocals;
	}

	/**
	 * Returns the label marking the position of the NEW instruction at the
	 * given index.  This is the nearest label before it with only
	 * pseudo-instructions in between, or a new label that must be inserted
	 * before the NEW (see {@link #pendingLabels()}).
	 * @param newInsnIndex the index of a NEW instruction
	 * @return the label of the NEW
	 */
	public Label newSiteLabel(int newInsnIndex) {
		checkArgument(insns[newInsnIndex].getOpcode() == Opcodes.NEW, "not a NEW: %s", newInsnIndex);
		for (int i = newInsnIndex - 1; i >= 0 && insns[i].getOpcode() < 0; --i)
			if (insns[i] instanceof LabelNode)
				return labels.get((LabelNode)insns[i]);
		for (Map.Entry<LabelNode, AbstractInsnNode> e : pendingLabels.entrySet())
			if (e.getValue() == insns[newInsnIndex])
				return labels.get(e.getKey());
		LabelNode labelNode = new LabelNode();
		pendingLabels.put(labelNode, insns[newInsnIndex]);
		return labelFor(labels, labelNode);
	}

	/**
	 * Returns the labels created by {@link #newSiteLabel(int)}, each mapped to
	 * the instruction it must be inserted before.
	 * @return the pending labels
	 */
	public ImmutableMap<LabelNode, AbstractInsnNode> pendingLabels() {
		return ImmutableMap.copyOf(pendingLabels);
	}

	/**
	 * Binds all labels of this graph to bytecode offsets.  Pending labels take
	 * the offset of the instruction they will be inserted before.
	 * @param offsets maps instructions to their bytecode offsets
	 */
	public void bindLabels(ToIntFunction<AbstractInsnNode> offsets) {
		for (Map.Entry<LabelNode, Label> e : labels.entrySet()) {
			AbstractInsnNode position = pendingLabels.containsKey(e.getKey()) ? pendingLabels.get(e.getKey()) : e.getKey();
			e.getValue().bind(offsets.applyAsInt(position));
		}
	}

	public MethodNode getMethodNode() {
		return methodNode;
	}

	public ImmutableList<BasicBlock> blocks() {
		return blocks;
	}

	public BasicBlock getBlock(int id) {
		return blocks.get(id);
	}

	/**
	 * Returns the instructions of this graph's method as they were when the
	 * graph was built.
	 * @return the instructions, indexed as in the method's instruction list
	 */
	public ImmutableList<AbstractInsnNode> instructions() {
		return ImmutableList.copyOf(insns);
	}

	AbstractInsnNode instruction(int index) {
		return insns[index];
	}

	public int blockOfInstruction(int insnIndex) {
		return blockOfInsn[insnIndex];
	}

	/**
	 * Returns the number of local variable slots the method needs: the larger
	 * of its declared maxLocals and the slots used by its parameters and
	 * instructions.
	 * @return the number of local variable slots
	 */
	public int getMaxLocals() {
		return maxLocals;
	}

	public void dump(PrintWriter writer) {
		writer.write(methodNode.name + methodNode.desc);
		writer.println();
		for (BasicBlock block : blocks) {
			writer.write(block.toString());
			if (block.isJumpTarget())
				writer.write(" target");
			writer.write(" " + block.successors());
			writer.println();
		}
		writer.flush();
	}
}
