package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * Computes the stack map frames of a method by forward dataflow analysis.
 *
 * Each basic block is simulated once to get its output frame relative to its
 * input frame.  Then, starting from the entry block, resolved output frames are
 * merged into successors' input frames until no input frame changes.  Blocks
 * never reached get a frame with no locals and a Throwable on the stack.
 *
 * A FrameComputer may be reused for several methods of the class its symbol
 * table belongs to.
 * @since 10/8/2026
 */
public final class FrameComputer {
	private static final Log LOG = LogFactory.getLog(FrameComputer.class);
	private static final ImmutableList<VerificationType> UNREACHABLE_STACK = ImmutableList.of(VerificationType.object("java/lang/Throwable"));
	private final SymbolTable symbolTable;
	private final AnalysisOptions options;

	public FrameComputer(SymbolTable symbolTable) {
		this(symbolTable, AnalysisOptions.defaults());
	}

	public FrameComputer(SymbolTable symbolTable, AnalysisOptions options) {
		this.symbolTable = checkNotNull(symbolTable);
		this.options = checkNotNull(options);
	}

	public SymbolTable getSymbolTable() {
		return symbolTable;
	}

	/**
	 * Computes frames for the given method, starting from the frame implied
	 * by its access flags and descriptor.
	 * @param methodNode the method
	 * @return the computed frames
	 * @throws AnalysisException if the method's code is unsupported or
	 * malformed
	 */
	public ComputedFrames compute(MethodNode methodNode) {
		return compute(methodNode, null, null);
	}

	/**
	 * Computes frames for the given code, starting from the given entry frame
	 * rather than the one implied by the method descriptor.
	 * @param methodNode the method holding the code
	 * @param entryLocals the locals at the first instruction
	 * @param entryStack the stack at the first instruction
	 * @return the computed frames
	 * @throws AnalysisException if the code is unsupported or malformed
	 */
	public ComputedFrames compute(MethodNode methodNode, List<VerificationType> entryLocals, List<VerificationType> entryStack) {
		checkArgument((entryLocals == null) == (entryStack == null), "entry locals and stack must both be given or both omitted");
		ControlFlowGraph cfg = ControlFlowGraph.build(methodNode, symbolTable);
		int maxLocals = cfg.getMaxLocals();
		if (entryLocals != null) {
			int slots = 0;
			for (VerificationType t : entryLocals)
				slots += t.isWide() ? 2 : 1;
			maxLocals = Math.max(maxLocals, slots);
		}

		for (BasicBlock block : cfg.blocks()) {
			Frame frame = new Frame(block.getId());
			for (int i = block.getBegin(); i < block.getEnd(); ++i)
				execute(frame, cfg, i);
			block.setFrame(frame);
		}
		//NEW site labels are created during simulation
		if (options.getOffsets() != null)
			cfg.bindLabels(options.getOffsets());

		Frame entryFrame = cfg.getBlock(0).getFrame();
		try {
			if (entryLocals == null)
				entryFrame.setInputFrameFromDescriptor(symbolTable, methodNode.access, methodNode.name, methodNode.desc, maxLocals);
			else
				entryFrame.setInputFrameFromVerificationTypes(symbolTable, entryLocals, entryStack, maxLocals);
		} catch (IllegalArgumentException ex) {
			throw AnalysisException.inBlock(0, "bad entry frame for " + methodNode.name + methodNode.desc, ex);
		}
		ImmutableList<VerificationType> initialLocals = entryFrame.getInputLocals(symbolTable);
		ImmutableList<VerificationType> initialStack = entryFrame.getInputStack(symbolTable);

		int maxStack = 0, iterations = 0;
		Deque<BasicBlock> worklist = new ArrayDeque<>();
		worklist.add(cfg.getBlock(0));
		cfg.getBlock(0).setInWorklist(true);
		while (!worklist.isEmpty()) {
			BasicBlock block = worklist.removeFirst();
			block.setInWorklist(false);
			block.markReachable();
			++iterations;
			Frame frame = block.getFrame();
			if (block.fallsOffEnd())
				throw AnalysisException.inBlock(block.getId(), "execution falls off the end of " + methodNode.name + methodNode.desc, null);
			maxStack = Math.max(maxStack, frame.getInputStackSize() + frame.getOutputStackMax());
			for (BasicBlock.Edge edge : block.successors()) {
				BasicBlock successor = cfg.getBlock(edge.getTarget());
				boolean changed;
				try {
					changed = frame.merge(symbolTable, successor.getFrame(), edge.getCatchType());
				} catch (IllegalArgumentException | IllegalStateException ex) {
					throw AnalysisException.inBlock(block.getId(), "can't merge into block " + successor.getId() + " of " + methodNode.name + methodNode.desc, ex);
				}
				if (changed && !successor.isInWorklist()) {
					successor.setInWorklist(true);
					worklist.addLast(successor);
				}
			}
		}
		if (LOG.isDebugEnabled())
			LOG.debug(methodNode.name + methodNode.desc + ": " + cfg.blocks().size() + " blocks, fixed point after " + iterations + " iterations");

		ImmutableList.Builder<StackMapFrame> frames = ImmutableList.builder();
		for (BasicBlock block : cfg.blocks()) {
			if (block.isReachable())
				frames.add(new StackMapFrame(block.getId(), block.getFirstRealNode(), block.getLabel(),
						block.getFrame().getInputLocals(symbolTable), block.getFrame().getInputStack(symbolTable),
						block.isJumpTarget(), true));
			else {
				if (LOG.isDebugEnabled())
					LOG.debug(methodNode.name + methodNode.desc + ": block " + block.getId() + " is unreachable");
				frames.add(new StackMapFrame(block.getId(), block.getFirstRealNode(), block.getLabel(),
						ImmutableList.<VerificationType>of(), UNREACHABLE_STACK, block.isJumpTarget(), false));
				maxStack = Math.max(maxStack, 1);
			}
		}
		return new ComputedFrames(cfg, frames.build(), initialLocals, initialStack, maxStack, maxLocals);
	}

	/**
	 * Simulates the instruction at the given index in the given frame.
	 */
	private void execute(Frame frame, ControlFlowGraph cfg, int index) {
		AbstractInsnNode insn = cfg.instruction(index);
		int opcode = insn.getOpcode();
		try {
			switch (insn.getType()) {
				case AbstractInsnNode.INSN:
				case AbstractInsnNode.JUMP_INSN:
				case AbstractInsnNode.TABLESWITCH_INSN:
				case AbstractInsnNode.LOOKUPSWITCH_INSN:
					frame.execute(opcode, 0, null, symbolTable);
					break;
				case AbstractInsnNode.INT_INSN:
					frame.execute(opcode, ((IntInsnNode)insn).operand, null, symbolTable);
					break;
				case AbstractInsnNode.VAR_INSN:
					frame.execute(opcode, ((VarInsnNode)insn).var, null, symbolTable);
					break;
				case AbstractInsnNode.IINC_INSN:
					frame.execute(opcode, ((IincInsnNode)insn).var, null, symbolTable);
					break;
				case AbstractInsnNode.TYPE_INSN:
					String type = ((TypeInsnNode)insn).desc;
					if (opcode == Opcodes.NEW)
						frame.execute(opcode, symbolTable.addForwardUninitializedType(type, cfg.newSiteLabel(index)), type, symbolTable);
					else
						frame.execute(opcode, 0, type, symbolTable);
					break;
				case AbstractInsnNode.FIELD_INSN:
					frame.execute(opcode, 0, ((FieldInsnNode)insn).desc, symbolTable);
					break;
				case AbstractInsnNode.METHOD_INSN:
					MethodInsnNode min = (MethodInsnNode)insn;
					frame.execute(opcode, min.name.charAt(0) == '<' ? 1 : 0, min.desc, symbolTable);
					break;
				case AbstractInsnNode.INVOKE_DYNAMIC_INSN:
					frame.execute(opcode, 0, ((InvokeDynamicInsnNode)insn).desc, symbolTable);
					break;
				case AbstractInsnNode.LDC_INSN:
					frame.execute(opcode, 0, constantDescriptor(((LdcInsnNode)insn).cst), symbolTable);
					break;
				case AbstractInsnNode.MULTIANEWARRAY_INSN:
					MultiANewArrayInsnNode manain = (MultiANewArrayInsnNode)insn;
					frame.execute(opcode, manain.dims, manain.desc, symbolTable);
					break;
				default:
					//labels, line numbers, frames
					break;
			}
		} catch (IllegalArgumentException ex) {
			throw AnalysisException.atInstruction(index, "can't simulate " + insn.getClass().getSimpleName() + " (opcode " + opcode + ")", ex);
		}
	}

	/**
	 * Returns the descriptor of the type an LDC of the given constant pushes.
	 */
	private static String constantDescriptor(Object cst) {
		if (cst instanceof Integer)
			return "I";
		if (cst instanceof Float)
			return "F";
		if (cst instanceof Long)
			return "J";
		if (cst instanceof Double)
			return "D";
		if (cst instanceof String)
			return "Ljava/lang/String;";
		if (cst instanceof Type) {
			int sort = ((Type)cst).getSort();
			if (sort == Type.OBJECT || sort == Type.ARRAY)
				return "Ljava/lang/Class;";
			if (sort == Type.METHOD)
				return "Ljava/lang/invoke/MethodType;";
			throw new IllegalArgumentException("bad LDC type constant " + cst);
		}
		if (cst instanceof Handle)
			return "Ljava/lang/invoke/MethodHandle;";
		if (cst instanceof ConstantDynamic)
			return ((ConstantDynamic)cst).getDescriptor();
		throw new IllegalArgumentException("bad LDC constant " + cst);
	}
}
