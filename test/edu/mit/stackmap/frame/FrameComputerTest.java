package edu.mit.stackmap.frame;

import static org.junit.Assert.*;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.Before;
import org.junit.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FrameNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * Tests the control-flow graph and the fixed-point iteration on hand-built
 * methods.
 * @since 10/9/2026
 */
public class FrameComputerTest {
	private static final VerificationType STRING = VerificationType.object("java/lang/String");
	private SymbolTable symbolTable;
	private FrameComputer computer;

	@Before
	public void setUp() {
		symbolTable = new SymbolTable("test/Owner");
		computer = new FrameComputer(symbolTable);
	}

	private static MethodNode method(int access, String name, String desc) {
		return new MethodNode(Opcodes.ASM9, access, name, desc, null, null);
	}

	@Test
	public void testStraightLine() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "three", "()I");
		mn.instructions.add(new InsnNode(Opcodes.ICONST_1));
		mn.instructions.add(new InsnNode(Opcodes.ICONST_2));
		mn.instructions.add(new InsnNode(Opcodes.IADD));
		mn.instructions.add(new InsnNode(Opcodes.IRETURN));
		ComputedFrames computed = computer.compute(mn);
		assertEquals(1, computed.frames().size());
		assertEquals(2, computed.getMaxStack());
		assertEquals(0, computed.getMaxLocals());
		assertTrue(computed.unreachableBlocks().isEmpty());

		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.defaults());
		for (int i = 0; i < mn.instructions.size(); ++i)
			assertFalse(mn.instructions.get(i) instanceof FrameNode);
		assertEquals(2, mn.maxStack);
	}

	/**
	 * static Object pick(boolean b) { Object o = b ? "s" : null; return o; }
	 */
	private static MethodNode diamond() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "pick", "(Z)Ljava/lang/Object;");
		LabelNode elseLabel = new LabelNode(), join = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new JumpInsnNode(Opcodes.IFEQ, elseLabel));
		insns.add(new LdcInsnNode("s"));
		insns.add(new VarInsnNode(Opcodes.ASTORE, 1));
		insns.add(new JumpInsnNode(Opcodes.GOTO, join));
		insns.add(elseLabel);
		insns.add(new InsnNode(Opcodes.ACONST_NULL));
		insns.add(new VarInsnNode(Opcodes.ASTORE, 1));
		insns.add(join);
		insns.add(new VarInsnNode(Opcodes.ALOAD, 1));
		insns.add(new InsnNode(Opcodes.ARETURN));
		return mn;
	}

	@Test
	public void testDiamondMergesStringAndNull() {
		ComputedFrames computed = computer.compute(diamond());
		assertEquals(4, computed.frames().size());
		StackMapFrame elseFrame = computed.getFrame(2), joinFrame = computed.getFrame(3);
		assertTrue(elseFrame.isJumpTarget());
		assertEquals(ImmutableList.of(VerificationType.INTEGER), elseFrame.getLocals());
		assertTrue(joinFrame.isJumpTarget());
		assertEquals(ImmutableList.of(VerificationType.INTEGER, STRING), joinFrame.getLocals());
		assertEquals(ImmutableList.of(), joinFrame.getStack());
		assertFalse(computed.getFrame(1).isJumpTarget());
		assertEquals(2, computed.getMaxLocals());
		assertEquals(1, computed.getMaxStack());
	}

	@Test
	public void testDiamondEmission() {
		MethodNode mn = diamond();
		ComputedFrames computed = computer.compute(mn);
		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.defaults());
		int frames = 0;
		for (int i = 0; i < mn.instructions.size(); ++i)
			if (mn.instructions.get(i) instanceof FrameNode) {
				FrameNode frame = (FrameNode)mn.instructions.get(i);
				//else: same locals as the initial frame; join: one more local
				assertEquals(frames == 0 ? Opcodes.F_SAME : Opcodes.F_APPEND, frame.type);
				++frames;
			}
		assertEquals(2, frames);
	}

	@Test
	public void testAllBlocksPlacement() {
		MethodNode mn = diamond();
		ComputedFrames computed = computer.compute(mn);
		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.builder().framePlacement(FramePlacement.ALL_BLOCKS).build());
		int frames = 0;
		for (int i = 0; i < mn.instructions.size(); ++i)
			if (mn.instructions.get(i) instanceof FrameNode)
				++frames;
		assertEquals(3, frames);
	}

	@Test
	public void testExceptionHandlerFrame() {
		//static void m() { try { String s = "x"; bar(); } catch (IOException e) {} }
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode start = new LabelNode(), end = new LabelNode(), handler = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(start);
		insns.add(new LdcInsnNode("x"));
		insns.add(new VarInsnNode(Opcodes.ASTORE, 0));
		insns.add(new MethodInsnNode(Opcodes.INVOKESTATIC, "test/Owner", "bar", "()V", false));
		insns.add(end);
		insns.add(new InsnNode(Opcodes.RETURN));
		insns.add(handler);
		insns.add(new VarInsnNode(Opcodes.ASTORE, 1));
		insns.add(new InsnNode(Opcodes.RETURN));
		mn.tryCatchBlocks.add(new TryCatchBlockNode(start, end, handler, "java/io/IOException"));

		ComputedFrames computed = computer.compute(mn);
		ControlFlowGraph cfg = computed.getControlFlowGraph();
		//the stores split the protected range and the handler
		assertEquals(5, cfg.blocks().size());
		StackMapFrame handlerFrame = computed.getFrame(3);
		assertTrue(handlerFrame.isJumpTarget());
		//the handler sees both the unset and the String local
		assertEquals(ImmutableList.of(), handlerFrame.getLocals());
		assertEquals(ImmutableList.of(VerificationType.object("java/io/IOException")), handlerFrame.getStack());
		assertEquals(2, computed.getMaxLocals());
	}

	@Test
	public void testFinallyHandlerCatchesThrowable() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode start = new LabelNode(), end = new LabelNode(), handler = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(start);
		insns.add(new MethodInsnNode(Opcodes.INVOKESTATIC, "test/Owner", "bar", "()V", false));
		insns.add(end);
		insns.add(new InsnNode(Opcodes.RETURN));
		insns.add(handler);
		insns.add(new InsnNode(Opcodes.ATHROW));
		mn.tryCatchBlocks.add(new TryCatchBlockNode(start, end, handler, null));
		ComputedFrames computed = computer.compute(mn);
		assertEquals(ImmutableList.of(VerificationType.object("java/lang/Throwable")), computed.getFrame(2).getStack());
	}

	@Test
	public void testConstructorInitializesThisBeforeJoin() {
		//Owner(boolean b) { super(); if (b) {} }
		MethodNode mn = method(Opcodes.ACC_PUBLIC, "<init>", "(Z)V");
		LabelNode join = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(new VarInsnNode(Opcodes.ALOAD, 0));
		insns.add(new MethodInsnNode(Opcodes.INVOKESPECIAL, "java/lang/Object", "<init>", "()V", false));
		insns.add(new VarInsnNode(Opcodes.ILOAD, 1));
		insns.add(new JumpInsnNode(Opcodes.IFEQ, join));
		insns.add(new InsnNode(Opcodes.NOP));
		insns.add(join);
		insns.add(new InsnNode(Opcodes.RETURN));
		ComputedFrames computed = computer.compute(mn);
		assertEquals(ImmutableList.of(VerificationType.UNINITIALIZED_THIS, VerificationType.INTEGER), computed.getInitialLocals());
		assertEquals(ImmutableList.of(VerificationType.object("test/Owner"), VerificationType.INTEGER),
				computed.getFrame(2).getLocals());
	}

	/**
	 * static Object m(boolean b) { return new StringBuilder(b ? "a" : "b"); }
	 */
	private static MethodNode newAcrossBranch() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "(Z)Ljava/lang/Object;");
		LabelNode elseLabel = new LabelNode(), join = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(new TypeInsnNode(Opcodes.NEW, "java/lang/StringBuilder"));
		insns.add(new InsnNode(Opcodes.DUP));
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new JumpInsnNode(Opcodes.IFEQ, elseLabel));
		insns.add(new LdcInsnNode("a"));
		insns.add(new JumpInsnNode(Opcodes.GOTO, join));
		insns.add(elseLabel);
		insns.add(new LdcInsnNode("b"));
		insns.add(join);
		insns.add(new MethodInsnNode(Opcodes.INVOKESPECIAL, "java/lang/StringBuilder", "<init>", "(Ljava/lang/String;)V", false));
		insns.add(new InsnNode(Opcodes.ARETURN));
		return mn;
	}

	@Test
	public void testUninitializedAcrossBranch() {
		MethodNode mn = newAcrossBranch();
		AbstractInsnNode newInsn = mn.instructions.getFirst();
		ComputedFrames computed = computer.compute(mn);
		StackMapFrame joinFrame = computed.getFrame(3);
		assertEquals(3, joinFrame.getStack().size());
		VerificationType uninitialized = joinFrame.getStack().get(0);
		assertEquals(VerificationType.Tag.UNINITIALIZED, uninitialized.getTag());
		assertEquals("java/lang/StringBuilder", uninitialized.getClassName());
		assertEquals(uninitialized, joinFrame.getStack().get(1));
		assertEquals(STRING, joinFrame.getStack().get(2));
		assertEquals(3, computed.getMaxStack());

		//the NEW had no label, so one is inserted before it
		LabelNode newLabel = uninitialized.getLabel().getLabelNode();
		assertEquals(newInsn, computed.getControlFlowGraph().pendingLabels().get(newLabel));
		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.defaults());
		assertSame(newLabel, newInsn.getPrevious());
	}

	@Test
	public void testDeadCodeIsRewritten() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode target = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(new JumpInsnNode(Opcodes.GOTO, target));
		insns.add(new InsnNode(Opcodes.ICONST_0));
		insns.add(new InsnNode(Opcodes.POP));
		insns.add(target);
		insns.add(new InsnNode(Opcodes.RETURN));
		ComputedFrames computed = computer.compute(mn);
		assertEquals(ImmutableSortedSet.of(1), computed.unreachableBlocks());
		StackMapFrame dead = computed.getFrame(1);
		assertFalse(dead.isReachable());
		assertEquals(ImmutableList.of(), dead.getLocals());
		assertEquals(ImmutableList.of(VerificationType.object("java/lang/Throwable")), dead.getStack());

		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.defaults());
		//GOTO, frame, ATHROW, label, frame, RETURN
		assertEquals(6, mn.instructions.size());
		assertEquals(Opcodes.ATHROW, mn.instructions.get(2).getOpcode());
		assertTrue(mn.instructions.get(1) instanceof FrameNode);
		assertEquals(1, mn.maxStack);
	}

	@Test
	public void testDeadCodeRemovedFromHandlerRange() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode start = new LabelNode(), end = new LabelNode(), handler = new LabelNode(), after = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(start);
		insns.add(new MethodInsnNode(Opcodes.INVOKESTATIC, "test/Owner", "bar", "()V", false));
		insns.add(new JumpInsnNode(Opcodes.GOTO, after));
		insns.add(new MethodInsnNode(Opcodes.INVOKESTATIC, "test/Owner", "bar", "()V", false));
		insns.add(end);
		insns.add(after);
		insns.add(new InsnNode(Opcodes.RETURN));
		insns.add(handler);
		insns.add(new InsnNode(Opcodes.ATHROW));
		mn.tryCatchBlocks.add(new TryCatchBlockNode(start, end, handler, null));

		ComputedFrames computed = computer.compute(mn);
		assertEquals(ImmutableSortedSet.of(1), computed.unreachableBlocks());
		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.defaults());
		assertEquals(1, mn.tryCatchBlocks.size());
		TryCatchBlockNode tcb = mn.tryCatchBlocks.get(0);
		assertSame(start, tcb.start);
		assertNotSame(end, tcb.end);
		//the new end is right before the dead block
		int endIndex = mn.instructions.indexOf(tcb.end);
		assertEquals(Opcodes.GOTO, mn.instructions.get(endIndex - 1).getOpcode());
	}

	@Test
	public void testDeadCodeKeptWhenNotRewriting() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode target = new LabelNode();
		mn.instructions.add(new JumpInsnNode(Opcodes.GOTO, target));
		mn.instructions.add(new InsnNode(Opcodes.NOP));
		mn.instructions.add(target);
		mn.instructions.add(new InsnNode(Opcodes.RETURN));
		ComputedFrames computed = computer.compute(mn);
		FrameNodeEmitter.emit(mn, computed, AnalysisOptions.builder().rewriteDeadCode(false).build());
		assertEquals(Opcodes.NOP, mn.instructions.get(2).getOpcode());
	}

	@Test
	public void testLoopReachesFixedPoint() {
		//static int sum(int n) { int s = 0; while (n > 0) { s += n; n--; } return s; }
		MethodNode mn = method(Opcodes.ACC_STATIC, "sum", "(I)I");
		LabelNode head = new LabelNode(), exit = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(new InsnNode(Opcodes.ICONST_0));
		insns.add(new VarInsnNode(Opcodes.ISTORE, 1));
		insns.add(head);
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new JumpInsnNode(Opcodes.IFLE, exit));
		insns.add(new VarInsnNode(Opcodes.ILOAD, 1));
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new InsnNode(Opcodes.IADD));
		insns.add(new VarInsnNode(Opcodes.ISTORE, 1));
		insns.add(new IincInsnNode(0, -1));
		insns.add(new JumpInsnNode(Opcodes.GOTO, head));
		insns.add(exit);
		insns.add(new VarInsnNode(Opcodes.ILOAD, 1));
		insns.add(new InsnNode(Opcodes.IRETURN));
		ComputedFrames computed = computer.compute(mn);
		assertEquals(ImmutableList.of(VerificationType.INTEGER, VerificationType.INTEGER), computed.getFrame(1).getLocals());
		assertEquals(ImmutableList.of(VerificationType.INTEGER, VerificationType.INTEGER), computed.getFrame(3).getLocals());
		assertEquals(2, computed.getMaxStack());
	}

	@Test
	public void testJsrIsRejected() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		LabelNode sub = new LabelNode();
		mn.instructions.add(new InsnNode(Opcodes.NOP));
		mn.instructions.add(new JumpInsnNode(Opcodes.JSR, sub));
		mn.instructions.add(new InsnNode(Opcodes.RETURN));
		mn.instructions.add(sub);
		mn.instructions.add(new VarInsnNode(Opcodes.ASTORE, 0));
		mn.instructions.add(new VarInsnNode(Opcodes.RET, 0));
		try {
			computer.compute(mn);
			fail("JSR accepted");
		} catch (AnalysisException ex) {
			assertEquals(1, ex.getInstructionIndex());
		}
	}

	@Test
	public void testBadDescriptorReportsInstruction() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		mn.instructions.add(new InsnNode(Opcodes.NOP));
		mn.instructions.add(new MethodInsnNode(Opcodes.INVOKESTATIC, "test/Owner", "bar", "()Q", false));
		mn.instructions.add(new InsnNode(Opcodes.RETURN));
		try {
			computer.compute(mn);
			fail("bad descriptor accepted");
		} catch (AnalysisException ex) {
			assertEquals(1, ex.getInstructionIndex());
			assertTrue(ex.getCause() instanceof IllegalArgumentException);
		}
	}

	@Test
	public void testStackHeightMismatchReportsBlock() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "(I)V");
		LabelNode join = new LabelNode();
		mn.instructions.add(new VarInsnNode(Opcodes.ILOAD, 0));
		mn.instructions.add(new JumpInsnNode(Opcodes.IFEQ, join));
		mn.instructions.add(new InsnNode(Opcodes.ICONST_1));
		mn.instructions.add(join);
		mn.instructions.add(new InsnNode(Opcodes.RETURN));
		try {
			computer.compute(mn);
			fail("stack height mismatch accepted");
		} catch (AnalysisException ex) {
			assertEquals(1, ex.getBlockId());
		}
	}

	@Test(expected = AnalysisException.class)
	public void testFallingOffTheEnd() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		mn.instructions.add(new InsnNode(Opcodes.NOP));
		computer.compute(mn);
	}

	@Test
	public void testSeededEntryFrame() {
		MethodNode mn = method(Opcodes.ACC_STATIC, "m", "()V");
		mn.instructions.add(new InsnNode(Opcodes.POP));
		mn.instructions.add(new InsnNode(Opcodes.RETURN));
		ComputedFrames computed = computer.compute(mn, ImmutableList.of(VerificationType.LONG), ImmutableList.of(STRING));
		assertEquals(ImmutableList.of(VerificationType.LONG), computed.getInitialLocals());
		assertEquals(ImmutableList.of(STRING), computed.getInitialStack());
		assertEquals(2, computed.getMaxLocals());
		assertEquals(1, computed.getMaxStack());
	}

	@Test
	public void testOffsetsBindLabels() {
		MethodNode mn = diamond();
		AnalysisOptions options = AnalysisOptions.builder()
				.offsets(insn -> mn.instructions.indexOf(insn))
				.build();
		ComputedFrames computed = new FrameComputer(symbolTable, options).compute(mn);
		Label joinLabel = computed.getFrame(3).getLabel();
		assertTrue(joinLabel.isBound());
		assertEquals(8, joinLabel.getOffset());
	}

	@Test
	public void testOffsetsBindNewSiteLabels() {
		MethodNode mn = newAcrossBranch();
		AbstractInsnNode newInsn = mn.instructions.getFirst();
		AnalysisOptions options = AnalysisOptions.builder()
				.offsets(insn -> mn.instructions.indexOf(insn))
				.build();
		ComputedFrames computed = new FrameComputer(symbolTable, options).compute(mn);
		VerificationType uninitialized = computed.getFrame(3).getStack().get(0);
		assertTrue(uninitialized.getLabel().isBound());
		assertEquals(0, uninitialized.getOffset());
		//the label is created for the NEW, which has no label of its own
		assertSame(newInsn, computed.getControlFlowGraph().pendingLabels().get(uninitialized.getLabel().getLabelNode()));
		int type = symbolTable.addForwardUninitializedType("java/lang/StringBuilder", uninitialized.getLabel());
		assertEquals(0, symbolTable.getUninitializedOffset(type));
	}

	@Test
	public void testDump() {
		ComputedFrames computed = computer.compute(diamond());
		StringWriter out = new StringWriter();
		computed.dump(new PrintWriter(out));
		computed.getControlFlowGraph().dump(new PrintWriter(out));
		assertTrue(out.toString(), out.toString().contains("pick(Z)Ljava/lang/Object;"));
		assertTrue(out.toString(), out.toString().contains("java/lang/String"));
	}
}
