package edu.mit.stackmap.frame;

import static org.junit.Assert.*;
import edu.mit.stackmap.util.ClassNodeClassLoader;
import edu.mit.stackmap.util.MethodNodeBuilder;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import org.junit.BeforeClass;
import org.junit.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FrameNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * Recomputes frames for whole classes and loads the result, so the JVM's
 * verifier checks the frames and maxs.
 * @since 10/16/2026
 */
public class StackMapsTest {
	private static Class<?> recomputed;

	@BeforeClass
	public static void recomputeFixture() throws Exception {
		ClassNode classNode = MethodNodeBuilder.buildClassNode(FrameFixture.class);
		for (MethodNode methodNode : classNode.methods) {
			methodNode.maxStack = 0;
			methodNode.maxLocals = 0;
		}
		AnalysisOptions options = AnalysisOptions.builder()
				.commonSuperClassResolver(new ClassHierarchyResolver(FrameFixture.class.getClassLoader()))
				.build();
		StackMaps.recompute(classNode, options);
		ClassNodeClassLoader loader = new ClassNodeClassLoader(FrameFixture.class.getClassLoader(), classNode);
		recomputed = loader.loadClass(FrameFixture.class.getName());
		assertSame(loader, recomputed.getClassLoader());
	}

	private static Object call(String name, Class<?>[] parameterTypes, Object... args) throws Exception {
		Method method = recomputed.getMethod(name, parameterTypes);
		return method.invoke(null, args);
	}

	@Test
	public void testConstructors() throws Exception {
		Constructor<?> fromBoolean = recomputed.getConstructor(boolean.class);
		Object big = fromBoolean.newInstance(true), small = fromBoolean.newInstance(false);
		Method getValue = recomputed.getMethod("getValue");
		assertEquals(100, getValue.invoke(big));
		assertEquals(1, getValue.invoke(small));
		Method scaled = recomputed.getMethod("scaled", int.class);
		assertEquals(new FrameFixture(true).scaled(3), scaled.invoke(big, 3));
	}

	@Test
	public void testLoopsAndSwitches() throws Exception {
		int[] values = {3, 1, 4, 1, 5, 9, 2, 6};
		assertEquals(FrameFixture.sum(values), call("sum", new Class<?>[]{int[].class}, (Object)values));
		for (int x : new int[]{-5, 0, 1, 2, 7, 1000})
			assertEquals(FrameFixture.classify(x), call("classify", new Class<?>[]{int.class}, x));
		for (int x = 0; x < 6; ++x)
			assertEquals(FrameFixture.dense(x), call("dense", new Class<?>[]{int.class}, x));
		assertEquals(FrameFixture.grid(5), call("grid", new Class<?>[]{int.class}, 5));
		assertEquals(FrameFixture.search(values, 15), call("search", new Class<?>[]{int[].class, int.class}, values, 15));
		assertEquals(-1, call("search", new Class<?>[]{int[].class, int.class}, values, 100));
	}

	@Test
	public void testWideLocals() throws Exception {
		assertEquals(FrameFixture.wide(10L, 3.5, 6), call("wide", new Class<?>[]{long.class, double.class, int.class}, 10L, 3.5, 6));
		assertEquals(FrameFixture.mixed(4), call("mixed", new Class<?>[]{int.class}, 4));
		assertEquals(FrameFixture.mixed(-3), call("mixed", new Class<?>[]{int.class}, -3));
	}

	@Test
	public void testExceptionHandlers() throws Exception {
		assertEquals(42, call("parse", new Class<?>[]{String.class}, "42"));
		assertEquals(-1, call("parse", new Class<?>[]{String.class}, "forty-two"));
		assertEquals(2, call("finallyCount", new Class<?>[0]));
		assertEquals(8, call("locked", new Class<?>[]{Object.class, int.class}, new Object(), 4));
		try {
			call("locked", new Class<?>[]{Object.class, int.class}, new Object(), -4);
			fail("expected an exception");
		} catch (java.lang.reflect.InvocationTargetException ex) {
			assertTrue(ex.getCause() instanceof IllegalArgumentException);
		}
	}

	@Test
	public void testUninitializedAndMergedTypes() throws Exception {
		assertEquals(FrameFixture.build(true, 4), call("build", new Class<?>[]{boolean.class, int.class}, true, 4));
		assertEquals(FrameFixture.build(false, 0), call("build", new Class<?>[]{boolean.class, int.class}, false, 0));
		assertEquals(FrameFixture.concat("x", 3, 4L), call("concat", new Class<?>[]{String.class, int.class, long.class}, "x", 3, 4L));
		assertEquals(7.0, call("widen", new Class<?>[]{boolean.class}, true));
		assertEquals(2.5, call("widen", new Class<?>[]{boolean.class}, false));
		assertEquals(3, call("length", new Class<?>[]{Object.class}, "abc"));
		assertEquals(2, call("length", new Class<?>[]{Object.class}, (Object)new int[2]));
		assertEquals(-1, call("length", new Class<?>[]{Object.class}, 5));
	}

	/**
	 * static int m(int x) {
	 *   try { if (x == 0) return 0; return x; <dead: iconst_5; ireturn> }
	 *   catch (Throwable t) { return -1; }
	 * }
	 */
	private static ClassNode generatedWithDeadCode() {
		ClassNode classNode = new ClassNode(Opcodes.ASM9);
		classNode.version = Opcodes.V1_8;
		classNode.access = Opcodes.ACC_PUBLIC | Opcodes.ACC_SUPER;
		classNode.name = "edu/mit/stackmap/generated/DeadCode";
		classNode.superName = "java/lang/Object";
		MethodNode mn = new MethodNode(Opcodes.ASM9, Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC, "m", "(I)I", null, null);
		LabelNode start = new LabelNode(), zero = new LabelNode(), end = new LabelNode(), handler = new LabelNode();
		InsnList insns = mn.instructions;
		insns.add(start);
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new JumpInsnNode(Opcodes.IFEQ, zero));
		insns.add(new VarInsnNode(Opcodes.ILOAD, 0));
		insns.add(new InsnNode(Opcodes.IRETURN));
		insns.add(new InsnNode(Opcodes.ICONST_5));
		insns.add(new InsnNode(Opcodes.IRETURN));
		insns.add(zero);
		insns.add(new InsnNode(Opcodes.ICONST_0));
		insns.add(new InsnNode(Opcodes.IRETURN));
		insns.add(end);
		insns.add(handler);
		insns.add(new InsnNode(Opcodes.POP));
		insns.add(new InsnNode(Opcodes.ICONST_M1));
		insns.add(new InsnNode(Opcodes.IRETURN));
		mn.tryCatchBlocks.add(new TryCatchBlockNode(start, end, handler, "java/lang/Throwable"));
		classNode.methods.add(mn);
		return classNode;
	}

	@Test
	public void testDeadCodeIsVerifiable() throws Exception {
		ClassNode classNode = generatedWithDeadCode();
		MethodNode mn = classNode.methods.get(0);
		ComputedFrames computed = StackMaps.recompute(classNode.name, mn, AnalysisOptions.defaults());
		assertEquals(1, computed.unreachableBlocks().size());

		int athrows = 0, frames = 0;
		for (AbstractInsnNode insn = mn.instructions.getFirst(); insn != null; insn = insn.getNext()) {
			if (insn.getOpcode() == Opcodes.ATHROW)
				++athrows;
			if (insn instanceof FrameNode)
				++frames;
			assertNotEquals(Opcodes.ICONST_5, insn.getOpcode());
		}
		assertEquals(1, athrows);
		//the dead block, the jump target and the handler
		assertEquals(3, frames);
		//the dead block is no longer protected
		assertEquals(2, mn.tryCatchBlocks.size());

		Class<?> klass = new ClassNodeClassLoader(getClass().getClassLoader(), classNode).loadClass("edu.mit.stackmap.generated.DeadCode");
		Method m = klass.getMethod("m", int.class);
		assertEquals(0, m.invoke(null, 0));
		assertEquals(9, m.invoke(null, 9));
	}

	@Test
	public void testGeneratedClassBytesAreCached() {
		ClassNode classNode = generatedWithDeadCode();
		StackMaps.recompute(classNode);
		ClassNodeClassLoader loader = new ClassNodeClassLoader(classNode);
		byte[] bytes = loader.getClassBytes("edu.mit.stackmap.generated.DeadCode");
		assertSame(bytes, loader.getClassBytes("edu.mit.stackmap.generated.DeadCode"));
		assertTrue(bytes.length > 0);
	}
}
