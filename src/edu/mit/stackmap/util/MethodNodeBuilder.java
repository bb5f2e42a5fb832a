package edu.mit.stackmap.util;

import java.io.IOException;
import java.io.InputStream;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

/**
 * Builds ClassNodes and MethodNodes without stack map frames, ready to have
 * their frames recomputed.
 */
public final class MethodNodeBuilder {
	private MethodNodeBuilder() {}

	/**
	 * Reads the given class's class file (through the class's own loader)
	 * into a ClassNode, dropping its stack map frames.
	 * @param klass the class to read
	 * @return a ClassNode for the class, without frames
	 * @throws IOException if the class file can't be read
	 */
	public static ClassNode buildClassNode(Class<?> klass) throws IOException {
		ClassLoader loader = klass.getClassLoader() != null ? klass.getClassLoader() : ClassLoader.getSystemClassLoader();
		String resource = klass.getName().replace('.', '/') + ".class";
		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null)
				throw new IOException("can't find class file " + resource);
			return read(new ClassReader(in));
		}
	}

	/**
	 * Reads the named class's class file from the system class path into a
	 * ClassNode, dropping its stack map frames.
	 * @param className the binary name of the class
	 * @return a ClassNode for the class, without frames
	 * @throws IOException if the class file can't be read
	 */
	public static ClassNode buildClassNode(String className) throws IOException {
		return read(new ClassReader(className));
	}

	private static ClassNode read(ClassReader reader) {
		ClassNode classNode = new ClassNode(Opcodes.ASM9);
		reader.accept(classNode, ClassReader.SKIP_FRAMES);
		return classNode;
	}

	/**
	 * Builds a MethodNode for the method with the given name and descriptor,
	 * dropping its stack map frames.
	 * @param klass the class declaring the method
	 * @param methodName the method's name
	 * @param methodDescriptor the method's descriptor
	 * @return a MethodNode for the method, without frames
	 * @throws IOException if the class file can't be read
	 * @throws NoSuchMethodException if the class has no such method
	 */
	public static MethodNode buildMethodNode(Class<?> klass, String methodName, String methodDescriptor) throws IOException, NoSuchMethodException {
		for (MethodNode methodNode : buildClassNode(klass).methods)
			if (methodNode.name.equals(methodName) && methodNode.desc.equals(methodDescriptor))
				return methodNode;
		throw new NoSuchMethodException(klass.getName() + "#" + methodName + methodDescriptor);
	}
}
