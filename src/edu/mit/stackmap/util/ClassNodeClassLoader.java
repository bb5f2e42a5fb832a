package edu.mit.stackmap.util;

import static com.google.common.base.Preconditions.*;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.tree.ClassNode;

/**
 * A ClassNodeClassLoader loads classes from ClassNodes, writing them with a
 * ClassWriter that neither computes frames nor maxs, so the frames and maxs
 * already in the nodes are what the JVM verifies.
 *
 * Classes with a ClassNode are loaded by this loader even if the parent loader
 * can load a class of the same name.
 * @since 10/15/2026
 */
public final class ClassNodeClassLoader extends ClassLoader {
	private final ImmutableMap<String, ClassNode> classNodes;
	private final Map<String, byte[]> classBytes = new HashMap<>();
	/**
	 * Creates a new ClassNodeClassLoader that will load the given classes
	 * itself and delegate others to the current thread's context class loader.
	 * @param classNodes the classes to load
	 */
	public ClassNodeClassLoader(ClassNode... classNodes) {
		this(Thread.currentThread().getContextClassLoader(), classNodes);
	}

	public ClassNodeClassLoader(ClassLoader parent, ClassNode... classNodes) {
		super(parent);
		ImmutableMap.Builder<String, ClassNode> builder = ImmutableMap.builder();
		for (ClassNode cn : classNodes)
			builder.put(cn.name.replace('/', '.'), cn);
		this.classNodes = builder.build();
	}

	/**
	 * Writes the given class to a class file without computing frames or
	 * maxs.
	 * @param classNode the class to write
	 * @return the class file bytes
	 */
	public static byte[] write(ClassNode classNode) {
		ClassWriter cw = new ClassWriter(0);
		classNode.accept(cw);
		return cw.toByteArray();
	}

	/**
	 * Returns the bytes this loader defined (or would define) the given class
	 * from.
	 * @param name the binary name of a class given to this loader
	 * @return the class file bytes
	 */
	public synchronized byte[] getClassBytes(String name) {
		ClassNode classNode = classNodes.get(name);
		checkArgument(classNode != null, "not loaded by this loader: %s", name);
		byte[] bytes = classBytes.get(name);
		if (bytes == null) {
			bytes = write(classNode);
			classBytes.put(name, bytes);
		}
		return bytes;
	}

	@Override
	protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
		if (!classNodes.containsKey(name))
			return super.loadClass(name, resolve);
		synchronized (getClassLoadingLock(name)) {
			Class<?> klass = findLoadedClass(name);
			if (klass == null)
				klass = findClass(name);
			if (resolve)
				resolveClass(klass);
			return klass;
		}
	}

	@Override
	protected Class<?> findClass(String name) throws ClassNotFoundException {
		if (!classNodes.containsKey(name))
			throw new ClassNotFoundException(name);
		byte[] bytes = getClassBytes(name);
		return defineClass(name, bytes, 0, bytes.length);
	}
}
