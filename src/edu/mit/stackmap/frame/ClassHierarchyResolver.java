package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;

/**
 * Resolves common super classes by loading both classes (without initializing
 * them) through a ClassLoader and walking the first one's superclass chain.
 * Interfaces merge to java/lang/Object.
 *
 * The loader must be able to see every class whose type is merged, so this
 * resolver can't be used while the class being analyzed is itself being
 * defined by that loader.
 * @since 10/19/2026
 */
public final class ClassHierarchyResolver implements CommonSuperClassResolver {
	private final ClassLoader loader;
	public ClassHierarchyResolver(ClassLoader loader) {
		this.loader = checkNotNull(loader);
	}

	@Override
	public String getCommonSuperClass(String type1, String type2) {
		Class<?> class1 = load(type1), class2 = load(type2);
		if (class1.isAssignableFrom(class2))
			return type1;
		if (class2.isAssignableFrom(class1))
			return type2;
		if (class1.isInterface() || class2.isInterface())
			return "java/lang/Object";
		do
			class1 = class1.getSuperclass();
		while (!class1.isAssignableFrom(class2));
		return class1.getName().replace('.', '/');
	}

	private Class<?> load(String internalName) {
		try {
			return Class.forName(internalName.replace('/', '.'), false, loader);
		} catch (ClassNotFoundException ex) {
			throw new TypeNotPresentException(internalName, ex);
		}
	}

	@Override
	public String toString() {
		return "ClassHierarchyResolver(" + loader + ")";
	}
}
