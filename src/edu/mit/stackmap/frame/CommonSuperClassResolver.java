package edu.mit.stackmap.frame;

/**
 * Computes the common super class of two reference types, for merging frames
 * that hold different reference types in the same slot.
 *
 * The default, {@link #ROOT_OBJECT}, needs no class hierarchy information and
 * always answers java/lang/Object.  This is conservative: it may lose type
 * information later code depends on (e.g. calling a method of a shared
 * superclass), but never claims a type more specific than the truth.
 * @since 9/29/2026
 */
public interface CommonSuperClassResolver {
	/**
	 * Returns the internal name of a common super class of the two given
	 * types.
	 * @param type1 the internal name of a class or array type
	 * @param type2 the internal name of a class or array type
	 * @return the internal name of a common super class of type1 and type2
	 */
	public String getCommonSuperClass(String type1, String type2);

	public static final CommonSuperClassResolver ROOT_OBJECT = new CommonSuperClassResolver() {
		@Override
		public String getCommonSuperClass(String type1, String type2) {
			return "java/lang/Object";
		}
		@Override
		public String toString() {
			return "ROOT_OBJECT";
		}
	};
}
