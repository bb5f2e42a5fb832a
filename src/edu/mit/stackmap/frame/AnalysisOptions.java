package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import java.io.StringReader;
import java.util.function.ToIntFunction;
import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonObject;
import javax.json.JsonReader;
import org.objectweb.asm.tree.AbstractInsnNode;

/**
 * Options controlling frame computation and emission.
 *
 * Instances of this class are immutable.  This class uses the builder
 * pattern; get a builder by calling {@link #builder()}, set options on it,
 * then call its build() method.  The serializable options (everything except
 * the resolver and the offsets function) round-trip through JSON with
 * {@link #toJson()} and {@link #fromJson(String)}.
 * @since 10/13/2026
 */
public final class AnalysisOptions {
	private static final AnalysisOptions DEFAULTS = builder().build();
	private final boolean rewriteDeadCode;
	private final FramePlacement framePlacement;
	private final CommonSuperClassResolver resolver;
	private final ToIntFunction<AbstractInsnNode> offsets;
	private AnalysisOptions(boolean rewriteDeadCode, FramePlacement framePlacement, CommonSuperClassResolver resolver, ToIntFunction<AbstractInsnNode> offsets) {
		//only called by the builder
		assert framePlacement != null;
		assert resolver != null;
		this.rewriteDeadCode = rewriteDeadCode;
		this.framePlacement = framePlacement;
		this.resolver = resolver;
		this.offsets = offsets;
	}

	public static final class Builder {
		private boolean rewriteDeadCode = true;
		private FramePlacement framePlacement = FramePlacement.JUMP_TARGETS;
		private CommonSuperClassResolver resolver = CommonSuperClassResolver.ROOT_OBJECT;
		private ToIntFunction<AbstractInsnNode> offsets;
		private Builder() {}

		/**
		 * Sets whether unreachable code is replaced by ATHROW and removed from
		 * exception handler ranges when frames are emitted.  Default true.
		 * @param rewriteDeadCode whether to rewrite dead code
		 * @return this
		 */
		public Builder rewriteDeadCode(boolean rewriteDeadCode) {
			this.rewriteDeadCode = rewriteDeadCode;
			return this;
		}

		public Builder framePlacement(FramePlacement framePlacement) {
			this.framePlacement = checkNotNull(framePlacement);
			return this;
		}

		public Builder commonSuperClassResolver(CommonSuperClassResolver resolver) {
			this.resolver = checkNotNull(resolver);
			return this;
		}

		/**
		 * Sets a function giving the bytecode offset of each instruction.  When
		 * set, labels are bound to offsets during analysis.  Default unset.
		 * @param offsets the offsets function, or null to unset
		 * @return this
		 */
		public Builder offsets(ToIntFunction<AbstractInsnNode> offsets) {
			this.offsets = offsets;
			return this;
		}

		public AnalysisOptions build() {
			return new AnalysisOptions(rewriteDeadCode, framePlacement, resolver, offsets);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a builder initialized with the given options.
	 * @param options the options to copy
	 * @return a new builder
	 */
	public static Builder builder(AnalysisOptions options) {
		return builder()
				.rewriteDeadCode(options.rewriteDeadCode)
				.framePlacement(options.framePlacement)
				.commonSuperClassResolver(options.resolver)
				.offsets(options.offsets);
	}

	public static AnalysisOptions defaults() {
		return DEFAULTS;
	}

	public boolean rewriteDeadCode() {
		return rewriteDeadCode;
	}

	public FramePlacement getFramePlacement() {
		return framePlacement;
	}

	public CommonSuperClassResolver getCommonSuperClassResolver() {
		return resolver;
	}

	/**
	 * Returns the offsets function, or null if none was set.
	 * @return the offsets function, or null
	 */
	public ToIntFunction<AbstractInsnNode> getOffsets() {
		return offsets;
	}

	/**
	 * Parses options from JSON.  Missing keys take their default values; the
	 * resolver and offsets function are always the defaults.
	 * @param json a JSON object as produced by {@link #toJson()}
	 * @return the parsed options
	 * @throws IllegalArgumentException if the JSON is malformed, holds a
	 * value of the wrong type or names an unknown frame placement
	 */
	public static AnalysisOptions fromJson(String json) {
		Builder builder = builder();
		try (JsonReader reader = Json.createReader(new StringReader(json))) {
			JsonObject obj = reader.readObject();
			if (obj.containsKey("rewriteDeadCode"))
				builder.rewriteDeadCode(obj.getBoolean("rewriteDeadCode"));
			if (obj.containsKey("framePlacement"))
				builder.framePlacement(FramePlacement.valueOf(obj.getString("framePlacement")));
		} catch (JsonException | ClassCastException ex) {
			throw new IllegalArgumentException("bad options JSON: " + json, ex);
		}
		return builder.build();
	}

	public String toJson() {
		return Json.createObjectBuilder()
				.add("rewriteDeadCode", rewriteDeadCode)
				.add("framePlacement", framePlacement.name())
				.build().toString();
	}

	@Override
	public String toString() {
		return String.format("AnalysisOptions{rewriteDeadCode=%s, framePlacement=%s, resolver=%s, offsets=%s}",
				rewriteDeadCode, framePlacement, resolver, offsets != null ? "set" : "unset");
	}
}
