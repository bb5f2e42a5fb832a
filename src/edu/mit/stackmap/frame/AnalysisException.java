package edu.mit.stackmap.frame;

/**
 * Thrown when frames cannot be computed for a method because its code is
 * unsupported or malformed.  Carries the index of the offending instruction
 * (in the method's instruction list) or the id of the offending block, where
 * known.
 * @since 10/7/2026
 */
public final class AnalysisException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final int instructionIndex;
	private final int blockId;
	private AnalysisException(String message, Throwable cause, int instructionIndex, int blockId) {
		super(message, cause);
		this.instructionIndex = instructionIndex;
		this.blockId = blockId;
	}

	public static AnalysisException atInstruction(int instructionIndex, String message, Throwable cause) {
		return new AnalysisException(message, cause, instructionIndex, -1);
	}

	public static AnalysisException atInstruction(int instructionIndex, String message) {
		return atInstruction(instructionIndex, message, null);
	}

	public static AnalysisException inBlock(int blockId, String message, Throwable cause) {
		return new AnalysisException(message, cause, -1, blockId);
	}

	/**
	 * Returns the index of the offending instruction, or -1 if unknown.
	 * @return the instruction index, or -1
	 */
	public int getInstructionIndex() {
		return instructionIndex;
	}

	/**
	 * Returns the id of the offending block, or -1 if unknown.
	 * @return the block id, or -1
	 */
	public int getBlockId() {
		return blockId;
	}

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		if (instructionIndex >= 0)
			return msg + " (at instruction " + instructionIndex + ")";
		if (blockId >= 0)
			return msg + " (in block " + blockId + ")";
		return msg;
	}
}
