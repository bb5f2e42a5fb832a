package edu.mit.stackmap.frame;

/**
 * Where explicit frames are emitted.  Unreachable blocks always get a frame.
 * @since 10/13/2026
 */
public enum FramePlacement {
	/**
	 * At the start of every block that is the target of a jump, a switch or an
	 * exception handler, as the class file format requires.
	 */
	JUMP_TARGETS {
		@Override
		boolean needsFrame(StackMapFrame frame) {
			return frame.isJumpTarget() || !frame.isReachable();
		}
	},
	/**
	 * At the start of every block except the entry block (whose frame is
	 * implicit unless it is also a jump target).
	 */
	ALL_BLOCKS {
		@Override
		boolean needsFrame(StackMapFrame frame) {
			return frame.getBlockId() != 0 || frame.isJumpTarget();
		}
	};

	abstract boolean needsFrame(StackMapFrame frame);
}
