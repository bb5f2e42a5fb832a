package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import static edu.mit.stackmap.frame.AbstractTypes.*;
import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * The input and output frames of a basic block.
 *
 * The input frame holds the types of the local variables and stack operands
 * at the start of the block.  It is unknown while the block is simulated and
 * is filled in by merges from predecessor blocks during the fixed-point
 * iteration, so it only contains resolved types.
 *
 * The output frame holds the types at the end of the block, computed by
 * simulating the block's instructions once.  Since the input frame is not
 * known at that time, output types may be relative to it (LOCAL and STACK
 * kinds).  The output stack is relative too: {@code outputStackStart} is the
 * (non-positive) number of input stack elements popped by the block, and
 * {@code outputStack[0..outputStackTop)} are the elements pushed on top of
 * what remains.
 * @since October 2, 2026
 */
public final class Frame {
	/**
	 * The id of the basic block this frame belongs to.
	 */
	private final int owner;
	private int[] inputLocals;
	private int[] inputStack;
	private int[] outputLocals;
	private int[] outputStack;
	private int outputStackStart;
	private int outputStackTop;
	/**
	 * The maximum relative stack size reached in the block (relative to the
	 * input stack size, so it can be negative before any push).
	 */
	private int outputStackMax;
	/**
	 * The types on which a constructor is invoked in the block.  Every
	 * occurrence of one of these types in the output frame is initialized at
	 * the end of the block.
	 */
	private int[] initializations;
	private int initializationCount;

	public Frame(int owner) {
		this.owner = owner;
	}

	public int getOwner() {
		return owner;
	}

	/**
	 * Returns true if the input frame has been set, either from the method
	 * descriptor or by a merge from a predecessor.
	 * @return true iff the input frame is set
	 */
	public boolean hasInputFrame() {
		return inputLocals != null && inputStack != null;
	}

	public int getInputStackSize() {
		return inputStack.length;
	}

	public int getOutputStackMax() {
		return outputStackMax;
	}

	// ------------------------------------------------------------------
	// Input frame initialization
	// ------------------------------------------------------------------

	/**
	 * Sets the input frame to the implicit first frame of a method with the
	 * given access flags and descriptor.
	 * @param symbolTable the symbol table to add types to
	 * @param access the method's access flags
	 * @param methodName the method's name (to recognize constructors)
	 * @param descriptor the method's descriptor
	 * @param maxLocals the number of local variable slots
	 */
	public void setInputFrameFromDescriptor(SymbolTable symbolTable, int access, String methodName, String descriptor, int maxLocals) {
		inputLocals = new int[maxLocals];
		inputStack = new int[0];
		int index = 0;
		if ((access & Opcodes.ACC_STATIC) == 0) {
			if (!methodName.equals("<init>"))
				inputLocals[index++] = REFERENCE_KIND | symbolTable.addType(symbolTable.getClassName());
			else
				inputLocals[index++] = UNINITIALIZED_THIS;
		}
		for (Type argumentType : Type.getArgumentTypes(descriptor)) {
			int abstractType = fromDescriptor(symbolTable, argumentType.getDescriptor(), 0);
			checkArgument(index + argumentType.getSize() <= maxLocals,
					"maxLocals %s too small for %s", maxLocals, descriptor);
			inputLocals[index++] = abstractType;
			if (isWide(abstractType))
				inputLocals[index++] = TOP;
		}
		while (index < maxLocals)
			inputLocals[index++] = TOP;
	}

	/**
	 * Sets the input frame from explicit verification types.  Long and double
	 * types are expanded to two slots; locals past the given ones are TOP.
	 * @param symbolTable the symbol table to add types to
	 * @param locals the local variable types
	 * @param stack the stack operand types
	 * @param maxLocals the number of local variable slots
	 */
	public void setInputFrameFromVerificationTypes(SymbolTable symbolTable, List<VerificationType> locals, List<VerificationType> stack, int maxLocals) {
		inputLocals = new int[maxLocals];
		int index = 0;
		for (VerificationType t : locals) {
			checkArgument(index + (t.isWide() ? 2 : 1) <= maxLocals, "too many locals for maxLocals %s: %s", maxLocals, locals);
			inputLocals[index++] = fromVerificationType(symbolTable, t);
			if (t.isWide())
				inputLocals[index++] = TOP;
		}
		while (index < maxLocals)
			inputLocals[index++] = TOP;

		int stackSlots = 0;
		for (VerificationType t : stack)
			stackSlots += t.isWide() ? 2 : 1;
		inputStack = new int[stackSlots];
		index = 0;
		for (VerificationType t : stack) {
			inputStack[index++] = fromVerificationType(symbolTable, t);
			if (t.isWide())
				inputStack[index++] = TOP;
		}
		outputStackTop = 0;
		initializationCount = 0;
	}

	// ------------------------------------------------------------------
	// Output frame
	// ------------------------------------------------------------------

	private int getLocal(int localIndex) {
		if (outputLocals == null || localIndex >= outputLocals.length)
			//never assigned in this block, so equal to its input value
			return LOCAL_KIND | localIndex;
		int abstractType = outputLocals[localIndex];
		if (abstractType == 0)
			abstractType = outputLocals[localIndex] = LOCAL_KIND | localIndex;
		return abstractType;
	}

	private void setLocal(int localIndex, int abstractType) {
		if (outputLocals == null)
			outputLocals = new int[10];
		if (localIndex >= outputLocals.length)
			outputLocals = Arrays.copyOf(outputLocals, Math.max(localIndex + 1, 2 * outputLocals.length));
		outputLocals[localIndex] = abstractType;
	}

	/**
	 * Stores a value in a local variable, invalidating the previous local if it
	 * held (or might hold) the first half of a wide value.
	 */
	private void storeLocal(int localIndex, int abstractType, boolean wide) {
		setLocal(localIndex, abstractType);
		if (wide)
			setLocal(localIndex + 1, TOP);
		if (localIndex > 0) {
			int previousLocalType = getLocal(localIndex - 1);
			if (isWide(previousLocalType))
				setLocal(localIndex - 1, TOP);
			else if (kind(previousLocalType) == LOCAL_KIND || kind(previousLocalType) == STACK_KIND)
				//not known yet; becomes TOP if it turns out to be wide
				setLocal(localIndex - 1, previousLocalType | TOP_IF_LONG_OR_DOUBLE_FLAG);
		}
	}

	private void push(int abstractType) {
		if (outputStack == null)
			outputStack = new int[10];
		if (outputStackTop >= outputStack.length)
			outputStack = Arrays.copyOf(outputStack, Math.max(outputStackTop + 1, 2 * outputStack.length));
		outputStack[outputStackTop++] = abstractType;
		int outputStackSize = outputStackStart + outputStackTop;
		if (outputStackSize > outputStackMax)
			outputStackMax = outputStackSize;
	}

	/**
	 * Pushes the type described by the given type descriptor, or the return
	 * type of the given method descriptor.  Pushes nothing for void.
	 */
	private void push(SymbolTable symbolTable, String descriptor) {
		int offset = descriptor.charAt(0) == '(' ? descriptor.indexOf(')') + 1 : 0;
		int abstractType = fromDescriptor(symbolTable, descriptor, offset);
		if (abstractType != 0) {
			push(abstractType);
			if (isWide(abstractType))
				push(TOP);
		}
	}

	private int pop() {
		if (outputStackTop > 0)
			return outputStack[--outputStackTop];
		//popping the input stack
		return STACK_KIND | -(--outputStackStart);
	}

	private void pop(int elements) {
		if (outputStackTop >= elements)
			outputStackTop -= elements;
		else {
			outputStackStart -= elements - outputStackTop;
			outputStackTop = 0;
		}
	}

	/**
	 * Pops the slots of the given type descriptor, or of the argument types of
	 * the given method descriptor.
	 */
	private void pop(String descriptor) {
		char c = descriptor.charAt(0);
		if (c == '(')
			pop((Type.getArgumentsAndReturnSizes(descriptor) >> 2) - 1);
		else if (c == 'J' || c == 'D')
			pop(2);
		else
			pop(1);
	}

	// ------------------------------------------------------------------
	// Uninitialized types
	// ------------------------------------------------------------------

	private void addInitializedType(int abstractType) {
		if (initializations == null)
			initializations = new int[2];
		if (initializationCount >= initializations.length)
			initializations = Arrays.copyOf(initializations, Math.max(initializationCount + 1, 2 * initializations.length));
		initializations[initializationCount++] = abstractType;
	}

	/**
	 * Returns the initialized type corresponding to the given type if a
	 * constructor is invoked on it in this block; otherwise returns the given
	 * type.
	 */
	private int getInitializedType(SymbolTable symbolTable, int abstractType) {
		if (abstractType != UNINITIALIZED_THIS
				&& (abstractType & (DIM_MASK | KIND_MASK)) != UNINITIALIZED_KIND
				&& (abstractType & (DIM_MASK | KIND_MASK)) != FORWARD_UNINITIALIZED_KIND)
			return abstractType;
		for (int i = 0; i < initializationCount; ++i) {
			int initializedType = initializations[i];
			int dim = initializedType & DIM_MASK;
			int kind = kind(initializedType);
			int value = value(initializedType);
			if (kind == LOCAL_KIND)
				initializedType = dim + inputLocals[value];
			else if (kind == STACK_KIND)
				initializedType = dim + inputStack[inputStack.length - value];
			if (abstractType == initializedType) {
				if (abstractType == UNINITIALIZED_THIS)
					return REFERENCE_KIND | symbolTable.addType(symbolTable.getClassName());
				return REFERENCE_KIND | symbolTable.addType(symbolTable.getType(value(abstractType)).getValue());
			}
		}
		return abstractType;
	}

	// ------------------------------------------------------------------
	// Instruction simulation
	// ------------------------------------------------------------------

	/**
	 * Simulates the given instruction on the output frame.
	 *
	 * The meaning of {@code arg} and {@code operand} depends on the opcode:
	 * <ul>
	 * <li>xLOAD, xSTORE, IINC, RET: arg is the local variable index;</li>
	 * <li>NEWARRAY: arg is the array type code ({@code Opcodes.T_INT}...);</li>
	 * <li>NEW: arg is the {@link SymbolTable} index of the uninitialized type
	 * created (from {@link SymbolTable#addUninitializedType} or
	 * {@link SymbolTable#addForwardUninitializedType});</li>
	 * <li>MULTIANEWARRAY: arg is the number of dimensions, operand the array
	 * descriptor;</li>
	 * <li>GETSTATIC, PUTSTATIC, GETFIELD, PUTFIELD: operand is the field
	 * descriptor;</li>
	 * <li>INVOKEx: operand is the method descriptor; for INVOKESPECIAL, arg is
	 * nonzero if the method is a constructor;</li>
	 * <li>LDC: operand is the descriptor of the pushed value's type;</li>
	 * <li>ANEWARRAY, CHECKCAST: operand is the internal name of the element
	 * or target type.</li>
	 * </ul>
	 * @param opcode the instruction's opcode
	 * @param arg the instruction's numeric operand, if any
	 * @param operand the instruction's symbolic operand, if any
	 * @param symbolTable the symbol table to add types to
	 * @throws IllegalArgumentException if the instruction is JSR or RET, or a
	 * descriptor is invalid
	 */
	public void execute(int opcode, int arg, String operand, SymbolTable symbolTable) {
		int abstractType1, abstractType2, abstractType3, abstractType4;
		switch (opcode) {
			case Opcodes.NOP:
			case Opcodes.INEG:
			case Opcodes.LNEG:
			case Opcodes.FNEG:
			case Opcodes.DNEG:
			case Opcodes.I2B:
			case Opcodes.I2C:
			case Opcodes.I2S:
			case Opcodes.GOTO:
			case Opcodes.RETURN:
				break;
			case Opcodes.ACONST_NULL:
				push(NULL);
				break;
			case Opcodes.ICONST_M1:
			case Opcodes.ICONST_0:
			case Opcodes.ICONST_1:
			case Opcodes.ICONST_2:
			case Opcodes.ICONST_3:
			case Opcodes.ICONST_4:
			case Opcodes.ICONST_5:
			case Opcodes.BIPUSH:
			case Opcodes.SIPUSH:
			case Opcodes.ILOAD:
				push(INTEGER);
				break;
			case Opcodes.LCONST_0:
			case Opcodes.LCONST_1:
			case Opcodes.LLOAD:
				push(LONG);
				push(TOP);
				break;
			case Opcodes.FCONST_0:
			case Opcodes.FCONST_1:
			case Opcodes.FCONST_2:
			case Opcodes.FLOAD:
				push(FLOAT);
				break;
			case Opcodes.DCONST_0:
			case Opcodes.DCONST_1:
			case Opcodes.DLOAD:
				push(DOUBLE);
				push(TOP);
				break;
			case Opcodes.LDC:
				push(symbolTable, checkNotNull(operand, "LDC without constant type"));
				break;
			case Opcodes.ALOAD:
				push(getLocal(arg));
				break;
			case Opcodes.LALOAD:
			case Opcodes.D2L:
				pop(2);
				push(LONG);
				push(TOP);
				break;
			case Opcodes.DALOAD:
			case Opcodes.L2D:
				pop(2);
				push(DOUBLE);
				push(TOP);
				break;
			case Opcodes.AALOAD:
				pop(1);
				abstractType1 = pop();
				push(abstractType1 == NULL ? abstractType1 : ELEMENT_OF + abstractType1);
				break;
			case Opcodes.ISTORE:
			case Opcodes.FSTORE:
			case Opcodes.ASTORE:
				storeLocal(arg, pop(), false);
				break;
			case Opcodes.LSTORE:
			case Opcodes.DSTORE:
				pop(1);
				storeLocal(arg, pop(), true);
				break;
			case Opcodes.IASTORE:
			case Opcodes.BASTORE:
			case Opcodes.CASTORE:
			case Opcodes.SASTORE:
			case Opcodes.FASTORE:
			case Opcodes.AASTORE:
				pop(3);
				break;
			case Opcodes.LASTORE:
			case Opcodes.DASTORE:
				pop(4);
				break;
			case Opcodes.POP:
			case Opcodes.IFEQ:
			case Opcodes.IFNE:
			case Opcodes.IFLT:
			case Opcodes.IFGE:
			case Opcodes.IFGT:
			case Opcodes.IFLE:
			case Opcodes.IRETURN:
			case Opcodes.FRETURN:
			case Opcodes.ARETURN:
			case Opcodes.TABLESWITCH:
			case Opcodes.LOOKUPSWITCH:
			case Opcodes.ATHROW:
			case Opcodes.MONITORENTER:
			case Opcodes.MONITOREXIT:
			case Opcodes.IFNULL:
			case Opcodes.IFNONNULL:
				pop(1);
				break;
			case Opcodes.POP2:
			case Opcodes.IF_ICMPEQ:
			case Opcodes.IF_ICMPNE:
			case Opcodes.IF_ICMPLT:
			case Opcodes.IF_ICMPGE:
			case Opcodes.IF_ICMPGT:
			case Opcodes.IF_ICMPLE:
			case Opcodes.IF_ACMPEQ:
			case Opcodes.IF_ACMPNE:
			case Opcodes.LRETURN:
			case Opcodes.DRETURN:
				pop(2);
				break;
			case Opcodes.DUP:
				abstractType1 = pop();
				push(abstractType1);
				push(abstractType1);
				break;
			case Opcodes.DUP_X1:
				abstractType1 = pop();
				abstractType2 = pop();
				push(abstractType1);
				push(abstractType2);
				push(abstractType1);
				break;
			case Opcodes.DUP_X2:
				abstractType1 = pop();
				abstractType2 = pop();
				abstractType3 = pop();
				push(abstractType1);
				push(abstractType3);
				push(abstractType2);
				push(abstractType1);
				break;
			case Opcodes.DUP2:
				abstractType1 = pop();
				abstractType2 = pop();
				push(abstractType2);
				push(abstractType1);
				push(abstractType2);
				push(abstractType1);
				break;
			case Opcodes.DUP2_X1:
				abstractType1 = pop();
				abstractType2 = pop();
				abstractType3 = pop();
				push(abstractType2);
				push(abstractType1);
				push(abstractType3);
				push(abstractType2);
				push(abstractType1);
				break;
			case Opcodes.DUP2_X2:
				abstractType1 = pop();
				abstractType2 = pop();
				abstractType3 = pop();
				abstractType4 = pop();
				push(abstractType2);
				push(abstractType1);
				push(abstractType4);
				push(abstractType3);
				push(abstractType2);
				push(abstractType1);
				break;
			case Opcodes.SWAP:
				abstractType1 = pop();
				abstractType2 = pop();
				push(abstractType1);
				push(abstractType2);
				break;
			case Opcodes.IALOAD:
			case Opcodes.BALOAD:
			case Opcodes.CALOAD:
			case Opcodes.SALOAD:
			case Opcodes.IADD:
			case Opcodes.ISUB:
			case Opcodes.IMUL:
			case Opcodes.IDIV:
			case Opcodes.IREM:
			case Opcodes.IAND:
			case Opcodes.IOR:
			case Opcodes.IXOR:
			case Opcodes.ISHL:
			case Opcodes.ISHR:
			case Opcodes.IUSHR:
			case Opcodes.L2I:
			case Opcodes.D2I:
			case Opcodes.FCMPL:
			case Opcodes.FCMPG:
				pop(2);
				push(INTEGER);
				break;
			case Opcodes.LADD:
			case Opcodes.LSUB:
			case Opcodes.LMUL:
			case Opcodes.LDIV:
			case Opcodes.LREM:
			case Opcodes.LAND:
			case Opcodes.LOR:
			case Opcodes.LXOR:
				pop(4);
				push(LONG);
				push(TOP);
				break;
			case Opcodes.FALOAD:
			case Opcodes.FADD:
			case Opcodes.FSUB:
			case Opcodes.FMUL:
			case Opcodes.FDIV:
			case Opcodes.FREM:
			case Opcodes.L2F:
			case Opcodes.D2F:
				pop(2);
				push(FLOAT);
				break;
			case Opcodes.DADD:
			case Opcodes.DSUB:
			case Opcodes.DMUL:
			case Opcodes.DDIV:
			case Opcodes.DREM:
				pop(4);
				push(DOUBLE);
				push(TOP);
				break;
			case Opcodes.LSHL:
			case Opcodes.LSHR:
			case Opcodes.LUSHR:
				pop(3);
				push(LONG);
				push(TOP);
				break;
			case Opcodes.IINC:
				setLocal(arg, INTEGER);
				break;
			case Opcodes.I2L:
			case Opcodes.F2L:
				pop(1);
				push(LONG);
				push(TOP);
				break;
			case Opcodes.I2F:
				pop(1);
				push(FLOAT);
				break;
			case Opcodes.I2D:
			case Opcodes.F2D:
				pop(1);
				push(DOUBLE);
				push(TOP);
				break;
			case Opcodes.F2I:
			case Opcodes.ARRAYLENGTH:
			case Opcodes.INSTANCEOF:
				pop(1);
				push(INTEGER);
				break;
			case Opcodes.LCMP:
			case Opcodes.DCMPL:
			case Opcodes.DCMPG:
				pop(4);
				push(INTEGER);
				break;
			case Opcodes.JSR:
			case Opcodes.RET:
				throw new IllegalArgumentException("JSR/RET are not supported by frame computation");
			case Opcodes.GETSTATIC:
				push(symbolTable, operand);
				break;
			case Opcodes.PUTSTATIC:
				pop(operand);
				break;
			case Opcodes.GETFIELD:
				pop(1);
				push(symbolTable, operand);
				break;
			case Opcodes.PUTFIELD:
				pop(operand);
				pop();
				break;
			case Opcodes.INVOKEVIRTUAL:
			case Opcodes.INVOKESPECIAL:
			case Opcodes.INVOKESTATIC:
			case Opcodes.INVOKEINTERFACE:
				pop(operand);
				if (opcode != Opcodes.INVOKESTATIC) {
					abstractType1 = pop();
					if (opcode == Opcodes.INVOKESPECIAL && arg != 0)
						addInitializedType(abstractType1);
				}
				push(symbolTable, operand);
				break;
			case Opcodes.INVOKEDYNAMIC:
				pop(operand);
				push(symbolTable, operand);
				break;
			case Opcodes.NEW:
				checkArgument(arg >= 0 && arg < symbolTable.size(), "NEW without uninitialized type: %s", arg);
				Symbol.Tag tag = symbolTable.getType(arg).getTag();
				if (tag == Symbol.Tag.UNINITIALIZED_TYPE)
					push(UNINITIALIZED_KIND | arg);
				else if (tag == Symbol.Tag.FORWARD_UNINITIALIZED_TYPE)
					push(FORWARD_UNINITIALIZED_KIND | arg);
				else
					throw new IllegalArgumentException("NEW with non-uninitialized type " + symbolTable.getType(arg));
				break;
			case Opcodes.NEWARRAY:
				pop();
				switch (arg) {
					case Opcodes.T_BOOLEAN:
						push(ARRAY_OF | BOOLEAN);
						break;
					case Opcodes.T_CHAR:
						push(ARRAY_OF | CHAR);
						break;
					case Opcodes.T_BYTE:
						push(ARRAY_OF | BYTE);
						break;
					case Opcodes.T_SHORT:
						push(ARRAY_OF | SHORT);
						break;
					case Opcodes.T_INT:
						push(ARRAY_OF | INTEGER);
						break;
					case Opcodes.T_FLOAT:
						push(ARRAY_OF | FLOAT);
						break;
					case Opcodes.T_DOUBLE:
						push(ARRAY_OF | DOUBLE);
						break;
					case Opcodes.T_LONG:
						push(ARRAY_OF | LONG);
						break;
					default:
						throw new IllegalArgumentException("bad NEWARRAY type " + arg);
				}
				break;
			case Opcodes.ANEWARRAY:
				pop();
				if (operand.charAt(0) == '[')
					push(symbolTable, '[' + operand);
				else
					push(ARRAY_OF | REFERENCE_KIND | symbolTable.addType(operand));
				break;
			case Opcodes.CHECKCAST:
				pop();
				if (operand.charAt(0) == '[')
					push(symbolTable, operand);
				else
					push(REFERENCE_KIND | symbolTable.addType(operand));
				break;
			case Opcodes.MULTIANEWARRAY:
				pop(arg);
				push(symbolTable, operand);
				break;
			default:
				throw new AssertionError("unknown opcode " + opcode);
		}
	}

	// ------------------------------------------------------------------
	// Merging
	// ------------------------------------------------------------------

	/**
	 * Resolves an output type against this frame's input frame.
	 */
	private int getConcreteOutputType(int abstractOutputType, int numStack) {
		int dim = abstractOutputType & DIM_MASK;
		int kind = kind(abstractOutputType);
		int concreteOutputType;
		if (kind == LOCAL_KIND)
			concreteOutputType = dim + inputLocals[value(abstractOutputType)];
		else if (kind == STACK_KIND)
			concreteOutputType = dim + inputStack[numStack - value(abstractOutputType)];
		else
			return abstractOutputType;
		if ((abstractOutputType & TOP_IF_LONG_OR_DOUBLE_FLAG) != 0 && isWide(concreteOutputType))
			concreteOutputType = TOP;
		return concreteOutputType;
	}

	/**
	 * Merges this frame's resolved output frame into the input frame of the
	 * given frame, which belongs to a successor of this frame's block.  This
	 * frame is not changed.
	 *
	 * If the successor is an exception handler, its input locals are also
	 * merged with this frame's input locals (the exception can be thrown by
	 * the block's first instruction), and its input stack is merged with a
	 * stack containing only the caught exception type.
	 * @param symbolTable the symbol table to add merged types to
	 * @param dstFrame the successor's frame
	 * @param catchType for an exception edge, the abstract type of the caught
	 * exception; otherwise 0
	 * @return true iff the input frame of dstFrame changed
	 */
	public boolean merge(SymbolTable symbolTable, Frame dstFrame, int catchType) {
		checkState(hasInputFrame(), "merging from frame %s without input", owner);
		boolean frameChanged = false;

		int numLocal = inputLocals.length;
		int numStack = inputStack.length;
		if (numStack + outputStackStart < 0)
			throw new IllegalArgumentException(String.format("stack underflow in block %s: input stack has %s elements, block pops %s",
					owner, numStack, -outputStackStart));
		if (dstFrame.inputLocals == null) {
			dstFrame.inputLocals = new int[numLocal];
			frameChanged = true;
		}
		checkState(dstFrame.inputLocals.length == numLocal, "frames %s and %s disagree on locals", owner, dstFrame.owner);

		for (int i = 0; i < numLocal; ++i) {
			int concreteOutputType;
			if (outputLocals != null && i < outputLocals.length && outputLocals[i] != 0)
				concreteOutputType = getConcreteOutputType(outputLocals[i], numStack);
			else
				concreteOutputType = inputLocals[i];
			if (initializations != null)
				concreteOutputType = getInitializedType(symbolTable, concreteOutputType);
			frameChanged |= merge(symbolTable, concreteOutputType, dstFrame.inputLocals, i);
		}

		if (catchType > 0) {
			for (int i = 0; i < numLocal; ++i)
				frameChanged |= merge(symbolTable, inputLocals[i], dstFrame.inputLocals, i);
			if (dstFrame.inputStack == null) {
				dstFrame.inputStack = new int[1];
				frameChanged = true;
			}
			frameChanged |= merge(symbolTable, catchType, dstFrame.inputStack, 0);
			return frameChanged;
		}

		int numInputStack = inputStack.length + outputStackStart;
		if (dstFrame.inputStack == null) {
			dstFrame.inputStack = new int[numInputStack + outputStackTop];
			frameChanged = true;
		}
		checkState(dstFrame.inputStack.length == numInputStack + outputStackTop,
				"stack height mismatch between block %s (%s) and successor %s (%s)",
				owner, numInputStack + outputStackTop, dstFrame.owner, dstFrame.inputStack.length);

		//input stack elements not popped by this block
		for (int i = 0; i < numInputStack; ++i) {
			int concreteOutputType = inputStack[i];
			if (initializations != null)
				concreteOutputType = getInitializedType(symbolTable, concreteOutputType);
			frameChanged |= merge(symbolTable, concreteOutputType, dstFrame.inputStack, i);
		}
		//elements pushed by this block
		for (int i = 0; i < outputStackTop; ++i) {
			int concreteOutputType = getConcreteOutputType(outputStack[i], numStack);
			if (initializations != null)
				concreteOutputType = getInitializedType(symbolTable, concreteOutputType);
			frameChanged |= merge(symbolTable, concreteOutputType, dstFrame.inputStack, numInputStack + i);
		}
		return frameChanged;
	}

	/**
	 * Merges the given type into the given slot of a resolved type array.
	 * @param symbolTable the symbol table to add merged types to
	 * @param sourceType a resolved abstract type
	 * @param dstTypes an array of resolved abstract types (or zeros)
	 * @param dstIndex the slot to merge into
	 * @return true iff the slot changed
	 */
	static boolean merge(SymbolTable symbolTable, int sourceType, int[] dstTypes, int dstIndex) {
		int dstType = dstTypes[dstIndex];
		if (dstType == sourceType)
			return false;

		int srcType = sourceType;
		if ((sourceType & ~DIM_MASK) == NULL) {
			if (dstType == NULL)
				return false;
			srcType = NULL;
		}

		if (dstType == 0) {
			dstTypes[dstIndex] = srcType;
			return true;
		}

		int mergedType;
		if (isReferenceOrArray(dstType)) {
			if (srcType == NULL)
				return false;
			else if ((srcType & (DIM_MASK | KIND_MASK)) == (dstType & (DIM_MASK | KIND_MASK))) {
				if (kind(dstType) == REFERENCE_KIND)
					//same dimension: that dimension of the common super class
					mergedType = (srcType & DIM_MASK) | REFERENCE_KIND
							| symbolTable.addMergedType(value(srcType), value(dstType));
				else {
					//primitive arrays of the same dimension but different element types
					int mergedDim = ELEMENT_OF + (srcType & DIM_MASK);
					mergedType = mergedDim | REFERENCE_KIND | symbolTable.addType("java/lang/Object");
				}
			} else if (isReferenceOrArray(srcType)) {
				//Object at the smaller dimension, where primitive arrays count
				//one dimension less (their elements aren't references)
				int srcDim = srcType & DIM_MASK;
				if (srcDim != 0 && kind(srcType) != REFERENCE_KIND)
					srcDim = ELEMENT_OF + srcDim;
				int dstDim = dstType & DIM_MASK;
				if (dstDim != 0 && kind(dstType) != REFERENCE_KIND)
					dstDim = ELEMENT_OF + dstDim;
				mergedType = Math.min(srcDim, dstDim) | REFERENCE_KIND | symbolTable.addType("java/lang/Object");
			} else
				mergedType = TOP;
		} else if (dstType == NULL)
			mergedType = isReferenceOrArray(srcType) ? srcType : TOP;
		else
			mergedType = TOP;

		if (mergedType != dstType) {
			dstTypes[dstIndex] = mergedType;
			return true;
		}
		return false;
	}

	// ------------------------------------------------------------------
	// Resolved views
	// ------------------------------------------------------------------

	/**
	 * Returns the input locals as verification types, with the second slot of
	 * wide values and all trailing TOPs elided.
	 * @param symbolTable the symbol table this frame's types come from
	 * @return the input locals
	 */
	public ImmutableList<VerificationType> getInputLocals(SymbolTable symbolTable) {
		checkState(inputLocals != null, "frame %s has no input", owner);
		int numLocal = 0, numTrailingTop = 0;
		for (int i = 0; i < inputLocals.length; ) {
			int localType = inputLocals[i];
			i += isWide(localType) ? 2 : 1;
			if (localType == TOP || localType == 0)
				++numTrailingTop;
			else {
				numLocal += numTrailingTop + 1;
				numTrailingTop = 0;
			}
		}
		ImmutableList.Builder<VerificationType> builder = ImmutableList.builder();
		for (int i = 0; numLocal > 0; --numLocal) {
			int localType = inputLocals[i];
			i += isWide(localType) ? 2 : 1;
			builder.add(localType == 0 ? VerificationType.TOP : toVerificationType(symbolTable, localType));
		}
		return builder.build();
	}

	/**
	 * Returns the input stack as verification types, bottom first, with the
	 * second slot of wide values elided.
	 * @param symbolTable the symbol table this frame's types come from
	 * @return the input stack
	 */
	public ImmutableList<VerificationType> getInputStack(SymbolTable symbolTable) {
		checkState(inputStack != null, "frame %s has no input", owner);
		ImmutableList.Builder<VerificationType> builder = ImmutableList.builder();
		for (int i = 0; i < inputStack.length; ) {
			int stackType = inputStack[i];
			i += isWide(stackType) ? 2 : 1;
			builder.add(stackType == 0 ? VerificationType.TOP : toVerificationType(symbolTable, stackType));
		}
		return builder.build();
	}

	/**
	 * Returns a copy of the raw input locals (one abstract type per slot).
	 */
	int[] inputLocals() {
		return inputLocals == null ? null : inputLocals.clone();
	}

	/**
	 * Returns a copy of the raw input stack (one abstract type per slot).
	 */
	int[] inputStack() {
		return inputStack == null ? null : inputStack.clone();
	}

	public void dump(PrintWriter writer, SymbolTable symbolTable) {
		writer.write("frame " + owner);
		writer.println();
		writer.write("\tin locals:");
		dumpTypes(writer, symbolTable, inputLocals, inputLocals == null ? 0 : inputLocals.length);
		writer.write("\tin stack:");
		dumpTypes(writer, symbolTable, inputStack, inputStack == null ? 0 : inputStack.length);
		writer.write("\tout locals:");
		dumpTypes(writer, symbolTable, outputLocals, outputLocals == null ? 0 : outputLocals.length);
		writer.write("\tout stack (start " + outputStackStart + "):");
		dumpTypes(writer, symbolTable, outputStack, outputStackTop);
		writer.flush();
	}

	private static void dumpTypes(PrintWriter writer, SymbolTable symbolTable, int[] types, int count) {
		if (types == null)
			writer.write(" <none>");
		else
			for (int i = 0; i < count; ++i)
				writer.write(" " + AbstractTypes.toString(symbolTable, types[i]));
		writer.println();
	}

	@Override
	public String toString() {
		return "Frame(" + owner + ")";
	}
}
