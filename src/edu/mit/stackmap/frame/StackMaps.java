package edu.mit.stackmap.frame;

import static com.google.common.base.Preconditions.*;
import edu.mit.stackmap.util.MethodNodeBuilder;
import java.io.IOException;
import java.io.PrintWriter;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

/**
 * Recomputes the stack map frames, maxStack and maxLocals of every method of a
 * class.
 * @since 10/14/2026
 */
public final class StackMaps {
	private static final Log LOG = LogFactory.getLog(StackMaps.class);
	private StackMaps() {}

	public static void recompute(ClassNode classNode) {
		recompute(classNode, AnalysisOptions.defaults());
	}

	/**
	 * Recomputes frames for all methods of the given class that have code.
	 * All methods share one symbol table.
	 * @param classNode the class to modify
	 * @param options the analysis options
	 * @throws AnalysisException if frames can't be computed for some method
	 */
	public static void recompute(ClassNode classNode, AnalysisOptions options) {
		checkNotNull(options);
		SymbolTable symbolTable = new SymbolTable(classNode.name, options.getCommonSuperClassResolver());
		FrameComputer computer = new FrameComputer(symbolTable, options);
		int methods = 0;
		for (MethodNode methodNode : classNode.methods) {
			if (methodNode.instructions.size() == 0)
				continue;
			FrameNodeEmitter.emit(methodNode, computer.compute(methodNode), options);
			++methods;
		}
		if (LOG.isDebugEnabled())
			LOG.debug(classNode.name + ": recomputed frames of " + methods + " methods, " + symbolTable.size() + " types");
	}

	/**
	 * Recomputes frames for one method.
	 * @param owner the internal name of the class declaring the method
	 * @param methodNode the method to modify
	 * @param options the analysis options
	 * @return the computed frames
	 * @throws AnalysisException if frames can't be computed
	 */
	public static ComputedFrames recompute(String owner, MethodNode methodNode, AnalysisOptions options) {
		SymbolTable symbolTable = new SymbolTable(owner, options.getCommonSuperClassResolver());
		ComputedFrames computed = new FrameComputer(symbolTable, options).compute(methodNode);
		FrameNodeEmitter.emit(methodNode, computed, options);
		return computed;
	}

	/**
	 * Prints the frames computed for each method of the named classes.
	 * @param args binary names of classes on the class path
	 * @throws IOException if a class file can't be read
	 */
	public static void main(String[] args) throws IOException {
		PrintWriter writer = new PrintWriter(System.out);
		for (String className : args) {
			ClassNode classNode = MethodNodeBuilder.buildClassNode(className);
			SymbolTable symbolTable = new SymbolTable(classNode.name);
			FrameComputer computer = new FrameComputer(symbolTable);
			for (MethodNode methodNode : classNode.methods)
				if (methodNode.instructions.size() > 0)
					computer.compute(methodNode).dump(writer);
		}
		writer.flush();
	}
}
