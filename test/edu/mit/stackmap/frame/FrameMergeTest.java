package edu.mit.stackmap.frame;

import static edu.mit.stackmap.frame.AbstractTypes.*;
import static org.junit.Assert.*;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the per-slot merge of resolved abstract types.
 * @since October 3, 2026
 */
public class FrameMergeTest {
	private SymbolTable symbolTable;
	private int string, integer, object, stringArray, objectArray, stringArray2, intArray, floatArray;

	@Before
	public void setUp() {
		symbolTable = new SymbolTable("test/Owner");
		string = REFERENCE_KIND | symbolTable.addType("java/lang/String");
		integer = REFERENCE_KIND | symbolTable.addType("java/lang/Integer");
		object = REFERENCE_KIND | symbolTable.addType("java/lang/Object");
		stringArray = ARRAY_OF | string;
		objectArray = ARRAY_OF | object;
		stringArray2 = ARRAY_OF + stringArray;
		intArray = ARRAY_OF | INTEGER;
		floatArray = ARRAY_OF | FLOAT;
	}

	private int merge(int source, int destination) {
		int[] slot = {destination};
		Frame.merge(symbolTable, source, slot, 0);
		return slot[0];
	}

	@Test
	public void testEqualTypesDoNotChange() {
		int[] slot = {string};
		assertFalse(Frame.merge(symbolTable, string, slot, 0));
		assertEquals(string, slot[0]);
	}

	@Test
	public void testUnsetSlotTakesSource() {
		int[] slot = {0};
		assertTrue(Frame.merge(symbolTable, INTEGER, slot, 0));
		assertEquals(INTEGER, slot[0]);
	}

	@Test
	public void testNullIntoReferenceKeepsReference() {
		int[] slot = {string};
		assertFalse(Frame.merge(symbolTable, NULL, slot, 0));
		assertEquals(string, slot[0]);
	}

	@Test
	public void testReferenceIntoNullTakesReference() {
		assertEquals(string, merge(string, NULL));
		assertEquals(intArray, merge(intArray, NULL));
	}

	@Test
	public void testUnrelatedReferencesMergeToObject() {
		assertEquals(object, merge(string, integer));
	}

	@Test
	public void testSameDimensionArraysMergeElements() {
		assertEquals(objectArray, merge(stringArray, ARRAY_OF | integer));
	}

	@Test
	public void testDifferentPrimitiveArraysMergeToObject() {
		assertEquals(object, merge(intArray, floatArray));
		assertEquals(objectArray, merge(ARRAY_OF + intArray, ARRAY_OF + floatArray));
	}

	@Test
	public void testDifferentDimensionsMergeToObjectOfSmallerDimension() {
		assertEquals(objectArray, merge(stringArray2, ARRAY_OF | integer));
		//primitive arrays count one dimension less
		assertEquals(object, merge(stringArray, intArray));
		assertEquals(object, merge(object, intArray));
	}

	@Test
	public void testIncompatibleTypesMergeToTop() {
		assertEquals(TOP, merge(INTEGER, FLOAT));
		assertEquals(TOP, merge(INTEGER, string));
		assertEquals(TOP, merge(string, LONG));
		assertEquals(TOP, merge(UNINITIALIZED_THIS, string));
		assertEquals(TOP, merge(UNINITIALIZED_THIS, NULL));
	}

	@Test
	public void testTopAbsorbs() {
		int[] slot = {TOP};
		assertFalse(Frame.merge(symbolTable, string, slot, 0));
		assertEquals(TOP, slot[0]);
	}

	private List<Integer> sampleTypes() {
		List<Integer> types = new ArrayList<>();
		for (int t : new int[]{TOP, INTEGER, FLOAT, LONG, DOUBLE, NULL, UNINITIALIZED_THIS,
				string, integer, object, stringArray, objectArray, stringArray2, intArray, floatArray})
			types.add(t);
		return types;
	}

	@Test
	public void testMergeIsSymmetric() {
		for (int a : sampleTypes())
			for (int b : sampleTypes())
				assertEquals(AbstractTypes.toString(symbolTable, a) + " / " + AbstractTypes.toString(symbolTable, b),
						merge(a, b), merge(b, a));
	}

	@Test
	public void testMergeIsIdempotent() {
		for (int a : sampleTypes())
			for (int b : sampleTypes()) {
				int[] slot = {b};
				Frame.merge(symbolTable, a, slot, 0);
				int once = slot[0];
				assertFalse(Frame.merge(symbolTable, a, slot, 0));
				assertEquals(once, slot[0]);
			}
	}

	@Test
	public void testMergeIsMonotone() {
		//once a slot has absorbed a type, merging it again never changes it
		for (int a : sampleTypes())
			for (int b : sampleTypes()) {
				int[] slot = {0};
				Frame.merge(symbolTable, a, slot, 0);
				Frame.merge(symbolTable, b, slot, 0);
				int merged = slot[0];
				assertFalse(Frame.merge(symbolTable, a, slot, 0));
				assertFalse(Frame.merge(symbolTable, b, slot, 0));
				assertEquals(merged, slot[0]);
			}
	}
}
