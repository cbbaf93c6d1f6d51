/*
 * $Id$
 *
 * Copyright (c) 2005-2009 Fran Lattanzio
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.teneighty.checkedheap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

/**
 * Sampled and explicit invariant checks.
 * <p>
 * A heap can only break if keys change behind its back, so these tests use
 * mutable boxes keyed by their current value.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class SelfVerificationTest
{

	private static final class Box
	{
		int value;

		Box(final int value)
		{
			this.value = value;
		}

		@Override
		public String toString()
		{
			return "Box(" + this.value + ")";
		}
	}

	private static final KeyFunction<Box, Integer> VALUE = new KeyFunction<Box, Integer>()
	{
		public Integer key(final Box element)
		{
			if (element.value < 0)
			{
				throw new IllegalStateException("negative box");
			}

			return Integer.valueOf(element.value);
		}
	};

	private Box[] boxes;

	private BinaryHeap<Box> heap;

	@Before
	public void setUp()
	{
		this.heap = new BinaryHeap<Box>(OrderMode.MIN, VALUE);
		this.boxes = new Box[7];
		for (int index = 0; index < this.boxes.length; index++)
		{
			this.boxes[index] = new Box(index + 1);
			this.heap.push(this.boxes[index]);
		}
	}

	@Test
	public void intactHeapPassesChecks()
	{
		assertTrue(this.heap.isValidHeap());
		this.heap.assertValid();
	}

	@Test
	public void assertValidNamesTheOffendingPair()
	{
		this.boxes[0].value = 100;
		assertFalse(this.heap.isValidHeap());

		try
		{
			this.heap.assertValid();
			fail("expected InvariantViolationError");
		}
		catch (final InvariantViolationError ive)
		{
			assertEquals(0, ive.getParentIndex());
			assertEquals(1, ive.getChildIndex());
			assertTrue(ive.getMessage(), ive.getMessage().contains(
					"parent 0, left 1"));
			assertTrue(ive.getMessage(), ive.getMessage().contains("Box(100)"));
		}
	}

	@Test
	public void everyOperationIsCheckedAtRateOne()
	{
		this.heap.setVerifySampleRate(1);
		this.boxes[2].value = 0;

		try
		{
			this.heap.removeAt(-1);
			fail("expected InvariantViolationError");
		}
		catch (final InvariantViolationError ive)
		{
			assertEquals(0, ive.getParentIndex());
			assertEquals(2, ive.getChildIndex());
		}

		// The guard is released even though the check failed.
		this.boxes[2].value = 3;
		this.heap.push(new Box(8));
		assertEquals(8, this.heap.size());
	}

	@Test
	public void checksRunOnlyOnMultiplesOfTheRate()
	{
		assertEquals(7L, this.heap.getOperationCount());
		this.heap.setVerifySampleRate(3);
		this.boxes[0].value = 100;

		// Operation 8 is not checked.
		this.heap.removeAt(-1);

		try
		{
			// Operation 9 is.
			this.heap.removeAt(-1);
			fail("expected InvariantViolationError");
		}
		catch (final InvariantViolationError ive)
		{
			assertEquals(9L, this.heap.getOperationCount());
		}
	}

	@Test
	public void failedOperationKeepsItsOwnException()
	{
		this.heap.setVerifySampleRate(1);
		this.boxes[2].value = 0;
		long ops = this.heap.getOperationCount();

		try
		{
			this.heap.push(new Box(-1));
			fail("expected InvalidValueException");
		}
		catch (final InvalidValueException ive)
		{
			assertTrue(ive.getCause() instanceof IllegalStateException);
			assertEquals(ops + 1, this.heap.getOperationCount());
		}

		// The next successful operation is checked again.
		try
		{
			this.heap.removeAt(-1);
			fail("expected InvariantViolationError");
		}
		catch (final InvariantViolationError ive)
		{
			assertEquals(2, ive.getChildIndex());
		}
	}

	@Test
	public void zeroRateDisablesChecks()
	{
		this.boxes[0].value = 100;
		for (int index = 0; index < 10; index++)
		{
			this.heap.removeAt(-1);
		}

		assertEquals(0, this.heap.getVerifySampleRate());
	}

	@Test
	public void heapifyRepairsChangedKeys()
	{
		this.heap.setVerifySampleRate(1);
		this.boxes[0].value = 100;

		this.heap.heapify();

		assertTrue(this.heap.isValidHeap());
		assertEquals(2, this.heap.peek().value);
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeRateIsRejected()
	{
		this.heap.setVerifySampleRate(-1);
	}

}
