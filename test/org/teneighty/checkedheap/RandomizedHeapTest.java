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
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;

import org.junit.Test;

/**
 * Random operation sequences checked against a
 * <code>java.util.PriorityQueue</code> reference model, with the invariant
 * verified after every operation.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class RandomizedHeapTest
{

	private static final long SEED = 123456789L;

	private static final int TRIALS = 20;

	private static final int OPS_PER_TRIAL = 400;

	private static final int KEY_MAX = 64;

	@Test
	public void randomOperationsKeepTheInvariant()
	{
		Random random = new Random(SEED);
		for (int trial = 0; trial < TRIALS; trial++)
		{
			this.runTrial(random, (trial % 2 == 0) ? OrderMode.MIN
					: OrderMode.MAX);
		}
	}

	private static PriorityQueue<Integer> reference(final OrderMode mode,
			final List<Integer> contents)
	{
		Comparator<Integer> order = (mode == OrderMode.MIN) ? Collections
				.<Integer> reverseOrder(Collections.<Integer> reverseOrder())
				: Collections.<Integer> reverseOrder();
		PriorityQueue<Integer> queue = new PriorityQueue<Integer>(11, order);
		queue.addAll(contents);
		return queue;
	}

	private void runTrial(final Random random, final OrderMode start)
	{
		BinaryHeap<Integer> heap = new BinaryHeap<Integer>(start, null,
				NanPolicy.RAISE, 1, null, null);
		PriorityQueue<Integer> model = reference(start,
				new ArrayList<Integer>());

		for (int op = 0; op < OPS_PER_TRIAL; op++)
		{
			int choice = random.nextInt(100);
			int value = random.nextInt(KEY_MAX);

			if (choice < 35)
			{
				heap.push(value);
				model.add(value);
			}
			else if (choice < 55)
			{
				assertEquals(model.poll(), heap.pop());
			}
			else if (choice < 63)
			{
				int removed = heap.remove(value);
				assertEquals(model.remove(value) ? 1 : 0, removed);
			}
			else if (choice < 68)
			{
				int removed = heap.remove(value, true);
				int expected = 0;
				while (model.remove(value))
				{
					expected++;
				}
				assertEquals(expected, removed);
			}
			else if (choice < 76)
			{
				model.add(value);
				assertEquals(model.poll(), heap.pushPop(value));
			}
			else if (choice < 82)
			{
				if (model.isEmpty() == false)
				{
					Integer root = model.poll();
					model.add(value);
					assertEquals(root, heap.replace(value));
				}
			}
			else if (choice < 88)
			{
				List<Integer> batch = new ArrayList<Integer>();
				int count = random.nextInt(6);
				for (int index = 0; index < count; index++)
				{
					batch.add(random.nextInt(KEY_MAX));
				}
				heap.extend(batch);
				model.addAll(batch);
			}
			else if (choice < 92)
			{
				BinaryHeap<Integer> other = new BinaryHeap<Integer>(heap
						.getOrderMode());
				int count = random.nextInt(5);
				for (int index = 0; index < count; index++)
				{
					int item = random.nextInt(KEY_MAX);
					other.push(item);
					model.add(item);
				}
				heap.merge(other);
			}
			else if (choice < 96)
			{
				int index = random.nextInt(heap.size() + 2) - 1;
				Integer expected = (index >= 0 && index < heap.size()) ? heap
						.toList().get(index) : null;
				Integer removed = heap.removeAt(index);
				assertEquals(expected, removed);
				if (removed != null)
				{
					model.remove(removed);
				}
			}
			else
			{
				heap.toggleMode();
				model = reference(heap.getOrderMode(), new ArrayList<Integer>(
						model));
			}

			assertTrue(heap.isValidHeap());
			assertEquals(model.size(), heap.size());
			assertEquals(model.peek(), heap.peek());
		}

		while (model.isEmpty() == false)
		{
			assertEquals(model.poll(), heap.pop());
		}
		assertTrue(heap.isEmpty());
	}

}
