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

import java.io.Serializable;

/**
 * An immutable snapshot of a heap's shape and configuration, as returned by
 * {@link BinaryHeap#getStats()}.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public final class HeapStats
	extends Object
	implements Serializable
{

	/**
	 * Serial version UID.
	 */
	private static final long serialVersionUID = 6620917L;

	private final int size;

	private final int depth;

	private final boolean perfect;

	private final int capacity;

	private final OrderMode mode;

	private final NanPolicy nan_policy;

	private final long operation_count;

	private final int verify_sample_rate;

	/**
	 * Constructor.
	 *
	 * @param size the element count.
	 * @param depth the tree depth.
	 * @param perfect whether the tree is perfect.
	 * @param capacity the backing capacity.
	 * @param mode the order mode.
	 * @param nan_policy the NaN policy.
	 * @param operation_count completed mutating operations.
	 * @param verify_sample_rate the self-check rate.
	 */
	HeapStats(final int size, final int depth, final boolean perfect,
			final int capacity, final OrderMode mode,
			final NanPolicy nan_policy, final long operation_count,
			final int verify_sample_rate)
	{
		super();

		this.size = size;
		this.depth = depth;
		this.perfect = perfect;
		this.capacity = capacity;
		this.mode = mode;
		this.nan_policy = nan_policy;
		this.operation_count = operation_count;
		this.verify_sample_rate = verify_sample_rate;
	}

	public int getSize()
	{
		return this.size;
	}

	public int getDepth()
	{
		return this.depth;
	}

	public boolean isPerfect()
	{
		return this.perfect;
	}

	public int getCapacity()
	{
		return this.capacity;
	}

	public OrderMode getOrderMode()
	{
		return this.mode;
	}

	public NanPolicy getNanPolicy()
	{
		return this.nan_policy;
	}

	public long getOperationCount()
	{
		return this.operation_count;
	}

	public int getVerifySampleRate()
	{
		return this.verify_sample_rate;
	}

	/**
	 * Get a string representation.
	 *
	 * @return a string.
	 */
	@Override
	public String toString()
	{
		return String.format(
				"HeapStats[size=%d, depth=%d, perfect=%b, capacity=%d, mode=%s, nanPolicy=%s, operations=%d, verifySampleRate=%d]",
				this.size, this.depth, this.perfect, this.capacity, this.mode,
				this.nan_policy, this.operation_count,
				this.verify_sample_rate);
	}

}
