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

/**
 * Signals that a heap no longer satisfies the heap property. This is always a
 * bug and should not be caught and ignored.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class InvariantViolationError
	extends AssertionError
{

	/**
	 * Serial version UID.
	 */
	private static final long serialVersionUID = 9920311L;

	/**
	 * Parent index.
	 */
	private final int parent;

	/**
	 * Child index.
	 */
	private final int child;

	/**
	 * Constructor.
	 *
	 * @param message the detail message.
	 * @param parent the index of the offending parent.
	 * @param child the index of the child preferred over it.
	 */
	public InvariantViolationError(final String message, final int parent,
			final int child)
	{
		super(message);

		this.parent = parent;
		this.child = child;
	}

	/**
	 * Get the index of the parent that broke the invariant.
	 *
	 * @return the parent index.
	 */
	public int getParentIndex()
	{
		return this.parent;
	}

	/**
	 * Get the index of the child preferred over its parent.
	 *
	 * @return the child index.
	 */
	public int getChildIndex()
	{
		return this.child;
	}

}
