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
 * The default key function: every element is its own key, ordered by its
 * <i>natural ordering</i>.
 * <p>
 * All instances are equal to each other, so heaps built with the default key
 * function can always be merged.
 *
 * @param <T> the element (and key) type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class IdentityKeyFunction<T extends Comparable<? super T>>
	extends Object
	implements KeyFunction<T, T>, Serializable
{

	/**
	 * Serial version.
	 */
	private static final long serialVersionUID = 4583457L;

	/**
	 * Constructor.
	 */
	public IdentityKeyFunction()
	{
		super();
	}

	/**
	 * Return the element itself.
	 *
	 * @param element the element.
	 * @return <code>element</code>.
	 * @throws NullPointerException If <code>element</code> is
	 *             <code>null</code>.
	 */
	public T key(final T element)
		throws NullPointerException
	{
		if (element == null)
		{
			throw new NullPointerException();
		}

		return element;
	}

	/**
	 * Check the specified object for equality.
	 * <p>
	 * Identity key functions hold no state, so any two of them project keys
	 * the same way. Heaps compare key functions with this method before a
	 * merge.
	 *
	 * @param other the other object.
	 * @return <code>true</code> if <code>other</code> is of the same class as
	 *         this object; <code>false</code> otherwise.
	 */
	@Override
	public boolean equals(final Object other)
	{
		if (other == null)
		{
			return false;
		}

		if (this == other)
		{
			return true;
		}

		return this.getClass().equals(other.getClass());
	}

	/**
	 * Get the hashcode inline with equals.
	 *
	 * @return a constant.
	 */
	@Override
	public int hashCode()
	{
		return 1;
	}

	/**
	 * Get a string representation of this object.
	 *
	 * @return the class name, actually.
	 */
	@Override
	public String toString()
	{
		return this.getClass().getName();
	}

}
