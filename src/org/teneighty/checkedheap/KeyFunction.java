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
 * Projects a heap element onto the key it is ordered by.
 * <p>
 * Keys must be mutually comparable through their natural ordering. A key
 * function should be a pure function of the element: the heap calls it many
 * times per operation and never caches the result.
 * <p>
 * Two heaps can only be merged if their key functions are
 * <code>equals</code>, so stateless implementations should override
 * <code>equals</code> and <code>hashCode</code> accordingly.
 *
 * @param <TElement> the element type.
 * @param <TKey> the key type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see IdentityKeyFunction
 */
public interface KeyFunction<TElement, TKey extends Comparable<? super TKey>>
{

	/**
	 * Compute the key of the specified element.
	 *
	 * @param element the element; never <code>null</code>.
	 * @return the key.
	 */
	public TKey key(TElement element);

}
