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

import java.util.Comparator;

/**
 * Orders elements by their normalized keys.
 * <p>
 * This is the one place where keys are computed and compared. Every failure
 * along the way (key function threw, returned <code>null</code> or a
 * non-comparable, NaN under {@link NanPolicy#RAISE}, keys not mutually
 * comparable) surfaces as an {@link InvalidValueException}.
 *
 * @param <TElement> the element type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
final class KeyComparator<TElement>
	extends Object
	implements Comparator<TElement>
{

	/**
	 * The key projection.
	 */
	private final KeyFunction<? super TElement, ?> key_function;

	/**
	 * What to do with NaN keys.
	 */
	private final NanPolicy nan_policy;

	/**
	 * Constructor.
	 *
	 * @param key_function the key function.
	 * @param nan_policy the NaN policy.
	 * @throws NullPointerException If either argument is <code>null</code>.
	 */
	KeyComparator(final KeyFunction<? super TElement, ?> key_function,
			final NanPolicy nan_policy)
		throws NullPointerException
	{
		super();

		if (key_function == null || nan_policy == null)
		{
			throw new NullPointerException();
		}

		this.key_function = key_function;
		this.nan_policy = nan_policy;
	}

	/**
	 * Get the key function.
	 *
	 * @return the key function.
	 */
	KeyFunction<? super TElement, ?> getKeyFunction()
	{
		return this.key_function;
	}

	/**
	 * Get the NaN policy.
	 *
	 * @return the policy.
	 */
	NanPolicy getNanPolicy()
	{
		return this.nan_policy;
	}

	/**
	 * Compute the normalized key of the specified element.
	 *
	 * @param element the element.
	 * @return the key, never <code>null</code> and never NaN.
	 * @throws InvalidValueException If no usable key can be computed.
	 */
	Object computeKey(final TElement element)
		throws InvalidValueException
	{
		Object raw;
		try
		{
			raw = this.key_function.key(element);
		}
		catch (final InvalidValueException ive)
		{
			throw ive;
		}
		catch (final RuntimeException re)
		{
			throw new InvalidValueException("key() failed for "
					+ EventAttributes.abbreviate(String.valueOf(element))
					+ ": " + re, re);
		}

		if (raw == null)
		{
			throw new InvalidValueException("key() returned null for "
					+ EventAttributes.abbreviate(String.valueOf(element)));
		}

		Object key = this.nan_policy.normalize(raw);
		if ((key instanceof Comparable) == false)
		{
			throw new InvalidValueException("key of "
					+ EventAttributes.abbreviate(String.valueOf(element))
					+ " is not comparable: " + key.getClass().getName());
		}

		return key;
	}

	/**
	 * Compare two elements by key.
	 *
	 * @param o1 the first element.
	 * @param o2 the second element.
	 * @return the natural-order comparison of their keys.
	 * @throws InvalidValueException If either key is unusable.
	 */
	public int compare(final TElement o1, final TElement o2)
		throws InvalidValueException
	{
		return compareKeys(this.computeKey(o1), this.computeKey(o2));
	}

	/**
	 * Compare two normalized keys by natural order.
	 *
	 * @param k1 the first key.
	 * @param k2 the second key.
	 * @return the comparison.
	 * @throws InvalidValueException If the keys are not mutually comparable.
	 */
	@SuppressWarnings("unchecked")
	static int compareKeys(final Object k1, final Object k2)
		throws InvalidValueException
	{
		try
		{
			return ((Comparable<Object>) k1).compareTo(k2);
		}
		catch (final ClassCastException cce)
		{
			throw new InvalidValueException("keys are not mutually comparable: "
					+ k1.getClass().getName() + " vs "
					+ k2.getClass().getName(), cce);
		}
	}

}
