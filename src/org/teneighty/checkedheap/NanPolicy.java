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
 * How a floating point NaN key is treated before comparison.
 * <p>
 * Only <code>Double</code> and <code>Float</code> keys can be NaN; coerced
 * keys keep their boxed type, so a <code>Float</code> NaN becomes a
 * <code>Float</code> infinity.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public enum NanPolicy
{

	/**
	 * NaN keys are rejected with an {@link InvalidValueException}.
	 */
	RAISE,

	/**
	 * NaN keys compare as negative infinity.
	 */
	COERCE_TO_MIN,

	/**
	 * NaN keys compare as positive infinity.
	 */
	COERCE_TO_MAX;

	/**
	 * Normalize the specified key.
	 *
	 * @param key the raw key.
	 * @return the key to compare with; <code>key</code> itself unless it is
	 *         NaN.
	 * @throws InvalidValueException If <code>key</code> is NaN and this
	 *             policy is {@link #RAISE}.
	 */
	public Object normalize(final Object key)
		throws InvalidValueException
	{
		if (key instanceof Double && ((Double) key).isNaN())
		{
			switch (this)
			{
				case COERCE_TO_MIN:
					return Double.valueOf(Double.NEGATIVE_INFINITY);
				case COERCE_TO_MAX:
					return Double.valueOf(Double.POSITIVE_INFINITY);
				default:
					throw new InvalidValueException(
							"NaN key is not allowed (nan policy RAISE)");
			}
		}

		if (key instanceof Float && ((Float) key).isNaN())
		{
			switch (this)
			{
				case COERCE_TO_MIN:
					return Float.valueOf(Float.NEGATIVE_INFINITY);
				case COERCE_TO_MAX:
					return Float.valueOf(Float.POSITIVE_INFINITY);
				default:
					throw new InvalidValueException(
							"NaN key is not allowed (nan policy RAISE)");
			}
		}

		return key;
	}

}
