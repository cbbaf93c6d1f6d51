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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the size-bounded attribute snapshots handed to a
 * {@link HeapObserver}.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
final class EventAttributes
	extends Object
{

	/**
	 * Longest string form kept verbatim ({@value}).
	 */
	static final int MAX_LENGTH = 200;

	/**
	 * Appended to truncated values.
	 */
	static final String ELLIPSIS = "…";

	/**
	 * Build an unmodifiable snapshot from alternating names and values.
	 * <p>
	 * A value whose string form exceeds {@link #MAX_LENGTH} characters is
	 * replaced by its truncated string form; other values are kept as-is.
	 *
	 * @param namesAndValues name, value, name, value...
	 * @return the snapshot.
	 * @throws IllegalArgumentException If an odd number of arguments is given.
	 */
	static Map<String, Object> of(final Object... namesAndValues)
		throws IllegalArgumentException
	{
		if ((namesAndValues.length % 2) != 0)
		{
			throw new IllegalArgumentException("Odd number of arguments");
		}

		Map<String, Object> map = new LinkedHashMap<String, Object>();
		for (int index = 0; index < namesAndValues.length; index += 2)
		{
			map.put(String.valueOf(namesAndValues[index]),
					compact(namesAndValues[index + 1]));
		}

		return Collections.unmodifiableMap(map);
	}

	/**
	 * Compact a single attribute value.
	 *
	 * @param value the value.
	 * @return <code>value</code>, or its truncated string form.
	 */
	static Object compact(final Object value)
	{
		String str = String.valueOf(value);
		if (str.length() > MAX_LENGTH)
		{
			return abbreviate(str);
		}

		return value;
	}

	/**
	 * Truncate a string to {@link #MAX_LENGTH} characters plus an ellipsis.
	 *
	 * @param str the string.
	 * @return the abbreviated string.
	 */
	static String abbreviate(final String str)
	{
		if (str.length() <= MAX_LENGTH)
		{
			return str;
		}

		return str.substring(0, MAX_LENGTH) + ELLIPSIS;
	}

	/**
	 * Not instantiable.
	 */
	private EventAttributes()
	{
		super();
	}

}
