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
 * The events a {@link BinaryHeap} reports to its {@link HeapObserver}.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public enum HeapEvent
{

	INSERT_START("insert_start"),

	INSERT("insert"),

	PUSH_DONE("push_done"),

	INSERT_ERROR("insert_error"),

	POP_START("pop_start"),

	POP_EMPTY("pop_empty"),

	POP_ROOT("pop_root"),

	MOVE("move"),

	POP_DONE("pop_done"),

	POP_ERROR("pop_error"),

	CLEAR("clear"),

	EXTEND("extend"),

	HEAPIFY_DONE("heapify_done"),

	TOGGLE_MODE("toggle_mode"),

	SET_MODE("set_mode"),

	REMOVE_VALUE("remove_value"),

	REMOVE_AT("remove_at"),

	/**
	 * Fired once per pairwise comparison inside a sift.
	 */
	COMPARE("compare"),

	/**
	 * Fired once per exchange inside a sift.
	 */
	SWAP("swap"),

	REPLACE_ROOT("replace_root"),

	MERGE("merge");

	/**
	 * The wire name.
	 */
	private final String name;

	/**
	 * Constructor.
	 *
	 * @param name the wire name.
	 */
	private HeapEvent(final String name)
	{
		this.name = name;
	}

	/**
	 * Get the canonical, lower case name of this event.
	 *
	 * @return the name, e.g. <code>"pop_root"</code>.
	 */
	public String getName()
	{
		return this.name;
	}

	/**
	 * Find the event with the specified canonical name.
	 *
	 * @param name the name.
	 * @return the event.
	 * @throws IllegalArgumentException If no event has that name.
	 */
	public static HeapEvent forName(final String name)
		throws IllegalArgumentException
	{
		for (HeapEvent event : values())
		{
			if (event.name.equals(name))
			{
				return event;
			}
		}

		throw new IllegalArgumentException("Unknown heap event: " + name);
	}

	/**
	 * Same as {@link #getName()}.
	 *
	 * @return the name.
	 */
	@Override
	public String toString()
	{
		return this.name;
	}

}
