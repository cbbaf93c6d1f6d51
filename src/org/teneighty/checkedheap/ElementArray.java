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

import java.util.ArrayList;
import java.util.List;

/**
 * The backing store of a {@link BinaryHeap}: a 0-based growable array with an
 * optional undo journal.
 * <p>
 * While a journal is open, every structural change (set, swap, append,
 * remove-last, clear) records enough information to be reversed. Calling
 * {@link #rollback()} replays the journal backwards and restores the array to
 * the exact state it had when {@link #beginJournal()} was called. The cost of
 * a rollback is proportional to the number of changes made, not to the size
 * of the array, so a failed push or pop stays logarithmic.
 * <p>
 * Capacity doubles when full and halves when less than a quarter used, but
 * never drops below the recommended capacity given at construction.
 *
 * @param <TElement> the element type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
final class ElementArray<TElement>
	extends Object
{

	/**
	 * Backing array of elements.
	 */
	private Object[] data;

	/**
	 * Number of live elements.
	 */
	private int size;

	/**
	 * Recommended (minimum) capacity.
	 */
	private final int rec_capacity;

	/**
	 * The undo journal, or <code>null</code> if none is open.
	 */
	private List<Undo> journal;

	/**
	 * Constructor.
	 *
	 * @param cap the initial (and minimum) capacity.
	 * @throws IllegalArgumentException If <code>cap</code> &lt; 0.
	 */
	ElementArray(final int cap)
		throws IllegalArgumentException
	{
		super();

		if (cap < 0)
		{
			throw new IllegalArgumentException("Invalid initial capacity");
		}

		this.rec_capacity = Math.max(1, cap);
		this.data = new Object[this.rec_capacity];
		this.size = 0;
		this.journal = null;
	}

	/**
	 * Get the number of live elements.
	 *
	 * @return the size.
	 */
	int size()
	{
		return this.size;
	}

	/**
	 * Get the capacity of this array.
	 *
	 * @return the capacity.
	 */
	int capacity()
	{
		return this.data.length;
	}

	/**
	 * Get the element at the specified index.
	 *
	 * @param index the index to get.
	 * @return the element at <code>index</code>.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	@SuppressWarnings("unchecked")
	TElement get(final int index)
	{
		this.checkIndex(index);
		return (TElement) this.data[index];
	}

	/**
	 * Set the value at the specified index.
	 *
	 * @param index the index.
	 * @param val the new value.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	void set(final int index, final TElement val)
	{
		this.checkIndex(index);

		if (this.journal != null)
		{
			this.journal.add(new Undo(Undo.SET, index, this.data[index]));
		}

		this.data[index] = val;
	}

	/**
	 * Exchange the elements at the two indices.
	 *
	 * @param i the first index.
	 * @param j the second index.
	 * @throws IndexOutOfBoundsException If either index is out of bounds.
	 */
	void swap(final int i, final int j)
	{
		this.checkIndex(i);
		this.checkIndex(j);

		if (this.journal != null)
		{
			this.journal.add(new Undo(Undo.SWAP, i, Integer.valueOf(j)));
		}

		Object tmp = this.data[i];
		this.data[i] = this.data[j];
		this.data[j] = tmp;
	}

	/**
	 * Append an element at the end.
	 *
	 * @param val the element.
	 */
	void add(final TElement val)
	{
		this.ensureCapacityUp(this.size + 1);

		if (this.journal != null)
		{
			this.journal.add(new Undo(Undo.ADD, this.size, null));
		}

		this.data[this.size++] = val;
	}

	/**
	 * Remove and return the last element.
	 *
	 * @return the former last element.
	 * @throws IndexOutOfBoundsException If this array is empty.
	 */
	@SuppressWarnings("unchecked")
	TElement removeLast()
	{
		if (this.size == 0)
		{
			throw new IndexOutOfBoundsException("removeLast on empty array");
		}

		TElement last = (TElement) this.data[--this.size];
		this.data[this.size] = null;

		if (this.journal != null)
		{
			this.journal.add(new Undo(Undo.REMOVE_LAST, this.size, last));
		}

		this.ensureCapacityDown();
		return last;
	}

	/**
	 * Remove every element.
	 */
	void clear()
	{
		if (this.journal != null)
		{
			this.journal.add(new Undo(Undo.CLEAR, this.size, this.toArray()));
		}

		this.size = 0;
		this.data = new Object[this.rec_capacity];
	}

	/**
	 * Copy the live elements into a new list, in index order.
	 *
	 * @return a fresh list.
	 */
	@SuppressWarnings("unchecked")
	List<TElement> toList()
	{
		List<TElement> list = new ArrayList<TElement>(this.size);
		for (int index = 0; index < this.size; index++)
		{
			list.add((TElement) this.data[index]);
		}

		return list;
	}

	/**
	 * Copy the live elements into a new array.
	 *
	 * @return a fresh array of length {@link #size()}.
	 */
	Object[] toArray()
	{
		Object[] copy = new Object[this.size];
		System.arraycopy(this.data, 0, copy, 0, this.size);
		return copy;
	}

	/**
	 * Start recording changes.
	 *
	 * @throws IllegalStateException If a journal is already open.
	 */
	void beginJournal()
	{
		if (this.journal != null)
		{
			throw new IllegalStateException("Journal already open");
		}

		this.journal = new ArrayList<Undo>();
	}

	/**
	 * Is a journal open?
	 *
	 * @return <code>true</code> if changes are being recorded.
	 */
	boolean isJournaling()
	{
		return (this.journal != null);
	}

	/**
	 * Stop recording and forget the recorded changes. Shrinking deferred
	 * while the journal was open happens now.
	 */
	void endJournal()
	{
		this.journal = null;
		this.ensureCapacityDown();
	}

	/**
	 * Undo every change recorded since {@link #beginJournal()} and close the
	 * journal.
	 *
	 * @return the number of changes undone.
	 * @throws IllegalStateException If no journal is open.
	 */
	int rollback()
	{
		if (this.journal == null)
		{
			throw new IllegalStateException("No journal open");
		}

		// Detach first, so the undo steps are not themselves recorded.
		List<Undo> undo = this.journal;
		this.journal = null;

		for (int index = undo.size() - 1; index >= 0; index--)
		{
			Undo step = undo.get(index);
			switch (step.kind)
			{
				case Undo.SET:
					this.data[step.index] = step.value;
					break;

				case Undo.SWAP:
					int other = ((Integer) step.value).intValue();
					Object tmp = this.data[step.index];
					this.data[step.index] = this.data[other];
					this.data[other] = tmp;
					break;

				case Undo.ADD:
					this.data[--this.size] = null;
					break;

				case Undo.REMOVE_LAST:
					this.ensureCapacityUp(this.size + 1);
					this.data[this.size++] = step.value;
					break;

				case Undo.CLEAR:
					Object[] saved = (Object[]) step.value;
					this.data = new Object[Math.max(this.rec_capacity,
							saved.length)];
					System.arraycopy(saved, 0, this.data, 0, saved.length);
					this.size = saved.length;
					break;

				default:
					throw new IllegalStateException("Unknown undo kind "
							+ step.kind);
			}
		}

		return undo.size();
	}

	/**
	 * Make sure the backing array holds at least <code>needed</code> slots.
	 *
	 * @param needed the required capacity.
	 */
	private void ensureCapacityUp(final int needed)
	{
		if (needed > this.data.length)
		{
			int new_capacity = Math.max(needed, this.data.length * 2);
			Object[] new_data = new Object[new_capacity];
			System.arraycopy(this.data, 0, new_data, 0, this.size);
			this.data = new_data;
		}
	}

	/**
	 * Shrink the backing array if it is mostly empty.
	 */
	private void ensureCapacityDown()
	{
		if (this.journal != null)
		{
			// Deferred to endJournal().
			return;
		}

		int new_capacity = this.data.length;
		while (this.size < (new_capacity / 4)
				&& (new_capacity / 2) >= this.rec_capacity)
		{
			new_capacity /= 2;
		}

		if (new_capacity != this.data.length)
		{
			Object[] new_data = new Object[new_capacity];
			System.arraycopy(this.data, 0, new_data, 0, this.size);
			this.data = new_data;
		}
	}

	/**
	 * Bounds check against the live size.
	 *
	 * @param index the index.
	 * @throws IndexOutOfBoundsException If out of bounds.
	 */
	private void checkIndex(final int index)
	{
		if (index < 0 || index >= this.size)
		{
			throw new IndexOutOfBoundsException("Index: " + index + ", Size: "
					+ this.size);
		}
	}

	/**
	 * One journal record.
	 *
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class Undo
		extends Object
	{

		static final int SET = 0;

		static final int SWAP = 1;

		static final int ADD = 2;

		static final int REMOVE_LAST = 3;

		static final int CLEAR = 4;

		/**
		 * What kind of change.
		 */
		final int kind;

		/**
		 * The index touched.
		 */
		final int index;

		/**
		 * Previous value, swap partner, or saved contents, depending on kind.
		 */
		final Object value;

		/**
		 * Constructor.
		 *
		 * @param kind the kind.
		 * @param index the index.
		 * @param value the saved value.
		 */
		Undo(final int kind, final int index, final Object value)
		{
			super();

			this.kind = kind;
			this.index = index;
			this.value = value;
		}

	}

}
