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
import java.util.Collections;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A self-verifying, instrumented binary heap.
 * <p>
 * Elements are kept in a complete binary tree laid out in an array: the root
 * sits at index 0, the children of index <code>i</code> at
 * <code>2i+1</code> and <code>2i+2</code>, its parent at
 * <code>(i-1)/2</code>. Every parent is <i>preferred-or-equal</i> to its
 * children, where preference is decided by a single predicate built from
 * <ul>
 * <li>the {@link OrderMode} (smallest or largest key at the root),</li>
 * <li>a {@link KeyFunction} projecting each element onto a comparable key
 * (the element itself by default), and</li>
 * <li>a {@link NanPolicy} deciding what a floating point NaN key means.</li>
 * </ul>
 * <p>
 * Every structural step is reported to an optional {@link HeapObserver}:
 * each pairwise comparison and exchange made while sifting, as well as the
 * start and end of every operation. Observers are called synchronously and
 * their failures are logged and ignored.
 * <p>
 * Mutating methods are guarded:
 * <ul>
 * <li>A mutating call made while another one is in progress (that is, from
 * inside an observer callback) fails immediately with a
 * {@link ReentrantMutationException}, without touching the heap.</li>
 * <li>If an operation fails half way, say because the key function threw for
 * one element, every change it made is undone before the exception is
 * rethrown. Callers see either the full effect or none of it.</li>
 * <li>Every <code>verifySampleRate</code> completed operations the whole tree
 * is checked, and an {@link InvariantViolationError} is thrown if the heap
 * property does not hold.</li>
 * </ul>
 * <p>
 * Query methods ({@link #toList()}, {@link #nlargest(int)}, ...) return
 * copies; the backing array is never exposed. The iterator is
 * <i>fail-fast</i>: it throws a {@link ConcurrentModificationException} once
 * the heap has completed any mutating operation after the iterator was
 * created.
 * <p>
 * Null elements are not permitted, so a <code>null</code> return from
 * {@link #pop()} or {@link #peek()} always means the heap is empty.
 * <p>
 * This class is not synchronized (by choice). You must ensure sequential
 * access externally, for example by holding one lock per heap instance.
 *
 * @param <TElement> the element type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class BinaryHeap<TElement>
	extends Object
	implements Iterable<TElement>
{

	/**
	 * The logger.
	 */
	private static final Logger log = LoggerFactory.getLogger(BinaryHeap.class);

	/**
	 * The default minimum array size (capacity) of any binary heap ({@value} ).
	 */
	private static final int DEFAULT_HEAP_CAPACITY = 16;

	/**
	 * The array of elements.
	 */
	private final ElementArray<TElement> heap;

	/**
	 * Current order mode.
	 */
	private OrderMode mode;

	/**
	 * Key computation and comparison.
	 */
	private final KeyComparator<TElement> comp;

	/**
	 * Event sink, or <code>null</code>.
	 */
	private HeapObserver observer;

	/**
	 * Run a full check every this many operations; 0 disables.
	 */
	private int verify_sample_rate;

	/**
	 * True while a mutating operation runs.
	 */
	private boolean mutating;

	/**
	 * Name of the operation holding the guard.
	 */
	private String mutating_op;

	/**
	 * The failure the running operation was rolled back for, if any.
	 */
	private Throwable failure;

	/**
	 * Completed mutating operations.
	 */
	private long op_count;

	/**
	 * The mod count, for the iterator.
	 */
	private volatile int mod_count;

	/**
	 * Constructor.
	 * <p>
	 * Creates an empty min-heap ordered by the elements' <i>natural
	 * ordering</i>. Elements must implement <code>Comparable</code> and be
	 * mutually comparable.
	 */
	public BinaryHeap()
	{
		this(OrderMode.MIN);
	}

	/**
	 * Constructor.
	 * <p>
	 * Creates an empty min-heap ordered by the elements' <i>natural
	 * ordering</i>, with the specified initial capacity.
	 *
	 * @param initial_capacity the initial capacity of this heap.
	 * @throws IllegalArgumentException If <code>initial_capacity</code> &lt; 0.
	 */
	public BinaryHeap(final int initial_capacity)
		throws IllegalArgumentException
	{
		this(OrderMode.MIN, null, NanPolicy.RAISE, 0, null, null,
				initial_capacity);
	}

	/**
	 * Constructor.
	 * <p>
	 * Elements are ordered by their <i>natural ordering</i>.
	 *
	 * @param mode the order mode.
	 * @throws NullPointerException If <code>mode</code> is <code>null</code>.
	 */
	public BinaryHeap(final OrderMode mode)
		throws NullPointerException
	{
		this(mode, null);
	}

	/**
	 * Constructor.
	 *
	 * @param mode the order mode.
	 * @param key_function the key function. A <code>null</code> means the
	 *            elements' natural ordering will be used.
	 * @throws NullPointerException If <code>mode</code> is <code>null</code>.
	 */
	public BinaryHeap(final OrderMode mode,
			final KeyFunction<? super TElement, ?> key_function)
		throws NullPointerException
	{
		this(mode, key_function, NanPolicy.RAISE);
	}

	/**
	 * Constructor.
	 *
	 * @param mode the order mode.
	 * @param key_function the key function, or <code>null</code> for natural
	 *            ordering.
	 * @param nan_policy the NaN policy.
	 * @throws NullPointerException If <code>mode</code> or
	 *             <code>nan_policy</code> is <code>null</code>.
	 */
	public BinaryHeap(final OrderMode mode,
			final KeyFunction<? super TElement, ?> key_function,
			final NanPolicy nan_policy)
		throws NullPointerException
	{
		this(mode, key_function, nan_policy, 0, null, null);
	}

	/**
	 * Constructor.
	 * <p>
	 * If <code>items</code> is given, the heap is built from them with a
	 * single linear-time rebuild. The build is reported to
	 * <code>observer</code> but is not counted as an operation.
	 *
	 * @param mode the order mode.
	 * @param key_function the key function, or <code>null</code> for natural
	 *            ordering.
	 * @param nan_policy the NaN policy.
	 * @param verify_sample_rate run a full invariant check every this many
	 *            operations; 0 disables the check.
	 * @param observer the event sink; may be <code>null</code>.
	 * @param items initial contents; may be <code>null</code>.
	 * @throws NullPointerException If <code>mode</code>,
	 *             <code>nan_policy</code> or any item is <code>null</code>.
	 * @throws IllegalArgumentException If <code>verify_sample_rate</code>
	 *             &lt; 0.
	 * @throws InvalidValueException If the key of an item cannot be computed.
	 */
	public BinaryHeap(final OrderMode mode,
			final KeyFunction<? super TElement, ?> key_function,
			final NanPolicy nan_policy, final int verify_sample_rate,
			final HeapObserver observer,
			final Iterable<? extends TElement> items)
		throws NullPointerException, IllegalArgumentException,
		InvalidValueException
	{
		this(mode, key_function, nan_policy, verify_sample_rate, observer,
				items, DEFAULT_HEAP_CAPACITY);
	}

	/**
	 * The master constructor.
	 *
	 * @param mode the order mode.
	 * @param key_function the key function, or <code>null</code>.
	 * @param nan_policy the NaN policy.
	 * @param verify_sample_rate the self-check rate.
	 * @param observer the observer, or <code>null</code>.
	 * @param items initial contents, or <code>null</code>.
	 * @param initial_capacity the initial capacity.
	 */
	private BinaryHeap(final OrderMode mode,
			final KeyFunction<? super TElement, ?> key_function,
			final NanPolicy nan_policy, final int verify_sample_rate,
			final HeapObserver observer,
			final Iterable<? extends TElement> items,
			final int initial_capacity)
	{
		super();

		if (mode == null || nan_policy == null)
		{
			throw new NullPointerException();
		}

		if (verify_sample_rate < 0)
		{
			throw new IllegalArgumentException("Invalid verify sample rate");
		}

		KeyFunction<? super TElement, ?> key = key_function;
		if (key == null)
		{
			key = BinaryHeap.<TElement> identity();
		}

		this.mode = mode;
		this.comp = new KeyComparator<TElement>(key, nan_policy);
		this.verify_sample_rate = verify_sample_rate;
		this.observer = observer;
		this.heap = new ElementArray<TElement>(initial_capacity);
		this.mutating = false;
		this.op_count = 0;
		this.mod_count = 0;

		if (items != null)
		{
			for (TElement item : items)
			{
				if (item == null)
				{
					throw new NullPointerException("null item");
				}

				this.heap.add(item);
			}

			// Observers cannot mutate us while we build.
			this.mutating = true;
			this.mutating_op = "construct";
			try
			{
				this.rebuild();
			}
			finally
			{
				this.mutating = false;
				this.mutating_op = null;
			}
		}
	}

	/**
	 * Get the default key function, typed for this heap.
	 *
	 * @param <E> the element type.
	 * @return an identity key function.
	 */
	@SuppressWarnings({ "unchecked", "rawtypes" })
	private static <E> KeyFunction<? super E, ?> identity()
	{
		return new IdentityKeyFunction();
	}

	/**
	 * Get the size.
	 *
	 * @return the number of elements.
	 */
	public int size()
	{
		return this.heap.size();
	}

	/**
	 * Is this heap empty?
	 *
	 * @return <code>true</code> if it holds no elements.
	 */
	public boolean isEmpty()
	{
		return (this.heap.size() == 0);
	}

	/**
	 * Get the capacity of the backing array.
	 *
	 * @return the capacity.
	 */
	public int getCapacity()
	{
		return this.heap.capacity();
	}

	/**
	 * Get the order mode.
	 *
	 * @return the mode.
	 */
	public OrderMode getOrderMode()
	{
		return this.mode;
	}

	/**
	 * Get the key function. For a heap created without one this is an
	 * {@link IdentityKeyFunction}.
	 *
	 * @return the key function.
	 */
	public KeyFunction<? super TElement, ?> getKeyFunction()
	{
		return this.comp.getKeyFunction();
	}

	/**
	 * Get the NaN policy.
	 *
	 * @return the policy.
	 */
	public NanPolicy getNanPolicy()
	{
		return this.comp.getNanPolicy();
	}

	/**
	 * Get the observer.
	 *
	 * @return the observer or <code>null</code>.
	 */
	public HeapObserver getObserver()
	{
		return this.observer;
	}

	/**
	 * Set (or remove, with <code>null</code>) the observer.
	 *
	 * @param observer the new observer.
	 */
	public void setObserver(final HeapObserver observer)
	{
		this.observer = observer;
	}

	/**
	 * Get the self-check rate.
	 *
	 * @return the rate; 0 means disabled.
	 */
	public int getVerifySampleRate()
	{
		return this.verify_sample_rate;
	}

	/**
	 * Set the self-check rate.
	 *
	 * @param verify_sample_rate run a full check every this many operations;
	 *            0 disables it.
	 * @throws IllegalArgumentException If <code>verify_sample_rate</code>
	 *             &lt; 0.
	 */
	public void setVerifySampleRate(final int verify_sample_rate)
		throws IllegalArgumentException
	{
		if (verify_sample_rate < 0)
		{
			throw new IllegalArgumentException("Invalid verify sample rate");
		}

		this.verify_sample_rate = verify_sample_rate;
	}

	/**
	 * Get the number of completed mutating operations, including failed
	 * ones.
	 *
	 * @return the count.
	 */
	public long getOperationCount()
	{
		return this.op_count;
	}

	/**
	 * Add an element.
	 * <p>
	 * The element's key is computed before anything is changed, so an
	 * unusable key leaves the heap untouched.
	 *
	 * @param value the element.
	 * @throws NullPointerException If <code>value</code> is <code>null</code>.
	 * @throws InvalidValueException If the key of <code>value</code> (or of an
	 *             element it is compared against) cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void push(final TElement value)
		throws NullPointerException, InvalidValueException,
		ReentrantMutationException
	{
		if (value == null)
		{
			throw new NullPointerException();
		}

		this.acquire("push");
		try
		{
			this.pushInternal(value);
		}
		catch (final RuntimeException re)
		{
			this.rollback("push", re);
			this.fire(HeapEvent.INSERT_ERROR, "value", value, "error", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("push", er);
			this.fire(HeapEvent.INSERT_ERROR, "value", value, "error", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Remove and return the root.
	 *
	 * @return the root, or <code>null</code> if this heap is empty.
	 * @throws InvalidValueException If a key cannot be computed while sifting.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public TElement pop()
		throws InvalidValueException, ReentrantMutationException
	{
		return this.pop(null);
	}

	/**
	 * Remove and return the root.
	 *
	 * @param defaultValue returned if this heap is empty.
	 * @return the root, or <code>defaultValue</code>.
	 * @throws InvalidValueException If a key cannot be computed while sifting.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public TElement pop(final TElement defaultValue)
		throws InvalidValueException, ReentrantMutationException
	{
		this.acquire("pop");
		try
		{
			int size = this.heap.size();
			if (size == 0)
			{
				this.fire(HeapEvent.POP_EMPTY, "size", 0);
				return defaultValue;
			}

			this.fire(HeapEvent.POP_START, "size", size);

			TElement root = this.heap.get(0);
			TElement last = this.heap.removeLast();
			this.fire(HeapEvent.POP_ROOT, "value", root, "size", size);

			if (this.heap.size() > 0)
			{
				this.heap.set(0, last);
				this.fire(HeapEvent.MOVE, "src", this.heap.size(), "dst", 0,
						"value", last);
				this.siftDown(0);
			}

			this.fire(HeapEvent.POP_DONE, "value", root, "size", this.heap
					.size());
			return root;
		}
		catch (final RuntimeException re)
		{
			this.rollback("pop", re);
			this.fire(HeapEvent.POP_ERROR, "error", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("pop", er);
			this.fire(HeapEvent.POP_ERROR, "error", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Get the root without removing it.
	 *
	 * @return the root, or <code>null</code> if this heap is empty.
	 */
	public TElement peek()
	{
		return this.peek(null);
	}

	/**
	 * Get the root without removing it.
	 *
	 * @param defaultValue returned if this heap is empty.
	 * @return the root, or <code>defaultValue</code>.
	 */
	public TElement peek(final TElement defaultValue)
	{
		return (this.heap.size() == 0) ? defaultValue : this.heap.get(0);
	}

	/**
	 * Remove every element.
	 *
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void clear()
		throws ReentrantMutationException
	{
		this.acquire("clear");
		try
		{
			int count = this.heap.size();
			if (count > 0)
			{
				this.heap.clear();
			}

			this.fire(HeapEvent.CLEAR, "count", count);
		}
		catch (final RuntimeException re)
		{
			this.rollback("clear", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("clear", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Add a batch of elements.
	 * <p>
	 * <code>items</code> is copied first. A <code>null</code> or empty batch
	 * does nothing, a single item is simply pushed, and a larger batch is
	 * appended and followed by one linear-time rebuild. If any key in the
	 * batch cannot be computed, none of the batch is added.
	 *
	 * @param items the elements; may be <code>null</code>.
	 * @throws NullPointerException If any item is <code>null</code>.
	 * @throws InvalidValueException If any key cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void extend(final Iterable<? extends TElement> items)
		throws NullPointerException, InvalidValueException,
		ReentrantMutationException
	{
		if (items == null)
		{
			return;
		}

		List<TElement> batch = new ArrayList<TElement>();
		for (TElement item : items)
		{
			if (item == null)
			{
				throw new NullPointerException("null item");
			}

			batch.add(item);
		}

		if (batch.isEmpty())
		{
			return;
		}

		this.acquire("extend");
		try
		{
			if (batch.size() == 1)
			{
				this.pushInternal(batch.get(0));
			}
			else
			{
				for (TElement item : batch)
				{
					this.comp.computeKey(item);
				}

				for (TElement item : batch)
				{
					this.heap.add(item);
				}

				this.rebuild();
				this.fire(HeapEvent.EXTEND, "count", batch.size());
			}
		}
		catch (final RuntimeException re)
		{
			this.rollback("extend", re);
			this.fire(HeapEvent.INSERT_ERROR, "error", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("extend", er);
			this.fire(HeapEvent.INSERT_ERROR, "error", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Rebuild the heap from scratch in linear time.
	 *
	 * @throws InvalidValueException If a key cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void heapify()
		throws InvalidValueException, ReentrantMutationException
	{
		this.acquire("heapify");
		try
		{
			this.rebuild();
		}
		catch (final RuntimeException re)
		{
			this.rollback("heapify", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("heapify", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Switch between min and max order and rebuild.
	 *
	 * @throws InvalidValueException If a key cannot be computed; the mode is
	 *             then left unchanged.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void toggleMode()
		throws InvalidValueException, ReentrantMutationException
	{
		this.changeMode("toggle_mode", HeapEvent.TOGGLE_MODE, this.mode
				.invert());
	}

	/**
	 * Set the order mode and rebuild.
	 * <p>
	 * Setting the current mode does nothing at all: no rebuild, no event,
	 * and no operation is counted.
	 *
	 * @param mode the new mode.
	 * @throws NullPointerException If <code>mode</code> is <code>null</code>.
	 * @throws InvalidValueException If a key cannot be computed; the mode is
	 *             then left unchanged.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void setMode(final OrderMode mode)
		throws NullPointerException, InvalidValueException,
		ReentrantMutationException
	{
		if (mode == null)
		{
			throw new NullPointerException();
		}

		if (mode == this.mode)
		{
			return;
		}

		this.changeMode("set_mode", HeapEvent.SET_MODE, mode);
	}

	/**
	 * Remove the first element equal to <code>value</code>.
	 *
	 * @param value the value to remove.
	 * @return the number removed, 0 or 1.
	 * @throws ReentrantMutationException If called from an observer.
	 * @see #remove(Object, boolean)
	 */
	public int remove(final Object value)
		throws ReentrantMutationException
	{
		return this.remove(value, false);
	}

	/**
	 * Remove elements equal to <code>value</code>.
	 * <p>
	 * Storage is scanned in index order, comparing with
	 * <code>value.equals(element)</code>. Each match is replaced by the last
	 * element, which is then sifted into place; the replacement is checked
	 * again at the same index before the scan moves on.
	 *
	 * @param value the value to remove.
	 * @param all remove every match if <code>true</code>, only the first one
	 *            otherwise.
	 * @return the number of elements removed.
	 * @throws InvalidValueException If a key cannot be computed while sifting.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public int remove(final Object value, final boolean all)
		throws InvalidValueException, ReentrantMutationException
	{
		this.acquire("remove");
		try
		{
			int removed = 0;
			if (value != null)
			{
				int index = 0;
				while (index < this.heap.size())
				{
					if (value.equals(this.heap.get(index)))
					{
						this.removeAtInternal(index);
						removed += 1;

						if (all == false)
						{
							break;
						}
					}
					else
					{
						index += 1;
					}
				}
			}

			if (removed > 0)
			{
				this.fire(HeapEvent.REMOVE_VALUE, "value", value, "count",
						removed);
			}

			return removed;
		}
		catch (final RuntimeException re)
		{
			this.rollback("remove", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("remove", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Remove the element at the specified storage index.
	 *
	 * @param index the index, in level order.
	 * @return the removed element, or <code>null</code> if <code>index</code>
	 *         is out of range (in which case nothing happens).
	 * @throws InvalidValueException If a key cannot be computed while sifting.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public TElement removeAt(final int index)
		throws InvalidValueException, ReentrantMutationException
	{
		this.acquire("remove_at");
		try
		{
			if (index < 0 || index >= this.heap.size())
			{
				return null;
			}

			return this.removeAtInternal(index);
		}
		catch (final RuntimeException re)
		{
			this.rollback("remove_at", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("remove_at", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Push <code>value</code> and pop the root, in one step.
	 * <p>
	 * Storage never grows: if this heap is empty, or <code>value</code> is
	 * strictly preferred over the root, then <code>value</code> itself is
	 * returned and nothing changes. Otherwise, ties included,
	 * <code>value</code> replaces the root and the old root is returned.
	 *
	 * @param value the element to push.
	 * @return the element popped.
	 * @throws NullPointerException If <code>value</code> is <code>null</code>.
	 * @throws InvalidValueException If a key cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public TElement pushPop(final TElement value)
		throws NullPointerException, InvalidValueException,
		ReentrantMutationException
	{
		if (value == null)
		{
			throw new NullPointerException();
		}

		this.acquire("pushpop");
		try
		{
			this.comp.computeKey(value);

			// Ties go into the heap, as they would after push then pop.
			if (this.heap.size() == 0
					|| this.prefer(value, this.heap.get(0)))
			{
				return value;
			}

			return this.replaceRoot(value);
		}
		catch (final RuntimeException re)
		{
			this.rollback("pushpop", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("pushpop", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Pop the root and push <code>value</code>, in one step.
	 * <p>
	 * Unlike {@link #pushPop(Object)}, the old root is returned even if
	 * <code>value</code> is preferred over it.
	 *
	 * @param value the new element.
	 * @return the old root.
	 * @throws NullPointerException If <code>value</code> is <code>null</code>.
	 * @throws EmptyHeapException If this heap is empty; use
	 *             {@link #push(Object)} instead.
	 * @throws InvalidValueException If a key cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public TElement replace(final TElement value)
		throws NullPointerException, EmptyHeapException,
		InvalidValueException, ReentrantMutationException
	{
		if (value == null)
		{
			throw new NullPointerException();
		}

		this.acquire("replace");
		try
		{
			if (this.heap.size() == 0)
			{
				throw new EmptyHeapException(
						"replace() on an empty heap; use push()");
			}

			this.comp.computeKey(value);
			return this.replaceRoot(value);
		}
		catch (final RuntimeException re)
		{
			this.rollback("replace", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("replace", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Add every element of <code>other</code> to this heap.
	 * <p>
	 * Both heaps must have the same order mode, NaN policy and an equal key
	 * function. <code>other</code> is not modified.
	 *
	 * @param other the heap to merge in.
	 * @throws NullPointerException If <code>other</code> is <code>null</code>.
	 * @throws IllegalArgumentException If <code>other</code> is this heap.
	 * @throws IncompatibleHeapsException If the configurations differ.
	 * @throws InvalidValueException If a key cannot be computed.
	 * @throws ReentrantMutationException If called from an observer.
	 */
	public void merge(final BinaryHeap<? extends TElement> other)
		throws NullPointerException, IllegalArgumentException,
		IncompatibleHeapsException, InvalidValueException,
		ReentrantMutationException
	{
		if (other == null)
		{
			throw new NullPointerException();
		}

		if (other == this)
		{
			throw new IllegalArgumentException("Cannot merge a heap with itself");
		}

		this.acquire("merge");
		try
		{
			if (other.mode != this.mode)
			{
				throw new IncompatibleHeapsException("Order mode differs: "
						+ this.mode + " vs " + other.mode);
			}

			if (other.getNanPolicy() != this.getNanPolicy())
			{
				throw new IncompatibleHeapsException("NaN policy differs: "
						+ this.getNanPolicy() + " vs " + other.getNanPolicy());
			}

			if (other.getKeyFunction().equals(this.getKeyFunction()) == false)
			{
				throw new IncompatibleHeapsException("Key function differs: "
						+ this.getKeyFunction() + " vs "
						+ other.getKeyFunction());
			}

			List<? extends TElement> items = other.heap.toList();
			if (items.isEmpty())
			{
				return;
			}

			for (TElement item : items)
			{
				this.heap.add(item);
			}

			this.rebuild();
			this.fire(HeapEvent.MERGE, "count", items.size());
		}
		catch (final RuntimeException re)
		{
			this.rollback("merge", re);
			throw re;
		}
		catch (final Error er)
		{
			this.rollback("merge", er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Get the <code>n</code> most preferred elements, most preferred first:
	 * smallest keys first for a min-heap, largest first for a max-heap.
	 * <p>
	 * This sorts a copy of the whole heap; it is meant for diagnostics rather
	 * than hot paths. Elements with equal keys keep their level order.
	 *
	 * @param n how many elements to return.
	 * @return a new list of at most <code>n</code> elements; empty if
	 *         <code>n</code> &lt;= 0.
	 * @throws InvalidValueException If a key cannot be computed.
	 */
	public List<TElement> nlargest(final int n)
		throws InvalidValueException
	{
		if (n <= 0)
		{
			return new ArrayList<TElement>();
		}

		List<TElement> sorted = this.heap.toList();
		Collections.sort(sorted, new Comparator<TElement>()
		{

			public int compare(final TElement a, final TElement b)
			{
				if (BinaryHeap.this.prefer(a, b))
				{
					return -1;
				}

				return BinaryHeap.this.prefer(b, a) ? 1 : 0;
			}

		});

		return new ArrayList<TElement>(sorted.subList(0, Math.min(n, sorted
				.size())));
	}

	/**
	 * Does the heap property hold everywhere?
	 *
	 * @return <code>true</code> if every parent is preferred-or-equal to its
	 *         children.
	 * @throws InvalidValueException If a key cannot be computed.
	 */
	public boolean isValidHeap()
		throws InvalidValueException
	{
		return (this.findViolation() == null);
	}

	/**
	 * Check the heap property everywhere.
	 *
	 * @throws InvariantViolationError If some child is preferred over its
	 *             parent; the message names both indices and values.
	 * @throws InvalidValueException If a key cannot be computed.
	 */
	public void assertValid()
		throws InvariantViolationError, InvalidValueException
	{
		InvariantViolationError violation = this.findViolation();
		if (violation != null)
		{
			throw violation;
		}
	}

	/**
	 * Get the number of levels in the tree.
	 *
	 * @return <code>floor(log2(size)) + 1</code>, or 0 if empty.
	 */
	public int depth()
	{
		int n = this.heap.size();
		return (n == 0) ? 0 : (Integer.SIZE - Integer.numberOfLeadingZeros(n));
	}

	/**
	 * Is every level of the tree full?
	 *
	 * @return <code>true</code> if the size is <code>2^h - 1</code> for some
	 *         <code>h &gt;= 0</code>.
	 */
	public boolean isPerfect()
	{
		int n = this.heap.size();
		return ((n & (n + 1)) == 0);
	}

	/**
	 * Get a snapshot of the shape and configuration of this heap.
	 *
	 * @return the stats.
	 */
	public HeapStats getStats()
	{
		return new HeapStats(this.size(), this.depth(), this.isPerfect(),
				this.getCapacity(), this.mode, this.getNanPolicy(),
				this.op_count, this.verify_sample_rate);
	}

	/**
	 * Get the elements in level (storage) order.
	 *
	 * @return a new list.
	 */
	public List<TElement> toList()
	{
		return this.heap.toList();
	}

	/**
	 * Create an independent heap with the same configuration and the same
	 * storage order. The observer is not copied.
	 *
	 * @return the copy.
	 */
	public BinaryHeap<TElement> copy()
	{
		BinaryHeap<TElement> copy = new BinaryHeap<TElement>(this.mode, this
				.getKeyFunction(), this.getNanPolicy(),
				this.verify_sample_rate, null, null, Math.max(1, this.heap
						.size()));

		for (TElement item : this.heap.toList())
		{
			copy.heap.add(item);
		}

		return copy;
	}

	/**
	 * Get an iterator over the elements in level order.
	 *
	 * @return a fail-fast iterator.
	 */
	public Iterator<TElement> iterator()
	{
		return new ElementIterator();
	}

	/**
	 * Get a string like <code>&lt;MinHeap [1, 4, 2]&gt;</code>.
	 *
	 * @return a string.
	 */
	@Override
	public String toString()
	{
		return String.format("<%1$s %2$s>", (this.mode == OrderMode.MIN)
				? "MinHeap" : "MaxHeap", this.heap.toList());
	}

	/**
	 * Enter a mutating operation.
	 *
	 * @param op the operation name, for diagnostics.
	 * @throws ReentrantMutationException If another operation is running.
	 */
	private void acquire(final String op)
		throws ReentrantMutationException
	{
		if (this.mutating)
		{
			throw new ReentrantMutationException("Re-entrant heap mutation in '"
					+ op + "' while '" + this.mutating_op + "' is running");
		}

		this.mutating = true;
		this.mutating_op = op;
		this.heap.beginJournal();
	}

	/**
	 * Leave a mutating operation. Always called, even on failure; the sampled
	 * check is skipped when the operation was rolled back.
	 *
	 * @throws InvariantViolationError If the sampled check fails.
	 */
	private void release()
		throws InvariantViolationError
	{
		Throwable failed = this.failure;
		this.heap.endJournal();
		this.mutating = false;
		this.mutating_op = null;
		this.failure = null;
		this.op_count += 1;
		this.mod_count += 1;

		// A failed operation keeps its own exception.
		if (failed == null && this.verify_sample_rate > 0
				&& (this.op_count % this.verify_sample_rate) == 0)
		{
			InvariantViolationError violation = this.findViolation();
			if (violation != null)
			{
				log.error("Heap invariant broken after {} operations: {}",
						this.op_count, violation.getMessage());
				throw violation;
			}
		}
	}

	/**
	 * Undo everything the current operation changed.
	 *
	 * @param op the operation name.
	 * @param cause why.
	 */
	private void rollback(final String op, final Throwable cause)
	{
		this.failure = cause;
		int undone = this.heap.rollback();
		log.debug("Rolled back {} ({} changes) after {}", op, undone, cause
				.toString());
	}

	/**
	 * Report an event to the observer, if any.
	 *
	 * @param event the event.
	 * @param namesAndValues attribute names and values, alternating.
	 */
	private void fire(final HeapEvent event, final Object... namesAndValues)
	{
		HeapObserver sink = this.observer;
		if (sink == null)
		{
			return;
		}

		try
		{
			sink.onEvent(event, EventAttributes.of(namesAndValues));
		}
		catch (final Throwable t)
		{
			log.debug("Observer failed on '{}' event, ignoring", event, t);
		}
	}

	/**
	 * Should <code>a</code> sit above <code>b</code>?
	 *
	 * @param a the first element.
	 * @param b the second element.
	 * @return <code>true</code> if <code>a</code> is strictly preferred.
	 * @throws InvalidValueException If a key cannot be computed.
	 */
	private boolean prefer(final TElement a, final TElement b)
		throws InvalidValueException
	{
		return this.mode.prefers(this.comp.compare(a, b));
	}

	/**
	 * Append and sift up, reporting as a push.
	 *
	 * @param value the element.
	 */
	private void pushInternal(final TElement value)
	{
		this.fire(HeapEvent.INSERT_START, "value", value);
		this.comp.computeKey(value);

		this.heap.add(value);
		int index = this.heap.size() - 1;
		this.fire(HeapEvent.INSERT, "index", index, "value", value);

		this.siftUp(index);
		this.fire(HeapEvent.PUSH_DONE, "size", this.heap.size());
	}

	/**
	 * Put <code>value</code> at the root and sift it down.
	 *
	 * @param value the new root.
	 * @return the old root.
	 */
	private TElement replaceRoot(final TElement value)
	{
		TElement root = this.heap.get(0);
		this.heap.set(0, value);
		this.fire(HeapEvent.REPLACE_ROOT, "old", root, "value", value);
		this.siftDown(0);
		return root;
	}

	/**
	 * Remove the element at a valid index.
	 *
	 * @param index the index.
	 * @return the removed element.
	 */
	private TElement removeAtInternal(final int index)
	{
		int last_index = this.heap.size() - 1;
		TElement removed = this.heap.get(index);
		TElement last = this.heap.removeLast();
		this.fire(HeapEvent.REMOVE_AT, "index", index, "value", removed);

		if (index < last_index)
		{
			this.heap.set(index, last);
			this.fire(HeapEvent.MOVE, "src", last_index, "dst", index,
					"value", last);

			// The replacement may be out of order in either direction, never
			// both.
			if (this.siftUp(index) == index)
			{
				this.siftDown(index);
			}
		}

		return removed;
	}

	/**
	 * Switch to the specified mode and rebuild; restore the old mode on
	 * failure.
	 *
	 * @param op the operation name.
	 * @param event the event to report.
	 * @param mode the new mode.
	 */
	private void changeMode(final String op, final HeapEvent event,
			final OrderMode mode)
	{
		this.acquire(op);
		OrderMode previous = this.mode;
		try
		{
			this.mode = mode;
			this.fire(event, "mode", mode);
			this.rebuild();
		}
		catch (final RuntimeException re)
		{
			this.mode = previous;
			this.rollback(op, re);
			throw re;
		}
		catch (final Error er)
		{
			this.mode = previous;
			this.rollback(op, er);
			throw er;
		}
		finally
		{
			this.release();
		}
	}

	/**
	 * Restore the heap property for arbitrary contents, bottom-up.
	 */
	private void rebuild()
	{
		int n = this.heap.size();
		for (int index = (n >>> 1) - 1; index >= 0; index--)
		{
			this.siftDown(index);
		}

		this.fire(HeapEvent.HEAPIFY_DONE, "size", n);
	}

	/**
	 * Move the element at <code>index</code> towards the root while it is
	 * preferred over its parent.
	 *
	 * @param index the start index.
	 * @return the index where the element came to rest.
	 */
	private int siftUp(final int index)
	{
		int at_node = index;

		while (at_node > 0)
		{
			int parent = (at_node - 1) >>> 1;
			TElement child_el = this.heap.get(at_node);
			TElement parent_el = this.heap.get(parent);

			this.fire(HeapEvent.COMPARE, "i", at_node, "j", parent, "ai",
					child_el, "aj", parent_el);
			if (this.prefer(child_el, parent_el) == false)
			{
				break;
			}

			this.fire(HeapEvent.SWAP, "i", at_node, "j", parent, "ai",
					child_el, "aj", parent_el);
			this.heap.swap(at_node, parent);
			at_node = parent;
		}

		return at_node;
	}

	/**
	 * Move the element at <code>index</code> towards the leaves while a
	 * child is preferred over it. The left child wins ties.
	 *
	 * @param index the start index.
	 * @return the index where the element came to rest.
	 */
	private int siftDown(final int index)
	{
		int n = this.heap.size();
		int at_node = index;

		while (true)
		{
			int left = (at_node << 1) + 1;
			int right = left + 1;
			int best = at_node;

			if (left < n)
			{
				this.fire(HeapEvent.COMPARE, "i", left, "j", best, "ai",
						this.heap.get(left), "aj", this.heap.get(best));
				if (this.prefer(this.heap.get(left), this.heap.get(best)))
				{
					best = left;
				}
			}

			if (right < n)
			{
				this.fire(HeapEvent.COMPARE, "i", right, "j", best, "ai",
						this.heap.get(right), "aj", this.heap.get(best));
				if (this.prefer(this.heap.get(right), this.heap.get(best)))
				{
					best = right;
				}
			}

			if (best == at_node)
			{
				return at_node;
			}

			this.fire(HeapEvent.SWAP, "i", at_node, "j", best, "ai",
					this.heap.get(at_node), "aj", this.heap.get(best));
			this.heap.swap(at_node, best);
			at_node = best;
		}
	}

	/**
	 * Find the first parent/child pair breaking the heap property.
	 *
	 * @return a description of the violation, or <code>null</code>.
	 */
	private InvariantViolationError findViolation()
	{
		int n = this.heap.size();
		for (int parent = 0; (parent << 1) + 1 < n; parent++)
		{
			int left = (parent << 1) + 1;
			int right = left + 1;

			if (this.prefer(this.heap.get(left), this.heap.get(parent)))
			{
				return this.violation(parent, left, "left");
			}

			if (right < n
					&& this.prefer(this.heap.get(right), this.heap.get(parent)))
			{
				return this.violation(parent, right, "right");
			}
		}

		return null;
	}

	/**
	 * Describe a violation.
	 *
	 * @param parent the parent index.
	 * @param child the child index.
	 * @param side "left" or "right".
	 * @return the error, not thrown.
	 */
	private InvariantViolationError violation(final int parent,
			final int child, final String side)
	{
		return new InvariantViolationError(String.format(
				"Heap broken at parent %1$d, %2$s %3$d: %4$s vs %5$s", parent,
				side, child, EventAttributes.abbreviate(String.valueOf(this.heap
						.get(parent))), EventAttributes.abbreviate(String
						.valueOf(this.heap.get(child)))), parent, child);
	}

	/**
	 * Level-order iterator.
	 * <p>
	 * Cheats a little bit and touches the storage and mod count fields of the
	 * enclosing heap.
	 *
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private final class ElementIterator
		extends Object
		implements Iterator<TElement>
	{

		/**
		 * Next index.
		 */
		private int it_count;

		/**
		 * Iterator mod count.
		 */
		private final int it_mod_count;

		/**
		 * Constructor.
		 */
		ElementIterator()
		{
			super();

			this.it_count = 0;
			this.it_mod_count = BinaryHeap.this.mod_count;
		}

		/**
		 * Has next.
		 *
		 * @return <code>true</code> if a next element exists.
		 * @throws ConcurrentModificationException If the heap was modified.
		 */
		public boolean hasNext()
			throws ConcurrentModificationException
		{
			if (BinaryHeap.this.mod_count != this.it_mod_count)
			{
				throw new ConcurrentModificationException();
			}

			return (this.it_count < BinaryHeap.this.heap.size());
		}

		/**
		 * Get the next element and advance.
		 *
		 * @return the next element.
		 * @throws NoSuchElementException If there is no next element.
		 * @throws ConcurrentModificationException If the heap was modified.
		 */
		public TElement next()
			throws NoSuchElementException, ConcurrentModificationException
		{
			if (this.hasNext() == false)
			{
				throw new NoSuchElementException("The iterator is empty");
			}

			return BinaryHeap.this.heap.get(this.it_count++);
		}

		/**
		 * Not supported.
		 *
		 * @throws UnsupportedOperationException always.
		 */
		public void remove()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

	}

}
