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

import java.util.Map;

/**
 * Receives structural events from a {@link BinaryHeap}.
 * <p>
 * Events are delivered synchronously, in program order, while the heap
 * operation is still running. An observer must therefore not call any
 * mutating method of the heap that notified it; such calls fail with a
 * {@link ReentrantMutationException}. Read-only methods are fine, although
 * the heap may be in the middle of a sift and need not satisfy the heap
 * invariant at that moment.
 * <p>
 * Exceptions thrown from {@link #onEvent(HeapEvent, Map)} are logged and
 * otherwise ignored by the heap.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public interface HeapObserver
{

	/**
	 * Handle one event.
	 *
	 * @param event the event.
	 * @param attributes an unmodifiable snapshot of the event attributes.
	 */
	public void onEvent(HeapEvent event, Map<String, Object> attributes);

}
