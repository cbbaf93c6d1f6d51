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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

/**
 * The journaled backing array.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class ElementArrayTest
{

	private static ElementArray<String> arrayOf(final String... values)
	{
		ElementArray<String> array = new ElementArray<String>(2);
		for (String value : values)
		{
			array.add(value);
		}

		return array;
	}

	@Test
	public void rollbackRestoresEveryKindOfChange()
	{
		ElementArray<String> array = arrayOf("a", "b", "c", "d", "e");

		array.beginJournal();
		assertTrue(array.isJournaling());
		array.swap(0, 4);
		array.set(2, "x");
		assertEquals("a", array.removeLast());
		array.add("y");
		array.add("z");
		array.clear();
		array.add("only");

		assertEquals(7, array.rollback());
		assertFalse(array.isJournaling());
		assertEquals(Arrays.asList("a", "b", "c", "d", "e"), array.toList());
	}

	@Test
	public void endJournalKeepsChanges()
	{
		ElementArray<String> array = arrayOf("a", "b");

		array.beginJournal();
		array.swap(0, 1);
		array.endJournal();

		assertEquals(Arrays.asList("b", "a"), array.toList());
	}

	@Test
	public void changesOutsideAJournalAreNotRecorded()
	{
		ElementArray<String> array = arrayOf("a", "b");
		array.swap(0, 1);

		array.beginJournal();
		assertEquals(0, array.rollback());
		assertEquals(Arrays.asList("b", "a"), array.toList());
	}

	@Test(expected = IllegalStateException.class)
	public void rollbackWithoutJournalFails()
	{
		arrayOf("a").rollback();
	}

	@Test(expected = IllegalStateException.class)
	public void nestedJournalsAreRejected()
	{
		ElementArray<String> array = arrayOf("a");
		array.beginJournal();
		array.beginJournal();
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void getPastSizeFails()
	{
		arrayOf("a", "b").get(2);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void removeLastOnEmptyFails()
	{
		new ElementArray<String>(4).removeLast();
	}

	@Test
	public void capacityDoublesAndHalves()
	{
		ElementArray<String> array = arrayOf("a", "b", "c", "d", "e");
		assertEquals(8, array.capacity());

		while (array.size() > 0)
		{
			array.removeLast();
		}

		assertEquals(2, array.capacity());
	}

	@Test
	public void shrinkingWaitsForTheJournalToClose()
	{
		ElementArray<String> array = arrayOf("a", "b", "c", "d", "e");

		array.beginJournal();
		while (array.size() > 0)
		{
			array.removeLast();
		}
		assertEquals(8, array.capacity());

		array.endJournal();
		assertEquals(2, array.capacity());
	}

}
