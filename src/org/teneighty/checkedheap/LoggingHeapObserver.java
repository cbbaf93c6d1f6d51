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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link HeapObserver} that writes every event to an SLF4J logger.
 * <p>
 * Useful as a tracing sink when no visual front end is attached. Output looks
 * like <code>swap {i=3, j=1, ai=2, aj=7}</code>.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class LoggingHeapObserver
	extends Object
	implements HeapObserver
{

	/**
	 * Log levels this observer can write at.
	 */
	public static enum Level
	{
		TRACE, DEBUG, INFO
	}

	/**
	 * The target logger.
	 */
	private final Logger logger;

	/**
	 * The level.
	 */
	private final Level level;

	/**
	 * Constructor.
	 * <p>
	 * Logs at debug level to the logger of this class.
	 */
	public LoggingHeapObserver()
	{
		this(LoggerFactory.getLogger(LoggingHeapObserver.class), Level.DEBUG);
	}

	/**
	 * Constructor.
	 *
	 * @param logger the logger to write to.
	 * @param level the level to write at.
	 * @throws NullPointerException If either argument is <code>null</code>.
	 */
	public LoggingHeapObserver(final Logger logger, final Level level)
		throws NullPointerException
	{
		super();

		if (logger == null || level == null)
		{
			throw new NullPointerException();
		}

		this.logger = logger;
		this.level = level;
	}

	/**
	 * Is logging enabled at the configured level?
	 *
	 * @return <code>true</code> if events would be written.
	 */
	public boolean isEnabled()
	{
		switch (this.level)
		{
			case TRACE:
				return this.logger.isTraceEnabled();
			case INFO:
				return this.logger.isInfoEnabled();
			default:
				return this.logger.isDebugEnabled();
		}
	}

	/**
	 * Log the event.
	 *
	 * @param event the event.
	 * @param attributes the attributes.
	 */
	public void onEvent(final HeapEvent event,
			final Map<String, Object> attributes)
	{
		switch (this.level)
		{
			case TRACE:
				this.logger.trace("{} {}", event, attributes);
				break;
			case INFO:
				this.logger.info("{} {}", event, attributes);
				break;
			default:
				this.logger.debug("{} {}", event, attributes);
				break;
		}
	}

}
