/**
 * Copyright (c) 2014-2015 by Wen Yu.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/legal/epl-v10.html
 *
 * Any modifications to this file must keep this entire header intact.
 *
 * Change History - most recent changes go on top of previous changes
 *
 * TickSource.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * Factory for periodic ticks on the event dispatch thread.
 */
public interface TickSource {
	/**
	 * Starts ticking right away.
	 *
	 * @param intervalMillis period between ticks in milliseconds, positive
	 * @param listener receiver of the ticks
	 * @return the handle that stops the ticks
	 */
	TickHandle schedule(int intervalMillis, TickListener listener);
}
