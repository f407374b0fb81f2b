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
 * PositionListener.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * User interaction with a {@link PositionIndicator}.
 */
public interface PositionListener {
	void dragStarted();

	void dragFinished();

	/**
	 * @param value the new frame index, whoever changed it
	 */
	void valueChanged(int value);
}
