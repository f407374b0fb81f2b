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
 * PositionIndicator.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * The scrub control showing which frame is on screen. It belongs to the
 * surrounding window; the animation handler only sets its range, value
 * and position text.
 */
public interface PositionIndicator {
	void addPositionListener(PositionListener listener);

	int getValue();

	void removePositionListener(PositionListener listener);

	/**
	 * Shows a "current / total" text next to the control.
	 */
	void setPositionText(String text);

	void setRange(int minimum, int maximum);

	/**
	 * Moves the control. Listeners see this as {@link PositionListener#valueChanged(int) valueChanged}.
	 */
	void setValue(int value);
}
