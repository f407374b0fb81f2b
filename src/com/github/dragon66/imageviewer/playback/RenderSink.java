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
 * RenderSink.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

import java.awt.image.BufferedImage;

/**
 * Display surface for the current frame. Images passed in are already
 * rotated and scaled to fit {@link #getWidth()} x {@link #getHeight()}.
 */
public interface RenderSink {
	void clear();

	void display(BufferedImage image);

	int getHeight();

	int getWidth();
}
