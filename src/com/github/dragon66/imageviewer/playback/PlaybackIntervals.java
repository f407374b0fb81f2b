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
 * PlaybackIntervals.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

import com.github.dragon66.imageviewer.media.MediaSource;

/**
 * Derives the playback clock period from a source's declared timing.
 * <p>
 * The clock polls; it does not fire once per frame. Its period follows the
 * first frame's delay scaled by the playback speed and is clamped so that
 * very short delays do not burn CPU and very long ones do not make the
 * position indicator lag.
 */
public final class PlaybackIntervals {
	public static final int MIN_INTERVAL = 10;
	public static final int MAX_INTERVAL = 200;
	// Used when the source declares no usable delay
	public static final int DEFAULT_DELAY = 100;
	// Used when there is no source to ask
	public static final int FALLBACK_INTERVAL = 50;

	/**
	 * @param firstFrameDelay declared delay in milliseconds, non-positive means unknown
	 * @param speedPercent playback speed, 100 being normal, non-positive means normal
	 * @return the clock period in milliseconds, within [{@value #MIN_INTERVAL}, {@value #MAX_INTERVAL}]
	 */
	public static int compute(int firstFrameDelay, int speedPercent) {
		int delay = (firstFrameDelay > 0)? firstFrameDelay : DEFAULT_DELAY;
		int speed = (speedPercent > 0)? speedPercent : MediaSource.DEFAULT_SPEED;
		long interval = (long)delay * MediaSource.DEFAULT_SPEED / speed;

		return (int)Math.max(MIN_INTERVAL, Math.min(interval, MAX_INTERVAL));
	}

	public static int forSource(MediaSource source) {
		if(source == null) return FALLBACK_INTERVAL;
		return compute(source.getFirstFrameDelay(), source.getSpeed());
	}

	private PlaybackIntervals() {}
}
