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
 * PlaybackClock.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    08Dec2015  Suspend and resume for pause
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * The single periodic timer behind an animation. It holds at most one
 * {@link TickHandle} at a time and revokes it before scheduling another.
 */
public class PlaybackClock {
	private final TickSource tickSource;
	private TickListener listener;
	private TickHandle handle;
	private int interval;
	private boolean disposed;

	public PlaybackClock(TickSource tickSource) {
		if(tickSource == null) throw new IllegalArgumentException("Null tick source");
		this.tickSource = tickSource;
	}

	/**
	 * Revokes the current handle for good. Calling it again has no effect.
	 */
	public void dispose() {
		cancelHandle();
		listener = null;
		disposed = true;
	}

	private void cancelHandle() {
		if(handle != null) {
			handle.cancel();
			handle = null;
		}
	}

	public int getInterval() {
		return interval;
	}

	public boolean isActive() {
		return handle != null && handle.isActive();
	}

	public boolean isDisposed() {
		return disposed;
	}

	/**
	 * Ticks again with the interval and listener of the last {@link #start(int, TickListener) start}.
	 */
	public void resume() {
		if(disposed || listener == null || isActive()) return;
		cancelHandle();
		handle = tickSource.schedule(interval, listener);
	}

	/**
	 * Starts ticking, replacing whatever was scheduled before.
	 */
	public void start(int intervalMillis, TickListener tickListener) {
		if(disposed) throw new IllegalStateException("Playback clock has been disposed");
		if(tickListener == null) throw new IllegalArgumentException("Null tick listener");
		cancelHandle();
		this.interval = intervalMillis;
		this.listener = tickListener;
		handle = tickSource.schedule(intervalMillis, tickListener);
	}

	/**
	 * Stops ticking but remembers the interval and listener.
	 */
	public void suspend() {
		cancelHandle();
	}
}
