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
 * VolumeControl.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    12Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

/**
 * Volume level and mute switch shared by the slider, the mute button and the keyboard.
 */
public class VolumeControl {
	public static final int MAX_VOLUME = 100;

	private int volume;
	private boolean muted;

	public VolumeControl(int volume, boolean muted) {
		setVolume(volume);
		this.muted = muted;
	}

	/**
	 * @return 0 while muted, the volume otherwise
	 */
	public int getEffectiveVolume() {
		return muted? 0 : volume;
	}

	public int getVolume() {
		return volume;
	}

	public boolean isMuted() {
		return muted;
	}

	public void setMuted(boolean muted) {
		this.muted = muted;
	}

	/**
	 * @param volume new level, clamped to 0..{@value #MAX_VOLUME}
	 */
	public void setVolume(int volume) {
		this.volume = Math.max(0, Math.min(volume, MAX_VOLUME));
	}

	/**
	 * @return true if muted afterwards
	 */
	public boolean toggleMute() {
		muted = !muted;
		return muted;
	}
}
