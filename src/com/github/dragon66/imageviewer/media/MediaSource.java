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
 * MediaSource.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    18Dec2015  Pixel budgets for decoders
 * WY    07Dec2015  Playback speed in percent
 * WY    30Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One decoded file: its frames, their delays and where playback currently is.
 * <p>
 * A source with a single frame is a static image. It never enters the
 * {@link PlaybackState#PLAYING PLAYING} state.
 * <p>
 * Frames are stepped by {@link #advance(long) advance} using each frame's
 * own delay scaled by the playback speed, and loop forever.
 */
public class MediaSource {
	// Used in place of a zero or missing frame delay
	public static final int DEFAULT_FRAME_DELAY = 100;
	public static final int DEFAULT_SPEED = 100;
	// Decoders refuse a single frame above this many pixels
	public static final long MAX_FRAME_PIXELS = 1L<<26;
	// and stop adding frames once all of them together would pass this
	public static final long MAX_TOTAL_PIXELS = 1L<<27;

	private final File file;
	private final MediaFormat format;
	private List<BufferedImage> frames;
	private final int[] delays;

	private int speed = DEFAULT_SPEED;
	private int currentFrame;
	private long elapsedInFrame;
	private PlaybackState state = PlaybackState.STOPPED;

	/**
	 * @param file the file the frames were decoded from
	 * @param format container format of the file
	 * @param frames decoded frames in display order, at least one
	 * @param delays per-frame delays in milliseconds, one for each frame
	 */
	public MediaSource(File file, MediaFormat format, List<BufferedImage> frames, int[] delays) {
		if(frames == null || frames.isEmpty())
			throw new IllegalArgumentException("A media source needs at least one frame");
		if(delays == null || delays.length != frames.size())
			throw new IllegalArgumentException("Expected " + frames.size() + " frame delays");
		for(BufferedImage frame : frames) {
			if(frame == null) throw new IllegalArgumentException("Null input image");
		}
		this.file = file;
		this.format = (format == null)? MediaFormat.OTHER : format;
		this.frames = Collections.unmodifiableList(new ArrayList<BufferedImage>(frames));
		this.delays = delays.clone();
	}

	/**
	 * Moves playback forward by the given amount of wall-clock time.
	 *
	 * @param elapsedMillis time since the previous call
	 * @return true if the current frame changed
	 */
	public boolean advance(long elapsedMillis) {
		if(state != PlaybackState.PLAYING || elapsedMillis <= 0) return false;

		int before = currentFrame;
		elapsedInFrame += elapsedMillis;
		long frameTime = effectiveDelay(currentFrame);

		while(elapsedInFrame >= frameTime) {
			elapsedInFrame -= frameTime;
			currentFrame = (currentFrame + 1) % frames.size();
			frameTime = effectiveDelay(currentFrame);
		}

		return currentFrame != before;
	}

	private long effectiveDelay(int index) {
		int delay = delays[index];
		if(delay <= 0) delay = DEFAULT_FRAME_DELAY;
		return Math.max(1L, (long)delay * DEFAULT_SPEED / speed);
	}

	public BufferedImage getCurrentFrame() {
		return getFrame(currentFrame);
	}

	public int getCurrentFrameNumber() {
		return currentFrame;
	}

	/**
	 * @param index frame index
	 * @return the declared delay of the frame in milliseconds, may be 0
	 */
	public int getDelay(int index) {
		if(index < 0 || index >= delays.length)
			throw new IndexOutOfBoundsException("Index: " + index);
		return delays[index];
	}

	public File getFile() {
		return file;
	}

	/**
	 * The delay the playback clock interval is derived from.
	 *
	 * @return the first frame's declared delay in milliseconds, may be 0
	 */
	public int getFirstFrameDelay() {
		return delays[0];
	}

	public MediaFormat getFormat() {
		return format;
	}

	public BufferedImage getFrame(int index) {
		if(frames == null)
			throw new IllegalStateException("Media source has been released: " + file);
		if(index < 0 || index >= frames.size())
			throw new IndexOutOfBoundsException("Index: " + index);
		return frames.get(index);
	}

	public int getFrameCount() {
		return delays.length;
	}

	public MediaType getMediaType() {
		return format.classify(getFrameCount());
	}

	public int getSpeed() {
		return speed;
	}

	public PlaybackState getState() {
		return state;
	}

	public boolean isAnimated() {
		return getFrameCount() > 1;
	}

	public boolean isReleased() {
		return frames == null;
	}

	/**
	 * Moves to the given frame. Playback continues from there if running.
	 *
	 * @param index frame index
	 * @return false if the index is out of range or the source has been released
	 */
	public boolean jumpToFrame(int index) {
		if(frames == null || index < 0 || index >= frames.size()) return false;
		currentFrame = index;
		elapsedInFrame = 0;
		return true;
	}

	/**
	 * Stops playback and drops the decoded frames. Frame access fails afterwards.
	 */
	public void release() {
		stop();
		frames = null;
	}

	public void setPaused(boolean paused) {
		if(state == PlaybackState.STOPPED) return;
		state = paused? PlaybackState.PAUSED : PlaybackState.PLAYING;
	}

	/**
	 * @param speed playback speed in percent of the declared frame delays, 100 being normal
	 */
	public void setSpeed(int speed) {
		if(speed <= 0)
			throw new IllegalArgumentException("Invalid playback speed: " + speed);
		this.speed = speed;
	}

	public void start() {
		if(frames == null || !isAnimated()) return;
		state = PlaybackState.PLAYING;
	}

	/**
	 * Stops playback. A later {@link #start() start} begins again from the first frame.
	 */
	public void stop() {
		state = PlaybackState.STOPPED;
		currentFrame = 0;
		elapsedInFrame = 0;
	}
}
