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
 * AnimationHandler.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    08Dec2015  Pause suspends the clock instead of idling it
 * WY    07Dec2015  Playback speed
 * WY    04Dec2015  Indicator listener revoked in cleanup
 * WY    03Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.github.dragon66.imageviewer.media.MediaFormat;
import com.github.dragon66.imageviewer.media.MediaSource;
import com.github.dragon66.imageviewer.media.MediaSourceLoader;
import com.github.dragon66.imageviewer.media.MediaType;
import com.github.dragon66.imageviewer.media.PlaybackState;
import com.github.dragon66.imageviewer.transform.ImageTransforms;
import com.github.dragon66.imageviewer.transform.RotationAngle;

/**
 * Loads, plays and tears down one image at a time.
 * <p>
 * The handler owns the current {@link MediaSource} and its {@link PlaybackClock};
 * the render sink, the position indicator and the host are borrowed from the
 * window. Loading anything first runs {@link #cleanup()}, so at most one clock
 * is ever active and no tick or indicator callback reaches a released source.
 * <p>
 * All methods are expected to be called on the event dispatch thread.
 */
public class AnimationHandler {
	private static final Logger LOGGER = Logger.getLogger(AnimationHandler.class.getName());

	private static final double BYTES_PER_MB = 1024.0 * 1024.0;

	private final RenderSink renderSink;
	private final PositionIndicator indicator;
	private final ViewerHost host;
	private final TickSource tickSource;
	private final MediaSourceLoader loader;

	private final PositionListener indicatorListener = new IndicatorListener();
	private final TickListener frameTicker = new FrameTicker();

	private MediaSource currentSource;
	private PlaybackClock clock;
	private boolean indicatorListenerRegistered;

	private RotationAngle rotation = RotationAngle.DEG_0;
	private int speed = MediaSource.DEFAULT_SPEED;
	// Set while the user holds the indicator; ticks leave its value alone
	private boolean dragging;
	// Set while the handler itself moves the indicator
	private boolean updatingIndicator;

	public AnimationHandler(RenderSink renderSink, PositionIndicator indicator, ViewerHost host, TickSource tickSource) {
		this(renderSink, indicator, host, tickSource, new MediaSourceLoader());
	}

	public AnimationHandler(RenderSink renderSink, PositionIndicator indicator, ViewerHost host, TickSource tickSource, MediaSourceLoader loader) {
		if(renderSink == null) throw new IllegalArgumentException("Null render sink");
		if(indicator == null) throw new IllegalArgumentException("Null position indicator");
		if(tickSource == null) throw new IllegalArgumentException("Null tick source");
		if(loader == null) throw new IllegalArgumentException("Null media source loader");
		this.renderSink = renderSink;
		this.indicator = indicator;
		this.host = (host == null)? new ViewerHostAdapter() {} : host;
		this.tickSource = tickSource;
		this.loader = loader;
	}

	/**
	 * Releases the current source and its clock. Safe to call at any time,
	 * any number of times.
	 * <p>
	 * The clock goes first so that no tick can run against a source that is
	 * half torn down, then the indicator listener, then the source itself.
	 */
	public void cleanup() {
		LOGGER.fine("Cleaning up animation resources");

		if(clock != null) {
			clock.dispose();
			clock = null;
		}

		if(indicatorListenerRegistered) {
			indicator.removePositionListener(indicatorListener);
			indicatorListenerRegistered = false;
		}
		dragging = false;

		if(currentSource != null) {
			currentSource.stop();
			renderSink.clear();
			currentSource.release();
			LOGGER.fine("Released " + currentSource.getFile());
			currentSource = null;
		}
	}

	private MediaType failed(String fileName) {
		renderSink.clear();
		host.hideLoadingIndicator();
		host.showMessage("Failed to load image: " + fileName);
		host.updateImageInfo();

		return MediaType.FAILED;
	}

	/**
	 * @return file size in megabytes, 0 if it cannot be determined
	 */
	static double fileSizeInMegabytes(File file) {
		try {
			return Files.size(file.toPath()) / BYTES_PER_MB;
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Cannot determine size of " + file, e);
			return 0;
		}
	}

	public PlaybackClock getPlaybackClock() {
		return clock;
	}

	public MediaSource getCurrentSource() {
		return currentSource;
	}

	public RotationAngle getRotation() {
		return rotation;
	}

	public int getSpeed() {
		return speed;
	}

	public boolean isDragging() {
		return dragging;
	}

	public boolean isPlaying() {
		return currentSource != null && currentSource.getState() == PlaybackState.PLAYING;
	}

	/**
	 * Opens a file, replacing whatever was shown before.
	 * <p>
	 * A file with more than one frame starts playing right away with the
	 * indicator spanning its frames. A single frame is shown as a static
	 * image with no clock at all. A file that cannot be decoded leaves the
	 * display blank and is reported through the host; nothing is thrown.
	 *
	 * @param file GIF, WEBP or any other image ImageIO can read
	 * @return how the file was classified, {@link MediaType#FAILED} if it could not be decoded
	 */
	public MediaType load(File file) {
		if(file == null) throw new IllegalArgumentException("Null input file");

		String fileName = file.getName();
		double sizeMb = fileSizeInMegabytes(file);

		host.showLoadingIndicator();
		host.showMessage(MediaFormat.fromFileName(fileName).getDisplayName() + " loading: " + fileName);

		cleanup();

		MediaSource source;

		try {
			source = loader.load(file);
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Failed to load image: " + file, e);
			return failed(fileName);
		} catch(RuntimeException e) {
			LOGGER.log(Level.WARNING, "Failed to load image: " + file, e);
			return failed(fileName);
		}

		source.setSpeed(speed);
		currentSource = source;

		if(source.isAnimated())
			startAnimation(source);
		else
			showStatic(source);

		host.hideLoadingIndicator();
		host.showMessage(String.format(Locale.ROOT, "%s image loaded: %s, size: %.2fMB",
				source.getFormat().getDisplayName(), fileName, sizeMb));
		host.updateImageInfo();

		return source.getMediaType();
	}

	private void onTick() {
		MediaSource source = currentSource;
		if(source == null || source.getState() != PlaybackState.PLAYING) return;

		if(source.advance(clock.getInterval())) {
			render(source.getCurrentFrame());
		}

		int frame = source.getCurrentFrameNumber();
		if(!dragging)
			setIndicatorValue(frame);
		updatePositionText(source);
	}

	private void render(BufferedImage frame) {
		renderSink.display(ImageTransforms.render(frame, rotation, renderSink.getWidth(), renderSink.getHeight()));
	}

	/**
	 * Redraws the current frame for the render sink's current size.
	 *
	 * @return false if nothing is loaded
	 */
	public boolean rescale() {
		if(currentSource == null) return false;
		render(currentSource.getCurrentFrame());

		return true;
	}

	/**
	 * Turns the picture by a quarter.
	 *
	 * @return false if nothing is loaded, the angle is then left unchanged
	 */
	public boolean rotate(boolean clockwise) {
		return setRotation(clockwise? rotation.clockwise() : rotation.counterClockwise());
	}

	/**
	 * Moves to a frame and shows it.
	 *
	 * @return false if nothing is loaded or the index is out of range
	 */
	public boolean seekToFrame(int frame) {
		MediaSource source = currentSource;
		if(source == null || !source.jumpToFrame(frame)) return false;
		render(source.getCurrentFrame());
		if(source.isAnimated())
			updatePositionText(source);

		return true;
	}

	private void setIndicatorValue(int value) {
		updatingIndicator = true;
		try {
			indicator.setValue(value);
		} finally {
			updatingIndicator = false;
		}
	}

	/**
	 * Applies the angle to the frame on screen right away and to every frame
	 * drawn after it. The angle stays in effect for files loaded later.
	 *
	 * @return false if nothing is loaded, the angle is then left unchanged
	 */
	public boolean setRotation(RotationAngle angle) {
		if(angle == null) throw new IllegalArgumentException("Null rotation angle");
		if(currentSource == null) {
			LOGGER.fine("No image to rotate");
			return false;
		}
		rotation = angle;
		render(currentSource.getCurrentFrame());
		LOGGER.fine("Rotation applied: " + angle.getDegrees() + " degrees");
		host.updateImageInfo();

		return true;
	}

	/**
	 * Changes the playback speed of the current and all later animations.
	 *
	 * @param percent 100 for the declared frame delays, 200 for twice as fast
	 */
	public void setSpeed(int percent) {
		if(percent <= 0) throw new IllegalArgumentException("Invalid playback speed: " + percent);
		this.speed = percent;
		if(currentSource == null) return;
		currentSource.setSpeed(percent);
		if(clock != null) {
			boolean running = clock.isActive();
			clock.start(PlaybackIntervals.forSource(currentSource), frameTicker);
			if(!running) clock.suspend();
		}
	}

	private void showStatic(MediaSource source) {
		render(source.getCurrentFrame());
		setIndicatorValue(0);
	}

	private void startAnimation(MediaSource source) {
		int frameCount = source.getFrameCount();

		source.jumpToFrame(0);
		source.start();

		setIndicatorRange(frameCount);
		setIndicatorValue(0);
		updatePositionText(source);
		render(source.getCurrentFrame());

		indicator.addPositionListener(indicatorListener);
		indicatorListenerRegistered = true;

		int interval = PlaybackIntervals.forSource(source);
		clock = new PlaybackClock(tickSource);
		clock.start(interval, frameTicker);
		LOGGER.fine("Playing " + frameCount + " frames, clock interval " + interval + "ms");

		host.playbackStateChanged(true);
	}

	private void setIndicatorRange(int frameCount) {
		updatingIndicator = true;
		try {
			indicator.setRange(0, frameCount - 1);
		} finally {
			updatingIndicator = false;
		}
	}

	/**
	 * Pauses a playing animation or resumes a paused one.
	 *
	 * @return true if the animation is playing afterwards
	 */
	public boolean togglePlayback() {
		MediaSource source = currentSource;
		if(source == null || !source.isAnimated() || clock == null) return false;

		boolean playing = source.getState() != PlaybackState.PLAYING;
		source.setPaused(!playing);
		if(playing)
			clock.resume();
		else
			clock.suspend();
		host.playbackStateChanged(playing);

		return playing;
	}

	private void updatePositionText(MediaSource source) {
		indicator.setPositionText((source.getCurrentFrameNumber() + 1) + " / " + source.getFrameCount());
	}

	private class FrameTicker implements TickListener {
		public void tick() {
			onTick();
		}
	}

	private class IndicatorListener implements PositionListener {
		public void dragStarted() {
			dragging = true;
		}

		public void dragFinished() {
			dragging = false;
			seekToFrame(indicator.getValue());
		}

		public void valueChanged(int value) {
			// Scrubbing shows frames live; the handler's own updates are not seeks
			if(updatingIndicator) return;
			seekToFrame(value);
		}
	}
}
