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
 * AnimationHandlerTest.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    15Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.dragon66.imageviewer.media.DecodeException;
import com.github.dragon66.imageviewer.media.MediaFormat;
import com.github.dragon66.imageviewer.media.MediaSource;
import com.github.dragon66.imageviewer.media.MediaSourceLoader;
import com.github.dragon66.imageviewer.media.MediaType;
import com.github.dragon66.imageviewer.media.PlaybackState;
import com.github.dragon66.imageviewer.transform.RotationAngle;

public class AnimationHandlerTest {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private final ManualTickSource tickSource = new ManualTickSource();
	private final RecordingSink sink = new RecordingSink();
	private final FakeIndicator indicator = new FakeIndicator();
	private final RecordingHost host = new RecordingHost();
	private final StubLoader loader = new StubLoader();
	private AnimationHandler handler;

	private File animation;
	private File still;
	private File broken;

	@Before
	public void setUp() throws IOException {
		handler = new AnimationHandler(sink, indicator, host, tickSource, loader);
		animation = tmp.newFile("anim.gif");
		still = tmp.newFile("still.gif");
		broken = tmp.newFile("broken.webp");
		loader.sources.put(animation, MediaFormat.GIF);
		loader.sources.put(still, MediaFormat.GIF);
	}

	private static List<BufferedImage> frames(int count, int width, int height) {
		List<BufferedImage> frames = new ArrayList<BufferedImage>();
		for(int i = 0; i < count; i++)
			frames.add(new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB));
		return frames;
	}

	@Test
	public void animationStartsPlayingWithIndicatorSpanningFrames() {
		loader.frameCount.put(animation, 24);

		MediaType type = handler.load(animation);

		assertEquals(MediaType.GIF_ANIMATION, type);
		assertTrue(handler.isPlaying());
		assertEquals(0, indicator.min);
		assertEquals(23, indicator.max);
		assertEquals(0, indicator.value);
		assertEquals("1 / 24", indicator.text);
		assertEquals(40, handler.getPlaybackClock().getInterval());
		assertEquals(1, tickSource.activeCount());
		assertEquals(1, indicator.listeners.size());
		assertEquals(Boolean.TRUE, host.playing);
	}

	@Test
	public void ticksAdvanceFramesAndIndicator() {
		loader.frameCount.put(animation, 24);
		handler.load(animation);
		int shown = sink.displayed;

		tickSource.tick(5);

		assertEquals(5, handler.getCurrentSource().getCurrentFrameNumber());
		assertEquals(5, indicator.value);
		assertEquals("6 / 24", indicator.text);
		assertEquals(shown + 5, sink.displayed);
	}

	@Test
	public void ticksLoopBackToFirstFrame() {
		loader.frameCount.put(animation, 4);
		handler.load(animation);

		tickSource.tick(4);

		assertEquals(0, handler.getCurrentSource().getCurrentFrameNumber());
		assertEquals(0, indicator.value);
	}

	@Test
	public void singleFrameIsShownWithoutClock() {
		loader.frameCount.put(still, 1);

		MediaType type = handler.load(still);

		assertEquals(MediaType.GIF_IMAGE, type);
		assertNull(handler.getPlaybackClock());
		assertEquals(0, tickSource.getHandles().size());
		assertEquals(0, indicator.value);
		assertEquals(1, sink.displayed);
		assertFalse(handler.isPlaying());
		assertTrue(indicator.listeners.isEmpty());
	}

	@Test
	public void neverTwoClocksAtOnce() {
		loader.frameCount.put(animation, 3);
		loader.frameCount.put(still, 1);

		handler.load(animation);
		handler.load(animation);
		handler.load(still);
		handler.load(animation);
		handler.setSpeed(200);
		handler.togglePlayback();
		handler.togglePlayback();

		assertEquals(1, tickSource.getMaxActive());
		assertEquals(1, tickSource.activeCount());
		assertEquals(1, indicator.listeners.size());
	}

	@Test
	public void cleanupIsIdempotent() {
		handler.cleanup();

		loader.frameCount.put(animation, 3);
		handler.load(animation);
		MediaSource source = handler.getCurrentSource();

		handler.cleanup();
		handler.cleanup();

		assertTrue(source.isReleased());
		assertNull(handler.getCurrentSource());
		assertNull(handler.getPlaybackClock());
		assertEquals(0, tickSource.activeCount());
		assertTrue(indicator.listeners.isEmpty());
		assertNull(sink.image);
	}

	@Test
	public void noTickReachesHandlerAfterCleanup() {
		loader.frameCount.put(animation, 3);
		handler.load(animation);
		handler.cleanup();
		int shown = sink.displayed;

		tickSource.tickStale();
		indicator.userMoves(2);

		assertEquals(shown, sink.displayed);
	}

	@Test
	public void loadingReleasesPreviousSource() {
		loader.frameCount.put(animation, 3);
		handler.load(animation);
		MediaSource first = handler.getCurrentSource();

		handler.load(animation);

		assertTrue(first.isReleased());
		assertFalse(handler.getCurrentSource().isReleased());
	}

	@Test
	public void dragSuppressesTickUpdatesAndSeeksOnRelease() {
		loader.frameCount.put(animation, 24);
		handler.load(animation);

		indicator.dragStarted();
		assertTrue(handler.isDragging());
		indicator.userMoves(10);
		int setsDuringDrag = indicator.setValueCalls;

		tickSource.tick(3);

		assertEquals(10, indicator.value);
		assertEquals(setsDuringDrag, indicator.setValueCalls);

		indicator.dragFinished();

		assertFalse(handler.isDragging());
		assertEquals(10, handler.getCurrentSource().getCurrentFrameNumber());

		tickSource.tick();
		assertEquals(11, indicator.value);
	}

	@Test
	public void scrubbingShowsFrame() {
		loader.frameCount.put(animation, 24);
		handler.load(animation);

		int shown = sink.displayed;
		indicator.userMoves(7);

		assertEquals(7, handler.getCurrentSource().getCurrentFrameNumber());
		assertEquals("8 / 24", indicator.text);
		assertEquals(shown + 1, sink.displayed);
	}

	@Test
	public void seekOutOfRangeIsIgnored() {
		loader.frameCount.put(animation, 3);

		assertFalse(handler.seekToFrame(1));
		handler.load(animation);
		assertFalse(handler.seekToFrame(3));
		assertTrue(handler.seekToFrame(2));
	}

	@Test
	public void rotationIsAppliedImmediately() {
		loader.frameCount.put(still, 1);
		handler.load(still);

		assertTrue(handler.rotate(true));

		assertEquals(RotationAngle.DEG_90, handler.getRotation());
		assertEquals(10, sink.image.getWidth());
		assertEquals(20, sink.image.getHeight());
		assertTrue(host.infoUpdates > 0);
	}

	@Test
	public void rotationSequencesAreEquivalent() {
		loader.frameCount.put(still, 1);
		handler.load(still);

		handler.rotate(true);
		handler.rotate(true);
		handler.rotate(true);
		RotationAngle threeClockwise = handler.getRotation();

		handler.setRotation(RotationAngle.DEG_0);
		handler.rotate(false);

		assertEquals(threeClockwise, handler.getRotation());

		handler.rotate(true);
		assertEquals(RotationAngle.DEG_0, handler.getRotation());
		assertEquals(20, sink.image.getWidth());
	}

	@Test
	public void rotationPersistsAcrossLoads() {
		loader.frameCount.put(still, 1);
		loader.frameCount.put(animation, 3);
		handler.load(still);
		handler.setRotation(RotationAngle.DEG_270);

		handler.load(animation);

		assertEquals(RotationAngle.DEG_270, handler.getRotation());
		assertEquals(10, sink.image.getWidth());
	}

	@Test
	public void rotationWithoutImageIsRefused() {
		assertFalse(handler.rotate(true));
		assertEquals(RotationAngle.DEG_0, handler.getRotation());
	}

	@Test
	public void failedLoadClearsDisplay() {
		loader.frameCount.put(animation, 3);
		handler.load(animation);
		MediaSource previous = handler.getCurrentSource();

		MediaType type = handler.load(broken);

		assertEquals(MediaType.FAILED, type);
		assertTrue(previous.isReleased());
		assertNull(handler.getCurrentSource());
		assertNull(sink.image);
		assertEquals(0, tickSource.activeCount());
		assertEquals("Failed to load image: broken.webp", host.lastMessage());
		assertFalse(host.loading);
	}

	@Test
	public void loadReportsProgress() {
		loader.frameCount.put(animation, 3);

		handler.load(animation);

		assertEquals("GIF loading: anim.gif", host.messages.get(0));
		assertEquals("GIF image loaded: anim.gif, size: 0.00MB", host.lastMessage());
		assertFalse(host.loading);
	}

	@Test
	public void togglePlaybackSuspendsClock() {
		loader.frameCount.put(animation, 5);
		handler.load(animation);

		assertFalse(handler.togglePlayback());

		assertEquals(PlaybackState.PAUSED, handler.getCurrentSource().getState());
		assertFalse(handler.getPlaybackClock().isActive());
		assertEquals(Boolean.FALSE, host.playing);
		tickSource.tickStale();
		assertEquals(0, handler.getCurrentSource().getCurrentFrameNumber());

		assertTrue(handler.togglePlayback());

		assertTrue(handler.getPlaybackClock().isActive());
		tickSource.tick();
		assertEquals(1, handler.getCurrentSource().getCurrentFrameNumber());
	}

	@Test
	public void togglePlaybackNeedsAnimation() {
		assertFalse(handler.togglePlayback());
		loader.frameCount.put(still, 1);
		handler.load(still);
		assertFalse(handler.togglePlayback());
	}

	@Test
	public void speedChangesClockInterval() {
		loader.frameCount.put(animation, 5);
		handler.load(animation);
		handler.togglePlayback();

		handler.setSpeed(200);

		assertEquals(20, handler.getPlaybackClock().getInterval());
		assertFalse(handler.getPlaybackClock().isActive());
		assertEquals(200, handler.getCurrentSource().getSpeed());

		handler.load(animation);
		assertEquals(200, handler.getCurrentSource().getSpeed());
		assertEquals(20, handler.getPlaybackClock().getInterval());
	}

	@Test
	public void rescaleFollowsSinkSize() {
		loader.frameCount.put(still, 1);
		assertFalse(handler.rescale());
		handler.load(still);

		sink.width = 40;
		sink.height = 40;
		assertTrue(handler.rescale());

		assertEquals(40, sink.image.getWidth());
		assertEquals(20, sink.image.getHeight());
	}

	@Test
	public void worksWithoutHost() {
		AnimationHandler bare = new AnimationHandler(sink, indicator, null, tickSource, loader);
		loader.frameCount.put(animation, 2);

		assertEquals(MediaType.GIF_ANIMATION, bare.load(animation));
		bare.cleanup();
	}

	@Test
	public void fileSizeOfMissingFileIsZero() {
		assertEquals(0.0, AnimationHandler.fileSizeInMegabytes(new File(tmp.getRoot(), "nope.gif")), 0.0);
	}

	/** Hands out 20x10 frames with a 40ms delay; unknown files fail to decode. */
	private static class StubLoader extends MediaSourceLoader {
		final Map<File, MediaFormat> sources = new HashMap<File, MediaFormat>();
		final Map<File, Integer> frameCount = new HashMap<File, Integer>();

		public MediaSource load(File file) throws IOException {
			MediaFormat format = sources.get(file);
			Integer count = frameCount.get(file);
			if(format == null || count == null) throw new DecodeException("Corrupt image: " + file.getName());
			int[] delays = new int[count];
			Arrays.fill(delays, 40);
			return new MediaSource(file, format, frames(count, 20, 10), delays);
		}
	}

	private static class RecordingSink implements RenderSink {
		BufferedImage image;
		int displayed;
		int width;
		int height;

		public void clear() {
			image = null;
		}

		public void display(BufferedImage image) {
			this.image = image;
			this.displayed++;
		}

		public int getHeight() {
			return height;
		}

		public int getWidth() {
			return width;
		}
	}

	/** Behaves like the slider: programmatic changes reach listeners too. */
	private class FakeIndicator implements PositionIndicator {
		final List<PositionListener> listeners = new ArrayList<PositionListener>();
		int min;
		int max;
		int value;
		int setValueCalls;
		String text;

		public void addPositionListener(PositionListener listener) {
			listeners.add(listener);
		}

		void dragFinished() {
			for(PositionListener listener : new ArrayList<PositionListener>(listeners)) listener.dragFinished();
		}

		void dragStarted() {
			for(PositionListener listener : new ArrayList<PositionListener>(listeners)) listener.dragStarted();
		}

		public int getValue() {
			return value;
		}

		public void removePositionListener(PositionListener listener) {
			listeners.remove(listener);
		}

		public void setPositionText(String text) {
			this.text = text;
		}

		public void setRange(int minimum, int maximum) {
			this.min = minimum;
			this.max = maximum;
		}

		public void setValue(int value) {
			setValueCalls++;
			change(value);
		}

		void userMoves(int value) {
			change(value);
		}

		private void change(int value) {
			this.value = value;
			for(PositionListener listener : new ArrayList<PositionListener>(listeners)) listener.valueChanged(value);
		}
	}

	private static class RecordingHost implements ViewerHost {
		final List<String> messages = new ArrayList<String>();
		Boolean playing;
		boolean loading;
		int infoUpdates;

		public void hideLoadingIndicator() {
			loading = false;
		}

		String lastMessage() {
			return messages.get(messages.size() - 1);
		}

		public void playbackStateChanged(boolean playing) {
			this.playing = playing;
		}

		public void showLoadingIndicator() {
			loading = true;
		}

		public void showMessage(String message) {
			messages.add(message);
		}

		public void updateImageInfo() {
			infoUpdates++;
		}
	}
}
