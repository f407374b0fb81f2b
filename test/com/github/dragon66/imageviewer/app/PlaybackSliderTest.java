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
 * PlaybackSliderTest.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    16Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.github.dragon66.imageviewer.playback.PositionListener;

public class PlaybackSliderTest {
	private final PlaybackSlider slider = new PlaybackSlider();
	private final RecordingListener listener = new RecordingListener();

	private static class RecordingListener implements PositionListener {
		final List<String> events = new ArrayList<String>();

		public void dragStarted() {
			events.add("start");
		}

		public void dragFinished() {
			events.add("finish");
		}

		public void valueChanged(int value) {
			events.add("value " + value);
		}
	}

	@Test
	public void programmaticValueIsReported() {
		slider.setRange(0, 23);
		slider.addPositionListener(listener);

		slider.setValue(5);

		assertEquals(5, slider.getValue());
		assertEquals(Arrays.asList("value 5"), listener.events);
	}

	@Test
	public void adjustingMapsToDrag() {
		slider.setRange(0, 23);
		slider.addPositionListener(listener);

		slider.getSlider().setValueIsAdjusting(true);
		slider.getSlider().setValue(7);
		slider.getSlider().setValueIsAdjusting(false);

		assertEquals(Arrays.asList("start", "value 0", "value 7", "finish"), listener.events);
	}

	@Test
	public void removedListenerHearsNothing() {
		slider.setRange(0, 10);
		slider.addPositionListener(listener);
		slider.removePositionListener(listener);

		slider.setValue(3);

		assertTrue(listener.events.isEmpty());
	}

	@Test
	public void rangeNeverInverted() {
		slider.setRange(5, 2);
		slider.setValue(9);

		assertEquals(5, slider.getValue());
	}

	@Test
	public void positionText() {
		slider.setPositionText("3 / 24");
		assertEquals("3 / 24", slider.getPositionText());
	}
}
