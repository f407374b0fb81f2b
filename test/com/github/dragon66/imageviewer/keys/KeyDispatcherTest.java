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
 * KeyDispatcherTest.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    16Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class KeyDispatcherTest {
	private final RecordingCommands commands = new RecordingCommands();
	private final KeyBindings bindings = new KeyBindings();
	private final KeyDispatcher dispatcher = new KeyDispatcher(bindings, commands);

	private DispatchResult press(int keyCode) {
		return dispatcher.dispatch(keyCode, 0);
	}

	@Test
	public void navigationReleasesPlayingAnimationFirst() {
		commands.animationActive = true;

		assertEquals(DispatchResult.HANDLED, press(KeyEvent.VK_RIGHT));
		assertEquals(Arrays.asList("cleanupCurrentMedia", "showNextImage"), commands.calls);
	}

	@Test
	public void navigationWithoutAnimation() {
		assertEquals(DispatchResult.HANDLED, press(KeyEvent.VK_LEFT));
		assertEquals(Arrays.asList("showPreviousImage"), commands.calls);
	}

	@Test
	public void rotationKeys() {
		press(KeyEvent.VK_R);
		press(KeyEvent.VK_L);
		dispatcher.dispatch(KeyEvent.VK_R, InputEvent.CTRL_DOWN_MASK);

		assertEquals(Arrays.asList("rotateImage(true)", "rotateImage(false)", "rotateImage(true)"), commands.calls);
	}

	@Test
	public void ctrlDTogglesDebug() {
		assertEquals(DispatchResult.HANDLED, dispatcher.dispatch(KeyEvent.VK_D, InputEvent.CTRL_DOWN_MASK));
		assertEquals(DispatchResult.NOT_HANDLED, press(KeyEvent.VK_D));
		assertEquals(DispatchResult.NOT_HANDLED,
				dispatcher.dispatch(KeyEvent.VK_D, InputEvent.CTRL_DOWN_MASK|InputEvent.SHIFT_DOWN_MASK));
		assertEquals(Arrays.asList("toggleDebugMode"), commands.calls);
	}

	@Test
	public void escapeOnlyLeavesFullScreen() {
		assertEquals(DispatchResult.NOT_HANDLED, press(KeyEvent.VK_ESCAPE));

		commands.fullScreen = true;
		assertEquals(DispatchResult.HANDLED, press(KeyEvent.VK_ESCAPE));
		assertEquals(Arrays.asList("toggleFullScreen"), commands.calls);
	}

	@Test
	public void fullScreenKeys() {
		press(KeyEvent.VK_F11);
		dispatcher.dispatch(KeyEvent.VK_ENTER, InputEvent.CTRL_DOWN_MASK);

		assertEquals(DispatchResult.NOT_HANDLED, press(KeyEvent.VK_ENTER));
		assertEquals(Arrays.asList("toggleFullScreen", "toggleFullScreen"), commands.calls);
	}

	@Test
	public void volumeStepsAreClamped() {
		commands.volume = 98;
		press(KeyEvent.VK_UP);
		assertEquals(100, commands.volume);

		commands.volume = 50;
		press(KeyEvent.VK_DOWN);
		assertEquals(45, commands.volume);

		commands.volume = 3;
		press(KeyEvent.VK_DOWN);
		assertEquals(0, commands.volume);
	}

	@Test
	public void playbackMuteAndDelete() {
		press(KeyEvent.VK_SPACE);
		press(KeyEvent.VK_M);
		press(KeyEvent.VK_DELETE);

		assertEquals(Arrays.asList("toggleAnimationPlayback", "toggleMute", "deleteCurrentImage"), commands.calls);
	}

	@Test
	public void reboundKeysFollowBindings() {
		bindings.setKey(ViewerAction.NEXT_IMAGE, KeyEvent.VK_N);
		commands.animationActive = true;

		assertEquals(DispatchResult.NOT_HANDLED, press(KeyEvent.VK_RIGHT));
		assertTrue(commands.calls.isEmpty());

		assertEquals(DispatchResult.HANDLED, press(KeyEvent.VK_N));
		assertEquals(Arrays.asList("cleanupCurrentMedia", "showNextImage"), commands.calls);
	}

	@Test
	public void unboundKeyIsNotHandled() {
		assertEquals(DispatchResult.NOT_HANDLED, press(KeyEvent.VK_Q));
		assertTrue(commands.calls.isEmpty());
	}

	@Test
	public void handlerOrderIsFixed() {
		assertEquals(7, dispatcher.getHandlers().size());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void handlersCannotBeChanged() {
		dispatcher.getHandlers().clear();
	}

	private static class RecordingCommands implements ViewerCommands {
		final List<String> calls = new ArrayList<String>();
		int volume = 50;
		boolean animationActive;
		boolean fullScreen;

		public void adjustVolume(int volume) {
			this.volume = volume;
			calls.add("adjustVolume(" + volume + ")");
		}

		public void cleanupCurrentMedia() {
			calls.add("cleanupCurrentMedia");
		}

		public void deleteCurrentImage() {
			calls.add("deleteCurrentImage");
		}

		public int getVolume() {
			return volume;
		}

		public boolean isAnimationActive() {
			return animationActive;
		}

		public boolean isFullScreen() {
			return fullScreen;
		}

		public void rotateImage(boolean clockwise) {
			calls.add("rotateImage(" + clockwise + ")");
		}

		public void showNextImage() {
			calls.add("showNextImage");
		}

		public void showPreviousImage() {
			calls.add("showPreviousImage");
		}

		public void toggleAnimationPlayback() {
			calls.add("toggleAnimationPlayback");
		}

		public void toggleDebugMode() {
			calls.add("toggleDebugMode");
		}

		public void toggleFullScreen() {
			calls.add("toggleFullScreen");
		}

		public void toggleMute() {
			calls.add("toggleMute");
		}
	}
}
