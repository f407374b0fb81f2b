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
 * KeyDispatcher.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    09Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Routes key presses to viewer commands.
 * <p>
 * Handlers are tried in a fixed order: special keys, media transition,
 * navigation, image manipulation, media controls, window management and
 * file management. The first one that handles a key ends the dispatch.
 * The media transition step only prepares for navigation and never ends it.
 */
public class KeyDispatcher {
	public static final int VOLUME_STEP = 5;
	public static final int MAX_VOLUME = 100;

	private static final int MODIFIER_MASK = InputEvent.CTRL_DOWN_MASK|InputEvent.ALT_DOWN_MASK
			|InputEvent.SHIFT_DOWN_MASK|InputEvent.META_DOWN_MASK;

	private final KeyBindings bindings;
	private final ViewerCommands commands;
	private final List<KeyHandler> handlers;

	public KeyDispatcher(KeyBindings bindings, ViewerCommands commands) {
		if(bindings == null) throw new IllegalArgumentException("Null key bindings");
		if(commands == null) throw new IllegalArgumentException("Null viewer commands");
		this.bindings = bindings;
		this.commands = commands;

		List<KeyHandler> chain = new ArrayList<KeyHandler>();
		chain.add(new SpecialKeys());
		chain.add(new MediaTransition());
		chain.add(new Navigation());
		chain.add(new Manipulation());
		chain.add(new MediaControls());
		chain.add(new WindowManagement());
		chain.add(new FileManagement());
		this.handlers = Collections.unmodifiableList(chain);
	}

	/**
	 * @param keyCode {@link KeyEvent#getKeyCode()}
	 * @param modifiersEx {@link InputEvent#getModifiersEx()}
	 * @return {@link DispatchResult#HANDLED} if some handler consumed the key
	 */
	public DispatchResult dispatch(int keyCode, int modifiersEx) {
		for(KeyHandler handler : handlers) {
			if(handler.handle(keyCode, modifiersEx) == DispatchResult.HANDLED)
				return DispatchResult.HANDLED;
		}
		return DispatchResult.NOT_HANDLED;
	}

	public KeyBindings getBindings() {
		return bindings;
	}

	public List<KeyHandler> getHandlers() {
		return handlers;
	}

	private static boolean onlyCtrl(int modifiersEx) {
		return (modifiersEx&MODIFIER_MASK) == InputEvent.CTRL_DOWN_MASK;
	}

	private class SpecialKeys implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(keyCode == KeyEvent.VK_ESCAPE && commands.isFullScreen()) {
				commands.toggleFullScreen();
				return DispatchResult.HANDLED;
			}
			if(keyCode == KeyEvent.VK_D && onlyCtrl(modifiersEx)) {
				commands.toggleDebugMode();
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class MediaTransition implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.PREVIOUS_IMAGE, keyCode, modifiersEx)
					|| bindings.matches(ViewerAction.NEXT_IMAGE, keyCode, modifiersEx)) {
				if(commands.isAnimationActive())
					commands.cleanupCurrentMedia();
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class Navigation implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.PREVIOUS_IMAGE, keyCode, modifiersEx)) {
				commands.showPreviousImage();
				return DispatchResult.HANDLED;
			}
			if(bindings.matches(ViewerAction.NEXT_IMAGE, keyCode, modifiersEx)) {
				commands.showNextImage();
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class Manipulation implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.ROTATE_CLOCKWISE, keyCode, modifiersEx)) {
				commands.rotateImage(true);
				return DispatchResult.HANDLED;
			}
			if(bindings.matches(ViewerAction.ROTATE_COUNTERCLOCKWISE, keyCode, modifiersEx)) {
				commands.rotateImage(false);
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class MediaControls implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.PLAY_PAUSE, keyCode, modifiersEx)) {
				commands.toggleAnimationPlayback();
				return DispatchResult.HANDLED;
			}
			if(bindings.matches(ViewerAction.VOLUME_UP, keyCode, modifiersEx)) {
				commands.adjustVolume(Math.min(commands.getVolume() + VOLUME_STEP, MAX_VOLUME));
				return DispatchResult.HANDLED;
			}
			if(bindings.matches(ViewerAction.VOLUME_DOWN, keyCode, modifiersEx)) {
				commands.adjustVolume(Math.max(commands.getVolume() - VOLUME_STEP, 0));
				return DispatchResult.HANDLED;
			}
			if(bindings.matches(ViewerAction.TOGGLE_MUTE, keyCode, modifiersEx)) {
				commands.toggleMute();
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class WindowManagement implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.TOGGLE_FULLSCREEN, keyCode, modifiersEx)) {
				commands.toggleFullScreen();
				return DispatchResult.HANDLED;
			}
			if(keyCode == KeyEvent.VK_ESCAPE && commands.isFullScreen()) {
				commands.toggleFullScreen();
				return DispatchResult.HANDLED;
			}
			if(keyCode == KeyEvent.VK_ENTER && onlyCtrl(modifiersEx)) {
				commands.toggleFullScreen();
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}

	private class FileManagement implements KeyHandler {
		public DispatchResult handle(int keyCode, int modifiersEx) {
			if(bindings.matches(ViewerAction.DELETE_FILE, keyCode, modifiersEx)) {
				commands.deleteCurrentImage();
				return DispatchResult.HANDLED;
			}
			return DispatchResult.NOT_HANDLED;
		}
	}
}
