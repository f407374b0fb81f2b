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
 * ViewerAction.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    09Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

import java.awt.event.KeyEvent;

/**
 * User commands that can be bound to a key, with their default key.
 * The setting name is what the binding is stored under in the settings file.
 */
public enum ViewerAction {
	PREVIOUS_IMAGE("prev_image", KeyEvent.VK_LEFT),
	NEXT_IMAGE("next_image", KeyEvent.VK_RIGHT),
	ROTATE_CLOCKWISE("rotate_clockwise", KeyEvent.VK_R),
	ROTATE_COUNTERCLOCKWISE("rotate_counterclockwise", KeyEvent.VK_L),
	PLAY_PAUSE("play_pause", KeyEvent.VK_SPACE),
	VOLUME_UP("volume_up", KeyEvent.VK_UP),
	VOLUME_DOWN("volume_down", KeyEvent.VK_DOWN),
	TOGGLE_MUTE("toggle_mute", KeyEvent.VK_M),
	TOGGLE_FULLSCREEN("toggle_fullscreen", KeyEvent.VK_F11),
	DELETE_FILE("delete_file", KeyEvent.VK_DELETE);

	private final String settingName;
	private final int defaultKey;

	private ViewerAction(String settingName, int defaultKey) {
		this.settingName = settingName;
		this.defaultKey = defaultKey;
	}

	public int getDefaultKey() {
		return defaultKey;
	}

	public String getSettingName() {
		return settingName;
	}

	/**
	 * @return the action stored under the name, or null for an unknown name
	 */
	public static ViewerAction fromSettingName(String settingName) {
		for(ViewerAction action : values()) {
			if(action.settingName.equals(settingName)) return action;
		}
		return null;
	}
}
