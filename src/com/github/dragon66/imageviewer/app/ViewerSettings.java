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
 * ViewerSettings.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    14Dec2015  Remember the last directory
 * WY    12Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.github.dragon66.imageviewer.keys.KeyBindings;
import com.github.dragon66.imageviewer.media.MediaSource;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * User preferences kept as JSON in the user data directory.
 * <pre>
 * {
 *   "keyBindings": { "prev_image": 37, "next_image": 39, ... },
 *   "playbackSpeed": 100,
 *   "volume": 100,
 *   "muted": false,
 *   "lastDirectory": "/home/me/Pictures"
 * }
 * </pre>
 * Missing entries take their defaults.
 */
public class ViewerSettings {
	public static final String FILE_NAME = "settings.json";

	private static final Logger LOGGER = Logger.getLogger(ViewerSettings.class.getName());
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private Map<String, Integer> keyBindings = new LinkedHashMap<String, Integer>();
	private int playbackSpeed = MediaSource.DEFAULT_SPEED;
	private int volume = VolumeControl.MAX_VOLUME;
	private boolean muted;
	private String lastDirectory;

	public KeyBindings getKeyBindings() {
		return KeyBindings.fromSettings(keyBindings);
	}

	public File getLastDirectory() {
		return (lastDirectory == null)? null : new File(lastDirectory);
	}

	public int getPlaybackSpeed() {
		return playbackSpeed;
	}

	public int getVolume() {
		return volume;
	}

	public boolean isMuted() {
		return muted;
	}

	/**
	 * Reads the settings file.
	 *
	 * @return the stored settings, or defaults if the file is missing or unreadable
	 */
	public static ViewerSettings load(File file) {
		if(file == null || !file.isFile()) return new ViewerSettings();

		Reader reader = null;

		try {
			reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
			ViewerSettings settings = GSON.fromJson(reader, ViewerSettings.class);
			if(settings == null) return new ViewerSettings();
			settings.normalize();
			return settings;
		} catch(JsonParseException e) {
			LOGGER.log(Level.WARNING, "Malformed settings file " + file + ", using defaults", e);
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Cannot read settings file " + file + ", using defaults", e);
		} finally {
			closeQuietly(reader);
		}

		return new ViewerSettings();
	}

	private static void closeQuietly(Reader reader) {
		if(reader == null) return;
		try {
			reader.close();
		} catch(IOException e) {
			LOGGER.log(Level.FINE, "Failed to close settings reader", e);
		}
	}

	private void normalize() {
		if(keyBindings == null) keyBindings = new LinkedHashMap<String, Integer>();
		if(playbackSpeed <= 0) playbackSpeed = MediaSource.DEFAULT_SPEED;
		volume = Math.max(0, Math.min(volume, VolumeControl.MAX_VOLUME));
	}

	public void save(File file) throws IOException {
		Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
		try {
			GSON.toJson(this, writer);
		} finally {
			writer.close();
		}
	}

	public void setKeyBindings(KeyBindings bindings) {
		this.keyBindings = bindings.toSettings();
	}

	public void setLastDirectory(File directory) {
		this.lastDirectory = (directory == null)? null : directory.getAbsolutePath();
	}

	public void setMuted(boolean muted) {
		this.muted = muted;
	}

	public void setPlaybackSpeed(int playbackSpeed) {
		if(playbackSpeed <= 0)
			throw new IllegalArgumentException("Invalid playback speed: " + playbackSpeed);
		this.playbackSpeed = playbackSpeed;
	}

	public void setVolume(int volume) {
		this.volume = Math.max(0, Math.min(volume, VolumeControl.MAX_VOLUME));
	}
}
