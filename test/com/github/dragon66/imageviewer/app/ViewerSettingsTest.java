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
 * ViewerSettingsTest.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    16Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.awt.event.KeyEvent;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.dragon66.imageviewer.keys.KeyBindings;
import com.github.dragon66.imageviewer.keys.KeyStrokes;
import com.github.dragon66.imageviewer.keys.ViewerAction;
import com.github.dragon66.imageviewer.media.MediaSource;

public class ViewerSettingsTest {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private File write(String json) throws IOException {
		File file = tmp.newFile(ViewerSettings.FILE_NAME);
		Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void missingFileGivesDefaults() {
		ViewerSettings settings = ViewerSettings.load(new File(tmp.getRoot(), ViewerSettings.FILE_NAME));

		assertEquals(MediaSource.DEFAULT_SPEED, settings.getPlaybackSpeed());
		assertEquals(VolumeControl.MAX_VOLUME, settings.getVolume());
		assertFalse(settings.isMuted());
		assertNull(settings.getLastDirectory());
		assertEquals(KeyEvent.VK_RIGHT, settings.getKeyBindings().getKey(ViewerAction.NEXT_IMAGE));
		assertEquals(MediaSource.DEFAULT_SPEED, ViewerSettings.load(null).getPlaybackSpeed());
	}

	@Test
	public void savedSettingsReloaded() throws IOException {
		KeyBindings bindings = new KeyBindings();
		bindings.setKey(ViewerAction.PLAY_PAUSE, KeyEvent.VK_P|KeyStrokes.CTRL);

		ViewerSettings settings = new ViewerSettings();
		settings.setKeyBindings(bindings);
		settings.setPlaybackSpeed(150);
		settings.setVolume(35);
		settings.setMuted(true);
		settings.setLastDirectory(tmp.getRoot());

		File file = new File(tmp.getRoot(), ViewerSettings.FILE_NAME);
		settings.save(file);
		ViewerSettings loaded = ViewerSettings.load(file);

		assertEquals(150, loaded.getPlaybackSpeed());
		assertEquals(35, loaded.getVolume());
		assertTrue(loaded.isMuted());
		assertEquals(tmp.getRoot().getAbsoluteFile(), loaded.getLastDirectory());
		assertEquals(KeyEvent.VK_P|KeyStrokes.CTRL, loaded.getKeyBindings().getKey(ViewerAction.PLAY_PAUSE));
	}

	@Test
	public void fileUsesSettingNames() throws IOException {
		File file = new File(tmp.getRoot(), ViewerSettings.FILE_NAME);
		new ViewerSettings().save(file);

		String json = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);

		assertTrue(json.contains("\"keyBindings\""));
		assertTrue(json.contains("\"playbackSpeed\": 100"));
	}

	@Test
	public void partialFileKeepsOtherDefaults() throws IOException {
		ViewerSettings settings = ViewerSettings.load(write("{\"volume\": 40, \"keyBindings\": {\"next_image\": 78}}"));

		assertEquals(40, settings.getVolume());
		assertEquals(MediaSource.DEFAULT_SPEED, settings.getPlaybackSpeed());
		assertEquals(KeyEvent.VK_N, settings.getKeyBindings().getKey(ViewerAction.NEXT_IMAGE));
		assertEquals(KeyEvent.VK_LEFT, settings.getKeyBindings().getKey(ViewerAction.PREVIOUS_IMAGE));
	}

	@Test
	public void outOfRangeValuesAreRepaired() throws IOException {
		ViewerSettings settings = ViewerSettings.load(write("{\"volume\": 400, \"playbackSpeed\": 0, \"keyBindings\": null}"));

		assertEquals(VolumeControl.MAX_VOLUME, settings.getVolume());
		assertEquals(MediaSource.DEFAULT_SPEED, settings.getPlaybackSpeed());
		assertEquals(KeyEvent.VK_SPACE, settings.getKeyBindings().getKey(ViewerAction.PLAY_PAUSE));
	}

	@Test
	public void malformedFileGivesDefaults() throws IOException {
		ViewerSettings settings = ViewerSettings.load(write("{ this is not json"));

		assertEquals(VolumeControl.MAX_VOLUME, settings.getVolume());
	}

	@Test(expected = IllegalArgumentException.class)
	public void speedMustBePositive() {
		new ViewerSettings().setPlaybackSpeed(-1);
	}
}
