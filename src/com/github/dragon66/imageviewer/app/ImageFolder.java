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
 * ImageFolder.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    13Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * The images next to the one being viewed, in name order, with wrap-around
 * previous and next.
 */
public class ImageFolder {
	public static final List<String> EXTENSIONS = Collections.unmodifiableList(
			Arrays.asList("gif", "webp", "png", "jpg", "jpeg", "bmp"));

	private static final Comparator<File> BY_NAME = new Comparator<File>() {
		public int compare(File f1, File f2) {
			int result = f1.getName().compareToIgnoreCase(f2.getName());
			return (result != 0)? result : f1.getName().compareTo(f2.getName());
		}
	};

	private final List<File> files;
	private int index;

	private ImageFolder(List<File> files, int index) {
		this.files = files;
		this.index = index;
	}

	/**
	 * Lists the supported images in the file's directory, positioned on the file.
	 */
	public static ImageFolder forFile(File file) {
		File current = file.getAbsoluteFile();
		File dir = current.getParentFile();
		List<File> files = new ArrayList<File>();
		File[] entries = (dir == null)? null : dir.listFiles();

		if(entries != null) {
			for(File entry : entries) {
				if(entry.isFile() && isSupported(entry)) files.add(entry.getAbsoluteFile());
			}
		}
		if(!files.contains(current)) files.add(current);
		Collections.sort(files, BY_NAME);

		return new ImageFolder(files, files.indexOf(current));
	}

	/**
	 * Deletes the current file from disk and moves to the one after it.
	 *
	 * @return the new current file or null if the folder is now empty
	 * @throws IOException if the file cannot be deleted, the position is then unchanged
	 */
	public File deleteCurrent() throws IOException {
		File current = getCurrent();
		if(current == null) return null;
		Files.deleteIfExists(current.toPath());
		files.remove(index);

		if(files.isEmpty()) {
			index = -1;
			return null;
		}
		if(index >= files.size()) index = 0;

		return files.get(index);
	}

	public File getCurrent() {
		return (index < 0)? null : files.get(index);
	}

	public List<File> getFiles() {
		return Collections.unmodifiableList(files);
	}

	/**
	 * @return zero-based position of the current file, -1 if empty
	 */
	public int getIndex() {
		return index;
	}

	public static boolean isSupported(File file) {
		String name = file.getName().toLowerCase(Locale.ROOT);
		int dot = name.lastIndexOf('.');
		return dot >= 0 && EXTENSIONS.contains(name.substring(dot + 1));
	}

	public File next() {
		if(files.isEmpty()) return null;
		index = (index + 1) % files.size();
		return files.get(index);
	}

	public File previous() {
		if(files.isEmpty()) return null;
		index = (index - 1 + files.size()) % files.size();
		return files.get(index);
	}

	public int size() {
		return files.size();
	}
}
