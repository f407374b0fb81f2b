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
 * MediaFormat.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    28Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.util.Locale;

/**
 * Container formats the viewer knows how to open.
 */
public enum MediaFormat {
	GIF("GIF", MediaType.GIF_IMAGE, MediaType.GIF_ANIMATION),
	WEBP("WEBP", MediaType.WEBP_IMAGE, MediaType.WEBP_ANIMATION),
	OTHER("Image", MediaType.IMAGE, MediaType.IMAGE);

	private final String displayName;
	private final MediaType staticType;
	private final MediaType animatedType;

	private MediaFormat(String displayName, MediaType staticType, MediaType animatedType) {
		this.displayName = displayName;
		this.staticType = staticType;
		this.animatedType = animatedType;
	}

	public String getDisplayName() {
		return displayName;
	}

	public MediaType classify(int frameCount) {
		return (frameCount > 1)? animatedType : staticType;
	}

	/**
	 * Sniffs the container format from the first bytes of a file.
	 *
	 * @param magic at least the first 12 bytes of the file, fewer if the file is shorter
	 * @return the detected format or null if the bytes are not recognized
	 */
	public static MediaFormat fromMagic(byte[] magic) {
		if(magic == null) return null;
		if(magic.length >= 6 && magic[0] == 'G' && magic[1] == 'I' && magic[2] == 'F' && magic[3] == '8'
				&& (magic[4] == '7' || magic[4] == '9') && magic[5] == 'a')
			return GIF;
		if(magic.length >= 12 && magic[0] == 'R' && magic[1] == 'I' && magic[2] == 'F' && magic[3] == 'F'
				&& magic[8] == 'W' && magic[9] == 'E' && magic[10] == 'B' && magic[11] == 'P')
			return WEBP;
		return null;
	}

	public static MediaFormat fromFileName(String fileName) {
		if(fileName == null) return OTHER;
		String lower = fileName.toLowerCase(Locale.ROOT);
		if(lower.endsWith(".gif")) return GIF;
		if(lower.endsWith(".webp")) return WEBP;
		return OTHER;
	}
}
