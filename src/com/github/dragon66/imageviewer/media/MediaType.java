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
 * MediaType.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    28Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

/**
 * Result of classifying a load request.
 */
public enum MediaType {
	GIF_IMAGE,
	GIF_ANIMATION,
	WEBP_IMAGE,
	WEBP_ANIMATION,
	IMAGE,
	FAILED;

	public boolean isAnimation() {
		return this == GIF_ANIMATION || this == WEBP_ANIMATION;
	}
}
