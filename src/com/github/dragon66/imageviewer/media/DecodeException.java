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
 * DecodeException.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    28Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.io.IOException;

/**
 * Thrown when an image file is empty, truncated, corrupt or in a format
 * none of the available readers understands.
 */
public class DecodeException extends IOException {

	private static final long serialVersionUID = -3395224405632125457L;

	public DecodeException(String message) {
		super(message);
	}

	public DecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
