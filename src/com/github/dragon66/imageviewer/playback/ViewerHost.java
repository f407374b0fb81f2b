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
 * ViewerHost.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    03Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * Optional hooks the window hosting an {@link AnimationHandler} may
 * implement. Extend {@link ViewerHostAdapter} to pick only some of them.
 */
public interface ViewerHost {
	void hideLoadingIndicator();

	void playbackStateChanged(boolean playing);

	void showLoadingIndicator();

	/**
	 * Transient status text such as load progress or failures.
	 */
	void showMessage(String message);

	/**
	 * Something shown about the current image (size, rotation, position) changed.
	 */
	void updateImageInfo();
}
