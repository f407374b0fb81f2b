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
 * ViewerHostAdapter.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    03Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

/**
 * An abstract adapter class for receiving viewer notifications.
 * The methods in this class are empty.
 */
public abstract class ViewerHostAdapter implements ViewerHost {
	public void hideLoadingIndicator() {}

	public void playbackStateChanged(boolean playing) {}

	public void showLoadingIndicator() {}

	public void showMessage(String message) {}

	public void updateImageInfo() {}
}
