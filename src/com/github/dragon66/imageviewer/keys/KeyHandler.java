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
 * KeyHandler.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    09Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

/**
 * One link of the key dispatch chain.
 */
public interface KeyHandler {
	/**
	 * @param keyCode a {@link java.awt.event.KeyEvent} VK_ code
	 * @param modifiers {@link java.awt.event.InputEvent} extended modifier mask
	 * @return {@link DispatchResult#HANDLED} to stop the dispatch
	 */
	DispatchResult handle(int keyCode, int modifiers);
}
