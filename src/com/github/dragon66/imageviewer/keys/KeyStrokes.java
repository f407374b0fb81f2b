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
 * KeyStrokes.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    10Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.keys;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;

/**
 * Encodes a key together with its Ctrl, Alt and Shift modifiers in one int,
 * the form key bindings are stored in.
 * <p>
 * The low 16 bits hold the {@link KeyEvent} VK_ code, the modifier flags sit above.
 */
public final class KeyStrokes {
	public static final int CTRL = 1<<16;
	public static final int ALT = 1<<17;
	public static final int SHIFT = 1<<18;

	private static final int KEY_MASK = 0xffff;
	private static final int MODIFIER_MASK = CTRL|ALT|SHIFT;

	/**
	 * @param keyCode the VK_ code of the key pressed
	 * @param modifiersEx {@link InputEvent#getModifiersEx()} of the same event
	 * @return the encoded stroke
	 */
	public static int capture(int keyCode, int modifiersEx) {
		return (keyCode&KEY_MASK)|toFlags(modifiersEx);
	}

	/**
	 * Text for a stroke the way the shortcut field shows it, for example Ctrl+Shift+S.
	 */
	public static String describe(int stroke) {
		StringBuilder text = new StringBuilder();

		if((stroke&CTRL) != 0) text.append("Ctrl+");
		if((stroke&ALT) != 0) text.append("Alt+");
		if((stroke&SHIFT) != 0) text.append("Shift+");

		int keyCode = keyCode(stroke);
		if(keyCode == KeyEvent.VK_ENTER)
			text.append("Enter");
		else
			text.append(KeyEvent.getKeyText(keyCode));

		return text.toString();
	}

	/**
	 * Whether a key can become a shortcut. Escape and Tab drive dialogs and focus,
	 * and a modifier on its own is not a shortcut.
	 */
	public static boolean isCapturable(int keyCode) {
		switch(keyCode) {
			case KeyEvent.VK_ESCAPE:
			case KeyEvent.VK_TAB:
			case KeyEvent.VK_CONTROL:
			case KeyEvent.VK_ALT:
			case KeyEvent.VK_SHIFT:
			case KeyEvent.VK_META:
			case KeyEvent.VK_ALT_GRAPH:
			case KeyEvent.VK_UNDEFINED:
				return false;
			default:
				return true;
		}
	}

	public static int keyCode(int stroke) {
		return stroke&KEY_MASK;
	}

	/**
	 * A stroke bound without modifiers matches its key whatever modifiers are
	 * held; one bound with modifiers needs exactly those.
	 */
	public static boolean matches(int stroke, int keyCode, int modifiersEx) {
		if(keyCode(stroke) != keyCode) return false;
		int flags = stroke&MODIFIER_MASK;
		return flags == 0 || flags == toFlags(modifiersEx);
	}

	private static int toFlags(int modifiersEx) {
		int flags = 0;
		if((modifiersEx&InputEvent.CTRL_DOWN_MASK) != 0) flags |= CTRL;
		if((modifiersEx&InputEvent.ALT_DOWN_MASK) != 0) flags |= ALT;
		if((modifiersEx&InputEvent.SHIFT_DOWN_MASK) != 0) flags |= SHIFT;
		return flags;
	}

	private KeyStrokes() {}
}
