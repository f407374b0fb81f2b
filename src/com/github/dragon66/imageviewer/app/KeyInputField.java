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
 * KeyInputField.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    10Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.awt.Color;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;

import javax.swing.JTextField;

import com.github.dragon66.imageviewer.keys.KeyStrokes;

/**
 * Read-only field that records the next key stroke typed into it,
 * used to rebind shortcuts.
 */
public class KeyInputField extends JTextField {

	private static final long serialVersionUID = 2164416375093318432L;

	public static final int NO_STROKE = -1;

	private int stroke = NO_STROKE;

	public KeyInputField() {
		setEditable(false);
		setHorizontalAlignment(JTextField.CENTER);
		setBackground(new Color(0xf0, 0xf0, 0xf0));
		setToolTipText("Click here and press a key");

		addKeyListener(new KeyAdapter() {
			public void keyPressed(KeyEvent e) {
				if(capture(e.getKeyCode(), e.getModifiersEx()))
					e.consume();
			}
		});
	}

	/**
	 * Records a stroke unless the key cannot be a shortcut.
	 *
	 * @return true if the stroke was recorded
	 */
	boolean capture(int keyCode, int modifiersEx) {
		if(!KeyStrokes.isCapturable(keyCode)) return false;
		setStroke(KeyStrokes.capture(keyCode, modifiersEx));
		return true;
	}

	/**
	 * @return the recorded stroke or {@link #NO_STROKE}
	 */
	public int getStroke() {
		return stroke;
	}

	public void setStroke(int stroke) {
		this.stroke = stroke;
		setText((stroke == NO_STROKE)? "" : KeyStrokes.describe(stroke));
	}
}
