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
 * ImageLabel.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    03Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.awt.Color;
import java.awt.image.BufferedImage;

import javax.swing.ImageIcon;
import javax.swing.JLabel;
import javax.swing.SwingConstants;

import com.github.dragon66.imageviewer.playback.RenderSink;

/**
 * Centered label showing the current frame.
 */
public class ImageLabel extends JLabel implements RenderSink {

	private static final long serialVersionUID = 4811740963577282105L;

	public ImageLabel() {
		super("", SwingConstants.CENTER);
		setOpaque(true);
		setBackground(Color.BLACK);
		setForeground(Color.LIGHT_GRAY);
	}

	public void clear() {
		setIcon(null);
	}

	public void display(BufferedImage image) {
		setText("");
		setIcon(new ImageIcon(image));
	}
}
