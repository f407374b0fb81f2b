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
 * PlaybackSlider.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    04Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.awt.BorderLayout;
import java.util.ArrayList;
import java.util.List;

import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JSlider;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;

import com.github.dragon66.imageviewer.playback.PositionIndicator;
import com.github.dragon66.imageviewer.playback.PositionListener;

/**
 * Frame scrubber with a "current / total" label.
 * <p>
 * The slider's value-is-adjusting flag turning on and off is reported as a
 * drag start and finish; every other change is a value change.
 */
public class PlaybackSlider extends JPanel implements PositionIndicator {

	private static final long serialVersionUID = -1867400372845151186L;

	private final JSlider slider = new JSlider(0, 0, 0);
	private final JLabel positionLabel = new JLabel("0 / 0");
	private final List<PositionListener> listeners = new ArrayList<PositionListener>();
	private boolean adjusting;

	public PlaybackSlider() {
		super(new BorderLayout(5, 0));
		slider.setFocusable(false);
		add(slider, BorderLayout.CENTER);
		add(positionLabel, BorderLayout.EAST);

		slider.addChangeListener(new ChangeListener() {
			public void stateChanged(ChangeEvent e) {
				fireStateChanged();
			}
		});
	}

	public void addPositionListener(PositionListener listener) {
		if(listener != null && !listeners.contains(listener)) listeners.add(listener);
	}

	private void fireStateChanged() {
		// Listeners may remove themselves while being notified
		List<PositionListener> snapshot = new ArrayList<PositionListener>(listeners);
		boolean nowAdjusting = slider.getValueIsAdjusting();

		if(nowAdjusting && !adjusting) {
			adjusting = true;
			for(PositionListener listener : snapshot) listener.dragStarted();
		} else if(!nowAdjusting && adjusting) {
			adjusting = false;
			for(PositionListener listener : snapshot) listener.dragFinished();
			return;
		}

		int value = slider.getValue();
		for(PositionListener listener : snapshot) listener.valueChanged(value);
	}

	JSlider getSlider() {
		return slider;
	}

	public String getPositionText() {
		return positionLabel.getText();
	}

	public int getValue() {
		return slider.getValue();
	}

	public void removePositionListener(PositionListener listener) {
		listeners.remove(listener);
	}

	public void setPositionText(String text) {
		positionLabel.setText(text);
	}

	public void setRange(int minimum, int maximum) {
		slider.setMinimum(minimum);
		slider.setMaximum(Math.max(minimum, maximum));
	}

	public void setValue(int value) {
		slider.setValue(value);
	}
}
