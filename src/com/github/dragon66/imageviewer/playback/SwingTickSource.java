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
 * SwingTickSource.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    02Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.playback;

import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;

import javax.swing.Timer;

/**
 * Ticks driven by {@link javax.swing.Timer}, delivered on the event dispatch thread.
 */
public class SwingTickSource implements TickSource {

	public TickHandle schedule(int intervalMillis, TickListener listener) {
		if(intervalMillis <= 0)
			throw new IllegalArgumentException("Invalid tick interval: " + intervalMillis);
		if(listener == null)
			throw new IllegalArgumentException("Null tick listener");
		SwingTickHandle handle = new SwingTickHandle(intervalMillis, listener);
		handle.timer.start();

		return handle;
	}

	private static class SwingTickHandle implements TickHandle, ActionListener {
		private final Timer timer;
		private final int interval;
		private TickListener listener;

		SwingTickHandle(int interval, TickListener listener) {
			this.interval = interval;
			this.listener = listener;
			this.timer = new Timer(interval, this);
			timer.setRepeats(true);
			timer.setCoalesce(true);
		}

		public void actionPerformed(ActionEvent e) {
			// An event queued before cancel() may still arrive
			TickListener current = listener;
			if(current != null) current.tick();
		}

		public void cancel() {
			timer.stop();
			timer.removeActionListener(this);
			listener = null;
		}

		public int getInterval() {
			return interval;
		}

		public boolean isActive() {
			return listener != null && timer.isRunning();
		}
	}
}
