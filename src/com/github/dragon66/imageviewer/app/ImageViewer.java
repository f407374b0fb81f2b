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
 * ImageViewer.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    14Dec2015  Load settings from the user data directory
 * WY    05Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import javax.swing.SwingUtilities;

/**
 * Starts the viewer, optionally opening the file named on the command line.
 */
public class ImageViewer {
	private static final Logger LOGGER = Logger.getLogger(ImageViewer.class.getName());

	public static void main(final String[] args) {
		configureLogging();

		File settingsFile = null;

		try {
			settingsFile = new File(AppPaths.getUserDataDirectory(), ViewerSettings.FILE_NAME);
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Cannot create user data directory, settings will not be saved", e);
		}

		final ViewerSettings settings = ViewerSettings.load(settingsFile);
		final File file = settingsFile;

		SwingUtilities.invokeLater(new Runnable() {
			public void run() {
				ImageViewerFrame frame = new ImageViewerFrame(settings, file);
				frame.setSize(800, 600);
				frame.setLocationRelativeTo(null);
				frame.setVisible(true);
				if(args.length > 0)
					frame.openFile(new File(args[0]));
			}
		});
	}

	private static void configureLogging() {
		InputStream in = ImageViewer.class.getResourceAsStream("/logging.properties");
		if(in == null) return;
		try {
			LogManager.getLogManager().readConfiguration(in);
		} catch(IOException e) {
			LOGGER.log(Level.WARNING, "Cannot read logging configuration", e);
		} finally {
			try {
				in.close();
			} catch(IOException e) {
				LOGGER.log(Level.FINE, "Failed to close logging configuration", e);
			}
		}
	}
}
