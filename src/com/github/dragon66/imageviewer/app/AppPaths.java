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
 * AppPaths.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    12Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.app;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.security.CodeSource;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Where the viewer is installed and where it keeps its user data.
 */
public final class AppPaths {
	public static final String USER_DATA_DIR = "UserData";

	private static final Logger LOGGER = Logger.getLogger(AppPaths.class.getName());

	/**
	 * The directory holding the application jar, or the parent of the class
	 * directory when running from a build tree. Falls back to the working directory.
	 */
	public static File getAppDirectory() {
		try {
			CodeSource codeSource = AppPaths.class.getProtectionDomain().getCodeSource();
			if(codeSource != null && codeSource.getLocation() != null) {
				File location = new File(codeSource.getLocation().toURI());
				File parent = location.getAbsoluteFile().getParentFile();
				if(parent != null) return parent;
			}
		} catch(URISyntaxException e) {
			LOGGER.log(Level.WARNING, "Cannot resolve application location", e);
		} catch(SecurityException e) {
			LOGGER.log(Level.WARNING, "Cannot resolve application location", e);
		}

		return new File(System.getProperty("user.dir")).getAbsoluteFile();
	}

	public static File getUserDataDirectory() throws IOException {
		return getUserDataDirectory(getAppDirectory());
	}

	/**
	 * @param appDirectory base directory
	 * @return the user data directory under it, created if it did not exist yet
	 * @throws IOException if the directory cannot be created
	 */
	public static File getUserDataDirectory(File appDirectory) throws IOException {
		File dataDir = new File(appDirectory, USER_DATA_DIR);
		Files.createDirectories(dataDir.toPath());

		return dataDir;
	}

	private AppPaths() {}
}
