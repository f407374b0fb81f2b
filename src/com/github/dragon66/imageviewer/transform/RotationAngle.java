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
 * RotationAngle.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    01Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.transform;

/**
 * Clockwise orientation applied to every rendered frame.
 */
public enum RotationAngle {
	DEG_0(0),
	DEG_90(90),
	DEG_180(180),
	DEG_270(270);

	private final int degrees;

	private RotationAngle(int degrees) {
		this.degrees = degrees;
	}

	public RotationAngle clockwise() {
		return fromDegrees(degrees + 90);
	}

	public RotationAngle counterClockwise() {
		return fromDegrees(degrees - 90);
	}

	public int getDegrees() {
		return degrees;
	}

	/** Quarter turns swap width and height. */
	public boolean isQuarterTurn() {
		return this == DEG_90 || this == DEG_270;
	}

	/**
	 * @param degrees any multiple of 90, negative values turn counter-clockwise
	 */
	public static RotationAngle fromDegrees(int degrees) {
		if(degrees % 90 != 0)
			throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees: " + degrees);
		int normalized = ((degrees % 360) + 360) % 360;
		for(RotationAngle angle : values()) {
			if(angle.degrees == normalized) return angle;
		}
		throw new AssertionError(normalized);
	}
}
