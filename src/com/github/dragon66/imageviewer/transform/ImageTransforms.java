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
 * ImageTransforms.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    01Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.transform;

import java.awt.AlphaComposite;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Rotation and scale-to-fit on decoded frames. Both always produce a new
 * ARGB image and leave the source untouched, except where noted.
 */
public final class ImageTransforms {

	/**
	 * Rotates the image clockwise about its centre.
	 *
	 * @return the input itself for {@link RotationAngle#DEG_0}
	 */
	public static BufferedImage rotate(BufferedImage image, RotationAngle angle) {
		if(image == null) throw new IllegalArgumentException("Null input image");
		if(angle == null || angle == RotationAngle.DEG_0) return image;

		int w = image.getWidth();
		int h = image.getHeight();
		int newWidth = angle.isQuarterTurn()? h : w;
		int newHeight = angle.isQuarterTurn()? w : h;

		AffineTransform transform = new AffineTransform();
		transform.translate(newWidth/2.0, newHeight/2.0);
		transform.rotate(Math.toRadians(angle.getDegrees()));
		transform.translate(-w/2.0, -h/2.0);

		BufferedImage rotated = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = rotated.createGraphics();

		try {
			g.setComposite(AlphaComposite.Src);
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
			g.drawImage(image, transform, null);
		} finally {
			g.dispose();
		}

		return rotated;
	}

	/**
	 * Scales the image to the largest size that fits the box while keeping its aspect ratio.
	 *
	 * @return the input itself if the box is empty or the image already has the fitted size
	 */
	public static BufferedImage scaleToFit(BufferedImage image, int boxWidth, int boxHeight) {
		if(image == null) throw new IllegalArgumentException("Null input image");
		if(boxWidth <= 0 || boxHeight <= 0) return image;

		Dimension size = fitSize(image.getWidth(), image.getHeight(), boxWidth, boxHeight);
		if(size.width == image.getWidth() && size.height == image.getHeight()) return image;

		BufferedImage scaled = new BufferedImage(size.width, size.height, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = scaled.createGraphics();

		try {
			g.setComposite(AlphaComposite.Src);
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
			g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
			g.drawImage(image, 0, 0, size.width, size.height, null);
		} finally {
			g.dispose();
		}

		return scaled;
	}

	/**
	 * Computes the aspect-preserving size of a width x height picture inside a box.
	 * Neither dimension of the result drops below 1.
	 */
	public static Dimension fitSize(int width, int height, int boxWidth, int boxHeight) {
		if(height <= 0) height = 1; // Avoid division by zero
		if(width <= 0) width = 1;

		int newWidth;
		int newHeight;

		if((double)boxWidth/boxHeight > (double)width/height) {
			// Box is wider, fit to height
			newHeight = boxHeight;
			newWidth = (int)(newHeight * ((double)width/height));
		} else {
			// Fit to width
			newWidth = boxWidth;
			newHeight = (int)(newWidth * ((double)height/width));
		}

		return new Dimension(Math.max(1, newWidth), Math.max(1, newHeight));
	}

	/**
	 * Rotation followed by scale-to-fit, the path every displayed frame takes.
	 */
	public static BufferedImage render(BufferedImage image, RotationAngle angle, int boxWidth, int boxHeight) {
		return scaleToFit(rotate(image, angle), boxWidth, boxHeight);
	}

	private ImageTransforms() {}
}
