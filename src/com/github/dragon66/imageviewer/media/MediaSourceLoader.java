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
 * MediaSourceLoader.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    18Dec2015  Refuse images above the pixel budget before decoding
 * WY    04Dec2015  WEBP through the ImageIO plugin registry
 * WY    30Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import com.github.dragon66.imageviewer.media.AnimatedGIFReader.GIFFrame;

/**
 * Opens a file as a {@link MediaSource}.
 * <p>
 * GIF goes through {@link AnimatedGIFReader}. Everything else, WEBP included,
 * goes through whatever ImageIO reader is registered for it; the WEBP reader
 * comes from the TwelveMonkeys plugin on the class path. ImageIO readers do
 * not report frame delays, so those frames get {@link MediaSource#DEFAULT_FRAME_DELAY}.
 */
public class MediaSourceLoader {
	private static final Logger LOGGER = Logger.getLogger(MediaSourceLoader.class.getName());

	private static final int MAGIC_LENGTH = 12;

	static {
		// Pick up plugins such as the WEBP reader
		ImageIO.scanForPlugins();
	}

	/**
	 * Decodes all frames of the file.
	 *
	 * @param file GIF, WEBP or any other ImageIO readable image
	 * @return the decoded source, stopped at frame 0
	 * @throws DecodeException if the file is missing, empty, corrupt or unsupported
	 * @throws IOException if reading the file fails
	 */
	public MediaSource load(File file) throws IOException {
		if(file == null) throw new IllegalArgumentException("Null input file");
		if(!file.isFile() || !file.canRead())
			throw new DecodeException("Unreadable file: " + file);
		if(file.length() == 0)
			throw new DecodeException("Empty file: " + file);

		MediaFormat format = detectFormat(file);

		try {
			if(format == MediaFormat.GIF)
				return loadGif(file);
			return loadWithImageIO(file, format);
		} catch(RuntimeException e) {
			// Third party readers throw all sorts of unchecked exceptions on corrupt input
			throw new DecodeException("Corrupt image: " + file.getName(), e);
		}
	}

	/**
	 * Sniffs the file's magic bytes, falling back to its extension.
	 */
	public MediaFormat detectFormat(File file) throws IOException {
		byte[] magic = new byte[MAGIC_LENGTH];
		int n = 0;
		InputStream is = new FileInputStream(file);

		try {
			int count = 0;
			while(n < MAGIC_LENGTH && (count = is.read(magic, n, MAGIC_LENGTH - n)) >= 0)
				n += count;
		} finally {
			is.close();
		}

		MediaFormat format = MediaFormat.fromMagic(Arrays.copyOf(magic, n));
		if(format != null) return format;

		return MediaFormat.fromFileName(file.getName());
	}

	private MediaSource loadGif(File file) throws IOException {
		AnimatedGIFReader reader = new AnimatedGIFReader();
		List<GIFFrame> gifFrames;
		InputStream is = new BufferedInputStream(new FileInputStream(file));

		try {
			gifFrames = reader.read(is);
		} finally {
			is.close();
		}

		List<BufferedImage> frames = new ArrayList<BufferedImage>(gifFrames.size());
		int[] delays = new int[gifFrames.size()];

		for(int i = 0; i < gifFrames.size(); i++) {
			frames.add(gifFrames.get(i).getFrame());
			delays[i] = gifFrames.get(i).getDelay();
		}

		LOGGER.log(Level.FINE, "Decoded GIF " + file.getName() + ": " + frames.size() + " frame(s), "
				+ reader.getLogicalScreenWidth() + "x" + reader.getLogicalScreenHeight());

		return new MediaSource(file, MediaFormat.GIF, frames, delays);
	}

	private MediaSource loadWithImageIO(File file, MediaFormat format) throws IOException {
		ImageInputStream iis = ImageIO.createImageInputStream(file);
		if(iis == null) throw new DecodeException("Cannot open image stream: " + file);

		try {
			Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
			if(!readers.hasNext())
				throw new DecodeException("Unsupported image format: " + file.getName());

			ImageReader reader = readers.next();

			try {
				reader.setInput(iis, false, false);
				int num = countImages(reader);

				List<BufferedImage> frames = new ArrayList<BufferedImage>();
				long totalPixels = 0;
				for(int i = 0; i < num; i++) {
					long pixels = (long)reader.getWidth(i)*reader.getHeight(i);
					if(pixels > MediaSource.MAX_FRAME_PIXELS)
						throw new DecodeException("Image too large: " + file.getName() + " "
								+ reader.getWidth(i) + "x" + reader.getHeight(i));
					totalPixels += pixels;
					if(totalPixels > MediaSource.MAX_TOTAL_PIXELS && !frames.isEmpty()) {
						LOGGER.log(Level.WARNING, file.getName() + " exceeds the pixel budget, keeping " + frames.size() + " frame(s)");
						break;
					}
					BufferedImage img = reader.read(i);
					if(img != null) frames.add(toArgb(img));
				}

				if(frames.isEmpty())
					throw new DecodeException("No image in file: " + file.getName());

				int[] delays = new int[frames.size()];
				Arrays.fill(delays, MediaSource.DEFAULT_FRAME_DELAY);

				LOGGER.log(Level.FINE, "Decoded " + format.getDisplayName() + " " + file.getName() + " with "
						+ reader.getClass().getSimpleName() + ": " + frames.size() + " frame(s)");

				return new MediaSource(file, format, frames, delays);
			} catch(DecodeException e) {
				throw e;
			} catch(IOException e) {
				throw new DecodeException("Corrupt image: " + file.getName(), e);
			} finally {
				reader.dispose();
			}
		} finally {
			iis.close();
		}
	}

	private static int countImages(ImageReader reader) throws IOException {
		try {
			return Math.max(1, reader.getNumImages(true));
		} catch(IllegalStateException e) {
			// Readers that cannot seek report no count, read the first image only
			LOGGER.log(Level.FINE, reader.getClass().getSimpleName() + " cannot count images", e);
			return 1;
		}
	}

	private static BufferedImage toArgb(BufferedImage src) {
		if(src.getType() == BufferedImage.TYPE_INT_ARGB) return src;
		BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = out.createGraphics();
		g.setComposite(AlphaComposite.Src);
		g.drawImage(src, 0, 0, null);
		g.dispose();

		return out;
	}
}
