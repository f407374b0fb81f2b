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
 * GifFixtures.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    15Dec2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;

/**
 * Builds small GIF files with the JDK's own GIF writer.
 */
public final class GifFixtures {

	/**
	 * Solid color frame using the default 256 color palette.
	 */
	public static BufferedImage solid(int width, int height, Color color) {
		BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_INDEXED);
		Graphics2D g = img.createGraphics();
		g.setColor(color);
		g.fillRect(0, 0, width, height);
		g.dispose();

		return img;
	}

	/**
	 * Encodes one frame per color, each with its own delay.
	 *
	 * @param delays frame delays in hundredths of a second
	 */
	public static byte[] animatedGif(int width, int height, Color[] colors, int[] delays) throws IOException {
		if(colors.length != delays.length) throw new IllegalArgumentException("One delay per color");

		ImageWriter writer = ImageIO.getImageWritersByFormatName("gif").next();
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		ImageOutputStream ios = ImageIO.createImageOutputStream(bout);

		try {
			writer.setOutput(ios);
			writer.prepareWriteSequence(null);

			for(int i = 0; i < colors.length; i++) {
				BufferedImage frame = solid(width, height, colors[i]);
				IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(frame), null);
				String format = metadata.getNativeMetadataFormatName();
				IIOMetadataNode root = (IIOMetadataNode)metadata.getAsTree(format);
				IIOMetadataNode gce = childNode(root, "GraphicControlExtension");
				gce.setAttribute("disposalMethod", "none");
				gce.setAttribute("userInputFlag", "FALSE");
				gce.setAttribute("transparentColorFlag", "FALSE");
				gce.setAttribute("transparentColorIndex", "0");
				gce.setAttribute("delayTime", String.valueOf(delays[i]));
				metadata.setFromTree(format, root);
				writer.writeToSequence(new IIOImage(frame, null, metadata), null);
			}

			writer.endWriteSequence();
		} finally {
			ios.close();
			writer.dispose();
		}

		return bout.toByteArray();
	}

	public static File writeAnimatedGif(File file, int width, int height, Color[] colors, int[] delays) throws IOException {
		Files.write(file.toPath(), animatedGif(width, height, colors, delays));
		return file;
	}

	public static File writeImage(File file, String format, BufferedImage image) throws IOException {
		if(!ImageIO.write(image, format, file))
			throw new IOException("No ImageIO writer for " + format);
		return file;
	}

	/**
	 * A few bytes claiming a 40000x40000 logical screen.
	 */
	public static byte[] oversizedScreenGif() {
		return handMadeGif(40000, 40000, 40000, 40000);
	}

	/**
	 * A 10x10 logical screen holding a 40000x40000 frame.
	 */
	public static byte[] oversizedFrameGif() {
		return handMadeGif(10, 10, 40000, 40000);
	}

	private static byte[] handMadeGif(int screenWidth, int screenHeight, int frameWidth, int frameHeight) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		bout.write('G'); bout.write('I'); bout.write('F');
		bout.write('8'); bout.write('9'); bout.write('a');
		writeShort(bout, screenWidth);
		writeShort(bout, screenHeight);
		bout.write(0x80); // Two color global table
		bout.write(0);
		bout.write(0);
		bout.write(new byte[6], 0, 6);
		bout.write(0x2c);
		writeShort(bout, 0);
		writeShort(bout, 0);
		writeShort(bout, frameWidth);
		writeShort(bout, frameHeight);
		bout.write(0);
		bout.write(2); // LZW minimum code size
		bout.write(0);
		bout.write(0x3b);

		return bout.toByteArray();
	}

	/**
	 * Appends a 4x4 frame whose LZW codes build a loop in the string table,
	 * followed by the trailer, to a GIF stripped of its own trailer.
	 */
	public static byte[] withLoopingLzwFrame(byte[] gif) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		bout.write(gif, 0, gif.length - 1);
		bout.write(0x2c);
		writeShort(bout, 0);
		writeShort(bout, 0);
		writeShort(bout, 4);
		writeShort(bout, 4);
		bout.write(0x80); // Two color local table
		bout.write(new byte[6], 0, 6);
		bout.write(2);
		// Codes 7, 6, 7 in three bits then 6 in four bits
		bout.write(2);
		bout.write(0xf7);
		bout.write(0x0d);
		bout.write(0);
		bout.write(0x3b);

		return bout.toByteArray();
	}

	private static void writeShort(ByteArrayOutputStream bout, int value) {
		bout.write(value&0xff);
		bout.write((value>>8)&0xff);
	}

	private static IIOMetadataNode childNode(IIOMetadataNode root, String name) {
		for(int i = 0; i < root.getLength(); i++) {
			if(root.item(i).getNodeName().equalsIgnoreCase(name))
				return (IIOMetadataNode)root.item(i);
		}
		IIOMetadataNode node = new IIOMetadataNode(name);
		root.appendChild(node);

		return node;
	}

	private GifFixtures() {}
}
