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
 * AnimatedGIFReader.java
 *
 * Who   Date       Description
 * ====  =========  =================================================
 * WY    18Dec2015  Pixel budget for screen and frames, slimmer GIFFrame
 * WY    05Dec2015  Skip unread image data sub-blocks after each frame
 * WY    02Dec2015  Per-frame palette copy so transparency does not leak
 * WY    28Nov2015  Delays in milliseconds, failures as DecodeException
 * WY    20Nov2015  Initial creation
 */

package com.github.dragon66.imageviewer.media;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes GIF87a and GIF89a images, animated or not, into a list of
 * composited frames the size of the logical screen. Interlaced and
 * transparent GIFs are supported, and so are the four disposal methods.
 * <p>
 * The LZW decoding part is a general purpose class which could be used
 * to decode TIFF image as well.
 */
public class AnimatedGIFReader {
	// Graphic control extension delays are in hundredths of a second
	public static final int DELAY_UNIT_MILLIS = 10;

	private static final Logger LOGGER = Logger.getLogger(AnimatedGIFReader.class.getName());

	private static final int DISPOSAL_UNSPECIFIED = 0;
	private static final int DISPOSAL_RESTORE_TO_BACKGROUND = 2;
	private static final int DISPOSAL_RESTORE_TO_PREVIOUS = 3;

	private static final int TRANSPARENCY_INDEX_NONE = 0;
	private static final int TRANSPARENCY_INDEX_SET = 1;
	private static final int TRANSPARENCY_COLOR_NONE = -1;

	// Global fields
	private GifHeader gifHeader;
	private int logicalScreenWidth;
	private int logicalScreenHeight;
	private int[] globalColorPalette;
	private int globalBitsPerPixel;
	// Graphic control extension specific fields
	protected int disposalMethod = DISPOSAL_UNSPECIFIED;
	protected int transparencyFlag = TRANSPARENCY_INDEX_NONE;
	protected int transparentColor = TRANSPARENCY_COLOR_NONE;
	protected int delay;
	// Frame specific fields
	protected int imageX;
	protected int imageY;
	private int width;
	private int height;
	private int bitsPerPixel;
	private int[] rgbColorPalette;

	private List<GIFFrame> gifFrames;

	// Logical screen canvas the frames are drawn upon
	private BufferedImage baseImage;

	private byte[] decodeLZW(InputStream is) throws IOException {
		int dimension = width*height;
		byte[] pixels = new byte[dimension];

		int minCodeSize = is.read();// The length of the root
		if(minCodeSize < 0) throw new EOFException();
		LZWTreeDecoder decoder = new LZWTreeDecoder(is, minCodeSize);
		decoder.decode(pixels, 0, dimension);
		decoder.skipRemainingBlocks();

		return pixels;
	}

	private byte[] decodeLZWInterlaced(InputStream is) throws IOException {
		int index = 0;
		int index2 = 0;
		int passParam[] = {0,8,4,8,2,4,1,2};
		int passStart[] = {0,width*passParam[2],width*passParam[4],width*passParam[6]};
		int passInc[]   = {width*passParam[1],width*passParam[3],width*passParam[5],width*passParam[7]};
		int passHeight[]= {((height-1)>>3)+1,((height+3)>>3),((height+1)>>2),((height)>>1)};

		int minCodeSize = is.read();// The length of the root
		if(minCodeSize < 0) throw new EOFException();

		int dimension = width*height;
		byte[] buf = new byte[dimension];
		byte[] pixels = new byte[dimension];

		LZWTreeDecoder decoder = new LZWTreeDecoder(is, minCodeSize);
		decoder.decode(buf, 0, dimension);
		decoder.skipRemainingBlocks();

		for (int pass=1;pass<5;pass++)
		{
			// pass 1: start at row 0, scan every 8 rows
			// pass 2: start at row 4, scan every 8 rows
			// pass 3: start at row 2, scan every 4 rows
			// pass 4: start at row 1, scan every 2 rows
			index = passStart[pass-1];
			int inc = (passInc[pass-1]-width);
			for(int row=0;row<passHeight[pass-1];row++,index+=inc)
			{
				for(int col=0;col<width;col++,index++,index2++)
				{
					pixels[index] = buf[index2];
				}
			}
		}

		return pixels;
	}

	/**
	 * Draws the raw frame onto the logical screen and returns a snapshot of it.
	 * The canvas is then disposed of according to the frame's disposal method
	 * so that it is ready for the next frame.
	 */
	private BufferedImage compositeFrame(BufferedImage raw) {
		if(baseImage == null)
			baseImage = new BufferedImage(logicalScreenWidth, logicalScreenHeight, BufferedImage.TYPE_INT_ARGB);
		BufferedImage previous = null;
		if(disposalMethod == DISPOSAL_RESTORE_TO_PREVIOUS)
			previous = copyOf(baseImage);

		Graphics2D g = baseImage.createGraphics();

		try {
			g.drawImage(raw, imageX, imageY, null);
			BufferedImage snapshot = copyOf(baseImage);

			if(disposalMethod == DISPOSAL_RESTORE_TO_BACKGROUND) {
				g.setComposite(AlphaComposite.Clear);
				g.fillRect(imageX, imageY, width, height);
			} else if(disposalMethod == DISPOSAL_RESTORE_TO_PREVIOUS) {
				g.setComposite(AlphaComposite.Src);
				g.drawImage(previous, 0, 0, null);
			} else if(disposalMethod > DISPOSAL_RESTORE_TO_PREVIOUS) { // To be defined
				baseImage = new BufferedImage(logicalScreenWidth, logicalScreenHeight, BufferedImage.TYPE_INT_ARGB);
			} // Leave in place or unspecified - no action needed

			return snapshot;
		} finally {
			g.dispose();
		}
	}

	private static BufferedImage copyOf(BufferedImage src) {
		BufferedImage copy = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = copy.createGraphics();
		g.setComposite(AlphaComposite.Src);
		g.drawImage(src, 0, 0, null);
		g.dispose();

		return copy;
	}

	/**
	 * Get the total number of frames read by this reader.
	 *
	 * @return number of frames read or 0 if not read yet
	 */
	public int getFrameCount() {
		if(gifFrames != null) // We have already read the image
			return gifFrames.size();
		return 0; // We haven't read the image yet
	}

	public BufferedImage getFrame(int i) {
		if(gifFrames == null) return null;
		if(i < 0 || i >= gifFrames.size())
			throw new IndexOutOfBoundsException("Index: " + i);
		return gifFrames.get(i).getFrame();
	}

	public List<GIFFrame> getGIFFrames() {
		if(gifFrames != null)
			return Collections.unmodifiableList(gifFrames);
		return Collections.emptyList();
	}

	public int getLogicalScreenHeight() {
		return logicalScreenHeight;
	}

	public int getLogicalScreenWidth() {
		return logicalScreenWidth;
	}

	/**
	 * Reads the whole stream.
	 * <p>
	 * A stream that ends in the middle of a frame after at least one
	 * complete frame keeps the frames read so far; browsers show
	 * such files the same way.
	 *
	 * @param is input stream for the image - single frame or multiple frame animated GIF
	 * @return the composited frames in display order, never empty
	 * @throws DecodeException if the stream is not a GIF or holds no complete frame
	 * @throws IOException if the stream itself fails
	 */
	public List<GIFFrame> read(InputStream is) throws IOException {
		gifHeader = null;
		baseImage = null;
		gifFrames = new ArrayList<GIFFrame>();

		try {
			readGlobalScopeData(is);
		} catch(EOFException e) {
			throw new DecodeException("Truncated GIF header", e);
		}

		try {
			BufferedImage raw = null;

			while((raw = readFrame(is)) != null) {
				BufferedImage composite = compositeFrame(raw);
				gifFrames.add(new GIFFrame(composite, delay*DELAY_UNIT_MILLIS));
				if((long)(gifFrames.size() + 1)*logicalScreenWidth*logicalScreenHeight > MediaSource.MAX_TOTAL_PIXELS) {
					LOGGER.log(Level.WARNING, "GIF frames exceed the pixel budget, keeping " + gifFrames.size() + " frame(s)");
					break;
				}
			}
		} catch(EOFException e) {
			if(gifFrames.isEmpty())
				throw new DecodeException("Truncated GIF stream", e);
			LOGGER.log(Level.FINE, "GIF stream ended early, keeping " + gifFrames.size() + " frame(s)");
		} catch(IllegalArgumentException e) {
			if(gifFrames.isEmpty())
				throw new DecodeException("Corrupt GIF image data", e);
			LOGGER.log(Level.WARNING, "Corrupt GIF frame after " + gifFrames.size() + " frame(s)", e);
		} catch(IndexOutOfBoundsException e) {
			// LZW codes pointing outside the string table
			if(gifFrames.isEmpty())
				throw new DecodeException("Corrupt GIF image data", e);
			LOGGER.log(Level.WARNING, "Corrupt GIF frame after " + gifFrames.size() + " frame(s)", e);
		}

		if(gifFrames.isEmpty())
			throw new DecodeException("GIF stream contains no image");

		return getGIFFrames();
	}

	private BufferedImage readFrame(InputStream is) throws IOException {
		resetFrameParameters();

		int imageSeparator = 0;

		do {
			imageSeparator = is.read();

			if(imageSeparator == -1 || imageSeparator == 0x3b) { // End of stream
				return null;
			}

			if (imageSeparator == 0x21) // (!) Extension Block
			{
				int func = is.read();
				int len = is.read();
				if(len < 0) throw new EOFException();

				if (func == 0xf9) { // Graphic Control Label - identifies the current block as a Graphic Control Extension
					int packedFields = is.read();
					// Determine the disposal method
					disposalMethod = ((packedFields&0x1c)>>2);
					delay = IOUtils.readUnsignedShort(is);
					// Read transparent color index
					int transparentColorIndex = is.read();
					// Check for transparent color flag
					if((packedFields&0x01) == 0x01){
						transparencyFlag = TRANSPARENCY_INDEX_SET;
						transparentColor = transparentColorIndex;
					}
					len = is.read();// len=0, block terminator!
				}
				// GIF87a specification mentions the repetition of multiple length
				// blocks while GIF89a gives no specific description. For safety, here
				// a while loop is used to check for block terminator!
				while(len > 0) {
					IOUtils.skipFully(is, len);
					len = is.read();// len=0, block terminator!
				}
				if(len < 0) throw new EOFException();
			}
		} while(imageSeparator != 0x2c); // ","

		byte flags2 = readImageDescriptor(is);

		if((flags2&0x80) == 0x80) {
			// A local color map is present
			bitsPerPixel = (flags2&0x07)+1;
			rgbColorPalette = readPalette(is, 1<<bitsPerPixel);
		} else {
			if(globalColorPalette == null)
				throw new DecodeException("GIF frame has no color table");
			bitsPerPixel = globalBitsPerPixel;
			rgbColorPalette = globalColorPalette.clone();
		}

		if(transparencyFlag == TRANSPARENCY_INDEX_SET && transparentColor < rgbColorPalette.length)
			rgbColorPalette[transparentColor] &= 0x00ffffff;
		else
			transparentColor = TRANSPARENCY_COLOR_NONE;

		byte[] pixels = ((flags2&0x40) == 0x40)? decodeLZWInterlaced(is) : decodeLZW(is);

		// Nothing to draw, keep the frame timing anyway
		if(width == 0 || height == 0)
			return new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);

		int[] off = {0};//band offset, we have only one band start at 0
		DataBuffer db = new DataBufferByte(pixels, pixels.length);
		WritableRaster raster = Raster.createInterleavedRaster(db, width, height, width, 1, off, null);
		ColorModel cm = new IndexColorModel(bitsPerPixel, rgbColorPalette.length, rgbColorPalette, 0, false, transparentColor, DataBuffer.TYPE_BYTE);

		return new BufferedImage(cm, raster, false, null);
	}

	private void readGlobalScopeData(InputStream is) throws IOException {
		// Global scope data including header, logical screen descriptor, global colorPalette if presents
		gifHeader = new GifHeader();
		gifHeader.readHeader(is);

		String signature = new String(gifHeader.signature, StandardCharsets.US_ASCII) + new String(gifHeader.version, StandardCharsets.US_ASCII);

		if ((!signature.equalsIgnoreCase("GIF87a")) && (!signature.equalsIgnoreCase("GIF89a")))	{
			throw new DecodeException("Not a GIF87a/GIF89a stream: " + signature);
		}

		logicalScreenWidth = gifHeader.screenWidth;
		logicalScreenHeight = gifHeader.screenHeight;

		if(logicalScreenWidth == 0 || logicalScreenHeight == 0)
			throw new DecodeException("Empty GIF logical screen");
		if((long)logicalScreenWidth*logicalScreenHeight > MediaSource.MAX_FRAME_PIXELS)
			throw new DecodeException("GIF logical screen too large: " + logicalScreenWidth + "x" + logicalScreenHeight);

		byte flags = gifHeader.flags;
		globalColorPalette = null;

		if((flags&0x80) == 0x80) { // A global color map is present
			globalBitsPerPixel = (flags&0x07)+1;
			globalColorPalette = readPalette(is, 1<<globalBitsPerPixel);
	   	}
	}

	private byte readImageDescriptor(InputStream is) throws IOException {
		int nindex = 0;
		byte ides[] = new byte[9];

		IOUtils.readFully(is,ides,0,9);

		imageX = (ides[nindex++]&0xff)|((ides[nindex++]&0xff)<<8);
		imageY = (ides[nindex++]&0xff)|((ides[nindex++]&0xff)<<8);
		width =  (ides[nindex++]&0xff)|((ides[nindex++]&0xff)<<8);
		height = (ides[nindex++]&0xff)|((ides[nindex++]&0xff)<<8);

		// Frames reaching past the logical screen are clipped when composited
		if((long)width*height > MediaSource.MAX_FRAME_PIXELS)
			throw new DecodeException("GIF frame too large: " + width + "x" + height);

		return ides[nindex++];
	}

	private static int[] readPalette(InputStream is, int numOfColor) throws IOException {
		int index1 = 0;
		int bytes2read = numOfColor*3;
		byte brgb[] = new byte[bytes2read];
		IOUtils.readFully(is,brgb,0,bytes2read);

		int[] palette = new int[numOfColor];

		for(int i = 0; i < numOfColor; i++)
			palette[i] = ((255<<24)|((brgb[index1++]&0xff)<<16)|((brgb[index1++]&0xff)<<8)|(brgb[index1++]&0xff));

		return palette;
	}

	private void resetFrameParameters() {
		disposalMethod = DISPOSAL_UNSPECIFIED;
		transparencyFlag = TRANSPARENCY_INDEX_NONE;
		transparentColor = TRANSPARENCY_COLOR_NONE;
		delay = 0;
		imageX = 0;
		imageY = 0;
		width = 0;
		height = 0;
	}

	private static class GifHeader {
		private byte  signature[] = new byte[3];
		private byte  version[] = new byte[3];

		private int screenWidth;
		private int screenHeight;
		private byte  flags;

		void readHeader(InputStream is) throws IOException {
			int nindex = 0;
			byte bhdr[] = new byte[13];

			IOUtils.readFully(is,bhdr,0,13);

			for(int i = 0; i < 3; i++)
				signature[i] = bhdr[nindex++];

			for(int i = 0; i < 3; i++)
				version[i] = bhdr[nindex++];

			screenWidth = ((bhdr[nindex++]&0xff)|((bhdr[nindex++]&0xff)<<8));
			screenHeight = ((bhdr[nindex++]&0xff)|((bhdr[nindex++]&0xff)<<8));
			flags = bhdr[nindex++];
			// Background color index and aspect ratio are not used
		}
	}

	/**
	 * One composited frame and how long it stays on screen, in milliseconds.
	 */
	public static class GIFFrame {
		private final BufferedImage frame;
		private final int delay;

		public GIFFrame(BufferedImage frame, int delay) {
			if(frame == null) throw new IllegalArgumentException("Null input image");
			this.frame = frame;
			this.delay = Math.max(0, delay);
		}

		public int getDelay() {
			return delay;
		}

		public BufferedImage getFrame() {
			return frame;
		}
	}

	private static class IOUtils {

		public static void readFully(InputStream is, byte b[]) throws IOException {
			readFully(is, b, 0, b.length);
		}

		public static void readFully(InputStream is, byte[] b, int off, int len) throws IOException {
			if (len < 0)
				throw new IndexOutOfBoundsException();
			int n = 0;
			while (n < len) {
				int count = is.read(b, off + n, len - n);
				if (count < 0)
					throw new EOFException();
				n += count;
			}
		}

		public static int readUnsignedShort(InputStream is) throws IOException {
			byte[] buf = new byte[2];
			readFully(is, buf);

			return ((buf[1]&0xff)<<8)|(buf[0]&0xff);
		}

		public static void skipFully(InputStream is, int n) throws IOException {
			readFully(is, new byte[n]);
		}

		private IOUtils() {}
	}

	private static class LZWTreeDecoder {

		// Variables for code reading
		private int bitsRemain = 0;
		private int bytesAvailable = 0;
		private int tempByte = 0;
		private int bufIndex = 0;
		private byte bytesBuf[] = new byte[256];
		// Set once the zero-length block terminator (or end of stream) was read
		private boolean terminatorSeen;

		private int oldcode = 0 ;
		private int code = 0;
		private int[] prefix = new int[4097];
		private int[] suffix = new int[4097];

		private int minCodeSize;
		private int clearCode;
		// End of image for GIF or end of information for TIFF
		private int endOfImage;

		// Variables to clear table
		private int codeLen;
		private int codeIndex;
		private int limit;

		private int firstCodeIndex;
		private int firstChar;

		private InputStream is;

		private static final int MASK[] = {0x00,0x001,0x003,0x007,0x00f,0x01f,0x03f,0x07f,0x0ff,0x1ff,0x3ff,0x7ff,0xfff};

		private int leftOver = 0;// Used to keep track of the not fully expanded code string.
		private int buf[] = new int[4097];

		private static final int MAX_CODE = (1<<12);

		/**
		 * GIF's initial code size is specified on a per-file basis at the beginning of
		 * the image data, with a minimum of 2 bits, and grows as soon as the string
		 * table's length is equal to 2**code-size. The least significant bit of a code
		 * is stored in the least significant bit of the byte stream.
		 * <p>
		 * The 'Clear Code' is equal to 2**(code-size - 1) and the 'End of Information Code'
		 * is equal to the Clear Code + 1.
		 */
		public LZWTreeDecoder(InputStream is, int minCodeSize) {
			if(minCodeSize < 2 || minCodeSize > 11)
				throw new IllegalArgumentException("invalid min_code_size: " + minCodeSize);
			this.is = is;
			this.minCodeSize = minCodeSize;
			clearCode = (1<<minCodeSize);
			endOfImage = clearCode+1;
			firstCodeIndex = endOfImage+1;
			clearStringTable();
		}

		private void clearStringTable() {
			codeLen = minCodeSize+1;
			limit = (1<<codeLen)-1;
			codeIndex = endOfImage;
		}

		public int decode(byte[] pix, int offset, int len) throws IOException {
			int counter = 0;// Keep track of how many bytes have been decoded.
			int tempcode = 0;
			int i = 0;

			if(leftOver>0){//flush out left over first.
				for( int j = leftOver-1; j >= 0; j--, leftOver-- ) {
					if ((offset >= pix.length)||(counter>=len))
						return counter;
					pix[offset++] = (byte)buf[j];
					counter++;
				}
			}

			label:
			do {
				i = 0;
				code = readLZWCode();
				tempcode = code;

				if(code == clearCode) {
					clearStringTable();
				} else if(code == endOfImage) {
					break;
				} else {
					if(code >= codeIndex) {
						tempcode = oldcode;
						buf[i++] = firstChar;
					}
					while (tempcode >= firstCodeIndex) {
						buf[i++] = suffix[tempcode];
						tempcode = prefix[tempcode];
					}
					buf[i++] = tempcode;

					suffix[codeIndex] = firstChar = tempcode;
					prefix[codeIndex] = oldcode;
					// Check boundary to deal with deferred clear code in LZW compression
					if(codeIndex < MAX_CODE) codeIndex++;

					oldcode = code;

					if((codeIndex > limit) && (codeLen<12)) {
						codeLen++;
						limit = (1<<codeLen)-1;
					}
					// Output strings for the current code
					leftOver = i;
					for( int j = i-1; j >= 0; j--, leftOver--, counter++ ) {
						if ((offset >= pix.length)||(counter>=len))
							break label;
						pix[offset++] = (byte)buf[j];
					}
				}
			} while(true);

			return counter;
		}

		/**
		 * Consumes whatever is left of the image data sub-blocks up to and
		 * including the block terminator.
		 */
		public void skipRemainingBlocks() throws IOException {
			if(terminatorSeen) return;
			// The current sub-block is already buffered
			bytesAvailable = 0;
			int len = is.read();
			while(len > 0) {
				IOUtils.skipFully(is, len);
				len = is.read();
			}
			terminatorSeen = true;
		}

		private int readLZWCode() throws IOException {
			int temp = (tempByte >> (8-bitsRemain));

			while (codeLen > bitsRemain) {
				if(bytesAvailable == 0) {
					// Start a new image data sub-block if possible!
					// The block size bytesAvailable is no bigger than 0xff
					bytesAvailable = is.read();

					if(bytesAvailable > 0) {
						IOUtils.readFully(is,bytesBuf,0,bytesAvailable);
						bufIndex = 0;
					} else {
						bytesAvailable = 0;
						terminatorSeen = true;
						return endOfImage;
					}
				}
				tempByte = bytesBuf[bufIndex++]&0xff;
				bytesAvailable--;
				temp |= (tempByte<<bitsRemain);
				bitsRemain += 8;
			}

			bitsRemain -= codeLen;

			return (temp&MASK[codeLen]);
		}
	}
}
