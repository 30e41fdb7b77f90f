/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.format;

import ai.evacortex.spectra.core.exceptions.CorruptSpectrumException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * SpectrumHeader opens every serialized {@link ai.evacortex.spectra.core.image.CompressedImage}.
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li>Magic marker and format version</li>
 *   <li>Original height and width</li>
 *   <li>Padded transform height and width</li>
 * </ul>
 *
 * <h3>Serialization</h3>
 * Little-endian, padded to a 4-byte boundary. The size is fixed, see {@link #SIZE}.
 */
public final class SpectrumHeader {

    public static final int MAGIC = 0x49435053; // ASCII: 'SPCI'
    public static final int VERSION = 1;

    public static final int MAGIC_LENGTH = 4;
    public static final int VERSION_LENGTH = 2;
    public static final int DIMENSION_LENGTH = 4;

    public static final int SIZE;

    static {
        int raw = MAGIC_LENGTH + VERSION_LENGTH + 4 * DIMENSION_LENGTH;
        SIZE = (raw % 4 == 0) ? raw : raw + (4 - (raw % 4));
    }

    private final int version;
    private final int height;
    private final int width;
    private final int fftHeight;
    private final int fftWidth;

    public SpectrumHeader(int version, int height, int width, int fftHeight, int fftWidth) {
        this.version = version;
        this.height = height;
        this.width = width;
        this.fftHeight = fftHeight;
        this.fftWidth = fftWidth;
    }

    public void writeTo(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int start = buf.position();
        buf.putInt(MAGIC);
        buf.putShort((short) version);
        buf.putInt(height);
        buf.putInt(width);
        buf.putInt(fftHeight);
        buf.putInt(fftWidth);
        while (buf.position() - start < SIZE) buf.put((byte) 0);
    }

    public static SpectrumHeader from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < SIZE) {
            throw new CorruptSpectrumException("header truncated: " + buf.remaining() + " bytes");
        }
        int start = buf.position();

        int magic = buf.getInt();
        if (magic != MAGIC) {
            throw new CorruptSpectrumException("invalid magic: " + Integer.toHexString(magic));
        }
        int version = buf.getShort() & 0xFFFF;
        if (version != VERSION) {
            throw new CorruptSpectrumException("unsupported version: " + version);
        }
        int height = buf.getInt();
        int width = buf.getInt();
        int fftHeight = buf.getInt();
        int fftWidth = buf.getInt();
        buf.position(start + SIZE);

        return new SpectrumHeader(version, height, width, fftHeight, fftWidth);
    }

    public int version()   { return version; }
    public int height()    { return height; }
    public int width()     { return width; }
    public int fftHeight() { return fftHeight; }
    public int fftWidth()  { return fftWidth; }
}
