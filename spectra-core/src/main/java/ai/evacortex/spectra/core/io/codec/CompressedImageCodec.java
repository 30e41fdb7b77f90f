/*
 * Spectra — Radix-2 Fourier Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectra.core.io.codec;

import ai.evacortex.spectra.core.exceptions.CorruptSpectrumException;
import ai.evacortex.spectra.core.exceptions.InvalidImageException;
import ai.evacortex.spectra.core.image.CompressedImage;
import ai.evacortex.spectra.core.image.ImageGrid;
import ai.evacortex.spectra.core.io.format.SpectrumHeader;
import ai.evacortex.spectra.core.math.Complex;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

/**
 * Binary encoding of {@link CompressedImage} for durable storage.
 *
 * <p>Only non-zero coefficients are written, so the size on disk follows the compression rate.
 * Layout (little-endian):</p>
 * <pre>
 *   SpectrumHeader
 *   for channel in (R, G, B):
 *       nonZeroCount : int
 *       nonZeroCount × (index : int, real : double, imag : double)   index = row · fftWidth + col
 *   checksum : long   xxHash64 of all preceding bytes
 * </pre>
 *
 * <p>Reads validate the header, the dimension invariants, strictly increasing indices within a
 * channel, and the checksum. Any violation raises {@link CorruptSpectrumException}.</p>
 *
 * @see SpectrumHeader
 */
public final class CompressedImageCodec {

    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int ENTRY_SIZE = 4 + 8 + 8;
    public static final int CHECKSUM_LENGTH = 8;

    private static final XXHash64 XX_HASH = XXHashFactory.fastestInstance().hash64();
    private static final long SEED = 0x5350454354524131L;

    private CompressedImageCodec() {}

    public static byte[] serialize(CompressedImage image) {
        Objects.requireNonNull(image, "image must not be null");

        ByteBuffer buf = ByteBuffer.allocate(estimateSize(image)).order(ORDER);
        new SpectrumHeader(SpectrumHeader.VERSION, image.height(), image.width(),
                image.fftHeight(), image.fftWidth()).writeTo(buf);

        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            Complex[][] spectrum = image.channel(ch);
            buf.putInt(countNonZero(spectrum));
            for (int r = 0; r < image.fftHeight(); r++) {
                Complex[] row = spectrum[r];
                for (int c = 0; c < image.fftWidth(); c++) {
                    Complex v = row[c];
                    if (v.isZero()) continue;
                    buf.putInt(r * image.fftWidth() + c);
                    buf.putDouble(v.real);
                    buf.putDouble(v.imag);
                }
            }
        }

        buf.putLong(checksum(buf.array(), buf.position()));
        return buf.array();
    }

    public static CompressedImage deserialize(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length < SpectrumHeader.SIZE + CHECKSUM_LENGTH) {
            throw new CorruptSpectrumException("only " + data.length + " bytes");
        }

        int payload = data.length - CHECKSUM_LENGTH;
        long expected = ByteBuffer.wrap(data, payload, CHECKSUM_LENGTH).order(ORDER).getLong();
        if (checksum(data, payload) != expected) {
            throw new CorruptSpectrumException("checksum mismatch");
        }

        ByteBuffer buf = ByteBuffer.wrap(data, 0, payload).order(ORDER);
        SpectrumHeader header = SpectrumHeader.from(buf);

        int fftHeight = header.fftHeight();
        int fftWidth = header.fftWidth();
        if (fftHeight <= 0 || fftWidth <= 0
                || fftHeight > CompressedImage.MAX_DIMENSION || fftWidth > CompressedImage.MAX_DIMENSION) {
            throw new CorruptSpectrumException("suspicious padded dimensions " + fftHeight + "x" + fftWidth);
        }
        long cells = (long) fftHeight * fftWidth;

        Complex[][][] spectra = new Complex[ImageGrid.CHANNELS][][];
        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            if (buf.remaining() < 4) {
                throw new CorruptSpectrumException("no count for channel " + ch);
            }
            int count = buf.getInt();
            if (count < 0 || count > cells || (long) count * ENTRY_SIZE > buf.remaining()) {
                throw new CorruptSpectrumException("invalid entry count " + count + " for channel " + ch);
            }

            Complex[][] spectrum = zeroSpectrum(fftHeight, fftWidth);
            int previous = -1;
            for (int i = 0; i < count; i++) {
                int index = buf.getInt();
                if (index <= previous || index >= cells) {
                    throw new CorruptSpectrumException("index " + index + " out of order or range in channel " + ch);
                }
                previous = index;
                spectrum[index / fftWidth][index % fftWidth] = new Complex(buf.getDouble(), buf.getDouble());
            }
            spectra[ch] = spectrum;
        }

        if (buf.hasRemaining()) {
            throw new CorruptSpectrumException(buf.remaining() + " trailing bytes");
        }

        try {
            return new CompressedImage(header.height(), header.width(), fftHeight, fftWidth,
                    spectra[0], spectra[1], spectra[2]);
        } catch (InvalidImageException e) {
            throw new CorruptSpectrumException("inconsistent dimensions", e);
        }
    }

    public static void write(Path path, CompressedImage image) throws IOException {
        byte[] data = serialize(image);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(tmp, data);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public static CompressedImage read(Path path) throws IOException {
        return deserialize(Files.readAllBytes(path));
    }

    public static int estimateSize(CompressedImage image) {
        long size = SpectrumHeader.SIZE + CHECKSUM_LENGTH;
        for (int ch = 0; ch < ImageGrid.CHANNELS; ch++) {
            size += 4 + (long) ENTRY_SIZE * countNonZero(image.channel(ch));
        }
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Serialized size exceeds array limits: " + size);
        }
        return (int) size;
    }

    private static int countNonZero(Complex[][] spectrum) {
        int count = 0;
        for (Complex[] row : spectrum) {
            for (Complex v : row) {
                if (!v.isZero()) count++;
            }
        }
        return count;
    }

    private static Complex[][] zeroSpectrum(int rows, int cols) {
        Complex[][] out = new Complex[rows][cols];
        for (Complex[] row : out) {
            Arrays.fill(row, Complex.ZERO);
        }
        return out;
    }

    private static long checksum(byte[] data, int length) {
        return XX_HASH.hash(data, 0, length, SEED);
    }
}
