package com.slack.netselect.codec;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

/**
 * Primitive encoders shared by every record on the internal select wire. Writers append to a
 * growable {@link ByteArrayOutputStream}, readers consume from a {@link ByteBuffer} and leave its
 * position at the unconsumed tail.
 *
 * <p>Layouts: varuint is unsigned LEB128, uint32/uint64 are big-endian, and bytes are a varuint
 * length followed by the raw bytes.
 */
public final class BinaryEncoding {

  private BinaryEncoding() {}

  public static void writeUint32(ByteArrayOutputStream dst, int v) {
    dst.write(v >>> 24);
    dst.write(v >>> 16);
    dst.write(v >>> 8);
    dst.write(v);
  }

  public static void writeUint64(ByteArrayOutputStream dst, long v) {
    for (int shift = 56; shift >= 0; shift -= 8) {
      dst.write((int) (v >>> shift));
    }
  }

  public static void writeVarUint(ByteArrayOutputStream dst, long v) {
    while ((v & ~0x7FL) != 0) {
      dst.write((int) ((v & 0x7F) | 0x80));
      v >>>= 7;
    }
    dst.write((int) v);
  }

  public static void writeBytes(ByteArrayOutputStream dst, byte[] b) {
    writeVarUint(dst, b.length);
    dst.write(b, 0, b.length);
  }

  public static void writeString(ByteArrayOutputStream dst, String s) {
    writeBytes(dst, s.getBytes(UTF_8));
  }

  public static int readUint32(ByteBuffer src, String what) throws IOException {
    if (src.remaining() < Integer.BYTES) {
      throw new IOException(
          String.format(
              "cannot unmarshal %s: need %d bytes; got %d bytes",
              what, Integer.BYTES, src.remaining()));
    }
    return src.getInt();
  }

  public static long readUint64(ByteBuffer src, String what) throws IOException {
    if (src.remaining() < Long.BYTES) {
      throw new IOException(
          String.format(
              "cannot unmarshal %s: need %d bytes; got %d bytes",
              what, Long.BYTES, src.remaining()));
    }
    return src.getLong();
  }

  public static long readVarUint(ByteBuffer src, String what) throws IOException {
    long result = 0;
    for (int shift = 0; shift < 64; shift += 7) {
      if (!src.hasRemaining()) {
        throw new IOException(String.format("cannot unmarshal %s: truncated varuint", what));
      }
      byte b = src.get();
      result |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new IOException(String.format("cannot unmarshal %s: varuint overflows 64 bits", what));
  }

  public static byte[] readBytes(ByteBuffer src, String what) throws IOException {
    long len = readVarUint(src, what + " length");
    if (len < 0 || len > src.remaining()) {
      throw new IOException(
          String.format(
              "cannot unmarshal %s: length %s exceeds the remaining %d bytes",
              what, Long.toUnsignedString(len), src.remaining()));
    }
    byte[] b = new byte[(int) len];
    src.get(b);
    return b;
  }

  /** Rejects malformed UTF-8 instead of substituting replacement characters. */
  public static String readString(ByteBuffer src, String what) throws IOException {
    byte[] b = readBytes(src, what);
    try {
      return UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(b))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IOException(String.format("cannot unmarshal %s: invalid UTF-8", what), e);
    }
  }
}
