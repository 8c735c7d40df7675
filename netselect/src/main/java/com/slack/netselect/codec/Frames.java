package com.slack.netselect.codec;

import java.io.IOException;
import java.util.Arrays;

/**
 * Length-prefixed frames: an 8-byte big-endian payload length followed by the payload. When
 * compression is enabled the payload is the zstd-compressed form of the raw bytes.
 */
public final class Frames {
  public static final int LENGTH_PREFIX_BYTES = Long.BYTES;

  /** Largest payload a Java array can hold. */
  public static final int MAX_FRAME_LENGTH = Integer.MAX_VALUE - 8;

  private Frames() {}

  /** Returns a complete frame for the given raw bytes, compressing them first if requested. */
  public static byte[] encodeFrame(byte[] raw, int rawLength, boolean compress) {
    byte[] payload;
    int payloadLength;
    if (compress) {
      byte[] src = rawLength == raw.length ? raw : Arrays.copyOf(raw, rawLength);
      payload = ZstdCompression.compress(src);
      payloadLength = payload.length;
    } else {
      payload = raw;
      payloadLength = rawLength;
    }

    byte[] frame = new byte[LENGTH_PREFIX_BYTES + payloadLength];
    long len = payloadLength;
    for (int i = 0; i < LENGTH_PREFIX_BYTES; i++) {
      frame[i] = (byte) (len >>> (56 - 8 * i));
    }
    System.arraycopy(payload, 0, frame, LENGTH_PREFIX_BYTES, payloadLength);
    return frame;
  }

  public static byte[] encodeFrame(byte[] raw, boolean compress) {
    return encodeFrame(raw, raw.length, compress);
  }

  /** Decompresses a frame payload or a blob if the sender compressed it. */
  public static byte[] decodePayload(byte[] payload, boolean compressed) throws IOException {
    return compressed ? ZstdCompression.decompress(payload) : payload;
  }

  /** Returns the blob body for the given raw bytes. Blobs carry no length prefix. */
  public static byte[] encodeBlob(byte[] raw, boolean compress) {
    return compress ? ZstdCompression.compress(raw) : raw;
  }
}
