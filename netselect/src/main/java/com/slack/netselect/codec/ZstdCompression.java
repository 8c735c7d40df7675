package com.slack.netselect.codec;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import java.io.IOException;

/**
 * Whole-buffer zstd compression used for frames and blobs. Every payload is compressed in one
 * shot, so the decompressed size is always present in the zstd frame header.
 */
public final class ZstdCompression {
  public static final int DEFAULT_COMPRESSION_LEVEL = 1;

  private ZstdCompression() {}

  public static byte[] compress(byte[] src) {
    return Zstd.compress(src, DEFAULT_COMPRESSION_LEVEL);
  }

  public static byte[] decompress(byte[] src) throws IOException {
    long size;
    try {
      size = Zstd.decompressedSize(src);
    } catch (ZstdException e) {
      throw new IOException("cannot read decompressed size of a " + src.length + " byte buffer", e);
    }
    if (size < 0 || size > Frames.MAX_FRAME_LENGTH) {
      throw new IOException(
          String.format(
              "too big decompressed size: %d bytes; mustn't exceed %d bytes",
              size, Frames.MAX_FRAME_LENGTH));
    }
    try {
      return Zstd.decompress(src, (int) size);
    } catch (ZstdException e) {
      throw new IOException("cannot decompress " + src.length + " bytes", e);
    }
  }
}
