package com.slack.netselect.codec;

import java.io.IOException;

/**
 * Incrementally splits a byte stream into frames. Chunks may end anywhere, including inside the
 * length prefix, so state is carried across {@link #feed} calls. The claimed length is checked
 * before any payload buffer is allocated.
 */
public class FrameDecoder {

  /** Receives the raw payload of every complete frame, in stream order. */
  @FunctionalInterface
  public interface FrameHandler {
    void onFrame(byte[] payload) throws IOException;
  }

  private final FrameHandler handler;
  private final byte[] lengthBuf = new byte[Frames.LENGTH_PREFIX_BYTES];
  private int lengthFilled;

  private byte[] payload;
  private int payloadFilled;

  private long framesDecoded;

  public FrameDecoder(FrameHandler handler) {
    this.handler = handler;
  }

  public void feed(byte[] chunk) throws IOException {
    feed(chunk, 0, chunk.length);
  }

  public void feed(byte[] chunk, int offset, int length) throws IOException {
    int pos = offset;
    int end = offset + length;
    while (pos < end) {
      if (payload == null) {
        int n = Math.min(Frames.LENGTH_PREFIX_BYTES - lengthFilled, end - pos);
        System.arraycopy(chunk, pos, lengthBuf, lengthFilled, n);
        lengthFilled += n;
        pos += n;
        if (lengthFilled < Frames.LENGTH_PREFIX_BYTES) {
          return;
        }
        startPayload(readLength());
      } else {
        int n = Math.min(payload.length - payloadFilled, end - pos);
        System.arraycopy(chunk, pos, payload, payloadFilled, n);
        payloadFilled += n;
        pos += n;
      }

      if (payload != null && payloadFilled == payload.length) {
        byte[] complete = payload;
        payload = null;
        payloadFilled = 0;
        lengthFilled = 0;
        framesDecoded++;
        handler.onFrame(complete);
      }
    }
  }

  /** Must be called at end of stream. A partially received frame is an error. */
  public void finish() throws IOException {
    if (payload != null) {
      throw new IOException(
          String.format(
              "cannot read frame with size of %d bytes: unexpected end of stream after %d bytes",
              payload.length, payloadFilled));
    }
    if (lengthFilled > 0) {
      throw new IOException(
          String.format(
              "cannot read frame size: unexpected end of stream after %d of %d bytes",
              lengthFilled, Frames.LENGTH_PREFIX_BYTES));
    }
  }

  public long getFramesDecoded() {
    return framesDecoded;
  }

  private long readLength() {
    long len = 0;
    for (byte b : lengthBuf) {
      len = (len << 8) | (b & 0xFF);
    }
    return len;
  }

  private void startPayload(long len) throws IOException {
    // unsigned values above Long.MAX_VALUE read back as negative
    if (len < 0 || len > Frames.MAX_FRAME_LENGTH) {
      throw new IOException(
          String.format(
              "too big data block: %s bytes; mustn't exceed %d bytes",
              Long.toUnsignedString(len), Frames.MAX_FRAME_LENGTH));
    }
    payload = new byte[(int) len];
    payloadFilled = 0;
  }
}
