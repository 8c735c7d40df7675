package com.slack.netselect.codec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A distinct value together with the number of rows it was seen in. */
public record ValueWithHits(String value, long hits) {

  public ValueWithHits {
    Objects.requireNonNull(value, "value");
  }

  public void marshal(ByteArrayOutputStream dst) {
    BinaryEncoding.writeString(dst, value);
    BinaryEncoding.writeUint64(dst, hits);
  }

  /**
   * Decodes one record from src and advances its position. The decoded value is a fresh string, so
   * it stays valid after the source buffer is reused.
   */
  public static ValueWithHits unmarshal(ByteBuffer src) throws IOException {
    String value = BinaryEncoding.readString(src, "value");
    long hits = BinaryEncoding.readUint64(src, "hits");
    return new ValueWithHits(value, hits);
  }

  /** Serializes all records back to back, as carried by a blob. */
  public static byte[] marshalAll(List<ValueWithHits> vhs) {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    for (ValueWithHits vh : vhs) {
      vh.marshal(dst);
    }
    return dst.toByteArray();
  }

  /** Decodes records until src is exhausted. */
  public static List<ValueWithHits> unmarshalAll(byte[] src) throws IOException {
    ByteBuffer buf = ByteBuffer.wrap(src);
    List<ValueWithHits> vhs = new ArrayList<>();
    while (buf.hasRemaining()) {
      try {
        vhs.add(unmarshal(buf));
      } catch (IOException e) {
        throw new IOException("cannot unmarshal ValueWithHits #" + vhs.size(), e);
      }
    }
    return vhs;
  }
}
