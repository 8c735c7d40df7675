package com.slack.netselect.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DataBlockTest {

  private static DataBlock block(String prefix, int rows) {
    List<String> msgs = new ArrayList<>();
    List<String> levels = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      msgs.add(prefix + " message " + i);
      levels.add(i % 2 == 0 ? "info" : "");
    }
    return DataBlock.of(
        List.of(new DataBlock.Column("_msg", msgs), new DataBlock.Column("level", levels)));
  }

  /** Encodes the blocks as a stream where every frame carries blocksPerFrame blocks. */
  private static byte[] encodeStream(List<DataBlock> blocks, int blocksPerFrame, boolean compress) {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    ByteArrayOutputStream frame = new ByteArrayOutputStream();
    int inFrame = 0;
    for (DataBlock db : blocks) {
      db.marshal(frame);
      if (++inFrame == blocksPerFrame) {
        stream.writeBytes(Frames.encodeFrame(frame.toByteArray(), compress));
        frame.reset();
        inFrame = 0;
      }
    }
    if (inFrame > 0) {
      stream.writeBytes(Frames.encodeFrame(frame.toByteArray(), compress));
    }
    return stream.toByteArray();
  }

  private static List<DataBlock> decodeStream(byte[] stream, boolean compressed)
      throws IOException {
    List<DataBlock> decoded = new ArrayList<>();
    DataBlock db = new DataBlock();
    List<String> valuesBuf = new ArrayList<>();
    FrameDecoder decoder =
        new FrameDecoder(
            payload -> {
              ByteBuffer src = ByteBuffer.wrap(Frames.decodePayload(payload, compressed));
              while (src.hasRemaining()) {
                db.unmarshal(src, valuesBuf);
                decoded.add(db.copy());
                valuesBuf.clear();
              }
            });
    decoder.feed(stream);
    decoder.finish();
    return decoded;
  }

  @Test
  public void testStreamRoundTrip() throws IOException {
    List<DataBlock> blocks = List.of(block("a", 3), block("b", 1), block("c", 0), block("d", 5));

    for (boolean compress : new boolean[] {false, true}) {
      for (int blocksPerFrame : new int[] {1, 3, blocks.size()}) {
        byte[] stream = encodeStream(blocks, blocksPerFrame, compress);
        assertThat(decodeStream(stream, compress))
            .as("compress=%s blocksPerFrame=%s", compress, blocksPerFrame)
            .containsExactlyElementsOf(blocks);
      }
    }
  }

  @Test
  public void testEmptyStreamAndEmptyFrame() throws IOException {
    assertThat(decodeStream(new byte[0], true)).isEmpty();
    assertThat(decodeStream(Frames.encodeFrame(new byte[0], false), false)).isEmpty();
  }

  @Test
  public void testDecodingTwiceYieldsSameBlocks() throws IOException {
    byte[] stream = encodeStream(List.of(block("x", 4), block("y", 2)), 2, true);
    assertThat(decodeStream(stream, true)).isEqualTo(decodeStream(stream, true));
  }

  @Test
  public void testUnicodeAndNulValues() throws IOException {
    DataBlock db =
        DataBlock.of(
            List.of(
                new DataBlock.Column("fïeld\u0000name", List.of("naïve ☃", "a\u0000b", ""))));
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    db.marshal(dst);

    DataBlock decoded = new DataBlock();
    decoded.unmarshal(ByteBuffer.wrap(dst.toByteArray()), new ArrayList<>());
    assertThat(decoded).isEqualTo(db);
    assertThat(decoded.getRowsCount()).isEqualTo(3);
  }

  @Test
  public void testColumnsAreViewsOfValuesBuf() throws IOException {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    block("first", 2).marshal(dst);
    block("second", 1).marshal(dst);
    ByteBuffer src = ByteBuffer.wrap(dst.toByteArray());

    DataBlock db = new DataBlock();
    List<String> valuesBuf = new ArrayList<>();
    db.unmarshal(src, valuesBuf);
    assertThat(valuesBuf).hasSize(4);
    DataBlock first = db.copy();
    valuesBuf.clear();

    db.unmarshal(src, valuesBuf);
    assertThat(valuesBuf).hasSize(2);
    assertThat(db.getColumns().get(0).values()).containsExactly("second message 0");
    assertThat(first).isEqualTo(block("first", 2));
    assertThat(src.hasRemaining()).isFalse();
  }

  @Test
  public void testTooManyColumnsRejected() {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    BinaryEncoding.writeVarUint(dst, 1);
    BinaryEncoding.writeVarUint(dst, DataBlock.MAX_COLUMNS_PER_BLOCK + 1);
    ByteBuffer src = ByteBuffer.wrap(dst.toByteArray());

    assertThatExceptionOfType(IOException.class)
        .isThrownBy(() -> new DataBlock().unmarshal(src, new ArrayList<>()))
        .withMessageContaining("too many columns in the block: 2001");
    assertThat(src.position()).isZero();
  }

  @Test
  public void testRowsCountBeyondInputRejected() {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    BinaryEncoding.writeVarUint(dst, 1_000_000_000L);
    BinaryEncoding.writeVarUint(dst, 1);
    BinaryEncoding.writeString(dst, "col");
    ByteBuffer src = ByteBuffer.wrap(dst.toByteArray());

    assertThatExceptionOfType(IOException.class)
        .isThrownBy(() -> new DataBlock().unmarshal(src, new ArrayList<>()))
        .withMessageContaining("too many rows in the block");
  }

  @Test
  public void testTruncatedBlockRestoresPosition() {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    block("t", 3).marshal(dst);
    byte[] data = dst.toByteArray();
    ByteBuffer src = ByteBuffer.wrap(data, 0, data.length - 2);
    DataBlock db = block("previous", 1).copy();

    assertThatExceptionOfType(IOException.class)
        .isThrownBy(() -> db.unmarshal(src, new ArrayList<>()));
    assertThat(src.position()).isZero();
    assertThat(db.getRowsCount()).isZero();
    assertThat(db.getColumns()).isEmpty();
  }

  @Test
  public void testUnevenColumnsRejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                DataBlock.of(
                    List.of(
                        new DataBlock.Column("a", List.of("1", "2")),
                        new DataBlock.Column("b", List.of("1")))));
  }
}
