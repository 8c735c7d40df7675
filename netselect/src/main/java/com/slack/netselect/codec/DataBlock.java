package com.slack.netselect.codec;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A block of query result rows stored column by column. Every column holds exactly {@link
 * #getRowsCount()} values.
 *
 * <p>A block filled by {@link #unmarshal} is a reusable decode target: its column values are views
 * into the caller's scratch list, so the block is only valid until that list is cleared. Consumers
 * that need the rows afterwards must copy them, e.g. with {@link #copy()}.
 */
public class DataBlock {
  public static final int MAX_COLUMNS_PER_BLOCK = 2000;

  /** A named column. */
  public record Column(String name, List<String> values) {
    public Column {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(values, "values");
    }
  }

  private int rowsCount;
  private final List<Column> columns = new ArrayList<>();

  public DataBlock() {}

  public static DataBlock of(List<Column> columns) {
    DataBlock db = new DataBlock();
    if (columns.isEmpty()) {
      return db;
    }
    int rows = columns.get(0).values().size();
    checkArgument(
        columns.size() <= MAX_COLUMNS_PER_BLOCK,
        "too many columns: %s; mustn't exceed %s",
        columns.size(),
        MAX_COLUMNS_PER_BLOCK);
    for (Column c : columns) {
      checkArgument(
          c.values().size() == rows,
          "column %s has %s values; want %s",
          c.name(),
          c.values().size(),
          rows);
      db.columns.add(new Column(c.name(), List.copyOf(c.values())));
    }
    db.rowsCount = rows;
    return db;
  }

  public int getRowsCount() {
    return rowsCount;
  }

  public List<Column> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  public void reset() {
    rowsCount = 0;
    columns.clear();
  }

  /** Returns a detached copy that stays valid after the decode scratch space is reused. */
  public DataBlock copy() {
    DataBlock db = new DataBlock();
    db.rowsCount = rowsCount;
    for (Column c : columns) {
      db.columns.add(new Column(c.name(), List.copyOf(c.values())));
    }
    return db;
  }

  /** Appends the serialized block to dst. */
  public void marshal(ByteArrayOutputStream dst) {
    BinaryEncoding.writeVarUint(dst, rowsCount);
    BinaryEncoding.writeVarUint(dst, columns.size());
    for (Column c : columns) {
      BinaryEncoding.writeString(dst, c.name());
      for (String v : c.values()) {
        BinaryEncoding.writeString(dst, v);
      }
    }
  }

  /**
   * Decodes one block from src, replacing the contents of this block. Column values are appended
   * to valuesBuf and the columns are views of it. On return src is positioned at the unconsumed
   * tail; on failure the position is restored.
   */
  public void unmarshal(ByteBuffer src, List<String> valuesBuf) throws IOException {
    int start = src.position();
    try {
      unmarshalInternal(src, valuesBuf);
    } catch (IOException e) {
      src.position(start);
      reset();
      throw e;
    }
  }

  private void unmarshalInternal(ByteBuffer src, List<String> valuesBuf) throws IOException {
    reset();

    long rows = BinaryEncoding.readVarUint(src, "rowsCount");
    long columnsCount = BinaryEncoding.readVarUint(src, "columnsCount");
    if (columnsCount < 0 || columnsCount > MAX_COLUMNS_PER_BLOCK) {
      throw new IOException(
          String.format(
              "too many columns in the block: %s; mustn't exceed %d",
              Long.toUnsignedString(columnsCount), MAX_COLUMNS_PER_BLOCK));
    }
    // every value takes at least one byte for its length
    if (columnsCount > 0 && (rows < 0 || rows > src.remaining())) {
      throw new IOException(
          String.format(
              "too many rows in the block: %s; only %d bytes left",
              Long.toUnsignedString(rows), src.remaining()));
    }

    int count = (int) columnsCount;
    String[] names = new String[count];
    int[] offsets = new int[count + 1];
    for (int i = 0; i < count; i++) {
      names[i] = BinaryEncoding.readString(src, "name of column #" + i);
      offsets[i] = valuesBuf.size();
      for (int j = 0; j < rows; j++) {
        valuesBuf.add(BinaryEncoding.readString(src, "value #" + j + " of column " + names[i]));
      }
    }
    offsets[count] = valuesBuf.size();

    // views are taken once valuesBuf stops growing
    for (int i = 0; i < count; i++) {
      columns.add(new Column(names[i], valuesBuf.subList(offsets[i], offsets[i + 1])));
    }
    rowsCount = columnsCount == 0 ? 0 : (int) rows;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DataBlock that)) return false;
    return rowsCount == that.rowsCount && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rowsCount, columns);
  }

  @Override
  public String toString() {
    return "DataBlock{" + "rowsCount=" + rowsCount + ", columns=" + columns.size() + '}';
  }
}
