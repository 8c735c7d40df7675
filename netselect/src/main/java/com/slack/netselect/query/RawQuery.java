package com.slack.netselect.query;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Query text carried verbatim, for deployments where only storage nodes understand the syntax. */
public final class RawQuery implements Query {
  private final String text;
  private final long timestamp;
  private final int concurrency;

  public RawQuery(String text, long timestamp, int concurrency) {
    checkArgument(text != null && !text.isBlank(), "query text cannot be empty");
    checkArgument(concurrency > 0, "concurrency must be positive; got %s", concurrency);
    this.text = text;
    this.timestamp = timestamp;
    this.concurrency = concurrency;
  }

  @Override
  public String canonicalString() {
    return text;
  }

  @Override
  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public int getConcurrency() {
    return concurrency;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RawQuery that)) return false;
    return timestamp == that.timestamp
        && concurrency == that.concurrency
        && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, timestamp, concurrency);
  }

  @Override
  public String toString() {
    return text;
  }
}
