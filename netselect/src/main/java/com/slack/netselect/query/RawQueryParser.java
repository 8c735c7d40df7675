package com.slack.netselect.query;

/** Keeps the query text as-is and applies a fixed concurrency. */
public class RawQueryParser implements QueryParser {
  private final int concurrency;

  public RawQueryParser(int concurrency) {
    this.concurrency = concurrency;
  }

  @Override
  public Query parse(String text, long timestamp) {
    return new RawQuery(text, timestamp, concurrency);
  }
}
