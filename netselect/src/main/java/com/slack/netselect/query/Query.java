package com.slack.netselect.query;

/**
 * A parsed query as seen by the fan-out layer. Implementations are immutable for the duration of
 * one fan-out call.
 */
public interface Query {

  /** Canonical text form; parsing it again yields an equivalent query. */
  String canonicalString();

  /** Text form understood by the remote storage nodes for this protocol version. */
  default String protocolString() {
    return canonicalString();
  }

  /** Evaluation timestamp in nanoseconds, used for relative time filters. */
  long getTimestamp();

  /** Desired number of parallel sub-queries. */
  int getConcurrency();
}
