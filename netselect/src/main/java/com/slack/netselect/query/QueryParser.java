package com.slack.netselect.query;

/** Turns the {@code query} and {@code timestamp} request parameters back into a {@link Query}. */
@FunctionalInterface
public interface QueryParser {
  Query parse(String text, long timestamp);
}
