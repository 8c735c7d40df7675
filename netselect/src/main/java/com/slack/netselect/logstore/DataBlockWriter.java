package com.slack.netselect.logstore;

import com.slack.netselect.codec.DataBlock;

/**
 * Receives result blocks tagged with the id of the worker that produced them. Worker ids let the
 * receiver keep per-worker state without locking; blocks from one worker arrive in order, blocks
 * from different workers may interleave arbitrarily.
 *
 * <p>The block is only valid for the duration of the call.
 */
@FunctionalInterface
public interface DataBlockWriter {
  void write(int workerId, DataBlock block);
}
