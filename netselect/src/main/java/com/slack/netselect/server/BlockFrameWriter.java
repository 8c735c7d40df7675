package com.slack.netselect.server;

import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpResponseWriter;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.stream.ClosedStreamException;
import com.slack.netselect.codec.DataBlock;
import com.slack.netselect.codec.Frames;
import com.slack.netselect.logstore.DataBlockWriter;
import java.io.ByteArrayOutputStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns the blocks produced by a query engine into the framed query response. Blocks are
 * accumulated in a buffer per worker and a buffer is written out as one frame once it reaches the
 * flush threshold. Only the write to the response is serialized between workers.
 *
 * <p>Headers are sent with the first frame, so a query that fails before producing any frame
 * still gets a plain error response.
 */
class BlockFrameWriter implements DataBlockWriter {
  private final HttpResponseWriter response;
  private final boolean compress;
  private final long flushThresholdBytes;

  private final ConcurrentMap<Integer, ByteArrayOutputStream> buffers = new ConcurrentHashMap<>();
  private final Object responseLock = new Object();

  // guarded by responseLock
  private boolean headersSent;
  private long framesWritten;

  BlockFrameWriter(HttpResponseWriter response, boolean compress, long flushThresholdBytes) {
    this.response = response;
    this.compress = compress;
    this.flushThresholdBytes = flushThresholdBytes;
  }

  @Override
  public void write(int workerId, DataBlock block) {
    // A worker only ever touches its own buffer.
    ByteArrayOutputStream buf =
        buffers.computeIfAbsent(workerId, id -> new ByteArrayOutputStream());
    block.marshal(buf);
    if (buf.size() >= flushThresholdBytes) {
      flush(buf);
    }
  }

  /** Flushes what every worker has buffered and ends the response. */
  void finish() {
    for (ByteArrayOutputStream buf : buffers.values()) {
      flush(buf);
    }
    synchronized (responseLock) {
      sendHeadersIfNeeded();
      response.close();
    }
  }

  /**
   * Ends the response with an error. Before any frame is out the client gets a 500 with the
   * reason, afterwards the stream is aborted so the client can't mistake it for a complete result.
   */
  void fail(HttpStatus status, Throwable cause) {
    synchronized (responseLock) {
      if (!headersSent) {
        headersSent = true;
        if (response.tryWrite(
                ResponseHeaders.of(
                    status, HttpHeaderNames.CONTENT_TYPE, MediaType.PLAIN_TEXT_UTF_8))
            && response.tryWrite(HttpData.ofUtf8(String.valueOf(cause.getMessage())))) {
          response.close();
          return;
        }
      }
      response.abort(cause);
    }
  }

  long getFramesWritten() {
    synchronized (responseLock) {
      return framesWritten;
    }
  }

  private void flush(ByteArrayOutputStream buf) {
    if (buf.size() == 0) {
      return;
    }
    byte[] frame = Frames.encodeFrame(buf.toByteArray(), compress);
    buf.reset();
    synchronized (responseLock) {
      sendHeadersIfNeeded();
      if (!response.tryWrite(HttpData.wrap(frame))) {
        throw ClosedStreamException.get();
      }
      framesWritten++;
    }
  }

  private void sendHeadersIfNeeded() {
    if (!headersSent) {
      headersSent = true;
      response.write(
          ResponseHeaders.of(HttpStatus.OK, HttpHeaderNames.CONTENT_TYPE, MediaType.OCTET_STREAM));
    }
  }
}
