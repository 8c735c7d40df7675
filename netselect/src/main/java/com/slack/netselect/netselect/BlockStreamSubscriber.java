package com.slack.netselect.netselect;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.SettableFuture;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpObject;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.HttpStatusClass;
import com.linecorp.armeria.common.ResponseHeaders;
import com.slack.netselect.codec.DataBlock;
import com.slack.netselect.codec.FrameDecoder;
import com.slack.netselect.codec.Frames;
import io.grpc.Context;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Consumes a streamed /internal/select/query response. Every frame is decompressed (unless the
 * request asked for raw frames) and split into data blocks which are handed to the block consumer
 * one by one. A block and its values are only valid for the duration of the callback.
 *
 * <p>All callbacks run on the response's event loop, one at a time.
 */
final class BlockStreamSubscriber implements Subscriber<HttpObject> {
  private final String requestUrl;
  private final boolean compressed;
  private final Consumer<DataBlock> processBlock;
  private final Context ctx;
  private final SettableFuture<Void> result;

  private final FrameDecoder decoder = new FrameDecoder(this::onFrame);
  private final DataBlock block = new DataBlock();
  private final List<String> valuesBuf = new ArrayList<>();
  private final ByteArrayOutputStream errorBody = new ByteArrayOutputStream();

  private Subscription subscription;
  private HttpStatus status;
  private boolean done;
  private long blocksReceived;

  BlockStreamSubscriber(
      String requestUrl,
      boolean compressed,
      Consumer<DataBlock> processBlock,
      Context ctx,
      SettableFuture<Void> result) {
    this.requestUrl = requestUrl;
    this.compressed = compressed;
    this.processBlock = processBlock;
    this.ctx = ctx;
    this.result = result;
  }

  @Override
  public void onSubscribe(Subscription s) {
    subscription = s;
    s.request(1);
  }

  @Override
  public void onNext(HttpObject obj) {
    if (done) {
      return;
    }
    try {
      if (obj instanceof ResponseHeaders headers) {
        if (headers.status().codeClass() != HttpStatusClass.INFORMATIONAL) {
          status = headers.status();
        }
      } else if (obj instanceof HttpData data && !data.isEmpty()) {
        if (HttpStatus.OK.equals(status)) {
          decoder.feed(data.array());
        } else {
          errorBody.write(data.array());
        }
      }
    } catch (IOException | RuntimeException e) {
      subscription.cancel();
      fail(e);
      return;
    }
    subscription.request(1);
  }

  @Override
  public void onError(Throwable t) {
    if (done) {
      return;
    }
    fail(new StorageNodeException(String.format("cannot read response from %s", requestUrl), t));
  }

  @Override
  public void onComplete() {
    if (done) {
      return;
    }
    if (status == null) {
      fail(new StorageNodeException(String.format("no response headers from %s", requestUrl)));
      return;
    }
    if (!HttpStatus.OK.equals(status)) {
      done = true;
      result.setException(unexpectedStatus(null));
      return;
    }
    try {
      decoder.finish();
    } catch (IOException e) {
      fail(e);
      return;
    }
    done = true;
    result.set(null);
  }

  private void onFrame(byte[] payload) throws IOException {
    byte[] data;
    try {
      data = Frames.decodePayload(payload, compressed);
    } catch (IOException e) {
      throw new StorageNodeException(
          String.format("cannot decompress data block received from %s", requestUrl), e);
    }
    ByteBuffer src = ByteBuffer.wrap(data);
    while (src.hasRemaining()) {
      try {
        block.unmarshal(src, valuesBuf);
      } catch (IOException e) {
        throw new StorageNodeException(
            String.format(
                "cannot unmarshal data block #%d received from %s", blocksReceived, requestUrl),
            e);
      }
      blocksReceived++;
      processBlock.accept(block);
      valuesBuf.clear();
    }
  }

  /**
   * The read failure, if any, only goes into the message. Its cause chain may hold the
   * cancellation that cut the body short, and this error must not be mistaken for one.
   */
  private StorageNodeException unexpectedStatus(Throwable readFailure) {
    String message =
        String.format(
            "unexpected status code for the request to %s: %d; want %d; response: \"%s\"",
            requestUrl,
            status.code(),
            HttpStatus.OK.code(),
            errorBody.toString(StandardCharsets.UTF_8));
    if (readFailure != null) {
      message += "; cannot read the rest of the response: " + Throwables.getRootCause(readFailure);
    }
    return new StorageNodeException(message);
  }

  private void fail(Throwable t) {
    done = true;
    // A node that answered with an error status failed on its own, even if the cancellation that
    // followed cut the body short.
    if (status != null && !HttpStatus.OK.equals(status)) {
      result.setException(unexpectedStatus(t));
      return;
    }
    if (ctx.isCancelled()) {
      CancellationException cancelled =
          new CancellationException(String.format("request to %s was cancelled", requestUrl));
      cancelled.initCause(t);
      result.setException(cancelled);
      return;
    }
    if (t instanceof StorageNodeException) {
      result.setException(t);
    } else if (t instanceof IOException) {
      result.setException(
          new StorageNodeException(
              String.format("cannot read data blocks from %s: %s", requestUrl, t.getMessage()),
              t));
    } else {
      result.setException(
          new StorageNodeException(
              String.format("cannot process data blocks from %s", requestUrl), t));
    }
  }
}
