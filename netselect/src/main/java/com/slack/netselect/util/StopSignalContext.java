package com.slack.netselect.util;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import io.grpc.Context;
import io.grpc.Deadline;
import java.util.concurrent.CancellationException;

/**
 * Adapts a one-shot stop signal to an {@link io.grpc.Context} so callers that still signal
 * shutdown by completing a future can drive context based cancellation.
 *
 * <p>{@link #done()} hands back the raw signal, {@link #err()} reports cancellation only once the
 * signal has fired and there is never a deadline. {@link #withCancellation()} derives a context
 * that is cancelled either by the signal or by the caller, whichever happens first.
 */
public final class StopSignalContext {
  private final ListenableFuture<?> stopSignal;

  public StopSignalContext(ListenableFuture<?> stopSignal) {
    this.stopSignal = stopSignal;
  }

  public ListenableFuture<?> done() {
    return stopSignal;
  }

  public CancellationException err() {
    return stopSignal.isDone() ? new CancellationException("stop signal fired") : null;
  }

  public Deadline deadline() {
    return null;
  }

  public Context.CancellableContext withCancellation() {
    Context.CancellableContext ctx = Context.ROOT.withCancellation();
    stopSignal.addListener(() -> ctx.cancel(err()), MoreExecutors.directExecutor());
    return ctx;
  }

  /** Shorthand for wrapping the signal and deriving a cancellable context from it. */
  public static Context.CancellableContext newStopSignalContext(ListenableFuture<?> stopSignal) {
    return new StopSignalContext(stopSignal).withCancellation();
  }

  /**
   * The reverse bridge: a signal that fires once ctx is cancelled. The listener on ctx is removed
   * as soon as the signal completes, so callers outliving a long-lived ctx should cancel the signal
   * when they are done with it.
   */
  public static ListenableFuture<Void> stopSignalOf(Context ctx) {
    SettableFuture<Void> stopSignal = SettableFuture.create();
    Context.CancellationListener listener = cancelled -> stopSignal.set(null);
    ctx.addListener(listener, MoreExecutors.directExecutor());
    stopSignal.addListener(() -> ctx.removeListener(listener), MoreExecutors.directExecutor());
    return stopSignal;
  }

  /** Returns true if t, or any of its causes, is a cancellation rather than a real failure. */
  public static boolean isCancellation(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof CancellationException) {
        return true;
      }
      if (cur.getCause() == cur) {
        break;
      }
    }
    return false;
  }
}
