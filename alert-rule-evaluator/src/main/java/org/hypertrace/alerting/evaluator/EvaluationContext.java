package org.hypertrace.alerting.evaluator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;

/**
 * Carries what a single evaluation needs besides the condition itself: the evaluation instant, a
 * hard deadline and a cancellation signal that data source clients hook into.
 */
public class EvaluationContext {
  @Getter private final long orgId;
  @Getter private final Instant evalTime;
  @Getter private final Instant deadline;
  @Getter private final Map<String, String> requestHeaders;
  private final Clock clock;
  private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
  private volatile boolean cancelled;

  public EvaluationContext(
      long orgId,
      Instant evalTime,
      Duration timeout,
      Map<String, String> requestHeaders,
      Clock clock) {
    this.orgId = orgId;
    this.evalTime = evalTime;
    this.clock = clock;
    this.deadline = clock.instant().plus(timeout);
    this.requestHeaders = requestHeaders == null ? Map.of() : Map.copyOf(requestHeaders);
  }

  public Duration remaining() {
    Duration remaining = Duration.between(clock.instant(), deadline);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public boolean isCancelled() {
    return cancelled || remaining().isZero();
  }

  public void cancel() {
    cancelled = true;
    cancelListeners.forEach(Runnable::run);
  }

  /** Registers a hook run on {@link #cancel()}; runs it right away if already cancelled. */
  public void onCancel(Runnable listener) {
    cancelListeners.add(listener);
    if (cancelled) {
      listener.run();
    }
  }

  public void checkNotCancelled() throws EvaluationException {
    if (isCancelled()) {
      throw new EvaluationException("evaluation cancelled: deadline exceeded");
    }
  }
}
