package com.ridwan.tweetharvest.retry;

import com.ridwan.tweetharvest.config.RetryConfig;
import com.ridwan.tweetharvest.exception.AuthExpiredException;
import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import com.ridwan.tweetharvest.exception.HarvestException;
import com.ridwan.tweetharvest.exception.NetworkUnavailableException;
import com.ridwan.tweetharvest.ratelimit.AdaptiveRateLimiter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs an upstream call and decides, per {@link FailureClass}, whether to wait and retry, ask the
 * caller for fresh credentials, give up, or treat the failure as end-of-results.
 *
 * <ul>
 *   <li>{@code AUTH_EXPIRED}: asks the listener; re-attempts only if it confirms refreshed
 *       credentials, otherwise throws {@link AuthExpiredException}
 *   <li>{@code NETWORK}: waits on the configured delay table between attempts; once the
 *       configured number of attempts (the first call included) has failed, throws {@link
 *       NetworkUnavailableException} without a further wait
 *   <li>{@code RATE_LIMITED}: one long wait, then re-attempts; not counted as a retry
 *   <li>{@code PAGINATION_GLITCH}: a few short retries, then reports no data
 *   <li>{@code UNKNOWN}: throws {@link HarvestException} immediately
 * </ul>
 */
@Slf4j
@Component
public class RetryPolicy {

  private final RetryConfig config;
  private final CancellableWaiter waiter;
  private final AdaptiveRateLimiter rateLimiter;

  public RetryPolicy(RetryConfig config, CancellableWaiter waiter, AdaptiveRateLimiter rateLimiter) {
    this.config = config;
    this.waiter = waiter;
    this.rateLimiter = rateLimiter;
  }

  /**
   * Like {@link #executeUntilExhausted} but treats exhausted glitch retries as a failure.
   *
   * @throws HarvestException when the call kept returning no data
   */
  public <T> T execute(String operation, Callable<T> call, RetryScope scope) {
    return executeUntilExhausted(operation, call, scope)
        .orElseThrow(() -> new HarvestException(operation + " returned no data"));
  }

  /**
   * Runs {@code call} under the retry rules.
   *
   * @return the call's result, or empty when pagination-glitch retries ran out (or the call
   *     returned null)
   */
  public <T> Optional<T> executeUntilExhausted(String operation, Callable<T> call, RetryScope scope) {
    RetryContext context = new RetryContext(operation);

    while (true) {
      scope.getCancellationToken().throwIfCancelled();
      try {
        T result = call.call();
        if (context.getTotalRetries() > 0) {
          log.info("{} succeeded after {} retries", operation, context.getTotalRetries());
        }
        return Optional.ofNullable(result);
      } catch (HarvestCancelledException e) {
        throw e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new HarvestCancelledException("Interrupted during " + operation);
      } catch (Exception e) {
        FailureClass failure = FailureClass.classify(e);
        context.setLastFailure(failure);
        log.warn("{} failed ({}): {}", operation, failure.getLabel(), e.getMessage());

        switch (failure) {
          case RATE_LIMITED:
            waitOutRateLimit(context, scope);
            break;
          case AUTH_EXPIRED:
            refreshCredentials(context, scope, e);
            break;
          case NETWORK:
            backOffNetwork(context, scope, e);
            break;
          case PAGINATION_GLITCH:
            if (!backOffGlitch(context, scope)) {
              log.info("{}: no data after {} retries, treating as end of results",
                  operation, context.getGlitchRetries());
              return Optional.empty();
            }
            break;
          default:
            scope.getListener().onStatus("Error during " + operation + ": " + e.getMessage());
            if (e instanceof HarvestException) {
              throw (HarvestException) e;
            }
            throw new HarvestException("Unrecoverable error during " + operation + ": " + e.getMessage(), e);
        }
      }
    }
  }

  private void waitOutRateLimit(RetryContext context, RetryScope scope) {
    rateLimiter.recordRateLimitHit();
    context.setRateLimitWaits(context.getRateLimitWaits() + 1);
    Duration wait = Duration.ofSeconds(config.getRateLimitWaitSeconds());
    context.setNextDelay(wait);

    String message =
        String.format(
            "Rate limited during %s. Waiting %d minutes before retrying.",
            context.getOperation(), wait.toMinutes());
    log.warn(message);
    scope.getListener().onStatus(message);
    waiter.await(
        wait,
        scope.getCancellationToken(),
        scope.getListener(),
        "Rate limit cooldown.",
        Duration.ofSeconds(config.getRateLimitNotifySeconds()));
    scope.getListener().onStatus("Rate limit cooldown finished, retrying " + context.getOperation());
  }

  private void refreshCredentials(RetryContext context, RetryScope scope, Exception cause) {
    String reason = "Authentication failed during " + context.getOperation() + ": " + cause.getMessage();
    if (context.getCredentialRefreshes() >= config.getMaxCredentialRefreshes()) {
      throw new AuthExpiredException(reason + " (credentials still rejected after refresh)", cause);
    }
    if (!scope.getListener().onCredentialsExpired(reason)) {
      throw cause instanceof AuthExpiredException
          ? (AuthExpiredException) cause
          : new AuthExpiredException(reason, cause);
    }
    context.setCredentialRefreshes(context.getCredentialRefreshes() + 1);
    log.info("Credentials refreshed, retrying {}", context.getOperation());
    if (scope.getReauthenticator() != null) {
      scope.getReauthenticator().run();
    }
  }

  private void backOffNetwork(RetryContext context, RetryScope scope, Exception cause) {
    rateLimiter.recordServerError();
    int failedAttempts = context.getNetworkRetries() + 1;
    int maxAttempts = config.getNetworkMaxAttempts();
    if (failedAttempts >= maxAttempts) {
      String message =
          String.format(
              "Network unavailable: %s failed after %d attempts",
              context.getOperation(), failedAttempts);
      log.error(message);
      scope.getListener().onNetworkDegraded(message);
      throw new NetworkUnavailableException(message, cause);
    }
    context.setNetworkRetries(failedAttempts);

    Duration delay = Duration.ofSeconds(config.networkDelaySeconds(failedAttempts));
    context.setNextDelay(delay);
    String message =
        String.format(
            "Network error during %s. Attempt %d/%d failed, retrying in %ds.",
            context.getOperation(), failedAttempts, maxAttempts, delay.getSeconds());
    scope.getListener().onStatus(message);
    if (failedAttempts >= config.getNetworkDegradedAfter()) {
      scope.getListener().onNetworkDegraded(message);
    }
    waiter.await(delay, scope.getCancellationToken());
  }

  private boolean backOffGlitch(RetryContext context, RetryScope scope) {
    if (context.getGlitchRetries() >= config.getGlitchMaxRetries()) {
      return false;
    }
    context.setGlitchRetries(context.getGlitchRetries() + 1);
    Duration delay = Duration.ofSeconds(config.getGlitchDelaySeconds());
    context.setNextDelay(delay);
    log.debug(
        "Retrying {} after pagination glitch ({}/{})",
        context.getOperation(),
        context.getGlitchRetries(),
        config.getGlitchMaxRetries());
    waiter.await(delay, scope.getCancellationToken());
    return true;
  }
}
