package com.ridwan.tweetharvest.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.support.RecordingSleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CancellableWaiterTest {

  @Test
  void shouldSleepInTicksOfAtMostOneSecond() {
    RecordingSleeper sleeper = new RecordingSleeper();
    CancellableWaiter waiter = new CancellableWaiter(sleeper);

    waiter.await(Duration.ofMillis(2500), CancellationToken.none());

    assertEquals(List.of(1000L, 1000L, 500L), sleeper.getSleeps());
  }

  @Test
  void shouldStopWithinOneTickOfCancellation() {
    CancellationToken token = new CancellationToken();
    RecordingSleeper sleeper = new RecordingSleeper();
    sleeper.onSleep(
        () -> {
          if (sleeper.getSleeps().size() == 3) {
            token.cancel();
          }
        });
    CancellableWaiter waiter = new CancellableWaiter(sleeper);

    assertThrows(
        HarvestCancelledException.class, () -> waiter.await(Duration.ofMinutes(15), token));
    assertEquals(3, sleeper.getSleeps().size());
  }

  @Test
  void shouldHonourExternalStopSignal() {
    AtomicBoolean stop = new AtomicBoolean(true);
    RecordingSleeper sleeper = new RecordingSleeper();

    assertThrows(
        HarvestCancelledException.class,
        () ->
            new CancellableWaiter(sleeper)
                .await(Duration.ofSeconds(5), CancellationToken.polling(stop::get)));
    assertTrue(sleeper.getSleeps().isEmpty());
  }

  @Test
  void shouldReportRemainingTimeAtNotifyInterval() {
    List<String> statuses = new ArrayList<>();
    HarvestListener listener =
        new HarvestListener() {
          @Override
          public void onStatus(String message) {
            statuses.add(message);
          }
        };
    CancellableWaiter waiter = new CancellableWaiter(new RecordingSleeper());

    waiter.await(
        Duration.ofSeconds(90), CancellationToken.none(), listener, "On break.", Duration.ofSeconds(30));

    assertEquals(List.of("On break. Resuming in 1:00", "On break. Resuming in 0:30"), statuses);
  }

  @Test
  void shouldFormatMinutesAndSeconds() {
    assertEquals("15:00", CancellableWaiter.mmss(900_000));
    assertEquals("0:01", CancellableWaiter.mmss(1));
  }
}
