package com.sayou.fabric.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.component.AbstractFetcher;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.Fetcher;
import com.sayou.fabric.component.RawPayload;
import com.sayou.fabric.exception.FetcherException;
import com.sayou.fabric.registry.Role;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ComponentSlotTest {

  private final AtomicInteger created = new AtomicInteger();
  private final AtomicInteger open = new AtomicInteger();
  private final AtomicInteger peakOpen = new AtomicInteger();
  private final AtomicInteger closedCount = new AtomicInteger();
  private final CountDownLatch entered = new CountDownLatch(1);
  private final CountDownLatch proceed = new CountDownLatch(1);

  @Test
  @DisplayName("failed instances are closed while the run goes on")
  void failedInstancesDoNotAccumulate() {
    ComponentSlot<Fetcher> slot = slot();

    for (int i = 0; i < 50; i++) {
      assertThrows(FetcherException.class, () -> slot.apply(f -> f.fetch("bad")));
    }

    assertEquals(50, created.get());
    assertTrue(peakOpen.get() <= 2, "peak open instances was " + peakOpen.get());
    assertEquals(1, slot.openInstances());

    slot.close();
    assertEquals(0, open.get());
    assertEquals(50, closedCount.get());
  }

  @Test
  @DisplayName("a retired instance stays open until its last caller leaves")
  void retiredInstanceClosesAfterItsLastCaller() throws Exception {
    ComponentSlot<Fetcher> slot = slot();
    AtomicReference<RawPayload> slowResult = new AtomicReference<>();
    Thread slowCaller = new Thread(() -> slowResult.set(slot.apply(f -> f.fetch("slow"))));
    slowCaller.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    assertThrows(FetcherException.class, () -> slot.apply(f -> f.fetch("bad")));
    RawPayload ok = slot.apply(f -> f.fetch("ok"));

    assertEquals("ok", ok.identifier());
    assertEquals(2, created.get());
    assertEquals(0, closedCount.get(), "the slow caller is still inside the failed instance");
    assertEquals(2, slot.openInstances());

    proceed.countDown();
    slowCaller.join(5000);

    assertEquals("slow", slowResult.get().identifier());
    assertEquals(1, closedCount.get());
    assertEquals(1, slot.openInstances());

    slot.close();
    assertEquals(0, open.get());
  }

  @Test
  void healthyInstanceIsReused() {
    ComponentSlot<Fetcher> slot = slot();

    slot.apply(f -> f.fetch("a"));
    slot.apply(f -> f.fetch("b"));

    assertEquals(1, created.get());
    assertEquals(0, closedCount.get());
    slot.close();
    assertEquals(1, closedCount.get());
  }

  private ComponentSlot<Fetcher> slot() {
    return ComponentSlot.open(
        Role.FETCHER, "counting", CountingFetcher::new, Fetcher.class, ComponentOptions.empty());
  }

  class CountingFetcher extends AbstractFetcher {
    CountingFetcher() {
      super("counting");
      created.incrementAndGet();
    }

    @Override
    protected void onInitialize(ComponentOptions options) {
      peakOpen.accumulateAndGet(open.incrementAndGet(), Math::max);
    }

    @Override
    protected RawPayload doFetch(String identifier) throws Exception {
      if (identifier.equals("slow")) {
        entered.countDown();
        assertTrue(proceed.await(5, TimeUnit.SECONDS));
      }
      if (identifier.equals("bad")) throw new IllegalStateException("cannot fetch " + identifier);
      return RawPayload.of(identifier, "text/plain", "content of " + identifier);
    }

    @Override
    protected void onClose() {
      open.decrementAndGet();
      closedCount.incrementAndGet();
    }
  }
}
