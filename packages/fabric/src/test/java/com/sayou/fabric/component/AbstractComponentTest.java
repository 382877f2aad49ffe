package com.sayou.fabric.component;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.exception.FetcherException;
import com.sayou.fabric.exception.InitializationException;
import com.sayou.fabric.exception.IoException;
import com.sayou.fabric.exception.NetworkException;
import com.sayou.fabric.exception.NotInitializedException;
import com.sayou.fabric.exception.StateException;
import com.sayou.fabric.exception.WriterException;
import com.sayou.fabric.registry.Role;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AbstractComponentTest {

  /** Fetcher whose behaviour is driven by the identifier. */
  static class ScriptedFetcher extends AbstractFetcher {
    final AtomicInteger closed = new AtomicInteger();
    int initCalls;

    ScriptedFetcher() {
      super("scripted");
    }

    @Override
    protected void onInitialize(ComponentOptions options) {
      initCalls++;
      if (options.getBoolean("fail_init", false)) {
        throw new IllegalStateException("cannot start");
      }
    }

    @Override
    protected RawPayload doFetch(String identifier) throws Exception {
      return switch (identifier) {
        case "network" -> throw new NetworkException("connection reset");
        case "missing" -> throw new IoException("no such file");
        case "checked" -> throw new java.io.IOException("disk");
        case "own" -> throw new FetcherException("bad gateway", null, false);
        case "null" -> null;
        default -> RawPayload.of(identifier, "text/plain", "content of " + identifier);
      };
    }

    @Override
    protected void onClose() {
      closed.incrementAndGet();
    }
  }

  @Test
  @DisplayName("a new component is uninitialized and refuses to execute")
  void executeBeforeInitialize() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    assertEquals(ComponentState.UNINITIALIZED, fetcher.state());
    assertThrows(NotInitializedException.class, () -> fetcher.fetch("a"));
  }

  @Test
  void initializeMovesToReadyAndIsIdempotent() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(ComponentOptions.empty());
    fetcher.initialize(ComponentOptions.empty());

    assertEquals(ComponentState.READY, fetcher.state());
    assertEquals(1, fetcher.initCalls);
    assertEquals("content of a", fetcher.fetch("a").text());
    assertEquals(Role.FETCHER, fetcher.role());
  }

  @Test
  @DisplayName("a failing initialize hook leaves the component failed for good")
  void failedInitialize() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    ComponentOptions options = ComponentOptions.of(java.util.Map.of("fail_init", true));

    InitializationException e =
        assertThrows(InitializationException.class, () -> fetcher.initialize(options));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(ComponentState.FAILED, fetcher.state());
    assertThrows(StateException.class, () -> fetcher.initialize(ComponentOptions.empty()));
    assertThrows(NotInitializedException.class, () -> fetcher.fetch("a"));
  }

  @Test
  @DisplayName("validation errors are role errors, not retryable, and keep the state")
  void validationFailure() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(null);

    FetcherException e = assertThrows(FetcherException.class, () -> fetcher.fetch(" "));
    assertFalse(e.isRetryable());
    assertEquals(Role.FETCHER, e.getRole());
    assertEquals(ComponentState.READY, fetcher.state());
  }

  @Test
  @DisplayName("hook errors become role errors and fail the instance")
  void executionFailure() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(ComponentOptions.empty());

    FetcherException e = assertThrows(FetcherException.class, () -> fetcher.fetch("network"));
    assertTrue(e.isRetryable());
    assertInstanceOf(NetworkException.class, e.getCause());
    assertEquals(ComponentState.FAILED, fetcher.state());
    assertThrows(NotInitializedException.class, () -> fetcher.fetch("a"));
  }

  @Test
  void retryableFlagFollowsTheCause() {
    ScriptedFetcher missing = new ScriptedFetcher();
    missing.initialize(ComponentOptions.empty());
    assertFalse(assertThrows(FetcherException.class, () -> missing.fetch("missing")).isRetryable());

    ScriptedFetcher checked = new ScriptedFetcher();
    checked.initialize(ComponentOptions.empty());
    assertTrue(assertThrows(FetcherException.class, () -> checked.fetch("checked")).isRetryable());
  }

  @Test
  void ownRoleErrorsPassThrough() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(ComponentOptions.empty());
    FetcherException e = assertThrows(FetcherException.class, () -> fetcher.fetch("own"));
    assertEquals("bad gateway", e.getMessage());
    assertFalse(e.isRetryable());
  }

  @Test
  void nullFetchResultIsEmptyPayload() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(ComponentOptions.empty());
    RawPayload payload = fetcher.fetch("null");
    assertTrue(payload.isEmpty());
    assertEquals("null", payload.identifier());
  }

  @Test
  void closeRunsTheHook() {
    ScriptedFetcher fetcher = new ScriptedFetcher();
    fetcher.initialize(ComponentOptions.empty());
    fetcher.close();
    assertEquals(1, fetcher.closed.get());
  }

  @Test
  void writerCountsAreNeverNegative() {
    AbstractWriter writer =
        new AbstractWriter("negative") {
          @Override
          protected int doStore(Object unit) {
            return -5;
          }
        };
    writer.initialize(ComponentOptions.empty());
    assertEquals(0, writer.store("unit"));
  }

  @Test
  void writerFailureIsWriterError() {
    AbstractWriter writer =
        new AbstractWriter("broken") {
          @Override
          protected int doStore(Object unit) {
            throw new IllegalStateException("disk full");
          }
        };
    writer.initialize(ComponentOptions.empty());
    assertThrows(WriterException.class, () -> writer.store("unit"));
    assertEquals(ComponentState.FAILED, writer.state());
  }

  @Test
  void transformerRejectsNullElements() {
    AbstractTransformer transformer =
        new AbstractTransformer("identity", Role.SPLITTER) {
          @Override
          protected List<com.sayou.fabric.atom.Atom> doTransform(
              List<com.sayou.fabric.atom.Atom> atoms) {
            return atoms;
          }
        };
    transformer.initialize(ComponentOptions.empty());
    List<com.sayou.fabric.atom.Atom> withNull = new java.util.ArrayList<>();
    withNull.add(null);

    assertThrows(
        com.sayou.fabric.exception.SplitterException.class, () -> transformer.transform(withNull));
    assertEquals(ComponentState.READY, transformer.state());
  }

  @Test
  void transformerNeedsATransformerRole() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new AbstractTransformer("bad", Role.WRITER) {
              @Override
              protected List<com.sayou.fabric.atom.Atom> doTransform(
                  List<com.sayou.fabric.atom.Atom> atoms) {
                return atoms;
              }
            });
  }
}
