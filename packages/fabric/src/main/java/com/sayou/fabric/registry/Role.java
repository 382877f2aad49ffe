package com.sayou.fabric.registry;

import com.sayou.fabric.component.Builder;
import com.sayou.fabric.component.Component;
import com.sayou.fabric.component.Fetcher;
import com.sayou.fabric.component.Generator;
import com.sayou.fabric.component.Seeder;
import com.sayou.fabric.component.Transformer;
import com.sayou.fabric.component.Writer;
import com.sayou.fabric.exception.BuilderException;
import com.sayou.fabric.exception.ComponentException;
import com.sayou.fabric.exception.FetcherException;
import com.sayou.fabric.exception.GeneratorException;
import com.sayou.fabric.exception.MapperException;
import com.sayou.fabric.exception.ParserException;
import com.sayou.fabric.exception.RefinerException;
import com.sayou.fabric.exception.SeederException;
import com.sayou.fabric.exception.SplitterException;
import com.sayou.fabric.exception.UnknownRoleException;
import com.sayou.fabric.exception.WriterException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of capability roles a component can be registered under.
 *
 * <p>Declaration order is pipeline order. Every role knows the pipeline stage it drives, the
 * capability interface its components implement, the strategy used when a run does not name one
 * and how to build its error subtype.
 */
public enum Role {
  SEEDER("seeder", "seed", Seeder.class, "single", SeederException::new),
  FETCHER("fetcher", "fetch", Fetcher.class, "file", FetcherException::new),
  GENERATOR("generator", "generate", Generator.class, "none", GeneratorException::new),
  PARSER("parser", "parse", Transformer.class, "auto", ParserException::new),
  REFINER("refiner", "refine", Transformer.class, "text_cleaner", RefinerException::new),
  SPLITTER("splitter", "chunk", Transformer.class, "fixed_length", SplitterException::new),
  MAPPER("mapper", "wrap", Transformer.class, "document_chunk", MapperException::new),
  BUILDER("builder", "assemble", Builder.class, "knowledge_graph", BuilderException::new),
  WRITER("writer", "store", Writer.class, "jsonl", WriterException::new);

  /** Builds the role specific {@link ComponentException}. */
  @FunctionalInterface
  interface ErrorFactory {
    ComponentException create(String message, Throwable cause, boolean retryable);
  }

  private final String id;
  private final String stage;
  private final Class<? extends Component> capability;
  private final String defaultStrategy;
  private final ErrorFactory errorFactory;

  Role(
      String id,
      String stage,
      Class<? extends Component> capability,
      String defaultStrategy,
      ErrorFactory errorFactory) {
    this.id = id;
    this.stage = stage;
    this.capability = capability;
    this.defaultStrategy = defaultStrategy;
    this.errorFactory = errorFactory;
  }

  /** Lower-case identifier used in configuration and strategy maps (e.g. {@code fetcher}). */
  public String id() {
    return id;
  }

  /** Name of the pipeline stage this role drives (e.g. {@code fetch}). */
  public String stage() {
    return stage;
  }

  @SuppressWarnings("rawtypes")
  public Class<? extends Component> capability() {
    return capability;
  }

  public String defaultStrategy() {
    return defaultStrategy;
  }

  /** Create the error subtype for this role. */
  public ComponentException error(String message, Throwable cause, boolean retryable) {
    return errorFactory.create(message, cause, retryable);
  }

  /**
   * Resolve a role by its identifier, case-insensitively.
   *
   * @throws UnknownRoleException when the identifier is not a declared role
   */
  public static Role fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (Role role : values()) {
        if (role.id.equals(normalized)) return role;
      }
    }
    throw new UnknownRoleException(id, ids());
  }

  public static List<String> ids() {
    return Arrays.stream(values()).map(Role::id).toList();
  }
}
