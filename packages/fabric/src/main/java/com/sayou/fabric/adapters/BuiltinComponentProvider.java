package com.sayou.fabric.adapters;

import com.sayou.fabric.adapters.builder.AtomListBuilder;
import com.sayou.fabric.adapters.builder.KnowledgeGraphBuilder;
import com.sayou.fabric.adapters.fetcher.FileFetcher;
import com.sayou.fabric.adapters.fetcher.HttpFetcher;
import com.sayou.fabric.adapters.generator.HtmlLinkGenerator;
import com.sayou.fabric.adapters.generator.NoneGenerator;
import com.sayou.fabric.adapters.seeder.DirectorySeeder;
import com.sayou.fabric.adapters.seeder.ManifestSeeder;
import com.sayou.fabric.adapters.seeder.SingleSeeder;
import com.sayou.fabric.adapters.transform.AutoParser;
import com.sayou.fabric.adapters.transform.DocumentChunkMapper;
import com.sayou.fabric.adapters.transform.FixedLengthSplitter;
import com.sayou.fabric.adapters.transform.PassthroughTransformer;
import com.sayou.fabric.adapters.transform.TextCleanerRefiner;
import com.sayou.fabric.adapters.writer.ConsoleWriter;
import com.sayou.fabric.adapters.writer.JsonlWriter;
import com.sayou.fabric.adapters.writer.MemoryWriter;
import com.sayou.fabric.component.Transformer;
import com.sayou.fabric.registry.ComponentProvider;
import com.sayou.fabric.registry.ComponentRegistry;
import com.sayou.fabric.registry.Role;

/** Registers the reference adapters shipped with the fabric. */
public class BuiltinComponentProvider implements ComponentProvider {

  @Override
  public String id() {
    return "builtin";
  }

  @Override
  public void register(ComponentRegistry registry) {
    registry
        .register(Role.SEEDER, SingleSeeder.NAME, SingleSeeder::new)
        .register(Role.SEEDER, ManifestSeeder.NAME, ManifestSeeder::new)
        .register(Role.SEEDER, DirectorySeeder.NAME, DirectorySeeder::new)
        .register(Role.FETCHER, FileFetcher.NAME, FileFetcher::new)
        .register(Role.FETCHER, HttpFetcher.NAME, HttpFetcher::new)
        .register(Role.GENERATOR, NoneGenerator.NAME, NoneGenerator::new)
        .register(Role.GENERATOR, HtmlLinkGenerator.NAME, HtmlLinkGenerator::new)
        .register(Role.PARSER, AutoParser.NAME, AutoParser::new)
        .register(Role.REFINER, TextCleanerRefiner.NAME, TextCleanerRefiner::new)
        .register(Role.SPLITTER, FixedLengthSplitter.NAME, FixedLengthSplitter::new)
        .register(Role.MAPPER, DocumentChunkMapper.NAME, DocumentChunkMapper::new)
        .register(Role.BUILDER, KnowledgeGraphBuilder.NAME, KnowledgeGraphBuilder::new)
        .register(Role.BUILDER, AtomListBuilder.NAME, AtomListBuilder::new)
        .register(Role.WRITER, JsonlWriter.NAME, JsonlWriter::new)
        .register(Role.WRITER, ConsoleWriter.NAME, ConsoleWriter::new)
        .register(Role.WRITER, MemoryWriter.NAME, MemoryWriter::new);

    for (Role role : Role.values()) {
      if (role.capability() == Transformer.class) {
        registry.register(
            role, PassthroughTransformer.NAME, () -> new PassthroughTransformer(role));
      }
    }
  }
}
