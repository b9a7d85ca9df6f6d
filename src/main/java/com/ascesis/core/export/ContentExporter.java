/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.export;

import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.CompilationContext;
import com.ascesis.core.model.ContextHandle;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.unimi.dsi.fastutil.ints.IntList;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * Writes compiled content, with identifiers resolved back to names, as JSON
 * for the downstream encoder.
 */
public class ContentExporter {

    public record ExportedContent(
            @JsonProperty("context") String context,
            @JsonProperty("root") String root,
            @JsonProperty("causes") Map<String, List<List<String>>> causes,
            @JsonProperty("effects") Map<String, List<List<String>>> effects,
            @JsonProperty("capacities") Map<String, Long> capacities,
            @JsonProperty("weights") List<ExportedWeight> weights,
            @JsonProperty("inhibitors") List<ExportedInhibitor> inhibitors
    ) {}

    public record ExportedWeight(
            @JsonProperty("face") String face,
            @JsonProperty("node") String node,
            @JsonProperty("suit") List<String> suit,
            @JsonProperty("weight") long weight
    ) {}

    public record ExportedInhibitor(
            @JsonProperty("face") String face,
            @JsonProperty("node") String node,
            @JsonProperty("suit") List<String> suit
    ) {}

    private final ObjectWriter writer;

    public ContentExporter(boolean pretty) {
        ObjectMapper objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.writer = pretty ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
    }

    public ExportedContent export(String rootName, CausalContent content, ContextHandle ctx) {
        return ctx.withContext(context -> toExport(rootName, content, context));
    }

    public String toJson(String rootName, CausalContent content, ContextHandle ctx) throws JsonProcessingException {
        return writer.writeValueAsString(export(rootName, content, ctx));
    }

    public void write(String rootName, CausalContent content, ContextHandle ctx, Path path) throws IOException {
        writer.writeValue(path.toFile(), export(rootName, content, ctx));
    }

    public void write(String rootName, CausalContent content, ContextHandle ctx, OutputStream out) throws IOException {
        writer.writeValue(out, export(rootName, content, ctx));
    }

    private static ExportedContent toExport(String rootName, CausalContent content, CompilationContext context) {
        Map<String, List<List<String>>> causes = new TreeMap<>();
        for (int id : content.getCauseIds()) {
            causes.put(context.nameOf(id), names(content.getCauses(id), context));
        }

        Map<String, List<List<String>>> effects = new TreeMap<>();
        for (int id : content.getEffectIds()) {
            effects.put(context.nameOf(id), names(content.getEffects(id), context));
        }

        List<ExportedWeight> weights = new ArrayList<>();
        for (Map.Entry<CompilationContext.SuitKey, Long> entry : context.getWeights().entrySet()) {
            CompilationContext.SuitKey key = entry.getKey();
            weights.add(new ExportedWeight(key.face().name(), context.nameOf(key.nodeId()),
                    names(key.suit(), context::nameOf), entry.getValue()));
        }

        List<ExportedInhibitor> inhibitors = new ArrayList<>();
        for (CompilationContext.SuitKey key : context.getInhibitors()) {
            inhibitors.add(new ExportedInhibitor(key.face().name(), context.nameOf(key.nodeId()),
                    names(key.suit(), context::nameOf)));
        }

        return new ExportedContent(context.getName(), rootName, causes, effects,
                new TreeMap<>(context.getCapacities()), weights, inhibitors);
    }

    private static List<List<String>> names(List<IntList> nodeSets, CompilationContext context) {
        List<List<String>> result = new ArrayList<>(nodeSets.size());
        for (IntList nodeSet : nodeSets) {
            result.add(names(nodeSet, context::nameOf));
        }
        return result;
    }

    private static List<String> names(IntList ids, IntFunction<String> nameOf) {
        List<String> result = new ArrayList<>(ids.size());
        for (int id : ids) {
            result.add(nameOf.apply(id));
        }
        return result;
    }
}
