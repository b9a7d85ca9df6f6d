/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.compiler.CompilationException;
import com.ascesis.model.Literal;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.function.BiFunction;

/**
 * A block of key/value properties, optionally tagged with a selector, for
 * example {@code vis { title: "Arrows" labels: { a: "Start" } }}.
 *
 * Values are literals, identifiers or nested blocks. Typed getters return
 * an empty result both for a missing key and for a value of another kind.
 */
public final class PropertyBlock implements CesFileBlock {

    public enum Selector {
        VIS("vis"),
        SAT("sat");

        private final String keyword;

        Selector(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * @throws CompilationException if the keyword names no selector
         */
        public static Selector fromKeyword(String keyword) {
            for (Selector selector : values()) {
                if (selector.keyword.equals(keyword)) {
                    return selector;
                }
            }
            throw new CompilationException(CompilationException.Reason.INVALID_DEFINITION,
                    "Unknown property block selector '" + keyword + "'");
        }
    }

    public sealed interface Value permits LiteralValue, IdentifierValue, BlockValue {
    }

    public record LiteralValue(Literal literal) implements Value {
        public LiteralValue {
            Objects.requireNonNull(literal, "Literal cannot be null");
        }
    }

    public record IdentifierValue(String identifier) implements Value {
        public IdentifierValue {
            Objects.requireNonNull(identifier, "Identifier cannot be null");
        }
    }

    public record BlockValue(PropertyBlock block) implements Value {
        public BlockValue {
            Objects.requireNonNull(block, "Block cannot be null");
        }
    }

    private final Selector selector;
    private final TreeMap<String, Value> fields;

    private PropertyBlock(Selector selector, TreeMap<String, Value> fields) {
        this.selector = selector;
        this.fields = fields;
    }

    public static PropertyBlock of(String key, Value value) {
        TreeMap<String, Value> fields = new TreeMap<>();
        fields.put(Objects.requireNonNull(key, "Key cannot be null"), Objects.requireNonNull(value, "Value cannot be null"));
        return new PropertyBlock(null, fields);
    }

    public static PropertyBlock empty() {
        return new PropertyBlock(null, new TreeMap<>());
    }

    public PropertyBlock withSelector(String keyword) {
        return new PropertyBlock(Selector.fromKeyword(keyword), fields);
    }

    /**
     * Merges the fields of later blocks into this one; a key given again
     * takes the later value. The selector of this block is kept.
     */
    public PropertyBlock withMore(List<PropertyBlock> more) {
        TreeMap<String, Value> merged = new TreeMap<>(fields);
        for (PropertyBlock block : more) {
            merged.putAll(block.fields);
        }
        return new PropertyBlock(selector, merged);
    }

    public Optional<Selector> getSelector() {
        return Optional.ofNullable(selector);
    }

    public Optional<Value> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public OptionalLong getSize(String key) {
        Value value = fields.get(key);
        if (value instanceof LiteralValue lit && lit.literal() instanceof Literal.Size size) {
            return OptionalLong.of(size.value());
        }
        return OptionalLong.empty();
    }

    public Optional<String> getName(String key) {
        Value value = fields.get(key);
        if (value instanceof LiteralValue lit && lit.literal() instanceof Literal.Name name) {
            return Optional.of(name.value());
        }
        return Optional.empty();
    }

    public Optional<String> getIdentifier(String key) {
        Value value = fields.get(key);
        if (value instanceof IdentifierValue id) {
            return Optional.of(id.identifier());
        }
        return Optional.empty();
    }

    public Optional<PropertyBlock> getBlock(String key) {
        Value value = fields.get(key);
        if (value instanceof BlockValue block) {
            return Optional.of(block.block());
        }
        return Optional.empty();
    }

    /**
     * Looks up {@code valueKey} in the block reached by following
     * {@code blockKeys} through nested blocks.
     */
    public OptionalLong getNestedSize(List<String> blockKeys, String valueKey) {
        Optional<PropertyBlock> block = descend(blockKeys.iterator());
        return block.isPresent() ? block.get().getSize(valueKey) : OptionalLong.empty();
    }

    public Optional<String> getNestedName(List<String> blockKeys, String valueKey) {
        return nested(blockKeys, valueKey, PropertyBlock::getName);
    }

    public Optional<String> getNestedIdentifier(List<String> blockKeys, String valueKey) {
        return nested(blockKeys, valueKey, PropertyBlock::getIdentifier);
    }

    private <T> Optional<T> nested(List<String> blockKeys, String valueKey,
                                   BiFunction<PropertyBlock, String, Optional<T>> getter) {
        return descend(blockKeys.iterator()).flatMap(block -> getter.apply(block, valueKey));
    }

    private Optional<PropertyBlock> descend(Iterator<String> blockKeys) {
        PropertyBlock current = this;
        while (blockKeys.hasNext()) {
            Optional<PropertyBlock> next = current.getBlock(blockKeys.next());
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public Map<String, Value> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyBlock that = (PropertyBlock) o;
        return selector == that.selector && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, fields);
    }

    @Override
    public String toString() {
        return (selector == null ? "" : selector.keyword() + " ") + fields;
    }
}
