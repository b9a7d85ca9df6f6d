/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.loader;

import com.ascesis.core.compiler.CompilationException;
import com.ascesis.core.file.CapacityBlock;
import com.ascesis.core.file.CesFile;
import com.ascesis.core.file.CesFileBlock;
import com.ascesis.core.file.ImmediateDefinition;
import com.ascesis.core.file.InhibitorBlock;
import com.ascesis.core.file.MultiplicityBlock;
import com.ascesis.core.file.PropertyBlock;
import com.ascesis.core.rex.Rex;
import com.ascesis.model.ArrowLink;
import com.ascesis.model.ArrowOperator;
import com.ascesis.model.CesFileDefinition;
import com.ascesis.model.FatArrowRule;
import com.ascesis.model.Literal;
import com.ascesis.model.Polynomial;
import com.ascesis.model.ThinArrowRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads a definitions file from its JSON syntax tree and builds the model
 * through the same constructors a surface-syntax parser would call.
 *
 * Property values and sizes written as JSON strings use the surface
 * notation: a quoted string is a name literal, a string of digits is a size
 * literal, anything else is an identifier.
 */
public class CesFileLoader {
    private static final Logger logger = Logger.getLogger(CesFileLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads a file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws CompilationException if the JSON does not describe a valid definitions file
     */
    public CesFile load(Path path) throws IOException {
        CesFileDefinition definition = objectMapper.readValue(path.toFile(), CesFileDefinition.class);
        CesFile file = toCesFile(definition);
        logger.fine(String.format("Loaded %d blocks from %s", file.getBlocks().size(), path));
        return file;
    }

    public CesFile read(String json) throws JsonProcessingException {
        return toCesFile(objectMapper.readValue(json, CesFileDefinition.class));
    }

    public CesFile toCesFile(CesFileDefinition definition) {
        List<CesFileBlock> blocks = new ArrayList<>();
        for (CesFileDefinition.Block block : definition.blocks()) {
            blocks.add(toBlock(block));
        }

        CesFile file = new CesFile(blocks);
        if (definition.root() != null) {
            file.setRootName(definition.root());
        }
        return file;
    }

    private CesFileBlock toBlock(CesFileDefinition.Block block) {
        String type = required(block.type(), "block type");
        return switch (type) {
            case "ces" -> new ImmediateDefinition(required(block.name(), "structure name"),
                    toRex(required(block.rex(), "structure body")));
            case "cap" -> toCapacityBlock(block.entries());
            case "mul" -> toMultiplicityBlock(block.entries());
            case "inh" -> toInhibitorBlock(block.entries());
            case "props" -> toPropertyBlock(block.selector(), block.fields());
            default -> throw invalid("Unknown block type '" + type + "'");
        };
    }

    // ==================== Context blocks ====================

    private CapacityBlock toCapacityBlock(List<CesFileDefinition.Entry> entries) {
        List<CapacityBlock> blocks = new ArrayList<>();
        for (CesFileDefinition.Entry entry : entries) {
            blocks.add(CapacityBlock.of(toLiteral(entry.size()), toNodeList(entry.nodes())));
        }
        return first(blocks, "cap").withMore(blocks.subList(1, blocks.size()));
    }

    private MultiplicityBlock toMultiplicityBlock(List<CesFileDefinition.Entry> entries) {
        List<MultiplicityBlock> blocks = new ArrayList<>();
        for (CesFileDefinition.Entry entry : entries) {
            Literal size = toLiteral(entry.size());
            Polynomial nodes = toNodeList(entry.nodes());
            Polynomial suit = toNodeList(entry.suit());
            blocks.add(isCauses(entry.face())
                    ? MultiplicityBlock.causes(size, nodes, suit)
                    : MultiplicityBlock.effects(size, nodes, suit));
        }
        return first(blocks, "mul").withMore(blocks.subList(1, blocks.size()));
    }

    private InhibitorBlock toInhibitorBlock(List<CesFileDefinition.Entry> entries) {
        List<InhibitorBlock> blocks = new ArrayList<>();
        for (CesFileDefinition.Entry entry : entries) {
            Polynomial nodes = toNodeList(entry.nodes());
            Polynomial suit = toNodeList(entry.suit());
            blocks.add(isCauses(entry.face())
                    ? InhibitorBlock.causes(nodes, suit)
                    : InhibitorBlock.effects(nodes, suit));
        }
        return first(blocks, "inh").withMore(blocks.subList(1, blocks.size()));
    }

    private static boolean isCauses(String face) {
        String value = required(face, "entry face");
        return switch (value) {
            case "causes" -> true;
            case "effects" -> false;
            default -> throw invalid("Unknown entry face '" + value + "'");
        };
    }

    private static <T> T first(List<T> blocks, String type) {
        if (blocks.isEmpty()) {
            throw invalid("Empty '" + type + "' block");
        }
        return blocks.get(0);
    }

    // ==================== Property blocks ====================

    private PropertyBlock toPropertyBlock(String selector, Map<String, Object> fields) {
        List<PropertyBlock> blocks = new ArrayList<>();
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            blocks.add(PropertyBlock.of(field.getKey(), toValue(field.getKey(), field.getValue())));
        }

        PropertyBlock block = blocks.isEmpty()
                ? PropertyBlock.empty()
                : blocks.get(0).withMore(blocks.subList(1, blocks.size()));
        return selector == null ? block : block.withSelector(selector);
    }

    @SuppressWarnings("unchecked")
    private PropertyBlock.Value toValue(String key, Object value) {
        if (value instanceof Map<?, ?> nested) {
            return new PropertyBlock.BlockValue(toPropertyBlock(null, (Map<String, Object>) nested));
        }
        if (value instanceof Number number) {
            return new PropertyBlock.LiteralValue(toSize(number));
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("\"") || trimmed.startsWith("'")) {
                return new PropertyBlock.LiteralValue(Literal.fromQuotedString(trimmed));
            }
            if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                return new PropertyBlock.LiteralValue(Literal.fromDigits(trimmed));
            }
            return new PropertyBlock.IdentifierValue(trimmed);
        }
        throw invalid("Unsupported value of property '" + key + "': " + value);
    }

    private static Literal toLiteral(Object value) {
        if (value instanceof Number number) {
            return toSize(number);
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.startsWith("\"") || trimmed.startsWith("'")
                    ? Literal.fromQuotedString(trimmed)
                    : Literal.fromDigits(trimmed);
        }
        throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                "Expected a literal, got " + value);
    }

    private static Literal toSize(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short) {
            return Literal.size(number.longValue());
        }
        if (number instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return Literal.size(big.longValue());
        }
        throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                "Not a size literal: " + number);
    }

    // ==================== Rule expressions ====================

    private Rex toRex(CesFileDefinition.Rex rex) {
        String kind = required(rex.kind(), "rule expression kind");
        return switch (kind) {
            case "thin" -> Rex.of(ThinArrowRule.fromParts(
                    toPolynomial(rex.polynomial()), toArrowLinks(rex.arrows())));
            case "fat" -> Rex.of(FatArrowRule.fromParts(
                    toPolynomial(rex.polynomial()), toArrowLinks(rex.arrows())));
            case "instance" -> Rex.instance(required(rex.name(), "instance name"), rex.args());
            case "immediate" -> Rex.immediate(required(rex.name(), "immediate name"), rex.args());
            case "chain" -> toChain(rex);
            default -> throw invalid("Unknown rule expression kind '" + kind + "'");
        };
    }

    private Rex toChain(CesFileDefinition.Rex rex) {
        Rex head = toRex(required(rex.head(), "chain head"));
        List<Rex.Link> links = new ArrayList<>();
        for (CesFileDefinition.More more : rex.more()) {
            Rex member = toRex(required(more.rex(), "chain member"));
            links.add(more.op() == null ? Rex.Link.product(member) : new Rex.Link(toOperator(more.op()), member));
        }
        return head.withMore(links);
    }

    private List<ArrowLink> toArrowLinks(List<CesFileDefinition.Arrow> arrows) {
        List<ArrowLink> links = new ArrayList<>(arrows.size());
        for (CesFileDefinition.Arrow arrow : arrows) {
            links.add(ArrowLink.of(toOperator(required(arrow.op(), "arrow operator")),
                    toPolynomial(arrow.polynomial())));
        }
        return links;
    }

    private static ArrowOperator toOperator(String symbol) {
        ArrowOperator operator = ArrowOperator.fromSymbol(symbol);
        if (operator == null) {
            throw new CompilationException(CompilationException.Reason.INVALID_OPERATOR,
                    "Unknown operator '" + symbol + "'");
        }
        return operator;
    }

    /**
     * Builds the sum of the given monomials, each monomial being the
     * product of its identifiers, so that repeated identifiers and
     * monomials are reported as idempotency warnings.
     */
    private static Polynomial toPolynomial(List<List<String>> monomials) {
        if (monomials == null || monomials.isEmpty()) {
            return Polynomial.empty();
        }
        Polynomial result = toMonomial(monomials.get(0));
        for (List<String> monomial : monomials.subList(1, monomials.size())) {
            result.withProductAdded(factors(monomial));
        }
        return result;
    }

    private static Polynomial toMonomial(List<String> names) {
        List<Polynomial> factors = factors(names);
        return factors.get(0).withProductMultiplied(factors.subList(1, factors.size()));
    }

    private static List<Polynomial> factors(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw invalid("Empty monomial");
        }
        List<Polynomial> factors = new ArrayList<>(names.size());
        for (String name : names) {
            factors.add(Polynomial.of(name));
        }
        return factors;
    }

    private static Polynomial toNodeList(List<String> names) {
        return names.isEmpty() ? Polynomial.empty() : toMonomial(names);
    }

    private static <T> T required(T value, String what) {
        if (value == null) {
            throw invalid("Missing " + what);
        }
        return value;
    }

    private static CompilationException invalid(String message) {
        return new CompilationException(CompilationException.Reason.INVALID_DEFINITION, message);
    }
}
