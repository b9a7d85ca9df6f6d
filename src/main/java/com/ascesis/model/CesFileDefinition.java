package com.ascesis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of a parsed definitions file.
 * This is a simple Data Transfer Object (DTO) used only for loading.
 *
 * Polynomials are written as lists of monomials, each monomial a list of
 * identifier names: {@code [["a"], ["b", "c"]]} stands for {@code a + b c}.
 */
public record CesFileDefinition(
        @JsonProperty("root") String root,
        @JsonProperty("blocks") List<Block> blocks
) {
    /**
     * DTO for a top-level block. {@code type} is one of {@code ces},
     * {@code cap}, {@code mul}, {@code inh} or {@code props}; the other
     * fields are read according to it.
     */
    public record Block(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("rex") Rex rex,
            @JsonProperty("selector") String selector,
            @JsonProperty("entries") List<Entry> entries,
            @JsonProperty("fields") Map<String, Object> fields
    ) {
        public List<Entry> entries() {
            return entries != null ? entries : List.of();
        }

        public Map<String, Object> fields() {
            return fields != null ? fields : Map.of();
        }
    }

    /**
     * DTO for one line of a capacity, multiplicity or inhibitor block.
     * {@code face} is {@code causes} or {@code effects}; capacity entries
     * have none.
     */
    public record Entry(
            @JsonProperty("face") String face,
            @JsonProperty("size") Object size,
            @JsonProperty("nodes") List<String> nodes,
            @JsonProperty("suit") List<String> suit
    ) {
        public List<String> nodes() {
            return nodes != null ? nodes : List.of();
        }

        public List<String> suit() {
            return suit != null ? suit : List.of();
        }
    }

    /**
     * DTO for a rule expression. {@code kind} selects the fields in use:
     * <ul>
     *   <li>{@code thin}, {@code fat}: {@code polynomial} and {@code arrows}</li>
     *   <li>{@code instance}, {@code immediate}: {@code name} and {@code args}</li>
     *   <li>{@code chain}: {@code head} and {@code more}</li>
     * </ul>
     */
    public record Rex(
            @JsonProperty("kind") String kind,
            @JsonProperty("polynomial") List<List<String>> polynomial,
            @JsonProperty("arrows") List<Arrow> arrows,
            @JsonProperty("name") String name,
            @JsonProperty("args") List<String> args,
            @JsonProperty("head") Rex head,
            @JsonProperty("more") List<More> more
    ) {
        public List<Arrow> arrows() {
            return arrows != null ? arrows : List.of();
        }

        public List<String> args() {
            return args != null ? args : List.of();
        }

        public List<More> more() {
            return more != null ? more : List.of();
        }
    }

    /**
     * DTO for one {@code op polynomial} link of an arrow rule.
     */
    public record Arrow(
            @JsonProperty("op") String op,
            @JsonProperty("polynomial") List<List<String>> polynomial
    ) {}

    /**
     * DTO for one member of a rule expression chain; a missing {@code op}
     * means juxtaposition.
     */
    public record More(
            @JsonProperty("op") String op,
            @JsonProperty("rex") Rex rex
    ) {}

    public List<Block> blocks() {
        return blocks != null ? blocks : List.of();
    }
}
