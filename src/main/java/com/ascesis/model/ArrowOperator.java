/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

/**
 * Binary operators joining polynomials and rule expressions.
 */
public enum ArrowOperator {
    ADD("+"),
    THIN_TX("->"),
    THIN_RX("<-"),
    FAT_TX("=>"),
    FAT_RX("<="),
    FAT_BOTH("<=>");

    private final String symbol;

    ArrowOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Converts a surface symbol such as {@code "=>"} to its operator.
     *
     * @return the operator, or null if the symbol is unknown
     */
    public static ArrowOperator fromSymbol(String symbol) {
        if (symbol == null) return null;
        String trimmed = symbol.trim();
        for (ArrowOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        return null;
    }

    public boolean isFat() {
        return this == FAT_TX || this == FAT_RX || this == FAT_BOTH;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
