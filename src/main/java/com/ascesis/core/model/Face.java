/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.model;

/**
 * The side of a node a weight or inhibitor applies to.
 */
public enum Face {
    /** Receiving side: the node's causes. */
    RX,
    /** Transmitting side: the node's effects. */
    TX
}
