/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Interns identifier names as dense integer ids. Ids are assigned in order
 * of first registration and never change, so compiled content can refer to
 * identifiers by id alone.
 */
public class IdentifierDictionary {

    private final Object2IntMap<String> nameToId = new Object2IntOpenHashMap<>();
    private final List<String> idToName = new ArrayList<>();

    public IdentifierDictionary() {
        nameToId.defaultReturnValue(-1);
    }

    /**
     * Returns the id of {@code name}, registering it on first use.
     */
    public int intern(String name) {
        return nameToId.computeIfAbsent(name, (String n) -> {
            int id = idToName.size();
            idToName.add(n);
            return id;
        });
    }

    /**
     * @return the name registered under {@code id}, or null if unknown
     */
    public String nameOf(int id) {
        if (id >= 0 && id < idToName.size()) {
            return idToName.get(id);
        }
        return null;
    }

    /**
     * @return the id of {@code name}, or -1 if it was never interned
     */
    public int idOf(String name) {
        return nameToId.getInt(name);
    }

    public boolean contains(String name) {
        return nameToId.containsKey(name);
    }

    public List<String> names() {
        return Collections.unmodifiableList(idToName);
    }

    public int size() {
        return idToName.size();
    }
}
