/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.optimization;

import com.ascesis.model.FatArrowRule;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Polynomial;
import com.ascesis.model.ThinArrowRule;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * The FIT (fat-into-thin) transformation: rewrites a bidirectional fat arrow
 * rule into an equivalent minimal list of thin arrow rules.
 *
 * Given the rule {@code a <= b => c}, already split into the directed parts
 * (b, a) and (b, c):
 *
 * 1. Split: every part yields an effect-only rule keyed by its flattened
 *    cause side and a cause-only rule keyed by its flattened effect side:
 *    {@code b -> a}, {@code b -> c}, {@code a <- b}, {@code c <- b}.
 * 2. Rules of the same direction sharing a key are merged by adding their
 *    polynomials: {@code b -> a + c}.
 * 3. Rules of the same direction sharing a polynomial are merged by joining
 *    their keys: {@code a c <- b}.
 * 4. Steps 2 and 3 repeat until a pass merges nothing. Every merge removes
 *    one rule, so the loop terminates.
 * 5. A cause-only and an effect-only rule with the same key are paired into
 *    one two-sided rule.
 *
 * Scans are stable: the first matching rule absorbs later ones. Since
 * union is commutative and associative, the merged content does not depend
 * on the scan order.
 */
public class FitTransformer {
    private static final Logger logger = Logger.getLogger(FitTransformer.class.getName());

    /**
     * A single-polynomial rule under construction: an effect polynomial for
     * the effect-only list, a cause polynomial for the cause-only list.
     */
    private static final class PendingRule {
        IdentifierList identifiers;
        final Polynomial polynomial;

        PendingRule(IdentifierList identifiers, Polynomial polynomial) {
            this.identifiers = identifiers;
            this.polynomial = polynomial;
        }
    }

    /**
     * Applies the transformation to one fat arrow rule.
     *
     * @param rule The fat arrow rule, already split into directed parts.
     * @return The thin arrow rules carrying the same causal meaning.
     */
    public List<ThinArrowRule> transform(FatArrowRule rule) {
        List<PendingRule> effectOnly = new ArrayList<>();
        List<PendingRule> causeOnly = new ArrayList<>();

        for (FatArrowRule.Part part : rule.getParts()) {
            IdentifierList sources = part.cause().flattenedClone().toIdentifierList();
            IdentifierList sinks = part.effect().flattenedClone().toIdentifierList();

            effectOnly.add(new PendingRule(sources, part.effect().copy()));
            causeOnly.add(new PendingRule(sinks, part.cause().copy()));
        }

        int passes = 0;
        boolean rulesChanged = true;
        while (rulesChanged) {
            passes++;
            rulesChanged = mergeByIdentifiers(effectOnly);
            rulesChanged |= mergeByIdentifiers(causeOnly);
            rulesChanged |= mergeByPolynomial(effectOnly);
            rulesChanged |= mergeByPolynomial(causeOnly);
        }

        List<ThinArrowRule> result = pair(effectOnly, causeOnly);
        logger.fine(String.format("FIT: %d parts -> %d thin rules after %d passes",
                rule.getParts().size(), result.size(), passes));
        return result;
    }

    /**
     * Merges rules with identical identifier lists by adding their polynomials.
     *
     * @return true if any rule was merged
     */
    private boolean mergeByIdentifiers(List<PendingRule> rules) {
        boolean merged = false;
        List<PendingRule> kept = new ArrayList<>(rules.size());

        outer:
        for (PendingRule candidate : rules) {
            for (PendingRule target : kept) {
                if (target.identifiers.equals(candidate.identifiers)) {
                    target.polynomial.addAssign(candidate.polynomial);
                    merged = true;
                    continue outer;
                }
            }
            kept.add(candidate);
        }

        rules.clear();
        rules.addAll(kept);
        return merged;
    }

    /**
     * Merges rules with identical polynomials by joining their identifier lists.
     *
     * @return true if any rule was merged
     */
    private boolean mergeByPolynomial(List<PendingRule> rules) {
        boolean merged = false;
        List<PendingRule> kept = new ArrayList<>(rules.size());

        outer:
        for (PendingRule candidate : rules) {
            for (PendingRule target : kept) {
                if (target.polynomial.equals(candidate.polynomial)) {
                    target.identifiers = target.identifiers.union(candidate.identifiers);
                    merged = true;
                    continue outer;
                }
            }
            kept.add(candidate);
        }

        rules.clear();
        rules.addAll(kept);
        return merged;
    }

    /**
     * Combines each cause-only rule with the effect-only rule of the same
     * identifier list, if there is one. Unpaired cause-only rules follow the
     * effect-only ones.
     */
    private List<ThinArrowRule> pair(List<PendingRule> effectOnly, List<PendingRule> causeOnly) {
        List<Polynomial> pairedCauses = new ArrayList<>(effectOnly.size());
        for (int i = 0; i < effectOnly.size(); i++) {
            pairedCauses.add(null);
        }
        List<PendingRule> unpaired = new ArrayList<>();

        outer:
        for (PendingRule rx : causeOnly) {
            for (int i = 0; i < effectOnly.size(); i++) {
                if (pairedCauses.get(i) == null && effectOnly.get(i).identifiers.equals(rx.identifiers)) {
                    pairedCauses.set(i, rx.polynomial);
                    continue outer;
                }
            }
            unpaired.add(rx);
        }

        List<ThinArrowRule> result = new ArrayList<>(effectOnly.size() + unpaired.size());
        Iterator<Polynomial> causes = pairedCauses.iterator();
        for (PendingRule tx : effectOnly) {
            Polynomial cause = causes.next();
            result.add(ThinArrowRule.of(tx.identifiers, cause == null ? Polynomial.empty() : cause, tx.polynomial));
        }
        for (PendingRule rx : unpaired) {
            result.add(ThinArrowRule.causeOnly(rx.identifiers, rx.polynomial));
        }
        return result;
    }
}
