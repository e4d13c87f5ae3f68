/*
 * Copyright (c) 2025 RepoQ TRS
 * Licensed under the Apache License, Version 2.0
 */
package com.repoq.trs.verifier.analysis;

import com.repoq.trs.api.TermGenerator;
import com.repoq.trs.api.model.Bindings;
import com.repoq.trs.api.model.MetaVariable;
import com.repoq.trs.api.model.Term;
import com.repoq.trs.core.term.Terms;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ground instances of a pattern, obtained by replacing each metavariable with a ground
 * sample of its sort. Enumeration is the cartesian product in odometer order, cut off at a
 * budget.
 *
 * @param instances  the instances, at most {@code budget} of them
 * @param exhaustive whether every combination of samples was enumerated
 */
public record GroundInstances(List<Term> instances, boolean exhaustive) {

    public GroundInstances {
        instances = List.copyOf(instances);
    }

    public static GroundInstances of(Term pattern, TermGenerator generator, int budget) {
        List<MetaVariable> variables = new ArrayList<>(Terms.variables(pattern));
        if (variables.isEmpty()) {
            return new GroundInstances(List.of(pattern), true);
        }
        List<List<Term>> choices = new ArrayList<>(variables.size());
        long combinations = 1;
        for (MetaVariable variable : variables) {
            List<Term> samples = generator.groundSamples(variable.sort());
            if (samples.isEmpty()) {
                return new GroundInstances(List.of(), true);
            }
            choices.add(samples);
            combinations = Math.min(Long.MAX_VALUE / 1024, combinations * samples.size());
        }

        List<Term> instances = new ArrayList<>();
        int[] odometer = new int[variables.size()];
        while (instances.size() < budget) {
            Map<MetaVariable, Term> assignment = new LinkedHashMap<>();
            for (int i = 0; i < variables.size(); i++) {
                assignment.put(variables.get(i), choices.get(i).get(odometer[i]));
            }
            instances.add(Bindings.of(assignment).substitute(pattern));
            if (!advance(odometer, choices)) {
                break;
            }
        }
        return new GroundInstances(instances, combinations <= budget);
    }

    private static boolean advance(int[] odometer, List<List<Term>> choices) {
        for (int i = odometer.length - 1; i >= 0; i--) {
            odometer[i]++;
            if (odometer[i] < choices.get(i).size()) {
                return true;
            }
            odometer[i] = 0;
        }
        return false;
    }
}
