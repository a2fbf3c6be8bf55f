package com.maxdemarzi.minilogic.quine;

import org.apache.commons.lang3.Validate;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;

/**
 * Tabulation step: repeatedly merges terms from neighbouring popcount groups until
 * nothing merges, keeping every term that never merged as a prime implicant.
 */
public final class QuineMcCluskey {

    private QuineMcCluskey() {
    }

    public static List<Implicant> primeImplicants(int numVars, RoaringBitmap minterms) {
        Validate.isTrue(numVars >= 0 && numVars <= 30, "Cannot minimize over %d variables", numVars);
        Validate.isTrue(minterms.isEmpty() || minterms.last() < (1L << numVars),
                "Minterm %s does not fit in %d variables", minterms.isEmpty() ? 0 : minterms.last(), numVars);

        TreeMap<Integer, List<Implicant>> groups = new TreeMap<>();
        for (int minterm : minterms) {
            Implicant implicant = new Implicant(minterm, numVars);
            groups.computeIfAbsent(implicant.ones(), k -> new ArrayList<>()).add(implicant);
        }

        List<Implicant> primes = new ArrayList<>();
        SortedMap<Integer, List<Implicant>> current = groups;

        // Every round adds one don't-care to the surviving terms
        for (int round = 0; round <= numVars && !current.isEmpty(); round++) {
            TreeMap<Integer, Map<Implicant, Implicant>> merged = new TreeMap<>();
            Set<Implicant> marked = new HashSet<>();

            for (Map.Entry<Integer, List<Implicant>> group : current.entrySet()) {
                List<Implicant> next = current.get(group.getKey() + 1);
                if (next == null) {
                    continue;
                }
                for (Implicant low : group.getValue()) {
                    for (Implicant high : next) {
                        Implicant combined = low.merge(high);
                        if (combined != null) {
                            marked.add(low);
                            marked.add(high);
                            merged.computeIfAbsent(combined.ones(), k -> new LinkedHashMap<>())
                                    .putIfAbsent(combined, combined);
                        }
                    }
                }
            }

            for (List<Implicant> group : current.values()) {
                for (Implicant implicant : group) {
                    if (!marked.contains(implicant)) {
                        primes.add(implicant);
                    }
                }
            }

            current = new TreeMap<>();
            for (Map.Entry<Integer, Map<Implicant, Implicant>> entry : merged.entrySet()) {
                current.put(entry.getKey(), new ArrayList<>(entry.getValue().values()));
            }
        }

        Collections.sort(primes);
        return primes;
    }
}
