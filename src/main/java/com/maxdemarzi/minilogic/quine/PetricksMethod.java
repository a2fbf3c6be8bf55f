package com.maxdemarzi.minilogic.quine;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.list.mutable.FastList;
import org.eclipse.collections.impl.multimap.list.FastListMultimap;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;

/**
 * Picks a minimum set of prime implicants covering every minterm. Essential implicants
 * are taken first, the rest of the chart is solved exactly by multiplying out the
 * product of sums and absorbing supersets after every step.
 * <p>
 * Ties between covers of equal size go to the one with fewer literals, then to the
 * lexicographically smallest list of patterns.
 */
public final class PetricksMethod {

    private PetricksMethod() {
    }

    public static List<Implicant> cover(List<Implicant> primes, RoaringBitmap minterms) {
        // Coverage chart: minterm -> indexes of the primes covering it
        FastListMultimap<Integer, Integer> chart = FastListMultimap.newMultimap();
        for (int i = 0; i < primes.size(); i++) {
            Implicant prime = primes.get(i);
            for (int minterm : prime.getMinterms()) {
                if (minterms.contains(minterm)) {
                    chart.put(minterm, i);
                }
            }
        }

        TreeSet<Integer> essentials = new TreeSet<>();
        for (int minterm : minterms) {
            MutableList<Integer> candidates = chart.get(minterm);
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("Minterm " + minterm + " is not covered by any prime implicant");
            }
            if (candidates.size() == 1) {
                essentials.add(candidates.getFirst());
            }
        }

        RoaringBitmap remaining = minterms.clone();
        for (int index : essentials) {
            remaining.andNot(primes.get(index).getMinterms());
        }

        RoaringBitmap chosen = new RoaringBitmap();
        for (int index : essentials) {
            chosen.add(index);
        }
        if (!remaining.isEmpty()) {
            chosen.or(best(products(chart, remaining), primes));
        }

        List<Implicant> selected = new ArrayList<>();
        for (int index : chosen) {
            selected.add(primes.get(index));
        }
        Collections.sort(selected);
        return selected;
    }

    // Multiplies out the sum for each remaining minterm, keeping only minimal products
    static List<RoaringBitmap> products(FastListMultimap<Integer, Integer> chart, RoaringBitmap remaining) {
        List<RoaringBitmap> products = FastList.newListWith(new RoaringBitmap());
        for (int minterm : remaining) {
            Set<RoaringBitmap> next = new HashSet<>();
            for (RoaringBitmap product : products) {
                for (int candidate : chart.get(minterm)) {
                    RoaringBitmap extended = product.clone();
                    extended.add(candidate);
                    next.add(extended);
                }
            }
            products = absorb(next);
        }
        return products;
    }

    static List<RoaringBitmap> absorb(Collection<RoaringBitmap> products) {
        List<RoaringBitmap> sorted = new ArrayList<>(products);
        sorted.sort(Comparator.comparingLong(RoaringBitmap::getLongCardinality));

        List<RoaringBitmap> kept = new ArrayList<>();
        for (RoaringBitmap product : sorted) {
            boolean absorbed = false;
            for (RoaringBitmap smaller : kept) {
                if (RoaringBitmap.andNot(smaller, product).isEmpty()) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                kept.add(product);
            }
        }
        return kept;
    }

    static RoaringBitmap best(List<RoaringBitmap> products, List<Implicant> primes) {
        Comparator<RoaringBitmap> bySize = Comparator.comparingLong(RoaringBitmap::getLongCardinality);
        Comparator<RoaringBitmap> byLiterals = Comparator.comparingInt(p -> literals(p, primes));
        Comparator<RoaringBitmap> byPatterns = (a, b) -> comparePatterns(patterns(a, primes), patterns(b, primes));
        return products.stream()
                .min(bySize.thenComparing(byLiterals).thenComparing(byPatterns))
                .orElseThrow(() -> new IllegalStateException("Petrick's method produced no cover"));
    }

    private static int literals(RoaringBitmap product, List<Implicant> primes) {
        int total = 0;
        for (int index : product) {
            total += primes.get(index).literalCount();
        }
        return total;
    }

    private static List<String> patterns(RoaringBitmap product, List<Implicant> primes) {
        List<String> patterns = new ArrayList<>();
        for (int index : product) {
            patterns.add(primes.get(index).getPattern());
        }
        Collections.sort(patterns);
        return patterns;
    }

    private static int comparePatterns(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int compared = a.get(i).compareTo(b.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
