package net.littleredcomputer.dpll;

import com.google.common.primitives.UnsignedInts;
import gnu.trove.list.TIntList;

/**
 * A port of gb_flip.w, the random number generator of Knuth's Stanford GraphBase, reproducing its
 * output bit for bit. Branching variables are drawn from it, so a search is exactly reproducible from
 * its seed.
 */
public class SGBRandom {
    private static final int TWO_TO_THE_31 = 0x80000000;
    private final int[] a = new int[56];
    private int next = 0;

    /* difference mod 2^31 */
    private static int modDiff(int x, int y) { return (x - y) & 0x7fffffff; }

    /**
     *  A random number generator bit-compatible with that provided by gb_flip.h in the
     *  Stanford GraphBase.
     *  @param seed the only influence on the numbers produced
     */
    public SGBRandom(int seed) {
        a[0] = -1;
        int prev = modDiff(seed, 0);
        int s = prev;
        int n = 1;
        a[55] = prev;
        for (int i = 21; i != 0; i = (i + 21) % 55) {
            a[i] = n;
            n = modDiff(prev, n);
            s = (s & 1) != 0 ? 0x40000000 + (s >> 1) : s >> 1;
            n = modDiff(n, s);
            prev = a[i];
        }
        // warm up
        for (int i = 0; i < 5; ++i) cycle();
    }

    /** @return a uniformly distributed value in [0, 2^31) */
    public int nextRand() {
        return a[next] >= 0 ? a[next--] : cycle();
    }

    /** @return a uniformly distributed value in [0, m) */
    public int unifRand(int m) {
        if (m <= 0) throw new IllegalArgumentException("range must be positive: " + m);
        int t = TWO_TO_THE_31 - UnsignedInts.remainder(TWO_TO_THE_31, m);
        int r;
        do r = nextRand(); while (UnsignedInts.compare(t, r) <= 0);
        return r % m;
    }

    /** @return an element of the nonempty list xs, each element being equally likely */
    public int choose(TIntList xs) {
        if (xs.isEmpty()) throw new IllegalArgumentException("nothing to choose from");
        return xs.get(unifRand(xs.size()));
    }

    private int cycle() {
        int i, j;
        for (i = 1, j = 32; j <= 55; i++, j++) a[i] = modDiff(a[i], a[j]);
        for (j = 1; i <= 55; i++, j++) a[i] = modDiff(a[i], a[j]);
        next = 54;
        return a[55];
    }
}
