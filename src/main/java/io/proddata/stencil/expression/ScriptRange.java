package io.proddata.stencil.expression;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The integers produced by {@code a..b} or {@code a..<b}, counting up when {@code a < b} and down
 * otherwise. Elements are computed on demand and narrowed to the smallest integer kind.
 * <p>
 * A range can be enumerated once.
 */
public final class ScriptRange implements Iterable<Value> {
    private final BigInteger from;
    private final BigInteger to;
    private final boolean inclusive;
    private boolean enumerated;

    public ScriptRange(BigInteger from, BigInteger to, boolean inclusive) {
        this.from = from;
        this.to = to;
        this.inclusive = inclusive;
    }

    public static ScriptRange inclusive(long from, long to) {
        return new ScriptRange(BigInteger.valueOf(from), BigInteger.valueOf(to), true);
    }

    public static ScriptRange exclusive(long from, long to) {
        return new ScriptRange(BigInteger.valueOf(from), BigInteger.valueOf(to), false);
    }

    public BigInteger getFrom() {
        return from;
    }

    public BigInteger getTo() {
        return to;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    /**
     * Number of elements, computed from the bounds without enumerating.
     */
    public BigInteger size() {
        BigInteger distance = to.subtract(from).abs();
        return inclusive ? distance.add(BigInteger.ONE) : distance;
    }

    public boolean isEmpty() {
        return size().signum() == 0;
    }

    @Override
    public synchronized Iterator<Value> iterator() {
        if (enumerated) {
            throw new IllegalStateException("The range " + this + " has already been enumerated");
        }
        enumerated = true;
        return new RangeIterator();
    }

    @Override
    public String toString() {
        return from + (inclusive ? ".." : "..<") + to;
    }

    private final class RangeIterator implements Iterator<Value> {
        private final BigInteger step = from.compareTo(to) < 0 ? BigInteger.ONE : BigInteger.ONE.negate();
        private BigInteger remaining = size();
        private BigInteger current = from;

        @Override
        public boolean hasNext() {
            return remaining.signum() > 0;
        }

        @Override
        public Value next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Value value = Value.integer(current);
            current = current.add(step);
            remaining = remaining.subtract(BigInteger.ONE);
            return value;
        }
    }
}
