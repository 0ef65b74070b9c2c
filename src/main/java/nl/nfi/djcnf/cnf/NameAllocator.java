package nl.nfi.djcnf.cnf;

import nl.nfi.djcnf.grammar.Grammar;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Issues fresh nonterminal names. An allocator is an immutable value: every allocation
 * returns the issued name together with a new allocator that also reserves it.
 *
 * <p>All symbols of the grammar are reserved, terminals included, so that a fresh
 * nonterminal never captures an existing terminal.
 */
public final class NameAllocator {

    private final Set<String> reserved;

    private NameAllocator(final Set<String> reserved) {
        this.reserved = reserved;
    }

    public static NameAllocator reserving(final Grammar grammar) {
        return reserving(grammar.symbols());
    }

    public static NameAllocator reserving(final Collection<String> names) {
        return new NameAllocator(Set.copyOf(names));
    }

    public boolean isReserved(final String name) {
        return reserved.contains(name);
    }

    // probes prefix + firstSuffix, prefix + (firstSuffix + 1), ...
    public Allocation allocate(final String prefix, final int firstSuffix) {
        int suffix = firstSuffix;
        while (isReserved(prefix + suffix)) {
            suffix++;
        }
        return issue(prefix + suffix);
    }

    // probes preferred, preferred + 2, preferred + 3, ...
    public Allocation allocatePreferring(final String preferred) {
        if (!isReserved(preferred)) {
            return issue(preferred);
        }
        return allocate(preferred, 2);
    }

    private Allocation issue(final String name) {
        final Set<String> names = new HashSet<>(reserved);
        names.add(name);
        return new Allocation(name, new NameAllocator(names));
    }

    public record Allocation(String name, NameAllocator allocator) {
    }
}
