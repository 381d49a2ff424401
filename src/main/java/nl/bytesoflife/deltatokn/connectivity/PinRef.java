package nl.bytesoflife.deltatokn.connectivity;

import java.util.Comparator;

/**
 * A component pin taking part in a net, written {@code R1.2}.
 */
public record PinRef(String reference, String pin) implements Comparable<PinRef> {

    private static final Comparator<PinRef> ORDER = Comparator
            .comparing(PinRef::reference, NaturalOrder.INSTANCE)
            .thenComparing(PinRef::pin, NaturalOrder.INSTANCE);

    @Override
    public int compareTo(PinRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return reference + "." + pin;
    }
}
