package info.isaksson.erland.eaxmi.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A value tagged with the {@link Producer} that emitted it. */
public final class Produced<T> {
    public final Producer producer;
    public final T value;

    public Produced(Producer producer, T value) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.value = Objects.requireNonNull(value, "value");
    }

    /** Tags every value of one producer, keeping order. */
    public static <T> List<Produced<T>> all(Producer producer, List<T> values) {
        List<Produced<T>> out = new ArrayList<>(values.size());
        for (T v : values) out.add(new Produced<>(producer, v));
        return out;
    }

    @Override public String toString() {
        return producer.label + ":" + value;
    }
}
