package app.cadence.core.review.algorithm;

import java.util.Random;
import java.util.function.Supplier;

public class RandomFuzzSource implements FuzzSource {

    private final Supplier<Random> randomSupplier;

    public RandomFuzzSource(Supplier<Random> randomSupplier) {
        this.randomSupplier = randomSupplier;
    }

    public static RandomFuzzSource seeded(long seed) {
        Random random = new Random(seed);
        return new RandomFuzzSource(() -> random);
    }

    @Override
    public double nextSigned() {
        return (randomSupplier.get().nextDouble() - 0.5) * 2;
    }
}
