// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;
import java.util.stream.LongStream;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static LongStream provideSeeds() {
        return LongStream.generate(SeedGenerator::generateSeed).limit(8);
    }

    /**
     * Generates a run of spaces and tabs of the given maximum length, possibly empty.
     */
    static String generateIndent(final RandomGenerator random, final int maxLength) {
        final var length = random.nextInt(maxLength + 1);
        final var builder = new StringBuilder(length);
        for (int i = 0; i < length; i += 1) {
            builder.append(random.nextBoolean() ? ' ' : '\t');
        }
        return builder.toString();
    }

    /**
     * Generates a word of lower-case ASCII letters, at least one letter long.
     */
    static String generateWord(final RandomGenerator random) {
        final var length = 1 + random.nextInt(8);
        final var builder = new StringBuilder(length);
        for (int i = 0; i < length; i += 1) {
            builder.append((char) ('a' + random.nextInt(26)));
        }
        return builder.toString();
    }

    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }
}
