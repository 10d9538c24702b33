package com.instaclustr.bulkrestore.impl.resolve;

import java.util.Random;

import com.google.inject.Inject;

/**
 * Random names for restored resources and restore runs.
 */
public class NameGenerator {

    public static final int RUN_TOKEN_LENGTH = 13;
    public static final int NAME_SUFFIX_LENGTH = 5;

    private static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    private static final String LETTERS = LOWERCASE + LOWERCASE.toUpperCase();

    private final Random random;

    @Inject
    public NameGenerator(final Random random) {
        this.random = random;
    }

    public String runToken() {
        return pick(LETTERS, RUN_TOKEN_LENGTH);
    }

    public String nameSuffix() {
        return pick(LOWERCASE, NAME_SUFFIX_LENGTH);
    }

    private String pick(final String alphabet, final int length) {
        final StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
