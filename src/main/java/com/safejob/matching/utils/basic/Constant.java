package com.safejob.matching.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String OUTCOME = "outcome";
}
