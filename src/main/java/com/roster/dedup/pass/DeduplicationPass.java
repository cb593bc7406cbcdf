package com.roster.dedup.pass;

/**
 * One stage of the deduplication pipeline. Passes run once per invocation in ascending
 * {@link #number()} order against a shared {@link PassContext}.
 */
public interface DeduplicationPass {

    int number();

    String name();

    PassResult run(PassContext context);
}
