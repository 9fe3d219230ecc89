package io.lintsignal.rule;

/**
 * Options type of rules that take no options.
 */
public record NoOptions() {

    public static final NoOptions INSTANCE = new NoOptions();
}
