package dev.sint.bytecode;

/**
 * Static stack behaviour of a program or fragment.
 *
 * @param requiredInputs words consumed from below the starting depth
 * @param netEffect words left on exit minus words present on entry
 * @param maxDepth highest stack depth reached, counting the required inputs
 * @param reachesEnd whether any path falls off the end (a program of only {@code err} does not)
 */
public record StackProfile(int requiredInputs, int netEffect, int maxDepth, boolean reachesEnd) {}
