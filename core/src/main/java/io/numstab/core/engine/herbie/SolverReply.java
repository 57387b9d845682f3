package io.numstab.core.engine.herbie;

/**
 * A well-formed Herbie reply.
 *
 * @param errin  error estimate of the input, in bits
 * @param errout error estimate of the rewrite, in bits
 * @param output the rewritten expression as canonical text
 */
record SolverReply(double errin, double errout, String output) {}
